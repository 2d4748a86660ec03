/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools.exceptions;

/**
 * Base class of all errors raised while reading an ABC file. Every such error is terminal for the parse call,
 * no partially resolved document is ever handed out
 */
public class AbcFormatException extends RuntimeException {
    public AbcFormatException(String message) {
        super(message);
    }
}
