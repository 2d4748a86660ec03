/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools.exceptions;

/**
 * Thrown if the information fields of a tune header are not arranged as X:, T:, ..., K:
 */
public class HeaderOrderException extends AbcFormatException {
    public HeaderOrderException(String rule, char found) {
        super(rule+" (found "+found+":)");
    }
}
