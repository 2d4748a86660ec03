/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools.exceptions;

public class EmptyInputException extends AbcFormatException {
    public EmptyInputException() {
        super("File is empty");
    }
}
