/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools.exceptions;

/**
 * Thrown if a note name does not start with one of the letters A-G or a-g. The tokenizer never produces such names,
 * so this signals an internal inconsistency
 */
public class InvalidPitchLetterException extends AbcFormatException {
    public InvalidPitchLetterException(String name) {
        super("No pitch value for note name '"+name+"'");
    }
}
