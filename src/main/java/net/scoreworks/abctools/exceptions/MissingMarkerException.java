/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools.exceptions;

public class MissingMarkerException extends AbcFormatException {
    public MissingMarkerException(String marker, String firstLine) {
        super("File does not appear to be an abc notation file: expected '"+marker+"' but first line is '"+firstLine+"'");
    }
}
