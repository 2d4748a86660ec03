/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools.exceptions;

public class HeaderTooShortException extends AbcFormatException {
    public HeaderTooShortException(int size) {
        super("Tune header must contain at least X:, T:, and K: but has "+size+" field(s)");
    }
}
