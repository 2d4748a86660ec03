/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools.exceptions;

/**
 * Thrown if the K: field is missing or does not have the form "C" followed by an optional list of accidentals.
 * General key signatures are not supported
 */
public class KeySignatureUnsupportedException extends AbcFormatException {
    public KeySignatureUnsupportedException(String keySignature) {
        super("Key signature must be present and must be C with accidentals, but was '"+keySignature+"'");
    }
    public KeySignatureUnsupportedException(String keySignature, String token) {
        super("Unsupported accidental '"+token+"' in key signature '"+keySignature+"'");
    }
}
