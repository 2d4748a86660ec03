/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools;

import org.apache.commons.collections4.BidiMap;
import org.apache.commons.collections4.bidimap.DualHashBidiMap;

/**
 * Pitch modifier written in front of a note letter. Each accidental shifts the pitch value of a {@link Note}
 * by a fixed number of semitones.
 */
public enum Accidental {
    FLAT(-1),
    NATURAL(0),
    SHARP(1);

    /** notation marks as they appear in the tune body and in the K: field */
    private static final BidiMap<Character, Accidental> MARKS = new DualHashBidiMap<>();
    static {
        MARKS.put('_', FLAT);
        MARKS.put('=', NATURAL);
        MARKS.put('^', SHARP);
    }

    private final int semitones;

    Accidental(int semitones) {
        this.semitones = semitones;
    }

    public int getSemitones() {
        return semitones;
    }

    public char getMark() {
        return MARKS.getKey(this);
    }

    public static boolean isMark(char c) {
        return MARKS.containsKey(c);
    }

    /**
     * @param mark one of '_', '=' or '^'
     * @throws IllegalArgumentException if the mark denotes no accidental
     */
    public static Accidental fromMark(char mark) {
        Accidental accidental = MARKS.get(mark);
        if (accidental == null)
            throw new IllegalArgumentException("'"+mark+"' is not an accidental");
        return accidental;
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
