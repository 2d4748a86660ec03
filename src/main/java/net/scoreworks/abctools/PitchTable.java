/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools;

import net.scoreworks.abctools.exceptions.InvalidPitchLetterException;
import org.apache.commons.lang3.ArrayUtils;
import org.jetbrains.annotations.NotNull;

/**
 * Maps note names to integer pitch values. Values follow the key positions of a piano, so that ordering pitch
 * values orders the notes by how they sound. Every step between white keys counts as two, except E-F and B-c.
 */
public final class PitchTable {
    private static final char[] LETTERS = {'C', 'D', 'E', 'F', 'G', 'A', 'B', 'c', 'd', 'e', 'f', 'g', 'a', 'b'};
    private static final int[] BASE_VALUES = {40, 42, 44, 45, 47, 49, 51, 52, 54, 56, 57, 59, 61, 63};

    public static final int OCTAVE = 12;

    private PitchTable() {}

    /**
     * @return value of the letter without any octave marks or accidental
     * @throws InvalidPitchLetterException if the letter is not one of A-G or a-g
     */
    public static int baseValue(char letter) {
        int index = ArrayUtils.indexOf(LETTERS, letter);
        if (index == ArrayUtils.INDEX_NOT_FOUND)
            throw new InvalidPitchLetterException(String.valueOf(letter));
        return BASE_VALUES[index];
    }

    /**
     * Compute the pitch value of a note.
     * @param name letter followed by any number of octave marks ("," one octave down, "'" one octave up)
     * @param accidental may be null if the note has none
     */
    public static int pitchValue(@NotNull String name, Accidental accidental) {
        if (name.isEmpty())
            throw new InvalidPitchLetterException(name);
        int value;
        try {
            value = baseValue(name.charAt(0));
        } catch (InvalidPitchLetterException e) {
            throw new InvalidPitchLetterException(name);
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == ',')
                value -= OCTAVE;
            else if (c == '\'')
                value += OCTAVE;
        }
        if (accidental != null)
            value += accidental.getSemitones();
        return value;
    }
}
