/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools;

import org.jetbrains.annotations.NotNull;

/**
 * A pitched event. Notes are equal and ordered solely by their pitch value, so enharmonic spellings like ^F and _G
 * collapse into the same note.
 */
public class Note extends MusicObject implements Comparable<Note> {

    /** letter with its octave marks, e.g. "c'" or "G," */
    private final String name;

    /** null if the note was written without accidental and no key signature applied one */
    private Accidental accidental;

    private int pitchValue;

    public Note(@NotNull String name, Accidental accidental, int duration) {
        super(duration);
        this.name = name;
        this.accidental = accidental;
        this.pitchValue = PitchTable.pitchValue(name, accidental);
    }

    public Note(@NotNull String name) {
        this(name, null, 1);
    }

    public String getName() {
        return name;
    }

    public char getLetter() {
        return name.charAt(0);
    }

    public Accidental getAccidental() {
        return accidental;
    }

    public boolean hasAccidental() {
        return accidental != null;
    }

    void setAccidental(Accidental accidental) {
        this.accidental = accidental;
        this.pitchValue = PitchTable.pitchValue(name, accidental);
    }

    public int getPitchValue() {
        return pitchValue;
    }

    @Override
    boolean tiesWith(MusicObject next) {
        return next instanceof Note && name.equals(((Note) next).name);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Note)) {
            return false;
        }
        Note other = (Note) o;
        return this.pitchValue == other.pitchValue;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(pitchValue);
    }

    @Override
    public int compareTo(@NotNull Note right) {
        return Integer.compare(pitchValue, right.pitchValue);
    }

    @Override
    public String toString() {
        StringBuilder strb = new StringBuilder();
        if (accidental != null)
            strb.append(accidental.getMark());
        strb.append(name);
        if (getDuration() > 0)
            strb.append(getDuration());
        return strb.toString();
    }
}
