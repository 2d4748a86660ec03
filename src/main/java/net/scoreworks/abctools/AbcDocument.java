/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools;

import net.scoreworks.abctools.exceptions.HeaderOrderException;
import net.scoreworks.abctools.exceptions.HeaderTooShortException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed tune: the information fields of its header and the resolved events of its body. The header is validated
 * and the key signature is applied on construction, so a document either exists fully resolved or not at all.
 */
public class AbcDocument {
    private final List<InformationField> fields;
    private final List<MusicObject> music;

    /**
     * @param fields header fields in the order they were read. Must start with X: and T: and end with K:
     * @param music folded events of the body. The document takes ownership and resolves accidentals in place
     * @throws HeaderTooShortException if there are fewer than three fields
     * @throws HeaderOrderException if the fields are not arranged as X:, T:, ..., K:
     * @throws net.scoreworks.abctools.exceptions.KeySignatureUnsupportedException if K: is not C with accidentals
     */
    public AbcDocument(@NotNull List<InformationField> fields, @NotNull List<MusicObject> music) {
        validateHeader(fields);
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.music = Collections.unmodifiableList(new ArrayList<>(music));
        KeySignaturePropagator.propagate(getKeySignature(), getNotes());
    }

    private static void validateHeader(List<InformationField> fields) {
        if (fields.size() < 3)
            throw new HeaderTooShortException(fields.size());
        if (fields.get(0).getKey() != 'X')
            throw new HeaderOrderException("Tune header must begin with X:", fields.get(0).getKey());
        if (fields.get(1).getKey() != 'T')
            throw new HeaderOrderException("Tune header must continue with T: after X:", fields.get(1).getKey());
        char last = fields.get(fields.size() - 1).getKey();
        if (last != 'K')
            throw new HeaderOrderException("Tune header must end with K:", last);
    }

    public List<InformationField> getFields() {
        return fields;
    }

    /**
     * @return the first field with the given key or null if there is none
     */
    public InformationField getField(char key) {
        char k = Character.toUpperCase(key);
        for (InformationField field : fields) {
            if (field.getKey() == k)
                return field;
        }
        return null;
    }

    public String getTitle() {
        return fields.get(1).getValue();
    }

    /**
     * @return value of the first K: field, which is the one key signature propagation uses
     */
    public String getKeySignature() {
        return getField('K').getValue();
    }

    public List<MusicObject> getMusic() {
        return music;
    }

    public List<Note> getNotes() {
        List<Note> notes = new ArrayList<>();
        for (MusicObject m : music) {
            if (m instanceof Note)
                notes.add((Note) m);
        }
        return notes;
    }

    /**
     * @return the lowest sounding note or null if the tune has no notes
     */
    public Note getLowestNote() {
        List<Note> notes = getNotes();
        return notes.isEmpty() ? null : Collections.min(notes);
    }

    /**
     * @return the highest sounding note or null if the tune has no notes
     */
    public Note getHighestNote() {
        List<Note> notes = getNotes();
        return notes.isEmpty() ? null : Collections.max(notes);
    }

    /**
     * Number of distinct pitch values between the lowest and highest note, both included. This is the number of
     * teeth a music box comb needs to play the tune
     */
    public int getPitchRange() {
        List<Note> notes = getNotes();
        if (notes.isEmpty())
            return 0;
        return Collections.max(notes).getPitchValue() - Collections.min(notes).getPitchValue() + 1;
    }

    /** sum of all event durations in beats */
    public int getTotalDuration() {
        int total = 0;
        for (MusicObject m : music) {
            total += m.getDuration();
        }
        return total;
    }
}
