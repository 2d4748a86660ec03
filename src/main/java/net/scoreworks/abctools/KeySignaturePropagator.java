/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools;

import net.scoreworks.abctools.exceptions.KeySignatureUnsupportedException;
import org.apache.commons.collections4.IterableUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

import static net.scoreworks.abctools.AbcParser.verbose;

/**
 * Applies the accidentals of a key signature to all notes that were written without one. Only the key of C with an
 * explicit list of accidentals is understood, e.g. "C ^F _B". Every note with a matching letter gets the accidental,
 * regardless of its octave and of bar lines. Accidentals written in the body always win.
 */
public final class KeySignaturePropagator {

    private KeySignaturePropagator() {}

    /**
     * @param keySignature value of the K: field, may be null if the field is missing
     * @throws KeySignatureUnsupportedException if the key signature is not C followed by accidentals
     */
    static void propagate(String keySignature, List<Note> notes) {
        String signature = StringUtils.trimToEmpty(keySignature);
        String[] tokens = StringUtils.split(signature, ' ');
        if (tokens.length == 0 || !tokens[0].equals("C"))
            throw new KeySignatureUnsupportedException(keySignature);

        for (int i = 1; i < tokens.length; i++) {
            String token = tokens[i];
            if (token.length() != 2)
                continue;
            char mark = token.charAt(0);
            char letter = Character.toLowerCase(token.charAt(1));
            if (!Accidental.isMark(mark) || letter < 'a' || letter > 'g')
                throw new KeySignatureUnsupportedException(keySignature, token);
            Accidental accidental = Accidental.fromMark(mark);
            for (Note n : IterableUtils.filteredIterable(notes,
                    n -> !n.hasAccidental() && Character.toLowerCase(n.getLetter()) == letter)) {
                if (verbose) System.out.println(">key signature: "+accidental+" "+n.getName());
                n.setAccidental(accidental);
            }
        }
    }
}
