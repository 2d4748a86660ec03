/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

import static net.scoreworks.abctools.AbcParser.verbose;

/**
 * Folds a token stream into the final event sequence. Two groupings are resolved while the tokens are consumed:
 * <ul>
 *  <li>tie: two tied events with the same name become one event holding the summed duration</li>
 *  <li>chord: all events after the first one in square brackets keep their place but get a duration of 0, so only
 *  the first member advances the timeline</li>
 * </ul>
 * Ties are resolved before chord zeroing, so a tied note inside a chord is summed first. Malformed groupings, like
 * a tie between different notes, are tolerated silently.
 */
public final class TieChordFolder {
    private final List<MusicObject> music = new ArrayList<>();
    private boolean pendingTie;
    private boolean inChord;

    private TieChordFolder() {}

    public static List<MusicObject> fold(@NotNull List<EventToken> tokens) {
        TieChordFolder folder = new TieChordFolder();
        for (EventToken token : tokens) {
            folder.accept(token);
        }
        return folder.music;
    }

    void accept(EventToken token) {
        music.add(token.getEvent());

        if (pendingTie) {
            int size = music.size();
            MusicObject previous = music.get(size - 2);
            MusicObject current = music.get(size - 1);
            if (previous.tiesWith(current)) {
                if (verbose) System.out.println(">tie "+previous+" + "+current);
                previous.setDuration(previous.getDuration() + current.getDuration());
                music.remove(size - 1);
            }
            pendingTie = false;
        }

        pendingTie = token.isTie();

        if (inChord) {
            //the last event is the merged one if a tie was just resolved
            MusicObject last = music.get(music.size() - 1);
            if (verbose) System.out.println(">chord member "+last+" zeroed");
            last.setDuration(0);
            inChord = !token.isChordEnd();
        }
        else {
            inChord = token.isChordStart();
        }
    }
}
