/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools;

/**
 * One scanned event of a tune body together with the grouping marks written around it. Tokens only live
 * between {@link EventTokenizer} and {@link TieChordFolder}.
 */
public class EventToken {
    private final MusicObject event;
    private final boolean chordStart;
    private final boolean chordEnd;
    private final boolean tie;

    public EventToken(MusicObject event, boolean chordStart, boolean chordEnd, boolean tie) {
        this.event = event;
        this.chordStart = chordStart;
        this.chordEnd = chordEnd;
        this.tie = tie;
    }

    public MusicObject getEvent() {
        return event;
    }

    /** token was preceded by "[" */
    public boolean isChordStart() {
        return chordStart;
    }

    /** token was followed by "]" */
    public boolean isChordEnd() {
        return chordEnd;
    }

    /** token was followed by "-" */
    public boolean isTie() {
        return tie;
    }
}
