/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools;

/**
 * Base class for every event of a tune body. An event occupies a number of beats on the timeline. Durations
 * are only changed by the parser while folding ties and chords, so they are fixed once an {@link AbcDocument}
 * is handed out.
 */
public abstract class MusicObject {

    /** length in beats, 0 for chord members that sound together with the preceding event */
    private int duration;

    protected MusicObject(int duration) {
        this.duration = duration;
    }

    public int getDuration() {
        return duration;
    }

    void setDuration(int duration) {
        this.duration = duration;
    }

    /**
     * @return true if a tie between this object and the given later one merges them into a single event
     */
    abstract boolean tiesWith(MusicObject next);
}
