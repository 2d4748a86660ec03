/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools;

/**
 * A silent event, written as z or x. Rests have no pitch and are ignored by key signature propagation.
 */
public class Rest extends MusicObject {

    public Rest(int duration) {
        super(duration);
    }

    public Rest() {
        this(1);
    }

    @Override
    boolean tiesWith(MusicObject next) {
        return next instanceof Rest;
    }

    @Override
    public String toString() {
        return "z" + getDuration();
    }
}
