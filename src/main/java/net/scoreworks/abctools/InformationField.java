/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools;

import org.jetbrains.annotations.NotNull;

/**
 * A header line of the form "K:value". The key is stored upper-cased, the value as written after the colon.
 */
public class InformationField {
    private final char key;
    private final String value;

    public InformationField(char key, @NotNull String value) {
        this.key = Character.toUpperCase(key);
        this.value = value;
    }

    public char getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return key + ":" + value;
    }
}
