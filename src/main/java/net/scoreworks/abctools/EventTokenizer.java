/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans the body of a tune into {@link EventToken}s. The body is first reduced to the constructs that carry
 * timing or pitch (letters, digits, accidentals, octave marks, ties and chord brackets), everything else like
 * decorations, bar lines and quoted annotations is dropped.
 */
public final class EventTokenizer {

    /** everything except letters, digits, whitespace and / - ^ _ , ' = [ ] */
    private static final Pattern UNUSED_CONSTRUCTS = Pattern.compile("[^a-zA-Z0-9\\s/\\-\\^_,'=\\[\\]]");
    private static final Pattern SPACES = Pattern.compile(" +");

    private static final Pattern EVENT = Pattern.compile(
            "(?<chordStart>  \\[?)          # chord start\n" +
            "(?<accidentals> [\\^=_]*)      # accidentals, the last one counts\n" +
            "(?<name>        [a-zA-Z][,']?) # letter with octave mark\n" +
            "(?<duration>    [0-9]?)        # duration in beats\n" +
            "(?<chordEnd>    \\]?)          # chord end\n" +
            "(?<tie>         -?)            # tie\n",
            Pattern.COMMENTS);

    private EventTokenizer() {}

    /**
     * Strip out constructs the tokenizer does not use, normalize spaces and join ties with whatever followed
     * them before decorations were removed.
     */
    public static String clean(@NotNull String body) {
        String content = UNUSED_CONSTRUCTS.matcher(body).replaceAll("");
        content = SPACES.matcher(content).replaceAll(" ");
        return content.replace("- ", "-");
    }

    /**
     * Scan a cleaned body left to right. Characters that do not form an event are skipped.
     */
    public static List<EventToken> tokenize(@NotNull String content) {
        List<EventToken> tokens = new ArrayList<>();
        Matcher m = EVENT.matcher(content);
        while (m.find()) {
            tokens.add(new EventToken(
                    createEvent(m.group("accidentals"), m.group("name"), m.group("duration")),
                    !m.group("chordStart").isEmpty(),
                    !m.group("chordEnd").isEmpty(),
                    !m.group("tie").isEmpty()));
        }
        return tokens;
    }

    private static MusicObject createEvent(String accidentals, String name, String duration) {
        int beats = StringUtils.isEmpty(duration) ? 1 : Integer.parseInt(duration);
        char letter = Character.toLowerCase(name.charAt(0));
        if (letter == 'z' || letter == 'x')
            return new Rest(beats);
        Accidental accidental = null;
        if (!accidentals.isEmpty())
            accidental = Accidental.fromMark(accidentals.charAt(accidentals.length() - 1));
        return new Note(name, accidental, beats);
    }
}
