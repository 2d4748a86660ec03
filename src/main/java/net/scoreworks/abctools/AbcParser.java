/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools;

import net.scoreworks.abctools.exceptions.EmptyInputException;
import net.scoreworks.abctools.exceptions.MissingMarkerException;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point for reading tunes in ABC notation. A file starts with the marker line "%abc", followed by the
 * information fields of the tune header and the tune body:
 * <pre>
 * %abc
 * X:1
 * T:Tune
 * K:C ^F
 * [CEG]2 F- F B |
 * </pre>
 * The parser reads the header, cleans and tokenizes the body, folds ties and chords and assembles an
 * {@link AbcDocument}. Parsing holds no state between calls.
 */
public final class AbcParser {
    public static final String MARKER = "%abc";

    private static final Pattern INFORMATION_FIELD = Pattern.compile("([A-Za-z]):(.*)");

    /** print messages for debug purposes */
    static boolean verbose;
    public static void setVerbose(boolean verbose) {
        AbcParser.verbose = verbose;
    }

    private AbcParser() {}

    /**
     * Read and parse an ABC file encoded in UTF-8.
     * @throws UncheckedIOException if the file can not be read
     */
    public static AbcDocument parse(@NotNull Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read "+file, e);
        }
        if (verbose) System.out.println("\n========== PARSING "+file.getFileName());
        return parse(lines);
    }

    /**
     * Parse the lines of an ABC file, starting with the marker line.
     * @throws EmptyInputException if there are no lines
     * @throws MissingMarkerException if the first line is not the marker
     */
    public static AbcDocument parse(@NotNull List<String> lines) {
        if (lines.isEmpty())
            throw new EmptyInputException();
        if (!lines.get(0).trim().equals(MARKER))
            throw new MissingMarkerException(MARKER, lines.get(0));

        //header ends with the first non-blank line that is no information field
        int index = 1;
        while (index < lines.size()) {
            String line = lines.get(index).trim();
            if (!line.isEmpty() && !INFORMATION_FIELD.matcher(line).matches())
                break;
            index++;
        }
        List<String> headerLines = lines.subList(1, index);

        StringBuilder body = new StringBuilder();
        for (String line : lines.subList(index, lines.size())) {
            body.append(line.trim());
        }
        return parse(headerLines, body.toString());
    }

    /**
     * Parse a tune that was already split into header and body.
     * @param headerLines lines of the form "K:value", blank lines are ignored
     * @param body the raw tune body
     */
    public static AbcDocument parse(@NotNull List<String> headerLines, @NotNull String body) {
        List<InformationField> fields = readHeader(headerLines);
        String content = EventTokenizer.clean(body);
        if (verbose) System.out.println(">body: "+content);
        List<MusicObject> music = TieChordFolder.fold(EventTokenizer.tokenize(content));
        AbcDocument document = new AbcDocument(fields, music);
        if (verbose) System.out.println(">resolved "+document.getMusic());
        return document;
    }

    static List<InformationField> readHeader(List<String> headerLines) {
        List<InformationField> fields = new ArrayList<>();
        for (String line : headerLines) {
            if (StringUtils.isBlank(line))
                continue;
            Matcher m = INFORMATION_FIELD.matcher(line.trim());
            if (!m.matches())
                break;
            InformationField field = new InformationField(m.group(1).charAt(0), m.group(2));
            if (verbose) System.out.println(">field "+field);
            fields.add(field);
        }
        return fields;
    }
}
