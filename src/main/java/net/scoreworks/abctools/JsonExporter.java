/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.abctools;

import org.apache.commons.text.StringEscapeUtils;
import org.jetbrains.annotations.NotNull;

/**
 * Writes (formatted) Json-Strings for parsed tunes, to hand them over to renderers. The output has the form
 * <pre>
 * {
 *   "fields":[{"key":"X","value":"1"}, ...],
 *   "events":[{"type":"note","duration":2,"name":"F","accidental":"sharp","pitchValue":46}, {"type":"rest","duration":1}, ...]
 * }
 * </pre>
 */
public final class JsonExporter {
    private static final String INDENT = "  ";

    private JsonExporter() {}

    public static String toJson(@NotNull AbcDocument document, boolean prettyPrinting) {
        return new Serialization(document, prettyPrinting).strb.toString();
    }

    private static String quote(String value) {
        return "\"" + StringEscapeUtils.escapeJson(value) + "\"";
    }

    private static class Serialization {

        /**
         * adds line breaks and indentations if set to true
         */
        private final boolean prettyPrinting;

        private final StringBuilder strb = new StringBuilder();

        Serialization(AbcDocument document, boolean prettyPrinting) {
            this.prettyPrinting = prettyPrinting;
            strb.append("{");
            printFields(document, 1);
            strb.append(",");
            printEvents(document, 1);
            if (prettyPrinting) newIndentedLine(strb, 0);
            strb.append("}");
        }

        private void printFields(AbcDocument document, int indentation) {
            if (prettyPrinting) newIndentedLine(strb, indentation);
            strb.append("\"fields\":[");
            for (InformationField field : document.getFields()) {
                if (prettyPrinting) newIndentedLine(strb, indentation + 1);
                strb.append("{\"key\":").append(quote(String.valueOf(field.getKey())))
                        .append(",\"value\":").append(quote(field.getValue())).append("},");
            }
            closeArray(indentation);
        }

        private void printEvents(AbcDocument document, int indentation) {
            if (prettyPrinting) newIndentedLine(strb, indentation);
            strb.append("\"events\":[");
            for (MusicObject m : document.getMusic()) {
                if (prettyPrinting) newIndentedLine(strb, indentation + 1);
                if (m instanceof Note) {
                    Note note = (Note) m;
                    strb.append("{\"type\":\"note\",\"duration\":").append(note.getDuration())
                            .append(",\"name\":").append(quote(note.getName()))
                            .append(",\"accidental\":");
                    if (note.hasAccidental())
                        strb.append(quote(note.getAccidental().toString()));
                    else
                        strb.append("null");
                    strb.append(",\"pitchValue\":").append(note.getPitchValue()).append("},");
                }
                else {
                    strb.append("{\"type\":\"rest\",\"duration\":").append(m.getDuration()).append("},");
                }
            }
            closeArray(indentation);
        }

        private void closeArray(int indentation) {
            //erase last comma, if last character is a comma (leave brackets alone)
            if (strb.charAt(strb.length() - 1) == ',') {
                strb.setLength(strb.length() - 1);
                if (prettyPrinting) newIndentedLine(strb, indentation);
            }
            strb.append("]");
        }
    }

    private static void newIndentedLine(StringBuilder strb, int number) {
        strb.append("\n");
        while (number > 0) {
            strb.append(INDENT);
            number--;
        }
    }
}
