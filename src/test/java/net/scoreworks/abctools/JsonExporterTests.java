package net.scoreworks.abctools;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

public class JsonExporterTests {

    @Test
    public void testCompactOutput() {
        AbcDocument document = AbcParser.parse(Arrays.asList("X:1", "T:Tune", "K:C _B"), "^F2 B z");
        String json = JsonExporter.toJson(document, false);
        Assertions.assertEquals("{\"fields\":[" +
                "{\"key\":\"X\",\"value\":\"1\"}," +
                "{\"key\":\"T\",\"value\":\"Tune\"}," +
                "{\"key\":\"K\",\"value\":\"C _B\"}]," +
                "\"events\":[" +
                "{\"type\":\"note\",\"duration\":2,\"name\":\"F\",\"accidental\":\"sharp\",\"pitchValue\":46}," +
                "{\"type\":\"note\",\"duration\":1,\"name\":\"B\",\"accidental\":\"flat\",\"pitchValue\":50}," +
                "{\"type\":\"rest\",\"duration\":1}]}", json);
    }

    @Test
    public void testPrettyPrinting() {
        AbcDocument document = AbcParser.parse(Arrays.asList("X:1", "T:Tune", "K:C"), "C");
        String json = JsonExporter.toJson(document, true);
        System.out.println(json);
        Assertions.assertEquals("{\n" +
                "  \"fields\":[\n" +
                "    {\"key\":\"X\",\"value\":\"1\"},\n" +
                "    {\"key\":\"T\",\"value\":\"Tune\"},\n" +
                "    {\"key\":\"K\",\"value\":\"C\"}\n" +
                "  ],\n" +
                "  \"events\":[\n" +
                "    {\"type\":\"note\",\"duration\":1,\"name\":\"C\",\"accidental\":null,\"pitchValue\":40}\n" +
                "  ]\n" +
                "}", json);
    }

    @Test
    public void testEmptyBodyAndEscaping() {
        AbcDocument document = AbcParser.parse(Arrays.asList("X:1", "T:The \"Tune\"", "K:C"), "");
        String json = JsonExporter.toJson(document, false);
        Assertions.assertTrue(json.contains("\"value\":\"The \\\"Tune\\\"\""));
        Assertions.assertTrue(json.endsWith("\"events\":[]}"));
    }
}
