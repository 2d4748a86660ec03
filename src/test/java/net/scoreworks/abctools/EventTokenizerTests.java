package net.scoreworks.abctools;

import net.scoreworks.abctools.exceptions.InvalidPitchLetterException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class EventTokenizerTests {

    private static Note noteAt(List<EventToken> tokens, int index) {
        return (Note) tokens.get(index).getEvent();
    }

    @Test
    public void testClean() {
        Assertions.assertEquals("C2 D E F", EventTokenizer.clean("C2 | D  E |: F"));
        Assertions.assertEquals("C2-C2", EventTokenizer.clean("C2- | C2"));
        Assertions.assertEquals("[CEG]2 ^f =g _a", EventTokenizer.clean("[CEG]2 ^f =g _a"));
        Assertions.assertEquals("A/2 B,", EventTokenizer.clean("A/2 B,.(){}"));
    }

    @Test
    public void testNotesAndDurations() {
        List<EventToken> tokens = EventTokenizer.tokenize("C2 D e' F,3 G");
        Assertions.assertEquals(5, tokens.size());
        Assertions.assertEquals("C", noteAt(tokens, 0).getName());
        Assertions.assertEquals(2, noteAt(tokens, 0).getDuration());
        Assertions.assertEquals(1, noteAt(tokens, 1).getDuration());
        Assertions.assertEquals("e'", noteAt(tokens, 2).getName());
        Assertions.assertEquals(68, noteAt(tokens, 2).getPitchValue());
        Assertions.assertEquals("F,", noteAt(tokens, 3).getName());
        Assertions.assertEquals(3, noteAt(tokens, 3).getDuration());
        Assertions.assertNull(noteAt(tokens, 4).getAccidental());
    }

    @Test
    public void testDurationIsSingleDigit() {
        List<EventToken> tokens = EventTokenizer.tokenize("C12 D");
        Assertions.assertEquals(2, tokens.size());
        Assertions.assertEquals(1, tokens.get(0).getEvent().getDuration());
        Assertions.assertEquals(1, tokens.get(1).getEvent().getDuration());
    }

    @Test
    public void testRests() {
        List<EventToken> tokens = EventTokenizer.tokenize("z2 x Z4 X");
        Assertions.assertEquals(4, tokens.size());
        for (EventToken token : tokens) {
            Assertions.assertTrue(token.getEvent() instanceof Rest);
        }
        Assertions.assertEquals(2, tokens.get(0).getEvent().getDuration());
        Assertions.assertEquals(1, tokens.get(1).getEvent().getDuration());
        Assertions.assertEquals(4, tokens.get(2).getEvent().getDuration());
    }

    @Test
    public void testAccidentals() {
        List<EventToken> tokens = EventTokenizer.tokenize("^F _B =c ^^G _^A =_d");
        Assertions.assertSame(Accidental.SHARP, noteAt(tokens, 0).getAccidental());
        Assertions.assertSame(Accidental.FLAT, noteAt(tokens, 1).getAccidental());
        Assertions.assertSame(Accidental.NATURAL, noteAt(tokens, 2).getAccidental());
        //only the mark right before the letter counts
        Assertions.assertSame(Accidental.SHARP, noteAt(tokens, 3).getAccidental());
        Assertions.assertSame(Accidental.SHARP, noteAt(tokens, 4).getAccidental());
        Assertions.assertSame(Accidental.FLAT, noteAt(tokens, 5).getAccidental());
        Assertions.assertEquals(53, noteAt(tokens, 5).getPitchValue());
    }

    @Test
    public void testGroupingFlags() {
        List<EventToken> tokens = EventTokenizer.tokenize("[C2 E2 G2] A-A");
        Assertions.assertEquals(5, tokens.size());
        Assertions.assertTrue(tokens.get(0).isChordStart());
        Assertions.assertFalse(tokens.get(0).isChordEnd());
        Assertions.assertFalse(tokens.get(1).isChordStart());
        Assertions.assertFalse(tokens.get(1).isChordEnd());
        Assertions.assertTrue(tokens.get(2).isChordEnd());
        Assertions.assertTrue(tokens.get(3).isTie());
        Assertions.assertFalse(tokens.get(4).isTie());
    }

    @Test
    public void testUnmatchedCharactersAreSkipped() {
        List<EventToken> tokens = EventTokenizer.tokenize("/ 3 C/2 - D");
        Assertions.assertEquals(2, tokens.size());
        Assertions.assertEquals("C", noteAt(tokens, 0).getName());
        Assertions.assertEquals("D", noteAt(tokens, 1).getName());
    }

    @Test
    public void testUnknownLetter() {
        Assertions.assertThrows(InvalidPitchLetterException.class, () -> EventTokenizer.tokenize("C H"));
    }
}
