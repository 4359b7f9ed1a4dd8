package software.amazon.pattern.scanner.input;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AlphabetTest {

    @Test
    public void lowercaseLatinMapsLettersInOrder() {
        Alphabet alphabet = Alphabet.lowercaseLatin();
        assertEquals(26, alphabet.size());
        assertEquals(0, alphabet.indexOf('a'));
        assertEquals(25, alphabet.indexOf('z'));
        assertEquals('q', alphabet.symbolAt(alphabet.indexOf('q')));
    }

    @Test
    public void indicesFollowDeclarationOrder() {
        Alphabet alphabet = Alphabet.of("tgca");
        assertEquals(0, alphabet.indexOf('t'));
        assertEquals(1, alphabet.indexOf('g'));
        assertEquals(2, alphabet.indexOf('c'));
        assertEquals(3, alphabet.indexOf('a'));
    }

    @Test
    public void containsIsBoundsChecked() {
        Alphabet alphabet = Alphabet.of("abc");
        assertTrue(alphabet.contains('b'));
        assertFalse(alphabet.contains('d'));
        assertFalse(alphabet.contains('A'));
        assertFalse(alphabet.contains('\uffff'));
        assertFalse(alphabet.contains('\0'));
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyAlphabetIsRejected() {
        Alphabet.of("");
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateSymbolIsRejected() {
        Alphabet.of("abca");
    }

    @Test(expected = InvalidAlphabetSymbolException.class)
    public void indexOfUndeclaredSymbolIsRejected() {
        Alphabet.lowercaseLatin().indexOf('{');
    }

    @Test
    public void indexOfReportsNoPositionOrSource() {
        try {
            Alphabet.lowercaseLatin().indexOf('{');
            fail("expected InvalidAlphabetSymbolException");
        } catch (InvalidAlphabetSymbolException e) {
            assertEquals('{', e.getSymbol());
            assertEquals(InvalidAlphabetSymbolException.NO_POSITION, e.getPosition());
            assertEquals(InvalidAlphabetSymbolException.LOOKUP, e.getPatternId());
            assertFalse(e.isInText());
            assertEquals("Symbol '{' (U+007B) is not in the alphabet", e.getMessage());
        }
    }

    @Test
    public void encodeTextReportsFirstOffendingPosition() {
        try {
            Alphabet.lowercaseLatin().encodeText("abc de");
            fail("expected InvalidAlphabetSymbolException");
        } catch (InvalidAlphabetSymbolException e) {
            assertEquals(' ', e.getSymbol());
            assertEquals(3, e.getPosition());
            assertTrue(e.isInText());
        }
    }

    @Test
    public void encodePatternReportsPatternId() {
        try {
            Alphabet.lowercaseLatin().encodePattern(7, "heLlo");
            fail("expected InvalidAlphabetSymbolException");
        } catch (InvalidAlphabetSymbolException e) {
            assertEquals('L', e.getSymbol());
            assertEquals(2, e.getPosition());
            assertEquals(7, e.getPatternId());
            assertFalse(e.isInText());
            assertTrue(e.getMessage().contains("pattern 7"));
        }
    }

    @Test
    public void encodeMapsEverySymbol() {
        assertArrayEquals(new int[] { 7, 4, 11, 11, 14 }, Alphabet.lowercaseLatin().encodeText("hello"));
        assertArrayEquals(new int[0], Alphabet.lowercaseLatin().encodeText(""));
    }

    @Test
    public void alphabetsWithSameSymbolsAreEqual() {
        assertThat(Alphabet.of("abcdefghijklmnopqrstuvwxyz"), is(Alphabet.lowercaseLatin()));
        assertFalse(Alphabet.of("ab").equals(Alphabet.of("ba")));
    }
}
