package org.fortranonjava.lexer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CharBlockTest {

    @Test
    public void testViewIntoBuffer() {
        CharBlock block = new CharBlock("do 10 i", 3, 2);

        assertEquals("10", block.toString());
        assertEquals('0', block.charAt(1));
        assertEquals(5, block.getEnd());
        assertTrue(block.contentEquals("10"));
        assertFalse(block.contentEquals("1"));
        assertEquals("0", block.subSequence(1, 2).toString());
    }

    @Test
    public void testBlankClassification() {
        assertTrue(new CharBlock(" \t ", 0, 3).isBlank());
        assertTrue(new CharBlock("abc", 1, 0).isBlank());
        assertFalse(new CharBlock(" !", 0, 2).isBlank());
        assertEquals('!', new CharBlock("  ! c", 0, 5).firstNonBlank());
        assertEquals(' ', new CharBlock("   ", 0, 3).firstNonBlank());
    }

    @Test
    public void testBoundsAreChecked() {
        assertThrows(IndexOutOfBoundsException.class, () -> new CharBlock("abc", 2, 2));
        CharBlock block = new CharBlock("abcdef", 1, 2);
        assertThrows(IndexOutOfBoundsException.class, () -> block.charAt(2));
        assertThrows(IndexOutOfBoundsException.class, () -> block.subSequence(0, 3));
    }
}
