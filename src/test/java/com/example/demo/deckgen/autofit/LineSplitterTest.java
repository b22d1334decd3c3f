package com.example.demo.deckgen.autofit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Line Splitter Tests")
public class LineSplitterTest {

    @Test
    @DisplayName("Text shorter than a line stays on one line")
    public void testShortText() {
        assertEquals(List.of("hello"), LineSplitter.split("hello", 10));
    }

    @Test
    @DisplayName("Breaks at the last space of each window")
    public void testBreaksAtSpaces() {
        assertEquals(Arrays.asList("aaa", "bbb", "ccc"), LineSplitter.split("aaa bbb ccc", 5));
    }

    @Test
    @DisplayName("Cuts words that are longer than a line")
    public void testCutsLongWords() {
        assertEquals(Arrays.asList("abcd", "efgh", "ij"), LineSplitter.split("abcdefghij", 4));
    }

    @Test
    @DisplayName("Hard breaks inside a wrapped segment add lines")
    public void testHardBreaks() {
        assertEquals(Arrays.asList("ab", "cd", "efgh"), LineSplitter.split("ab\ncd efgh", 6));
    }

    @Test
    @DisplayName("No line is longer than the limit")
    public void testLineLengthBound() {
        String text = "The quick brown fox jumps over the lazy dog while a supercalifragilistic word appears twice "
                + "supercalifragilistic and the text keeps going for a little while longer.";
        for (int width = 1; width <= 40; width++) {
            for (String line : LineSplitter.split(text, width)) {
                assertTrue(line.length() <= width, "line '" + line + "' exceeds " + width);
            }
        }
    }

    @Test
    @DisplayName("Rejects a non-positive line length")
    public void testRejectsZeroWidth() {
        assertThrows(IllegalArgumentException.class, () -> LineSplitter.split("text", 0));
    }
}
