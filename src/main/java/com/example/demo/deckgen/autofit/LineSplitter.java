package com.example.demo.deckgen.autofit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Greedy word wrap used to estimate how many lines a text needs.
 */
public final class LineSplitter {

    private LineSplitter() {
    }

    /**
     * Breaks {@code text} into lines of at most {@code maxChars} characters, preferring
     * the last space of each window and cutting mid word when a window has none.
     * Hard line breaks inside wrapped segments produce extra lines.
     *
     * @param maxChars characters per line, at least 1
     */
    public static List<String> split(String text, int maxChars) {
        if (maxChars < 1) {
            throw new IllegalArgumentException("maxChars must be positive, got " + maxChars);
        }
        List<String> lines = new ArrayList<>();
        String rest = text == null ? "" : text;
        while (rest.length() > maxChars) {
            int pos = rest.substring(0, maxChars).lastIndexOf(' ');
            pos = pos <= 0 ? maxChars : pos;
            lines.addAll(Arrays.asList(rest.substring(0, pos).split("\n", -1)));
            int next = rest.indexOf(' ', pos) + 1;
            if (next < pos || next > pos + maxChars) {
                next = pos;
            }
            rest = rest.substring(next);
        }
        lines.add(rest);
        return lines;
    }
}
