package com.example.demo.deckgen.model;

import com.example.demo.deckgen.exception.MalformedTextRangeException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw text plus character range annotations. Ranges are half open
 * ({@code [start, end)}) offsets into {@link #rawText}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextDefinition {
    @Builder.Default
    private String rawText = "";

    @Builder.Default
    private List<TextRun> textRuns = new ArrayList<>();

    @Builder.Default
    private List<ListMarker> listMarkers = new ArrayList<>();

    public static TextDefinition of(String rawText) {
        return TextDefinition.builder().rawText(rawText).build();
    }

    /**
     * Checks that every run and list marker lies within the text.
     *
     * @throws MalformedTextRangeException on the first range that does not
     */
    public void validate() {
        int length = rawText == null ? 0 : rawText.length();
        if (textRuns != null) {
            for (TextRun run : textRuns) {
                checkRange("text run", run.getStart(), run.getEnd(), length);
            }
        }
        if (listMarkers != null) {
            for (ListMarker marker : listMarkers) {
                checkRange("list marker", marker.getStart(), marker.getEnd(), length);
            }
        }
    }

    private void checkRange(String what, int start, int end, int length) {
        if (start < 0 || start > end || end > length) {
            throw new MalformedTextRangeException(String.format(
                    "Invalid %s range [%d, %d) for text of length %d: \"%s\"",
                    what, start, end, length, abbreviate(rawText)));
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 40 ? text : text.substring(0, 40) + "...";
    }
}
