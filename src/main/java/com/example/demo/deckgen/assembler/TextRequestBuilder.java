package com.example.demo.deckgen.assembler;

import com.example.demo.deckgen.exception.UnsupportedContentException;
import com.example.demo.deckgen.model.ListMarker;
import com.example.demo.deckgen.model.TextDefinition;
import com.example.demo.deckgen.model.TextRun;
import com.example.demo.deckgen.remote.Dimension;
import com.example.demo.deckgen.remote.Link;
import com.example.demo.deckgen.remote.OptionalColor;
import com.example.demo.deckgen.remote.TextStyle;
import com.example.demo.deckgen.remote.request.CreateParagraphBulletsRequest;
import com.example.demo.deckgen.remote.request.InsertTextRequest;
import com.example.demo.deckgen.remote.request.Request;
import com.example.demo.deckgen.remote.request.TextRange;
import com.example.demo.deckgen.remote.request.UpdateTextStyleRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Turns a {@link TextDefinition} into insert, style and bullet requests.
 *
 * Styles and bullets are emitted last range first so that applying one never shifts
 * the indices of the next. The definition itself is left untouched.
 */
@Component
public class TextRequestBuilder {

    /**
     * @param fittedFontSize autofit result in points, or null when autofit is off.
     *                       Applied to the whole text and to every run without its own size.
     * @return requests in dispatch order, empty for blank text
     */
    public List<Request> build(TextDefinition text, TextTarget target, Double fittedFontSize) {
        List<Request> requests = new ArrayList<>();
        if (text == null || text.getRawText() == null || text.getRawText().trim().isEmpty()) {
            return requests;
        }

        requests.add(Request.of(InsertTextRequest.builder()
                .objectId(target.getObjectId())
                .cellLocation(target.getCellLocation())
                .text(text.getRawText())
                .build()));

        List<TextRun> runs = new ArrayList<>();
        if (text.getTextRuns() != null) {
            runs.addAll(text.getTextRuns());
        }
        if (fittedFontSize != null) {
            runs.add(TextRun.builder().start(0).end(text.getRawText().length()).build());
        }
        for (int i = runs.size() - 1; i >= 0; i--) {
            Request styleRequest = styleRequest(runs.get(i), target, fittedFontSize);
            if (styleRequest != null) {
                requests.add(styleRequest);
            }
        }

        List<ListMarker> markers = text.getListMarkers() == null ? List.of() : text.getListMarkers();
        for (int i = markers.size() - 1; i >= 0; i--) {
            ListMarker marker = markers.get(i);
            requests.add(Request.of(CreateParagraphBulletsRequest.builder()
                    .objectId(target.getObjectId())
                    .cellLocation(target.getCellLocation())
                    .textRange(TextRange.fixed(marker.getStart(), marker.getEnd()))
                    .bulletPreset(marker.getType() == ListMarker.ListType.ORDERED
                            ? CreateParagraphBulletsRequest.NUMBERED_PRESET
                            : CreateParagraphBulletsRequest.BULLET_PRESET)
                    .build()));
        }
        return requests;
    }

    private Request styleRequest(TextRun run, TextTarget target, Double fittedFontSize) {
        Double fontSize = run.getFontSize() != null ? run.getFontSize() : fittedFontSize;
        TextStyle style = TextStyle.builder()
                .bold(run.getBold())
                .italic(run.getItalic())
                .underline(run.getUnderline())
                .strikethrough(run.getStrikethrough())
                .smallCaps(run.getSmallCaps())
                .fontFamily(run.getFontFamily())
                .fontSize(fontSize == null ? null : Dimension.pt(fontSize))
                .foregroundColor(color(run.getForegroundColor()))
                .backgroundColor(color(run.getBackgroundColor()))
                .link(run.getLink() == null ? null : new Link(run.getLink()))
                .baselineOffset(run.getBaselineOffset())
                .build();

        String fields = fieldMask(style);
        if (fields.isEmpty()) {
            return null;
        }
        return Request.of(UpdateTextStyleRequest.builder()
                .objectId(target.getObjectId())
                .cellLocation(target.getCellLocation())
                .textRange(TextRange.fixed(run.getStart(), run.getEnd()))
                .style(style)
                .fields(fields)
                .build());
    }

    /**
     * Comma separated names of the style properties that are set.
     */
    static String fieldMask(TextStyle style) {
        StringJoiner fields = new StringJoiner(",");
        addIfSet(fields, "bold", style.getBold());
        addIfSet(fields, "italic", style.getItalic());
        addIfSet(fields, "underline", style.getUnderline());
        addIfSet(fields, "strikethrough", style.getStrikethrough());
        addIfSet(fields, "smallCaps", style.getSmallCaps());
        addIfSet(fields, "fontFamily", style.getFontFamily());
        addIfSet(fields, "fontSize", style.getFontSize());
        addIfSet(fields, "foregroundColor", style.getForegroundColor());
        addIfSet(fields, "backgroundColor", style.getBackgroundColor());
        addIfSet(fields, "link", style.getLink());
        addIfSet(fields, "baselineOffset", style.getBaselineOffset());
        return fields.toString();
    }

    private static void addIfSet(StringJoiner fields, String name, Object value) {
        if (value != null) {
            fields.add(name);
        }
    }

    /**
     * Parses {@code #rrggbb} (or {@code #rgb}) into a color with 0..1 components.
     */
    static OptionalColor color(String hex) {
        if (hex == null || hex.isBlank()) {
            return null;
        }
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if (digits.length() == 3) {
            digits = new StringBuilder()
                    .append(digits.charAt(0)).append(digits.charAt(0))
                    .append(digits.charAt(1)).append(digits.charAt(1))
                    .append(digits.charAt(2)).append(digits.charAt(2))
                    .toString();
        }
        if (digits.length() != 6) {
            throw new UnsupportedContentException("Not a hex color: " + hex);
        }
        int value;
        try {
            value = Integer.parseInt(digits, 16);
        } catch (NumberFormatException e) {
            throw new UnsupportedContentException("Not a hex color: " + hex);
        }
        return OptionalColor.rgb(
                ((value >> 16) & 0xff) / 255.0,
                ((value >> 8) & 0xff) / 255.0,
                (value & 0xff) / 255.0);
    }
}
