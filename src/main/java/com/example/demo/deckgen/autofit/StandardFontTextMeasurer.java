package com.example.demo.deckgen.autofit;

import com.example.demo.deckgen.geometry.Units;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;

/**
 * Measures text with the metrics of the standard PDF fonts, so no font has to be
 * installed on the host. Sans families map to Helvetica (Arial shares its widths),
 * serif families to Times and monospace families to Courier.
 *
 * Characters the font cannot encode fall back to a full em for East Asian
 * wide characters and to the font's average width otherwise.
 */
@Component
public class StandardFontTextMeasurer implements TextMeasurer {

    private static final double BOLD_WEIGHT = 600;
    private static final float WIDE_WIDTH = 1000f;

    @Override
    public double measureWidth(String text, String fontFamily, double weight, double fontSizePt) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        PDType1Font font = selectFont(fontFamily, weight >= BOLD_WEIGHT);
        return units(font, text) / 1000.0 * emPixels(fontSizePt);
    }

    @Override
    public double lineHeight(String fontFamily, double weight, double fontSizePt) {
        return emPixels(fontSizePt);
    }

    static PDType1Font selectFont(String fontFamily, boolean bold) {
        if (isMonospace(fontFamily)) {
            return bold ? PDType1Font.COURIER_BOLD : PDType1Font.COURIER;
        }
        if (isSerif(fontFamily)) {
            return bold ? PDType1Font.TIMES_BOLD : PDType1Font.TIMES_ROMAN;
        }
        return bold ? PDType1Font.HELVETICA_BOLD : PDType1Font.HELVETICA;
    }

    private static float units(PDType1Font font, String text) {
        try {
            return font.getStringWidth(text);
        } catch (IllegalArgumentException e) {
            // at least one glyph is outside the font's encoding
            return unitsPerCodePoint(font, text);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read metrics of " + font.getName(), e);
        }
    }

    private static float unitsPerCodePoint(PDType1Font font, String text) {
        float total = 0;
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            total += glyphUnits(font, codePoint);
            i += Character.charCount(codePoint);
        }
        return total;
    }

    private static float glyphUnits(PDType1Font font, int codePoint) {
        try {
            return font.getStringWidth(new String(Character.toChars(codePoint)));
        } catch (IllegalArgumentException e) {
            if (isWide(codePoint)) {
                return WIDE_WIDTH;
            }
            return font.getAverageFontWidth();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read metrics of " + font.getName(), e);
        }
    }

    static boolean isWide(int codePoint) {
        Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
        if (script == Character.UnicodeScript.HAN
                || script == Character.UnicodeScript.HIRAGANA
                || script == Character.UnicodeScript.KATAKANA
                || script == Character.UnicodeScript.HANGUL) {
            return true;
        }
        Character.UnicodeBlock block = Character.UnicodeBlock.of(codePoint);
        return block == Character.UnicodeBlock.CJK_SYMBOLS_AND_PUNCTUATION
                || block == Character.UnicodeBlock.HALFWIDTH_AND_FULLWIDTH_FORMS;
    }

    private static double emPixels(double fontSizePt) {
        return Units.pointsToPixels(fontSizePt);
    }

    static boolean isMonospace(String fontFamily) {
        if (fontFamily == null) {
            return false;
        }
        String family = fontFamily.toLowerCase(Locale.ROOT);
        return family.contains("mono") || family.startsWith("courier") || family.equals("consolas");
    }

    static boolean isSerif(String fontFamily) {
        if (fontFamily == null) {
            return false;
        }
        String family = fontFamily.toLowerCase(Locale.ROOT);
        return family.startsWith("times") || family.equals("georgia") || family.equals("garamond")
                || (family.contains("serif") && !family.contains("sans"));
    }
}
