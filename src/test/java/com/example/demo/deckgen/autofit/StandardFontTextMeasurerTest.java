package com.example.demo.deckgen.autofit;

import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Standard Font Text Measurer Tests")
public class StandardFontTextMeasurerTest {

    private final StandardFontTextMeasurer measurer = new StandardFontTextMeasurer();

    @Test
    public void testSingleGlyphWidth() {
        // 12pt = 16px, 'A' is 667/1000 em
        assertEquals(0.667 * 16, measurer.measureWidth("A", "Arial", 400, 12), 1e-4);
    }

    @Test
    public void testBoldIsWider() {
        double regular = measurer.measureWidth("abc", "Arial", 400, 12);
        double bold = measurer.measureWidth("abc", "Arial", 700, 12);
        assertTrue(bold > regular);
    }

    @Test
    public void testMonospaceFamilies() {
        assertEquals(4 * 0.6 * 16, measurer.measureWidth("iiii", "Courier New", 400, 12), 1e-4);
        assertEquals(4 * 0.6 * 16, measurer.measureWidth("MMMM", "Roboto Mono", 400, 12), 1e-4);
        assertTrue(StandardFontTextMeasurer.isMonospace("Consolas"));
        assertFalse(StandardFontTextMeasurer.isMonospace("Arial"));
    }

    @Test
    public void testAccentedLatinUsesFontMetrics() {
        // eacute is 556/1000 em in Helvetica
        assertEquals(0.556 * 16, measurer.measureWidth("é", "Arial", 400, 12), 1e-4);
    }

    @Test
    @DisplayName("Glyphs the font cannot encode are measured as full width when East Asian")
    public void testUnencodableWideGlyphs() {
        assertEquals(2 * 16, measurer.measureWidth("日本", "Arial", 400, 12), 1e-4);
        assertEquals(2 * 16 + 0.667 * 16, measurer.measureWidth("テキA", "Arial", 400, 12), 1e-4);
        assertTrue(StandardFontTextMeasurer.isWide('語'));
        assertFalse(StandardFontTextMeasurer.isWide('a'));
    }

    @Test
    public void testSerifFamiliesUseTimes() {
        // 'A' is 722/1000 em in Times-Roman
        assertEquals(0.722 * 16, measurer.measureWidth("A", "Times New Roman", 400, 12), 1e-4);
        assertEquals(PDType1Font.TIMES_BOLD, StandardFontTextMeasurer.selectFont("Georgia", true));
        assertEquals(PDType1Font.HELVETICA, StandardFontTextMeasurer.selectFont("Open Sans", false));
    }

    @Test
    public void testLineHeightIsOneEm() {
        assertEquals(16, measurer.lineHeight("Arial", 400, 12), 1e-4);
        assertEquals(0, measurer.measureWidth("", "Arial", 400, 12));
    }
}
