package com.example.demo.deckgen.autofit;

import com.example.demo.deckgen.config.AutofitProperties;
import com.example.demo.deckgen.core.RenderContext;
import com.example.demo.deckgen.geometry.BoundingBox;
import com.example.demo.deckgen.geometry.Units;
import com.example.demo.deckgen.remote.PageElement;
import com.example.demo.deckgen.remote.TextElement;
import com.example.demo.deckgen.remote.TextStyle;
import com.example.demo.deckgen.style.EffectiveStyle;
import com.example.demo.deckgen.style.StyleInheritanceResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * Finds the largest font size, no larger than the shape's current one, at which a
 * text fits its placeholder. The search shrinks by a fixed step and stops at a
 * readability floor even when the text still overflows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutofitCalculator {

    private final AutofitProperties properties;
    private final TextMeasurer measurer;
    private final StyleInheritanceResolver styleResolver;

    /**
     * Font size (pt) for {@code text} placed in {@code element}. Results are memoized in
     * the context's cache until its snapshot is reloaded.
     */
    public double fontSizeFor(String text, PageElement element, FitConstraint constraint, RenderContext context) {
        FontSizeKey key = new FontSizeKey(text == null ? "" : text, element.getObjectId(), constraint);
        return context.getFontSizeCache().get(key,
                k -> compute(k.getText(), element, k.getConstraint(), context));
    }

    double compute(String text, PageElement element, FitConstraint constraint, RenderContext context) {
        List<PageElement> chain = styleResolver.ancestorChain(element, context.getSnapshot());
        EffectiveStyle style = styleResolver.resolve(chain);
        Candidate candidate = candidate(element, style);

        if (text.isEmpty() || constraint == FitConstraint.NONE) {
            return candidate.size;
        }
        PageElement sized = nearestSized(chain);
        if (sized == null) {
            log.debug("No size known for {} or its parents, keeping {}pt", element.getObjectId(), candidate.size);
            return candidate.size;
        }

        BoundingBox box = BoundingBox.of(sized);
        Bounds bounds = new Bounds(
                Units.emuToPoints(box.getWidth()) - properties.getPadding(),
                Units.emuToPoints(box.getHeight()) - properties.getPadding());

        double floor = properties.getMinFontSize();
        double size = candidate.size;
        if (size < floor) {
            return size;
        }
        while (size > floor && isOutsideBounds(text, size, candidate, style, constraint, bounds)) {
            size = Math.max(floor, size - properties.getStep());
        }
        log.debug("Fitted {} chars into {} ({}): {}pt -> {}pt",
                text.length(), element.getObjectId(), constraint, candidate.size, size);
        return size;
    }

    private boolean isOutsideBounds(String text, double size, Candidate candidate, EffectiveStyle style,
                                    FitConstraint constraint, Bounds bounds) {
        List<String> lines = LineSplitter.split(text, estimateCharsPerLine(text, size, candidate, bounds));
        if (constraint == FitConstraint.HORIZONTAL && lines.size() > 1) {
            return true;
        }

        int hardBreaks = Math.max(1, countBreaks(text));
        double verticalWhitespace = hardBreaks * (style.getSpaceAbove() + style.getSpaceBelow())
                + (hardBreaks - 1) * (style.getLineSpacing() / 100 * size);
        double horizontalWhitespace = style.getIndentStart() + style.getIndentEnd();

        double widestPx = 0;
        for (String line : lines) {
            widestPx = Math.max(widestPx, measurer.measureWidth(line, candidate.family, candidate.weight, size));
        }
        double lineHeightPt = Units.pixelsToPoints(measurer.lineHeight(candidate.family, candidate.weight, size));
        double height = lines.size() * lineHeightPt + verticalWhitespace;
        double width = Units.pixelsToPoints(widestPx) + horizontalWhitespace;
        return width > bounds.width || height > bounds.height;
    }

    private int estimateCharsPerLine(String text, double size, Candidate candidate, Bounds bounds) {
        int sampleLength = Math.min(text.length(), properties.getSampleSize());
        String sample = text.substring(0, sampleLength);
        double averageCharPx = measurer.measureWidth(sample, candidate.family, candidate.weight, size) / sampleLength;
        if (averageCharPx <= 0) {
            return Math.max(1, text.length());
        }
        double chars = Units.pointsToPixels(bounds.width) / (averageCharPx * properties.getWidthCorrection());
        return Math.max(1, (int) Math.floor(chars));
    }

    /**
     * Starting metrics: averages over the explicit sizes and weights of the element's own
     * text runs, falling back to the inherited style.
     */
    private Candidate candidate(PageElement element, EffectiveStyle style) {
        double sizeSum = 0;
        int sizeCount = 0;
        double weightSum = 0;
        int weightCount = 0;
        String family = null;
        for (TextElement textElement : textElements(element)) {
            if (textElement.getTextRun() == null || textElement.getTextRun().getStyle() == null) {
                continue;
            }
            TextStyle runStyle = textElement.getTextRun().getStyle();
            if (runStyle.getFontSize() != null && runStyle.getFontSize().getMagnitude() != null) {
                sizeSum += runStyle.getFontSize().toPoints();
                sizeCount++;
            }
            if (runStyle.getWeightedFontFamily() != null && runStyle.getWeightedFontFamily().getWeight() != null) {
                weightSum += runStyle.getWeightedFontFamily().getWeight();
                weightCount++;
            }
            if (family == null && runStyle.getFontFamily() != null) {
                family = runStyle.getFontFamily();
            }
        }
        double size = sizeCount > 0 ? sizeSum / sizeCount : style.getFontSize();
        if (size <= 0) {
            size = properties.getDefaultFontSize();
        }
        double weight = weightCount > 0 ? weightSum / weightCount : style.getWeight();
        return new Candidate(size, weight, family != null ? family : style.getFontFamily());
    }

    private static PageElement nearestSized(List<PageElement> chain) {
        for (int i = chain.size() - 1; i >= 0; i--) {
            if (BoundingBox.hasSize(chain.get(i))) {
                return chain.get(i);
            }
        }
        return null;
    }

    private static List<TextElement> textElements(PageElement element) {
        if (element.getShape() == null || element.getShape().getText() == null
                || element.getShape().getText().getTextElements() == null) {
            return Collections.emptyList();
        }
        return element.getShape().getText().getTextElements();
    }

    private static int countBreaks(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    private static final class Candidate {
        final double size;
        final double weight;
        final String family;

        Candidate(double size, double weight, String family) {
            this.size = size;
            this.weight = weight;
            this.family = family;
        }
    }

    private static final class Bounds {
        final double width;
        final double height;

        Bounds(double width, double height) {
            this.width = width;
            this.height = height;
        }
    }
}
