package com.example.demo.deckgen.assembler;

import com.example.demo.deckgen.config.ValidationProperties;
import com.example.demo.deckgen.exception.UnsupportedContentException;
import com.example.demo.deckgen.model.Body;
import com.example.demo.deckgen.model.ImageDefinition;
import com.example.demo.deckgen.model.SlideDefinition;
import com.example.demo.deckgen.model.TableDefinition;
import com.example.demo.deckgen.model.TextDefinition;
import com.example.demo.deckgen.model.TextRun;
import com.example.demo.deckgen.model.VideoDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Checks a deck before any request is built, so a bad slide fails the run before
 * the document is touched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeckValidator {

    private final ValidationProperties properties;

    /**
     * @throws com.example.demo.deckgen.exception.MalformedTextRangeException on a range outside its text
     * @throws UnsupportedContentException on content the renderer cannot place
     */
    public void validate(List<SlideDefinition> slides) {
        for (SlideDefinition slide : slides) {
            validateText(slide.getTitle());
            validateText(slide.getSubtitle());
            validateText(slide.getNotes());

            int videos = 0;
            if (slide.getBodies() != null) {
                for (Body body : slide.getBodies()) {
                    validateText(body.getText());
                    if (body.getVideos() != null) {
                        videos += body.getVideos().size();
                        for (VideoDefinition video : body.getVideos()) {
                            if (video.getWidth() <= 0 || video.getHeight() <= 0) {
                                throw new UnsupportedContentException(String.format(
                                        "Slide #%d: video %s has no size", slide.getIndex(), video.getId()));
                            }
                        }
                    }
                    if (body.getImages() != null) {
                        for (ImageDefinition image : body.getImages()) {
                            if (image.getWidth() <= 0 || image.getHeight() <= 0) {
                                throw new UnsupportedContentException(String.format(
                                        "Slide #%d: image %s has no size", slide.getIndex(), image.getUrl()));
                            }
                        }
                    }
                }
            }
            if (videos > 1) {
                throw new UnsupportedContentException(String.format(
                        "Slide #%d: multiple videos per slide are not supported (found %d)", slide.getIndex(), videos));
            }

            if (slide.getTables() != null) {
                if (properties.isSingleTablePerSlide() && slide.getTables().size() > 1) {
                    throw new UnsupportedContentException(String.format(
                            "Slide #%d: only one table per slide is allowed (found %d)",
                            slide.getIndex(), slide.getTables().size()));
                }
                for (TableDefinition table : slide.getTables()) {
                    validateTable(table);
                }
            }
        }
        log.debug("Validated {} slides", slides.size());
    }

    private static void validateTable(TableDefinition table) {
        if (table.getCells() == null) {
            return;
        }
        for (List<TextDefinition> row : table.getCells()) {
            if (row == null) {
                continue;
            }
            for (TextDefinition cell : row) {
                validateText(cell);
            }
        }
    }

    private static void validateText(TextDefinition text) {
        if (text == null) {
            return;
        }
        text.validate();
        if (text.getTextRuns() != null) {
            // color() throws on anything it cannot parse
            for (TextRun run : text.getTextRuns()) {
                TextRequestBuilder.color(run.getForegroundColor());
                TextRequestBuilder.color(run.getBackgroundColor());
            }
        }
    }
}
