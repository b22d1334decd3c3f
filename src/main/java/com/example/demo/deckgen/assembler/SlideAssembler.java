package com.example.demo.deckgen.assembler;

import com.example.demo.deckgen.autofit.AutofitCalculator;
import com.example.demo.deckgen.autofit.FitConstraint;
import com.example.demo.deckgen.core.DocumentSnapshot;
import com.example.demo.deckgen.core.RenderContext;
import com.example.demo.deckgen.geometry.BoundingBox;
import com.example.demo.deckgen.geometry.MediaPlacementCalculator;
import com.example.demo.deckgen.geometry.Placement;
import com.example.demo.deckgen.layout.LayoutResolver;
import com.example.demo.deckgen.model.Body;
import com.example.demo.deckgen.model.ImageDefinition;
import com.example.demo.deckgen.model.SlideDefinition;
import com.example.demo.deckgen.model.TableDefinition;
import com.example.demo.deckgen.model.TextDefinition;
import com.example.demo.deckgen.remote.PageElement;
import com.example.demo.deckgen.remote.request.CreateSlideRequest;
import com.example.demo.deckgen.remote.request.DeleteObjectRequest;
import com.example.demo.deckgen.remote.request.LayoutReference;
import com.example.demo.deckgen.remote.request.Request;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Builds the two batches of a render.
 *
 * The create pass only adds slides from layouts. Their placeholders exist once the
 * remote service has applied it, so the populate pass must run against a snapshot
 * read after the create pass was dispatched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlideAssembler {

    static final String TITLE = "TITLE";
    static final String CENTERED_TITLE = "CENTERED_TITLE";
    static final String SUBTITLE = "SUBTITLE";
    static final String BODY = "BODY";
    static final String PICTURE = "PICTURE";

    private final LayoutResolver layoutResolver;
    private final AutofitCalculator autofitCalculator;
    private final MediaPlacementCalculator placementCalculator;
    private final TextRequestBuilder textRequestBuilder;
    private final TableRequestBuilder tableRequestBuilder;
    private final MediaRequestBuilder mediaRequestBuilder;

    /**
     * One createSlide per slide, preceded by deletes of the existing slides when asked to.
     * Every slide gets a fresh object id and moves to CREATED.
     *
     * @throws com.example.demo.deckgen.exception.LayoutNotFoundException if a layout is missing;
     *         no slide changes state in that case
     */
    public List<Request> createPass(List<SlideDefinition> slides, RenderContext context, boolean eraseExisting) {
        DocumentSnapshot snapshot = context.getSnapshot();
        List<Request> requests = new ArrayList<>();

        if (eraseExisting) {
            for (String existingId : snapshot.existingSlideIds()) {
                requests.add(Request.of(new DeleteObjectRequest(existingId)));
            }
            log.debug("Erasing {} existing slides", requests.size());
        }

        // resolve every layout first so a missing one fails before any state changes
        List<String> layoutIds = new ArrayList<>(slides.size());
        for (SlideDefinition slide : slides) {
            layoutIds.add(layoutResolver.resolveLayoutId(slide, snapshot));
        }

        for (int i = 0; i < slides.size(); i++) {
            SlideDefinition slide = slides.get(i);
            String objectId = UUID.randomUUID().toString();
            requests.add(Request.of(new CreateSlideRequest(objectId, new LayoutReference(layoutIds.get(i)))));
            slide.markCreated(objectId);
        }
        log.info("Create pass: {} requests for {} slides", requests.size(), slides.size());
        return requests;
    }

    /**
     * Fills every created slide. Must be given a context whose snapshot already
     * contains the slides of the create pass.
     */
    public List<Request> populatePass(List<SlideDefinition> slides, RenderContext context) {
        List<Request> requests = new ArrayList<>();
        for (SlideDefinition slide : slides) {
            int before = requests.size();
            populateSlide(slide, context, requests);
            slide.markPopulated();
            log.debug("Slide #{}: {} populate requests", slide.getIndex(), requests.size() - before);
        }
        log.info("Populate pass: {} requests for {} slides", requests.size(), slides.size());
        return requests;
    }

    private void populateSlide(SlideDefinition slide, RenderContext context, List<Request> requests) {
        DocumentSnapshot snapshot = context.getSnapshot();
        String slideId = slide.getObjectId();

        fillPlaceholder(slide, slide.getTitle(), TITLE, FitConstraint.HORIZONTAL, context, requests);
        fillPlaceholder(slide, slide.getTitle(), CENTERED_TITLE, FitConstraint.HORIZONTAL, context, requests);
        fillPlaceholder(slide, slide.getSubtitle(), SUBTITLE, FitConstraint.NONE, context, requests);

        if (slide.getBackgroundImage() != null) {
            log.debug("Slide #{}: setting background image to {}", slide.getIndex(), slide.getBackgroundImage().getUrl());
            requests.add(mediaRequestBuilder.background(slide.getBackgroundImage(), slideId));
        }

        if (slide.hasTables()) {
            for (TableDefinition table : slide.getTables()) {
                requests.addAll(tableRequestBuilder.build(table, slideId));
            }
        }

        if (slide.hasBodies()) {
            List<PageElement> bodyElements = snapshot.findPlaceholders(slideId, BODY);
            List<PageElement> pictures = snapshot.findPlaceholders(slideId, PICTURE);
            int bodyCount = Math.min(bodyElements.size(), slide.getBodies().size());
            if (bodyCount < slide.getBodies().size()) {
                log.debug("Slide #{}: {} bodies but only {} body placeholders, skipping the rest",
                        slide.getIndex(), slide.getBodies().size(), bodyElements.size());
            }

            int nextPicture = 0;
            for (int i = 0; i < bodyCount; i++) {
                PageElement placeholder = bodyElements.get(i);
                Body body = slide.getBodies().get(i);
                fillText(body.getText(), placeholder, FitConstraint.VERTICAL, context, requests);
                nextPicture = appendImages(slide, body, pictures, nextPicture, snapshot, requests);
                appendVideo(slide, body, placeholder, snapshot, requests);
            }

            for (PageElement picture : pictures) {
                requests.add(Request.of(new DeleteObjectRequest(picture.getObjectId())));
            }
        }

        if (slide.getNotes() != null) {
            Optional<String> notesId = snapshot.findSpeakerNotesObjectId(slideId);
            if (notesId.isPresent()) {
                requests.addAll(textRequestBuilder.build(slide.getNotes(), TextTarget.shape(notesId.get()), null));
            } else {
                log.debug("Slide #{}: no speaker notes shape, skipping notes", slide.getIndex());
            }
        }
    }

    private void fillPlaceholder(SlideDefinition slide, TextDefinition text, String type, FitConstraint constraint,
                                 RenderContext context, List<Request> requests) {
        if (text == null) {
            return;
        }
        List<PageElement> elements = context.getSnapshot().findPlaceholders(slide.getObjectId(), type);
        if (elements.isEmpty()) {
            log.debug("Slide #{}: skipping undefined placeholder {}", slide.getIndex(), type);
            return;
        }
        fillText(text, elements.get(0), constraint, context, requests);
    }

    private void fillText(TextDefinition text, PageElement element, FitConstraint constraint,
                          RenderContext context, List<Request> requests) {
        if (text == null || text.getRawText() == null || text.getRawText().trim().isEmpty()) {
            return;
        }
        Double fitted = null;
        if (constraint != FitConstraint.NONE) {
            fitted = autofitCalculator.fontSizeFor(text.getRawText(), element, constraint, context);
        }
        requests.addAll(textRequestBuilder.build(text, TextTarget.shape(element.getObjectId()), fitted));
    }

    /**
     * Places a body's images into the next free picture placeholders; whatever is left
     * over shares a region centered on the page.
     *
     * @return index of the next unused picture placeholder
     */
    private int appendImages(SlideDefinition slide, Body body, List<PageElement> pictures, int nextPicture,
                             DocumentSnapshot snapshot, List<Request> requests) {
        if (body.getImages() == null || body.getImages().isEmpty()) {
            return nextPicture;
        }
        List<ImageDefinition> leftovers = new ArrayList<>();
        for (ImageDefinition image : body.getImages()) {
            if (nextPicture < pictures.size() && BoundingBox.hasSize(pictures.get(nextPicture))) {
                log.debug("Slide #{}: adding image {} into placeholder {}",
                        slide.getIndex(), image.getUrl(), pictures.get(nextPicture).getObjectId());
                List<ImageDefinition> single = Collections.singletonList(image);
                List<Placement> placement = placementCalculator.placeImages(single,
                        BoundingBox.of(pictures.get(nextPicture)));
                requests.addAll(mediaRequestBuilder.images(single, placement, slide.getObjectId()));
                nextPicture++;
            } else {
                leftovers.add(image);
            }
        }
        if (!leftovers.isEmpty()) {
            log.debug("Slide #{}: centering {} images without placeholder", slide.getIndex(), leftovers.size());
            BoundingBox region = placementCalculator.centeredRegion(leftovers, snapshot.pageSize());
            List<Placement> placements = placementCalculator.placeImages(leftovers, region);
            requests.addAll(mediaRequestBuilder.images(leftovers, placements, slide.getObjectId()));
        }
        return nextPicture;
    }

    private void appendVideo(SlideDefinition slide, Body body, PageElement placeholder,
                             DocumentSnapshot snapshot, List<Request> requests) {
        if (body.getVideos() == null || body.getVideos().isEmpty()) {
            return;
        }
        log.debug("Slide #{}: adding video {}", slide.getIndex(), body.getVideos().get(0).getId());
        BoundingBox box = BoundingBox.hasSize(placeholder)
                ? BoundingBox.of(placeholder)
                : BoundingBox.page(snapshot.pageSize());
        Placement placement = placementCalculator.placeVideo(body.getVideos().get(0), box);
        requests.addAll(mediaRequestBuilder.video(body.getVideos().get(0), placement, slide.getObjectId()));
    }
}
