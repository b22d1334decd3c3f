package com.example.demo.deckgen.support;

import com.example.demo.deckgen.client.SlidesClient;
import com.example.demo.deckgen.exception.RemoteCallException;
import com.example.demo.deckgen.remote.ImageElement;
import com.example.demo.deckgen.remote.NotesProperties;
import com.example.demo.deckgen.remote.Page;
import com.example.demo.deckgen.remote.PageElement;
import com.example.demo.deckgen.remote.Placeholder;
import com.example.demo.deckgen.remote.Presentation;
import com.example.demo.deckgen.remote.Shape;
import com.example.demo.deckgen.remote.SlideProperties;
import com.example.demo.deckgen.remote.request.BatchUpdateResponse;
import com.example.demo.deckgen.remote.request.CreateSlideRequest;
import com.example.demo.deckgen.remote.request.Request;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory presentation service. Applies createSlide (copying the layout's placeholders
 * with their parent links, sizes and transforms, plus a notes page) and deleteObject;
 * other requests are only recorded. Every read returns a deep copy.
 */
public class FakeSlidesClient implements SlidesClient {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Presentation presentation;
    private final RecordingSleeper clock;
    private final List<List<Request>> batches = new ArrayList<>();
    private final List<Long> batchTimes = new ArrayList<>();
    private final Map<Integer, RemoteCallException> failures = new HashMap<>();
    private int reads;
    private String copiedTemplateId;

    public FakeSlidesClient(Presentation presentation, RecordingSleeper clock) {
        this.presentation = presentation;
        this.clock = clock;
    }

    /**
     * Make the n-th batchUpdate call (0 based) fail with the given error.
     */
    public FakeSlidesClient failBatch(int call, RemoteCallException error) {
        failures.put(call, error);
        return this;
    }

    @Override
    public Presentation getPresentation(String presentationId) {
        reads++;
        return copy();
    }

    @Override
    public Presentation createPresentation(String title) {
        presentation.setTitle(title);
        reads++;
        return copy();
    }

    /**
     * The copy is the held presentation itself, renamed.
     */
    @Override
    public String copyPresentation(String templateId, String title) {
        copiedTemplateId = templateId;
        presentation.setTitle(title);
        return presentation.getPresentationId();
    }

    @Override
    public BatchUpdateResponse batchUpdate(String presentationId, List<Request> requests) {
        int call = batches.size();
        batches.add(new ArrayList<>(requests));
        batchTimes.add(clock.now());
        if (failures.containsKey(call)) {
            throw failures.get(call);
        }
        for (Request request : requests) {
            if (request.getCreateSlide() != null) {
                createSlide(request.getCreateSlide());
            } else if (request.getDeleteObject() != null) {
                deleteObject(request.getDeleteObject().getObjectId());
            }
        }
        return new BatchUpdateResponse(presentationId, new ArrayList<>());
    }

    private void createSlide(CreateSlideRequest request) {
        String slideId = request.getObjectId();
        Page layout = presentation.getLayouts().stream()
                .filter(l -> l.getObjectId().equals(request.getSlideLayoutReference().getLayoutId()))
                .findFirst()
                .orElseThrow(() -> new RemoteCallException(400, "INVALID_ARGUMENT",
                        "Invalid requests[0].createSlide: layout not found", null));

        List<PageElement> elements = new ArrayList<>();
        for (PageElement source : layout.getPageElements()) {
            Placeholder placeholder = source.placeholder();
            if (placeholder == null) {
                continue;
            }
            Placeholder inherited = Placeholder.builder()
                    .type(placeholder.getType())
                    .index(placeholder.getIndex())
                    .parentObjectId(source.getObjectId())
                    .build();
            PageElement.PageElementBuilder copy = PageElement.builder()
                    .objectId(slideId + "_" + source.getObjectId())
                    .size(source.getSize())
                    .transform(source.getTransform());
            if (source.getImage() != null) {
                copy.image(ImageElement.builder().placeholder(inherited).build());
            } else {
                copy.shape(Shape.builder().shapeType("TEXT_BOX").placeholder(inherited).build());
            }
            elements.add(copy.build());
        }

        String notesShapeId = slideId + "_notes_body";
        Page notesPage = Page.builder()
                .objectId(slideId + "_notes")
                .pageType("NOTES")
                .pageElements(new ArrayList<>(List.of(TestPresentations.unsizedShape(notesShapeId, "BODY", null))))
                .notesProperties(new NotesProperties(notesShapeId))
                .build();

        presentation.getSlides().add(Page.builder()
                .objectId(slideId)
                .pageType("SLIDE")
                .pageElements(elements)
                .slideProperties(SlideProperties.builder()
                        .layoutObjectId(layout.getObjectId())
                        .masterObjectId("master")
                        .notesPage(notesPage)
                        .build())
                .build());
    }

    private void deleteObject(String objectId) {
        if (presentation.getSlides().removeIf(slide -> slide.getObjectId().equals(objectId))) {
            return;
        }
        for (Page slide : presentation.getSlides()) {
            slide.getPageElements().removeIf(element -> objectId.equals(element.getObjectId()));
        }
    }

    private Presentation copy() {
        return objectMapper.convertValue(presentation, Presentation.class);
    }

    public Presentation getState() {
        return presentation;
    }

    public List<List<Request>> getBatches() {
        return batches;
    }

    public List<Long> getBatchTimes() {
        return batchTimes;
    }

    public int getReads() {
        return reads;
    }

    public String getCopiedTemplateId() {
        return copiedTemplateId;
    }
}
