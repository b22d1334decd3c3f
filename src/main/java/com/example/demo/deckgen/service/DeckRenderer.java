package com.example.demo.deckgen.service;

import com.example.demo.deckgen.aspect.LogExecutionTime;
import com.example.demo.deckgen.assembler.DeckValidator;
import com.example.demo.deckgen.assembler.SlideAssembler;
import com.example.demo.deckgen.client.SlidesClient;
import com.example.demo.deckgen.config.AutofitProperties;
import com.example.demo.deckgen.config.DispatchProperties;
import com.example.demo.deckgen.core.DocumentSnapshot;
import com.example.demo.deckgen.core.RenderContext;
import com.example.demo.deckgen.dispatch.DispatchScheduler;
import com.example.demo.deckgen.dispatch.UploadScheduler;
import com.example.demo.deckgen.exception.DeckGenerationException;
import com.example.demo.deckgen.model.DeckRenderRequest;
import com.example.demo.deckgen.model.DeckRenderResponse;
import com.example.demo.deckgen.model.SlideDefinition;
import com.example.demo.deckgen.remote.Presentation;
import com.example.demo.deckgen.remote.request.Request;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Main orchestrator for deck rendering.
 *
 * Runs the two pass protocol against one presentation:
 * - validate the deck
 * - open the target: an existing presentation, a copy of a template or a new one
 * - upload local images
 * - create pass: add one slide per definition from its layout, dispatch
 * - reload, so the new slides and their placeholders are visible
 * - populate pass: fill placeholders, add media, dispatch
 *
 * Request building is delegated to {@link SlideAssembler} and remote traffic to
 * {@link DispatchScheduler}; this class only sequences them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeckRenderer {
    private final SlidesClient slidesClient;
    private final DeckValidator validator;
    private final SlideAssembler assembler;
    private final DispatchScheduler dispatchScheduler;
    private final UploadScheduler uploadScheduler;
    private final AutofitProperties autofitProperties;
    private final DispatchProperties dispatchProperties;

    /**
     * Render the deck into the requested presentation. A template id takes precedence
     * and renders into a copy of the template; with neither id a blank presentation is created.
     *
     * @return id of the presentation and request counts
     * @throws DeckGenerationException on any failure; the document may be partially updated
     */
    @LogExecutionTime("Total Deck Rendering")
    public DeckRenderResponse render(DeckRenderRequest request) {
        List<SlideDefinition> slides = request.getSlides();
        if (slides == null) {
            throw new DeckGenerationException("INVALID_REQUEST", "Request has no slide list");
        }
        log.info("Rendering {} slides into {}", slides.size(), describeTarget(request));
        try {
            validator.validate(slides);

            Presentation presentation = openPresentation(request);
            String presentationId = presentation.getPresentationId();
            RenderContext context = new RenderContext(new DocumentSnapshot(presentation),
                    autofitProperties.getCacheMaximumSize());

            uploadScheduler.uploadLocalImages(slides, request.isAllowUpload());

            List<Request> createRequests = assembler.createPass(slides, context, request.isEraseExisting());
            dispatchScheduler.dispatch(presentationId, createRequests);

            // placeholders of the new slides only exist in a fresh read
            context.reload(new DocumentSnapshot(slidesClient.getPresentation(presentationId)));

            List<Request> populateRequests = assembler.populatePass(slides, context);
            dispatchScheduler.dispatch(presentationId, populateRequests);

            if (dispatchProperties.isReloadAfterPopulate()) {
                context.reload(new DocumentSnapshot(slidesClient.getPresentation(presentationId)));
            }

            CacheStats stats = context.getFontSizeCache().stats();
            log.debug("Autofit cache: {} hits, {} misses", stats.hitCount(), stats.missCount());
            log.info("Rendered {} slides into {} ({} requests)", slides.size(), presentationId,
                    createRequests.size() + populateRequests.size());

            return DeckRenderResponse.builder()
                    .presentationId(presentationId)
                    .slideCount(slides.size())
                    .requestCount(createRequests.size() + populateRequests.size())
                    .build();
        } catch (DeckGenerationException e) {
            log.error("Deck rendering failed: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Unexpected error while rendering deck", e);
            throw new DeckGenerationException("GENERATION_FAILED", "Failed to render deck: " + e.getMessage(), e);
        }
    }

    private Presentation openPresentation(DeckRenderRequest request) {
        if (request.getTemplateId() != null) {
            String copyId = slidesClient.copyPresentation(request.getTemplateId(), request.getTitle());
            log.info("Copied template {} to {}", request.getTemplateId(), copyId);
            return slidesClient.getPresentation(copyId);
        }
        if (request.getPresentationId() != null) {
            return slidesClient.getPresentation(request.getPresentationId());
        }
        return slidesClient.createPresentation(request.getTitle());
    }

    private static String describeTarget(DeckRenderRequest request) {
        if (request.getTemplateId() != null) {
            return "a copy of " + request.getTemplateId();
        }
        return request.getPresentationId() != null ? request.getPresentationId() : "a new presentation";
    }
}
