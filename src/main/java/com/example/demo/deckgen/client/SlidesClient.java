package com.example.demo.deckgen.client;

import com.example.demo.deckgen.remote.Presentation;
import com.example.demo.deckgen.remote.request.BatchUpdateResponse;
import com.example.demo.deckgen.remote.request.Request;

import java.util.List;

/**
 * Remote presentation service. Implementations throw
 * {@link com.example.demo.deckgen.exception.RemoteCallException} when a call fails.
 */
public interface SlidesClient {

    Presentation getPresentation(String presentationId);

    Presentation createPresentation(String title);

    /**
     * Copies a template presentation, layouts and masters included.
     *
     * @return id of the copy
     */
    String copyPresentation(String templateId, String title);

    /**
     * Applies the requests atomically, in order. Either all of them take effect or none.
     */
    BatchUpdateResponse batchUpdate(String presentationId, List<Request> requests);
}
