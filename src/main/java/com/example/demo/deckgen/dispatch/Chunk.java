package com.example.demo.deckgen.dispatch;

import com.example.demo.deckgen.remote.request.Request;
import lombok.Value;

import java.util.List;

/**
 * A slice of a batch. {@code offset} is the index of its first request in the whole batch.
 */
@Value
public class Chunk {
    int offset;
    List<Request> requests;
}
