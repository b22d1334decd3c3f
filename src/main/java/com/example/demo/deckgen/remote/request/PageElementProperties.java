package com.example.demo.deckgen.remote.request;

import com.example.demo.deckgen.remote.AffineTransform;
import com.example.demo.deckgen.remote.Size;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where a new element goes: the page it belongs to plus optional size and transform.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageElementProperties {
    private String pageObjectId;
    private Size size;
    private AffineTransform transform;
}
