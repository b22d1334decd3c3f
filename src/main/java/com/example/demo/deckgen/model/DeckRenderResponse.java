package com.example.demo.deckgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeckRenderResponse {
    private String presentationId;
    private int slideCount;
    private int requestCount;
}
