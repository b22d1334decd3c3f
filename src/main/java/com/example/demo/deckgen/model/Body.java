package com.example.demo.deckgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Content for one body region of a slide.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Body {
    private TextDefinition text;

    @Builder.Default
    private List<ImageDefinition> images = new ArrayList<>();

    @Builder.Default
    private List<VideoDefinition> videos = new ArrayList<>();
}
