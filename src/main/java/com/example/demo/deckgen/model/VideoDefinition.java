package com.example.demo.deckgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Embedded video, identified by its hosting service id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoDefinition {
    private String id;
    private double width;
    private double height;
    private boolean autoPlay;
}
