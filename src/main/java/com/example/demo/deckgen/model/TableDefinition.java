package com.example.demo.deckgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableDefinition {
    private int rows;
    private int columns;

    /**
     * Cell text, indexed [row][column]
     */
    @Builder.Default
    private List<List<TextDefinition>> cells = new ArrayList<>();
}
