package com.example.demo.deckgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListMarker {
    private int start;
    private int end;

    @Builder.Default
    private ListType type = ListType.UNORDERED;

    public enum ListType {
        ORDERED,
        UNORDERED
    }
}
