package com.example.demo.deckgen.remote.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Range within a shape's or cell's text. Only FIXED_RANGE is produced here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TextRange {
    @Builder.Default
    private String type = "FIXED_RANGE";
    private Integer startIndex;
    private Integer endIndex;

    public static TextRange fixed(int startIndex, int endIndex) {
        return new TextRange("FIXED_RANGE", startIndex, endIndex);
    }
}
