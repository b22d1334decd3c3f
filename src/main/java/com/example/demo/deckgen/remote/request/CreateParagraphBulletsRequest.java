package com.example.demo.deckgen.remote.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreateParagraphBulletsRequest {
    public static final String NUMBERED_PRESET = "NUMBERED_DIGIT_ALPHA_ROMAN";
    public static final String BULLET_PRESET = "BULLET_DISC_CIRCLE_SQUARE";

    private String objectId;
    private TableCellLocation cellLocation;
    private TextRange textRange;
    private String bulletPreset;
}
