package com.example.demo.deckgen.remote.request;

import com.example.demo.deckgen.remote.TextStyle;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code fields} is the mask of style properties being set; the service rejects an empty one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UpdateTextStyleRequest {
    private String objectId;
    private TableCellLocation cellLocation;
    private TextRange textRange;
    private TextStyle style;
    private String fields;
}
