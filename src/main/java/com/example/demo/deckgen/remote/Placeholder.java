package com.example.demo.deckgen.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Placeholder info. {@code parentObjectId} points at the layout (or master)
 * placeholder this one inherits from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Placeholder {
    /**
     * TITLE, CENTERED_TITLE, SUBTITLE, BODY, PICTURE, ...
     */
    private String type;
    private Integer index;
    private String parentObjectId;
}
