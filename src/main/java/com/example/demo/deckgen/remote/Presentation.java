package com.example.demo.deckgen.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A point-in-time read of the remote presentation. Only the parts the renderer
 * looks at are mapped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Presentation {
    private String presentationId;
    private String title;
    private String revisionId;
    private Size pageSize;
    private List<Page> slides;
    private List<Page> layouts;
    private List<Page> masters;
}
