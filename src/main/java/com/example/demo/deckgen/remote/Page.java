package com.example.demo.deckgen.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A slide, layout, master or notes page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Page {
    private String objectId;

    /**
     * SLIDE, LAYOUT, MASTER, NOTES
     */
    private String pageType;
    private List<PageElement> pageElements;
    private LayoutProperties layoutProperties;
    private SlideProperties slideProperties;
    private NotesProperties notesProperties;
}
