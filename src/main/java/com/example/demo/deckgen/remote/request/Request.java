package com.example.demo.deckgen.remote.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One mutation of a batch update. Exactly one field is set; its JSON name is the
 * request kind (createSlide, insertText, ...).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Request {
    public static final String CREATE_SLIDE = "createSlide";
    public static final String DELETE_OBJECT = "deleteObject";
    public static final String INSERT_TEXT = "insertText";
    public static final String UPDATE_TEXT_STYLE = "updateTextStyle";
    public static final String CREATE_PARAGRAPH_BULLETS = "createParagraphBullets";
    public static final String UPDATE_PAGE_PROPERTIES = "updatePageProperties";
    public static final String CREATE_IMAGE = "createImage";
    public static final String UPDATE_PAGE_ELEMENT_ALT_TEXT = "updatePageElementAltText";
    public static final String CREATE_VIDEO = "createVideo";
    public static final String UPDATE_VIDEO_PROPERTIES = "updateVideoProperties";
    public static final String CREATE_TABLE = "createTable";
    public static final String UPDATE_TABLE_CELL_PROPERTIES = "updateTableCellProperties";

    private CreateSlideRequest createSlide;
    private DeleteObjectRequest deleteObject;
    private InsertTextRequest insertText;
    private UpdateTextStyleRequest updateTextStyle;
    private CreateParagraphBulletsRequest createParagraphBullets;
    private UpdatePagePropertiesRequest updatePageProperties;
    private CreateImageRequest createImage;
    private UpdatePageElementAltTextRequest updatePageElementAltText;
    private CreateVideoRequest createVideo;
    private UpdateVideoPropertiesRequest updateVideoProperties;
    private CreateTableRequest createTable;
    private UpdateTableCellPropertiesRequest updateTableCellProperties;

    /**
     * Name of the populated field, or "unknown" for an empty envelope.
     */
    @JsonIgnore
    public String kind() {
        if (createSlide != null) {
            return CREATE_SLIDE;
        }
        if (deleteObject != null) {
            return DELETE_OBJECT;
        }
        if (insertText != null) {
            return INSERT_TEXT;
        }
        if (updateTextStyle != null) {
            return UPDATE_TEXT_STYLE;
        }
        if (createParagraphBullets != null) {
            return CREATE_PARAGRAPH_BULLETS;
        }
        if (updatePageProperties != null) {
            return UPDATE_PAGE_PROPERTIES;
        }
        if (createImage != null) {
            return CREATE_IMAGE;
        }
        if (updatePageElementAltText != null) {
            return UPDATE_PAGE_ELEMENT_ALT_TEXT;
        }
        if (createVideo != null) {
            return CREATE_VIDEO;
        }
        if (updateVideoProperties != null) {
            return UPDATE_VIDEO_PROPERTIES;
        }
        if (createTable != null) {
            return CREATE_TABLE;
        }
        if (updateTableCellProperties != null) {
            return UPDATE_TABLE_CELL_PROPERTIES;
        }
        return "unknown";
    }

    public static Request of(CreateSlideRequest payload) {
        return Request.builder().createSlide(payload).build();
    }

    public static Request of(DeleteObjectRequest payload) {
        return Request.builder().deleteObject(payload).build();
    }

    public static Request of(InsertTextRequest payload) {
        return Request.builder().insertText(payload).build();
    }

    public static Request of(UpdateTextStyleRequest payload) {
        return Request.builder().updateTextStyle(payload).build();
    }

    public static Request of(CreateParagraphBulletsRequest payload) {
        return Request.builder().createParagraphBullets(payload).build();
    }

    public static Request of(UpdatePagePropertiesRequest payload) {
        return Request.builder().updatePageProperties(payload).build();
    }

    public static Request of(CreateImageRequest payload) {
        return Request.builder().createImage(payload).build();
    }

    public static Request of(UpdatePageElementAltTextRequest payload) {
        return Request.builder().updatePageElementAltText(payload).build();
    }

    public static Request of(CreateVideoRequest payload) {
        return Request.builder().createVideo(payload).build();
    }

    public static Request of(UpdateVideoPropertiesRequest payload) {
        return Request.builder().updateVideoProperties(payload).build();
    }

    public static Request of(CreateTableRequest payload) {
        return Request.builder().createTable(payload).build();
    }

    public static Request of(UpdateTableCellPropertiesRequest payload) {
        return Request.builder().updateTableCellProperties(payload).build();
    }
}
