package com.example.demo.deckgen.remote.request;

import com.example.demo.deckgen.remote.RgbColor;
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
public class UpdateTableCellPropertiesRequest {
    private String objectId;
    private TableRange tableRange;
    private TableCellProperties tableCellProperties;
    private String fields;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TableRange {
        private TableCellLocation location;
        private Integer rowSpan;
        private Integer columnSpan;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TableCellProperties {
        private TableCellBackgroundFill tableCellBackgroundFill;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TableCellBackgroundFill {
        private SolidFill solidFill;
    }

    /**
     * Solid fill; the color nests an rgbColor the same way text colors do.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SolidFill {
        private OpaqueColorHolder color;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class OpaqueColorHolder {
        private RgbColor rgbColor;
    }
}
