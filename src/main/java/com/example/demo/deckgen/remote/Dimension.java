package com.example.demo.deckgen.remote;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
@JsonIgnoreProperties(ignoreUnknown = true)
public class Dimension {
    private Double magnitude;

    /**
     * EMU or PT
     */
    private String unit;

    public static Dimension pt(double magnitude) {
        return new Dimension(magnitude, "PT");
    }

    public static Dimension emu(double magnitude) {
        return new Dimension(magnitude, "EMU");
    }

    /**
     * Magnitude in points, 0 when unset.
     */
    @JsonIgnore
    public double toPoints() {
        if (magnitude == null) {
            return 0;
        }
        return "EMU".equals(unit) ? magnitude / 12700.0 : magnitude;
    }
}
