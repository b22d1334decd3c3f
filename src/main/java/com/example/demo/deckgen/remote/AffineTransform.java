package com.example.demo.deckgen.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 2D affine transform [scaleX shearX translateX; shearY scaleY translateY].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AffineTransform {
    private Double scaleX;
    private Double scaleY;
    private Double shearX;
    private Double shearY;
    private Double translateX;
    private Double translateY;
    private String unit;

    /**
     * Axis aligned transform that only translates, in EMU.
     */
    public static AffineTransform translation(double translateX, double translateY) {
        return AffineTransform.builder()
                .scaleX(1.0).scaleY(1.0)
                .shearX(0.0).shearY(0.0)
                .translateX(translateX).translateY(translateY)
                .unit("EMU")
                .build();
    }
}
