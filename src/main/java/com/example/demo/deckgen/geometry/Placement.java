package com.example.demo.deckgen.geometry;

import lombok.Value;

/**
 * Final size and position of a placed element, in EMU.
 */
@Value
public class Placement {
    double translateX;
    double translateY;
    double width;
    double height;
}
