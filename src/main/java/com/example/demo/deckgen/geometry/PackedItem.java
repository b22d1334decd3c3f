package com.example.demo.deckgen.geometry;

import lombok.Value;

/**
 * An item positioned by a packer; coordinates are relative to the packed layout.
 */
@Value
public class PackedItem<T> {
    double x;
    double y;
    double width;
    double height;
    T meta;
}
