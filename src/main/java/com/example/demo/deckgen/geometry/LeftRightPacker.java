package com.example.demo.deckgen.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Places items in a single row, left to right, top aligned. The exported extent
 * is the sum of the widths by the tallest height.
 */
public class LeftRightPacker<T> {
    private final List<PackedItem<T>> items = new ArrayList<>();
    private double cursorX;
    private double maxHeight;

    public LeftRightPacker<T> add(double width, double height, T meta) {
        items.add(new PackedItem<>(cursorX, 0, width, height, meta));
        cursorX += width;
        maxHeight = Math.max(maxHeight, height);
        return this;
    }

    public PackedLayout<T> export() {
        return new PackedLayout<>(cursorX, maxHeight, Collections.unmodifiableList(new ArrayList<>(items)));
    }
}
