package com.example.demo.deckgen.geometry;

import lombok.Value;

import java.util.List;

@Value
public class PackedLayout<T> {
    double width;
    double height;
    List<PackedItem<T>> items;
}
