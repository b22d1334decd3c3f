package com.example.demo.deckgen.assembler;

import com.example.demo.deckgen.remote.request.TableCellLocation;
import lombok.Value;

/**
 * Where text goes: a shape, or one cell of a table.
 */
@Value
public class TextTarget {
    String objectId;
    TableCellLocation cellLocation;

    public static TextTarget shape(String objectId) {
        return new TextTarget(objectId, null);
    }

    public static TextTarget cell(String tableId, int row, int column) {
        return new TextTarget(tableId, new TableCellLocation(row, column));
    }
}
