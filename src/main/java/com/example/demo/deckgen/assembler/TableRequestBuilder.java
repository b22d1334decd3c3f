package com.example.demo.deckgen.assembler;

import com.example.demo.deckgen.model.TableDefinition;
import com.example.demo.deckgen.model.TextDefinition;
import com.example.demo.deckgen.remote.RgbColor;
import com.example.demo.deckgen.remote.request.CreateTableRequest;
import com.example.demo.deckgen.remote.request.PageElementProperties;
import com.example.demo.deckgen.remote.request.Request;
import com.example.demo.deckgen.remote.request.TableCellLocation;
import com.example.demo.deckgen.remote.request.UpdateTableCellPropertiesRequest;
import com.example.demo.deckgen.remote.request.UpdateTableCellPropertiesRequest.OpaqueColorHolder;
import com.example.demo.deckgen.remote.request.UpdateTableCellPropertiesRequest.SolidFill;
import com.example.demo.deckgen.remote.request.UpdateTableCellPropertiesRequest.TableCellBackgroundFill;
import com.example.demo.deckgen.remote.request.UpdateTableCellPropertiesRequest.TableCellProperties;
import com.example.demo.deckgen.remote.request.UpdateTableCellPropertiesRequest.TableRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Builds the requests for one table: the table itself at its default size, the text of
 * every cell, and a gray fill over the header row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableRequestBuilder {

    /**
     * Markdown tables always have a header row; a first cell with this text means
     * the author wants the row gone.
     */
    public static final String DELETE_ROW_SENTINEL = "DELETE THIS ROW";

    static final double HEADER_GRAY = 0.75;

    private final TextRequestBuilder textRequestBuilder;

    public List<Request> build(TableDefinition table, String slideObjectId) {
        List<List<TextDefinition>> cells = table.getCells() == null
                ? new ArrayList<>() : new ArrayList<>(table.getCells());
        int rows = table.getRows();
        boolean hasHeader = true;
        if (isSentinelRow(cells)) {
            cells.remove(0);
            rows = rows - 1;
            hasHeader = false;
        }

        List<Request> requests = new ArrayList<>();
        if (rows <= 0 || table.getColumns() <= 0) {
            log.warn("Skipping empty table ({} rows x {} columns) on slide {}", rows, table.getColumns(), slideObjectId);
            return requests;
        }

        String tableId = UUID.randomUUID().toString();
        requests.add(Request.of(CreateTableRequest.builder()
                .objectId(tableId)
                .elementProperties(PageElementProperties.builder().pageObjectId(slideObjectId).build())
                .rows(rows)
                .columns(table.getColumns())
                .build()));

        for (int r = 0; r < cells.size(); r++) {
            List<TextDefinition> row = cells.get(r);
            if (row == null) {
                continue;
            }
            for (int c = 0; c < row.size(); c++) {
                requests.addAll(textRequestBuilder.build(row.get(c), TextTarget.cell(tableId, r, c), null));
            }
        }

        if (hasHeader) {
            requests.add(Request.of(headerFill(tableId, table.getColumns())));
        }
        return requests;
    }

    private static boolean isSentinelRow(List<List<TextDefinition>> cells) {
        if (cells.isEmpty() || cells.get(0) == null || cells.get(0).isEmpty() || cells.get(0).get(0) == null) {
            return false;
        }
        return DELETE_ROW_SENTINEL.equals(cells.get(0).get(0).getRawText());
    }

    private static UpdateTableCellPropertiesRequest headerFill(String tableId, int columns) {
        return UpdateTableCellPropertiesRequest.builder()
                .objectId(tableId)
                .tableRange(new TableRange(new TableCellLocation(0, 0), 1, columns))
                .tableCellProperties(new TableCellProperties(new TableCellBackgroundFill(
                        new SolidFill(new OpaqueColorHolder(new RgbColor(HEADER_GRAY, HEADER_GRAY, HEADER_GRAY))))))
                .fields("tableCellBackgroundFill.solidFill.color")
                .build();
    }
}
