package com.pacaccounting.processing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Text of one spreadsheet row.
 *
 * @param index       zero based row number in the sheet
 * @param cells       cell texts by column, null for empty cells
 * @param firstIndent indentation level of the first cell's style
 */
public record SheetRow(int index, List<String> cells, int firstIndent) {

    public SheetRow {
        cells = cells == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(cells));
    }

    public static SheetRow of(int index, String... cells) {
        return new SheetRow(index, Arrays.asList(cells), 0);
    }

    public String cell(int column) {
        return column >= 0 && column < cells.size() ? cells.get(column) : null;
    }

    public int width() {
        return cells.size();
    }

    public boolean isBlank() {
        return cells.stream().allMatch(cell -> cell == null || cell.isBlank());
    }
}
