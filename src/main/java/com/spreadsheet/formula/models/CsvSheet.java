package com.spreadsheet.formula.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of POST /formula/csv/import: the non-empty cells read from the CSV
 * and the size of the grid it described.
 */
public class CsvSheet {
    private final Map<String, CellData> cells;
    private final int rows;
    private final int columns;

    public CsvSheet(Map<String, CellData> cells, int rows, int columns) {
        this.cells = cells;
        this.rows = rows;
        this.columns = columns;
    }

    public static CsvSheet empty() {
        return new CsvSheet(new LinkedHashMap<>(), 0, 0);
    }

    public Map<String, CellData> getCells() {
        return cells;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }
}
