package com.spreadsheet.formula.engine;

/**
 * Supplies the raw stored text of a cell, including the leading "=" for formula cells.
 * Must return "" (or null) for a blank cell and must not modify anything.
 */
@FunctionalInterface
public interface CellAccessor {

    String getRawValue(String cellId);
}
