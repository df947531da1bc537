package com.spreadsheet.formula.models;

/**
 * Enumerates the kinds of evaluated value:
 * NUMBER, TEXT, ERROR.
 * There is no boolean type; 1 and 0 stand in for true and false.
 */
public enum ValueType {
    NUMBER,
    TEXT,
    ERROR
}
