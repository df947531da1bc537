package com.spreadsheet.formula.models;

/**
 * The stored content of one cell as the editor sends it:
 * - value: the raw text, a formula when it starts with "="
 * - format: how the evaluated value should be displayed
 */
public class CellData {
    private String value;
    private CellFormat format = CellFormat.PLAIN;

    // Default constructor needed for JSON (de)serialization
    public CellData() {
    }

    public CellData(String value, CellFormat format) {
        this.value = value;
        this.format = format;
    }

    public String getValue() {
        return value;
    }
    public CellFormat getFormat() {
        return format;
    }
    public void setValue(String value) {
        this.value = value;
    }
    public void setFormat(CellFormat format) {
        this.format = format;
    }
}
