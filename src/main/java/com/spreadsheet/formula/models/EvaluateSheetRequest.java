package com.spreadsheet.formula.models;

import java.util.Map;

/**
 * Body of POST /formula/sheet and POST /formula/csv/export: a snapshot of cells keyed by id.
 * {
 *   "cells": {
 *     "A1": { "value": "1200", "format": "currency" },
 *     "A2": { "value": "=A1*2" }
 *   }
 * }
 */
public class EvaluateSheetRequest {
    private Map<String, CellData> cells;

    public EvaluateSheetRequest() {
    }

    public EvaluateSheetRequest(Map<String, CellData> cells) {
        this.cells = cells;
    }

    public Map<String, CellData> getCells() {
        return cells;
    }
    public void setCells(Map<String, CellData> cells) {
        this.cells = cells;
    }
}
