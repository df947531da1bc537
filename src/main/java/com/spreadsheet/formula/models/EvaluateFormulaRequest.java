package com.spreadsheet.formula.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of POST /formula/evaluate:
 * {
 *   "formula": "=SUM(A1:A3)",
 *   "cells": { "A1": "5", "A2": "=A1*2" }
 * }
 */
public class EvaluateFormulaRequest {
    private String formula;
    private Map<String, String> cells = new LinkedHashMap<>();

    public EvaluateFormulaRequest() {
    }

    public EvaluateFormulaRequest(String formula, Map<String, String> cells) {
        this.formula = formula;
        this.cells = cells;
    }

    public String getFormula() {
        return formula;
    }
    public Map<String, String> getCells() {
        return cells;
    }
    public void setFormula(String formula) {
        this.formula = formula;
    }
    public void setCells(Map<String, String> cells) {
        this.cells = cells;
    }
}
