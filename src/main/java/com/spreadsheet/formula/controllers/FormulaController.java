package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.exceptions.InvalidRequestException;
import com.spreadsheet.formula.models.CsvSheet;
import com.spreadsheet.formula.models.EvaluateFormulaRequest;
import com.spreadsheet.formula.models.EvaluateFormulaResponse;
import com.spreadsheet.formula.models.EvaluateSheetRequest;
import com.spreadsheet.formula.models.Value;
import com.spreadsheet.formula.services.FormulaService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST endpoints for evaluating formulas.
 * "/formula" is the base path. Callers send the cells with every request.
 */
@RestController
@RequestMapping("/formula")
public class FormulaController {

    @Autowired
    private FormulaService formulaService;

    /**
     * POST /formula/evaluate
     * Body: { "formula": "=SUM(A1:A3)", "cells": { "A1": "5", ... } }
     * Returns { "value": 5.0, "type": "NUMBER", "error": false }.
     * Formula errors such as #DIV/0! are normal results (200 OK, "error": true).
     */
    @PostMapping("/evaluate")
    public ResponseEntity<EvaluateFormulaResponse> evaluate(@RequestBody EvaluateFormulaRequest request) {
        if (request.getFormula() == null) {
            throw new InvalidRequestException("Missing field: formula");
        }
        Value value = formulaService.evaluate(request.getFormula(), request.getCells());
        return ResponseEntity.ok(EvaluateFormulaResponse.from(value));
    }

    /**
     * POST /formula/sheet
     * Body: { "cells": { "A1": { "value": "1200", "format": "currency" }, ... } }
     * Returns the display text of every cell, e.g. { "A1": "$1,200.00", ... }.
     * An invalid cell id key is a 400 (INVALID_CELL_REFERENCE).
     */
    @PostMapping("/sheet")
    public ResponseEntity<Map<String, String>> evaluateSheet(@RequestBody EvaluateSheetRequest request) {
        if (request.getCells() == null) {
            throw new InvalidRequestException("Missing field: cells");
        }
        return ResponseEntity.ok(formulaService.evaluateSheet(request.getCells()));
    }

    /**
     * POST /formula/csv/import
     * Body: CSV text (comma, tab or semicolon separated).
     * Returns { "cells": { "A1": { "value": "...", "format": "PLAIN" }, ... }, "rows": 2, "columns": 3 }.
     */
    @PostMapping(value = "/csv/import", consumes = {MediaType.TEXT_PLAIN_VALUE, "text/csv"})
    public ResponseEntity<CsvSheet> importCsv(@RequestBody(required = false) String csv) {
        return ResponseEntity.ok(formulaService.importCsv(csv));
    }

    /**
     * POST /formula/csv/export
     * Body: same shape as /formula/sheet. Returns the raw cell contents as CSV.
     */
    @PostMapping(value = "/csv/export", produces = "text/csv")
    public ResponseEntity<String> exportCsv(@RequestBody EvaluateSheetRequest request) {
        if (request.getCells() == null) {
            throw new InvalidRequestException("Missing field: cells");
        }
        return ResponseEntity.ok(formulaService.exportCsv(request.getCells()));
    }
}
