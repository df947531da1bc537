package com.spreadsheet.formula.services;

import com.spreadsheet.formula.engine.CellAccessor;
import com.spreadsheet.formula.engine.FormulaEngine;
import com.spreadsheet.formula.exceptions.InvalidCellReferenceException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellData;
import com.spreadsheet.formula.models.CellFormat;
import com.spreadsheet.formula.models.CsvSheet;
import com.spreadsheet.formula.models.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluates formulas against a snapshot of cells supplied by the caller.
 * Nothing is stored between calls; every request brings the cells it needs.
 */
@Service
public class FormulaService {

    private static final Logger log = LoggerFactory.getLogger(FormulaService.class);

    private final FormulaEngine engine;
    private final CellDisplayFormatter formatter;
    private final SheetCsvConverter csvConverter;

    public FormulaService(FormulaEngine engine, CellDisplayFormatter formatter, SheetCsvConverter csvConverter) {
        this.engine = engine;
        this.formatter = formatter;
        this.csvConverter = csvConverter;
    }

    /**
     * Evaluates one formula (or plain value) where cell references read from 'cells',
     * a map of cell id -> raw text. Missing cells are blank.
     */
    public Value evaluate(String formula, Map<String, String> cells) {
        Map<String, String> raw = normalizeKeys(cells == null ? Collections.emptyMap() : cells);
        log.debug("Evaluating '{}' against {} cells", formula, raw.size());
        return engine.evaluate(formula, accessorFor(raw));
    }

    /**
     * Computes the display text of every supplied cell:
     * - formula cells (text starting with "=", no leading space) are evaluated, then formatted
     * - data cells are formatted as they are
     * - blank cells display as ""
     * The result keeps the input order, keyed by canonical cell id.
     */
    public Map<String, String> evaluateSheet(Map<String, CellData> cells) {
        Map<String, CellData> sheet = normalizeKeys(cells == null ? Collections.emptyMap() : cells);
        Map<String, String> raw = new LinkedHashMap<>();
        sheet.forEach((id, data) -> raw.put(id, data == null || data.getValue() == null ? "" : data.getValue()));
        CellAccessor accessor = accessorFor(raw);
        log.debug("Evaluating sheet snapshot with {} cells", sheet.size());

        Map<String, String> display = new LinkedHashMap<>();
        for (Map.Entry<String, CellData> entry : sheet.entrySet()) {
            String id = entry.getKey();
            String value = raw.get(id);
            CellFormat format = entry.getValue() == null ? CellFormat.PLAIN : entry.getValue().getFormat();

            if (value.isEmpty()) {
                display.put(id, "");
            } else if (value.startsWith("=")) {
                Value result = engine.evaluateCell(id, accessor);
                display.put(id, formatter.format(result.toString(), format));
            } else {
                display.put(id, formatter.format(value, format));
            }
        }
        return display;
    }

    public CsvSheet importCsv(String csv) {
        CsvSheet sheet = csvConverter.parse(csv);
        log.debug("Imported CSV: {} rows, {} columns, {} cells",
                sheet.getRows(), sheet.getColumns(), sheet.getCells().size());
        return sheet;
    }

    /**
     * Exports the raw cell contents (formulas as written, not their results) as CSV.
     */
    public String exportCsv(Map<String, CellData> cells) {
        return csvConverter.export(normalizeKeys(cells == null ? Collections.emptyMap() : cells));
    }

    private CellAccessor accessorFor(Map<String, String> raw) {
        return cellId -> raw.getOrDefault(cellId, "");
    }

    /**
     * Rewrites keys to canonical ids ("b2" -> "B2"), rejecting anything that isn't a cell id.
     */
    private <T> Map<String, T> normalizeKeys(Map<String, T> cells) {
        Map<String, T> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, T> entry : cells.entrySet()) {
            CellAddress address = CellAddress.parse(entry.getKey())
                    .orElseThrow(() -> new InvalidCellReferenceException("Invalid cell reference: " + entry.getKey()));
            normalized.put(address.toString(), entry.getValue());
        }
        return normalized;
    }
}
