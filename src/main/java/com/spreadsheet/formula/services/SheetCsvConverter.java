package com.spreadsheet.formula.services;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.spreadsheet.formula.exceptions.InvalidRequestException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellData;
import com.spreadsheet.formula.models.CellFormat;
import com.spreadsheet.formula.models.CsvSheet;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between CSV text and cell snapshots.
 * Cells keep their raw text, so formulas travel as written ("=A1*2").
 */
@Component
public class SheetCsvConverter {

    private static final char[] DELIMITERS = {',', '\t', ';'};

    private final CsvMapper csvMapper = new CsvMapper()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);

    private final ObjectWriter rowWriter = csvMapper.writer(CsvSchema.emptySchema().withLineSeparator("\n"));

    /**
     * Reads CSV text into cells. The delimiter (comma, tab or semicolon) is guessed from the first line.
     * Values are trimmed and empty fields produce no cell. Row n of the file becomes row n of the sheet.
     */
    public CsvSheet parse(String csv) {
        if (csv == null || csv.trim().isEmpty()) {
            return CsvSheet.empty();
        }
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(detectDelimiter(csv));

        List<String[]> rows;
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class).with(schema).readValues(csv)) {
            rows = it.readAll();
        } catch (IOException e) {
            throw new InvalidRequestException("Malformed CSV: " + e.getMessage());
        }
        while (!rows.isEmpty() && isBlank(rows.get(rows.size() - 1))) {
            rows.remove(rows.size() - 1);
        }

        Map<String, CellData> cells = new LinkedHashMap<>();
        int columns = 0;
        for (int r = 0; r < rows.size(); r++) {
            String[] fields = rows.get(r);
            columns = Math.max(columns, fields.length);
            for (int c = 0; c < fields.length; c++) {
                String value = fields[c] == null ? "" : fields[c].trim();
                if (!value.isEmpty()) {
                    cells.put(CellAddress.cellId(r + 1, c + 1), new CellData(value, CellFormat.PLAIN));
                }
            }
        }
        return new CsvSheet(cells, rows.size(), columns);
    }

    /**
     * Writes cells as comma-separated text covering A1 to the bottom-right used cell.
     * Trailing empty fields and trailing empty lines are left out.
     * Keys must already be canonical cell ids.
     */
    public String export(Map<String, CellData> cells) {
        int maxRow = 0;
        int maxColumn = 0;
        for (String id : cells.keySet()) {
            CellAddress address = CellAddress.parse(id)
                    .orElseThrow(() -> new IllegalArgumentException("Not a cell id: " + id));
            maxRow = Math.max(maxRow, address.getRow());
            maxColumn = Math.max(maxColumn, address.getColumn());
        }

        List<String> lines = new ArrayList<>();
        for (int r = 1; r <= maxRow; r++) {
            String[] fields = new String[maxColumn];
            int used = 0;
            for (int c = 1; c <= maxColumn; c++) {
                CellData cell = cells.get(CellAddress.cellId(r, c));
                String value = cell == null || cell.getValue() == null ? "" : cell.getValue();
                fields[c - 1] = value;
                if (!value.isEmpty()) {
                    used = c;
                }
            }
            lines.add(used == 0 ? "" : writeRow(Arrays.copyOf(fields, used)));
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return String.join("\n", lines);
    }

    private String writeRow(String[] fields) {
        try {
            String row = rowWriter.writeValueAsString(fields);
            return row.endsWith("\n") ? row.substring(0, row.length() - 1) : row;
        } catch (IOException e) {
            throw new IllegalStateException("Could not write CSV row", e);
        }
    }

    /**
     * Picks the candidate delimiter that occurs most often, outside quotes, on the first line.
     * Comma wins ties and lines without any delimiter.
     */
    static char detectDelimiter(String csv) {
        String firstLine = csv.split("\\r?\\n", 2)[0];
        char best = ',';
        int bestCount = 0;
        for (char delimiter : DELIMITERS) {
            int count = 0;
            boolean inQuotes = false;
            for (int i = 0; i < firstLine.length(); i++) {
                char ch = firstLine.charAt(i);
                if (ch == '"') {
                    inQuotes = !inQuotes;
                } else if (ch == delimiter && !inQuotes) {
                    count++;
                }
            }
            if (count > bestCount) {
                bestCount = count;
                best = delimiter;
            }
        }
        return best;
    }

    private static boolean isBlank(String[] row) {
        for (String field : row) {
            if (field != null && !field.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
