package com.spreadsheet.formula.services;

import com.spreadsheet.formula.models.CellFormat;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellDisplayFormatterTest {

    private final CellDisplayFormatter formatter = new CellDisplayFormatter();

    @Test
    void testPlainAndBlank() {
        assertEquals("1234.5", formatter.format("1234.5", CellFormat.PLAIN));
        assertEquals("abc", formatter.format("abc", null));
        assertEquals("", formatter.format("", CellFormat.CURRENCY));
        assertEquals("", formatter.format(null, CellFormat.NUMBER));
    }

    @Test
    void testNumber() {
        assertEquals("1,234,567.89", formatter.format("1234567.891", CellFormat.NUMBER));
        assertEquals("-12.00", formatter.format("-12", CellFormat.NUMBER));
        assertEquals("abc", formatter.format("abc", CellFormat.NUMBER));
    }

    @Test
    void testCurrency() {
        assertEquals("$1,200.00", formatter.format("1200", CellFormat.CURRENCY));
        assertEquals("-$3.00", formatter.format("-3", CellFormat.CURRENCY));
        assertEquals("#DIV/0!", formatter.format("#DIV/0!", CellFormat.CURRENCY));
    }

    @Test
    void testPercent() {
        assertEquals("12.50%", formatter.format("0.125", CellFormat.PERCENT));
        assertEquals("150.00%", formatter.format("1.5", CellFormat.PERCENT));
    }

    /**
     * Day serials, ISO dates and US dates all render as MM/dd/yyyy.
     */
    @Test
    void testDate() {
        assertEquals("03/15/2024", formatter.format("19797", CellFormat.DATE));
        assertEquals("03/15/2024", formatter.format("2024-03-15", CellFormat.DATE));
        assertEquals("03/15/2024", formatter.format("2024-03-15T10:00:00Z", CellFormat.DATE));
        assertEquals("01/02/2024", formatter.format("1/2/2024", CellFormat.DATE));
    }

    @Test
    void testDateRollsOver() {
        assertEquals("03/01/2024", formatter.format("2024-02-30", CellFormat.DATE));
    }

    @Test
    void testUnreadableDateIsUnchanged() {
        assertEquals("soon", formatter.format("soon", CellFormat.DATE));
        // Serial 5 lands in 1970, too early to be taken as a date
        assertEquals("5", formatter.format("5", CellFormat.DATE));
    }
}
