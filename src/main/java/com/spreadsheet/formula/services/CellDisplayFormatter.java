package com.spreadsheet.formula.services;

import com.spreadsheet.formula.engine.Coercions;
import com.spreadsheet.formula.engine.NumberFormats;
import com.spreadsheet.formula.models.CellFormat;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders an evaluated cell value for display according to the cell's format.
 * Values the format can't interpret are shown unchanged.
 */
@Component
public class CellDisplayFormatter {

    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})");
    private static final Pattern US_DATE = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{4})$");

    // Serials outside these years are taken to be plain numbers, not dates
    private static final int MIN_SERIAL_YEAR = 1900;
    private static final int MAX_SERIAL_YEAR = 2200;

    /**
     * Formats a value:
     * NUMBER -> "1,234.50", CURRENCY -> "$1,234.50" / "-$3.00",
     * PERCENT -> "12.50%", DATE -> "03/15/2024".
     */
    public String format(String value, CellFormat format) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        if (format == null || format == CellFormat.PLAIN) {
            return value;
        }

        switch (format) {
            case NUMBER: {
                Double num = Coercions.parseNumber(value);
                return num == null ? value : NumberFormats.grouped(num, 2);
            }
            case CURRENCY: {
                Double num = Coercions.parseNumber(value);
                if (num == null) {
                    return value;
                }
                String formatted = NumberFormats.grouped(Math.abs(num), 2);
                return num < 0 ? "-$" + formatted : "$" + formatted;
            }
            case PERCENT: {
                Double num = Coercions.parseNumber(value);
                return num == null ? value : NumberFormats.grouped(num * 100, 2) + "%";
            }
            case DATE: {
                LocalDate date = parseAsDate(value);
                return date == null ? value : NumberFormats.usDate(date);
            }
            default:
                return value;
        }
    }

    /**
     * Reads a day serial, a "yyyy-M-d" prefix or "M/d/yyyy".
     * Out-of-range months and days roll over, so "2024-02-30" is March 1st.
     */
    private LocalDate parseAsDate(String value) {
        String trimmed = value.trim();

        Double serial = Coercions.parseNumber(trimmed);
        if (serial != null) {
            LocalDate date = NumberFormats.toDate(serial);
            if (date.getYear() >= MIN_SERIAL_YEAR && date.getYear() <= MAX_SERIAL_YEAR) {
                return date;
            }
        }

        Matcher iso = ISO_DATE.matcher(trimmed);
        if (iso.find()) {
            return calendarDate(iso.group(1), iso.group(2), iso.group(3));
        }
        Matcher us = US_DATE.matcher(trimmed);
        if (us.matches()) {
            return calendarDate(us.group(3), us.group(1), us.group(2));
        }
        return null;
    }

    private LocalDate calendarDate(String year, String month, String day) {
        return LocalDate.of(Integer.parseInt(year), 1, 1)
                .plusMonths(Integer.parseInt(month) - 1L)
                .plusDays(Integer.parseInt(day) - 1L);
    }
}
