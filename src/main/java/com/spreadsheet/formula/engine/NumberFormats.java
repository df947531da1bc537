package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.models.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * Number and date rendering shared by TEXT() and the cell display formatter.
 * Dates are day serials: days since 1970-01-01 UTC, the fraction being the time of day.
 */
public final class NumberFormats {

    public static final long MILLIS_PER_DAY = 86_400_000L;

    private NumberFormats() {
    }

    /**
     * Fixed number of decimals, halves rounded away from zero: (2.345, 2) -> "2.35".
     */
    public static String fixed(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Value.formatNumber(value);
        }
        return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * Fixed decimals with comma thousands separators: (1234567.891, 2) -> "1,234,567.89".
     */
    public static String grouped(double value, int decimals) {
        String plain = fixed(Math.abs(value), decimals);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return plain;
        }
        int dot = plain.indexOf('.');
        String intPart = dot < 0 ? plain : plain.substring(0, dot);
        String decPart = dot < 0 ? "" : plain.substring(dot);

        StringBuilder formatted = new StringBuilder();
        for (int i = 0; i < intPart.length(); i++) {
            if (i > 0 && (intPart.length() - i) % 3 == 0) {
                formatted.append(',');
            }
            formatted.append(intPart.charAt(i));
        }
        formatted.append(decPart);
        return value < 0 ? "-" + formatted : formatted.toString();
    }

    /**
     * Calendar date (UTC) of a day serial. The time of day is dropped.
     */
    public static LocalDate toDate(double serial) {
        long millis = (long) (serial * MILLIS_PER_DAY);
        return Instant.ofEpochMilli(millis).atZone(ZoneOffset.UTC).toLocalDate();
    }

    /**
     * Renders a date as MM/dd/yyyy.
     */
    public static String usDate(LocalDate date) {
        return String.format(Locale.ROOT, "%02d/%02d/%04d", date.getMonthValue(), date.getDayOfMonth(), date.getYear());
    }
}
