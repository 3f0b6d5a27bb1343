package com.bank.bakeoff.engine.features;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsing of raw CSV cell text into numbers, dates, booleans and labels.
 */
public final class CellValues {

    private static final Pattern CURRENCY_SYMBOLS = Pattern.compile("[$,€£¥]");
    private static final Pattern ACCOUNTING_NEGATIVE = Pattern.compile("^\\((.+)\\)$");
    private static final Set<String> BOOLEAN_TOKENS = Set.of("true", "false", "yes", "no", "1", "0", "y", "n");

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm[:ss]"),
            DateTimeFormatter.ofPattern("M/d/yyyy h:mm[:ss] a", Locale.US));

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("M/d/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yy"),
            DateTimeFormatter.ofPattern("d-MMM-yyyy", Locale.US),
            DateTimeFormatter.ofPattern("d-MMM-yy", Locale.US),
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US),
            DateTimeFormatter.ofPattern("MMM d yyyy", Locale.US));

    private CellValues() {}

    /**
     * @return the numeric value, or NaN when the cell is blank or not a number
     */
    public static double parseNumeric(String raw) {
        if (raw == null) return Double.NaN;
        String cleaned = CURRENCY_SYMBOLS.matcher(raw.trim()).replaceAll("");
        cleaned = ACCOUNTING_NEGATIVE.matcher(cleaned).replaceAll("-$1");
        if (cleaned.isEmpty() || cleaned.equals("-")) return Double.NaN;
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    public static LocalDateTime parseDate(String raw) {
        if (raw == null) return null;
        String value = raw.trim();
        if (value.length() < 6) return null;

        LocalDateTime parsed = tryParse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME, false);
        if (parsed != null) return parsed;
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            parsed = tryParse(value, format, false);
            if (parsed != null) return parsed;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            parsed = tryParse(value, format, true);
            if (parsed != null) return parsed;
        }
        return null;
    }

    private static LocalDateTime tryParse(String value, DateTimeFormatter format, boolean dateOnly) {
        try {
            if (dateOnly) {
                return LocalDate.parse(value, format).atStartOfDay();
            }
            if (format == DateTimeFormatter.ISO_OFFSET_DATE_TIME) {
                return OffsetDateTime.parse(value, format).toLocalDateTime();
            }
            return LocalDateTime.parse(value, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static boolean isBooleanToken(String raw) {
        return raw != null && BOOLEAN_TOKENS.contains(raw.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * 1/true/yes are truthy; anything else is 0.
     */
    public static double parseBoolean(String raw) {
        if (raw == null) return 0.0;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        return v.equals("1") || v.equals("true") || v.equals("yes") ? 1.0 : 0.0;
    }

    /**
     * Ground-truth label: 1/true/yes, or a numeric value of at least 0.5, is positive.
     */
    public static int parseLabel(String raw) {
        if (raw == null) return 0;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (v.equals("1") || v.equals("true") || v.equals("yes")) return 1;
        double numeric = parseNumeric(v);
        return !Double.isNaN(numeric) && numeric >= 0.5 ? 1 : 0;
    }

    public static boolean isBlank(String raw) {
        return raw == null || raw.trim().isEmpty();
    }
}
