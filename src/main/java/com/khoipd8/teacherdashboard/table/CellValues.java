package com.khoipd8.teacherdashboard.table;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient readers for the free-text numbers and dates teachers type into the workbook.
 */
public final class CellValues {

    private static final Pattern LEADING_DECIMAL =
            Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");
    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");
    private static final Pattern ISO_PREFIX = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})(?:[T ].*)?$");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("uuuu/M/d", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("M/d/uuuu", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM d, uuuu", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMMM d, uuuu", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d MMM uuuu", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d MMMM uuuu", Locale.ENGLISH)
    );

    private CellValues() {
    }

    /** Leading decimal of the cell ({@code "85.5%"} reads as 85.5); 0 when there is none. */
    public static double leadingNumber(String cell) {
        if (cell == null) {
            return 0;
        }
        Matcher m = LEADING_DECIMAL.matcher(cell);
        return m.find() ? Double.parseDouble(m.group(1)) : 0;
    }

    /** Leading integer of the cell ({@code "3.5"} reads as 3); 0 when there is none. */
    public static int leadingInt(String cell) {
        if (cell == null) {
            return 0;
        }
        Matcher m = LEADING_INTEGER.matcher(cell);
        if (!m.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException overflow) {
            return 0;
        }
    }

    public static Optional<LocalDate> parseDate(String cell) {
        if (cell == null || cell.isBlank()) {
            return Optional.empty();
        }
        String text = cell.trim();
        Matcher iso = ISO_PREFIX.matcher(text);
        if (iso.matches()) {
            try {
                return Optional.of(LocalDate.parse(iso.group(1)));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate date = tryParse(text, format);
            if (date != null) {
                return Optional.of(date);
            }
        }
        return Optional.empty();
    }

    private static LocalDate tryParse(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * The cell as {@code yyyy-MM-dd} when it parses as a date, otherwise the trimmed text, so that
     * day membership can be decided by plain string equality.
     */
    public static String isoDate(String cell) {
        if (cell == null) {
            return null;
        }
        return parseDate(cell).map(LocalDate::toString).orElse(cell.trim());
    }
}
