package com.parkthrive.crmops.resolve;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for the string encodings the CRM uses in custom fields.
 */
public final class FieldValues {

    public static final String LIST_DELIMITER = ",";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final DateTimeFormatter US = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    private FieldValues() {
    }

    /**
     * Components of a comma separated value, trimmed, in order. Blank input yields an empty list.
     */
    public static List<String> splitList(String value) {
        List<String> parts = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return parts;
        }
        for (String part : value.split(LIST_DELIMITER)) {
            parts.add(part.trim());
        }
        return parts;
    }

    /**
     * Appends {@code item} to a comma separated value, keeping every existing component as is.
     */
    public static String append(String existing, String item) {
        if (existing == null || existing.isEmpty()) {
            return item;
        }
        return existing + LIST_DELIMITER + item;
    }

    /**
     * Component {@code index} of a comma separated value, or empty string when there are fewer.
     */
    public static String component(String value, int index) {
        List<String> parts = splitList(value);
        return index < parts.size() ? parts.get(index) : "";
    }

    /**
     * {@code yyyy-MM-dd} to {@code MM/dd/yyyy}; anything else is returned unchanged.
     */
    public static String isoToUsDate(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        try {
            return LocalDate.parse(value, ISO).format(US);
        } catch (DateTimeParseException e) {
            return value;
        }
    }

    /**
     * Whole amounts without decimals, others with two, zero as {@code 0}.
     * Values that are not numbers are returned unchanged.
     */
    public static String formatMoney(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String cleaned = value.trim().replace(",", "");
        if (cleaned.startsWith("$")) {
            cleaned = cleaned.substring(1);
        }
        try {
            BigDecimal amount = new BigDecimal(cleaned);
            if (amount.signum() == 0) {
                return "0";
            }
            if (amount.stripTrailingZeros().scale() <= 0) {
                return amount.setScale(0, RoundingMode.UNNECESSARY).toPlainString();
            }
            return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
        } catch (NumberFormatException | ArithmeticException e) {
            return value;
        }
    }
}
