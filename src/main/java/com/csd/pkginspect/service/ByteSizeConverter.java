package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.InvalidArgumentException;
import com.csd.pkginspect.model.ByteSize;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Converts between raw byte counts and symbolic sizes such as {@code 12.4 MB}, base 1024.
 */
public final class ByteSizeConverter {

    public static final int BYTES_BASE = 1024;

    private static final Map<String, String> UNIT_NAMES = new LinkedHashMap<>();
    private static final Map<String, Double> UNIT_VALUES = new LinkedHashMap<>();

    static {
        String[][] units = {
                {"KB", "KB (Kilobytes)"},
                {"MB", "MB (Megabytes)"},
                {"GB", "GB (Gigabytes)"},
                {"TB", "TB (Terabytes)"}
        };
        for (int i = 0; i < units.length; i++) {
            UNIT_NAMES.put(units[i][0], units[i][1]);
            UNIT_VALUES.put(units[i][0], Math.pow(BYTES_BASE, i + 1));
        }
    }

    private ByteSizeConverter() {}

    public static ByteSize fromBytes(double bytes) {
        if (bytes < 0 || Double.isNaN(bytes)) {
            throw new InvalidArgumentException("Byte count must be a non-negative number, got " + bytes);
        }
        String chosen = "TB";
        for (Map.Entry<String, Double> unit : UNIT_VALUES.entrySet()) {
            if (bytes / BYTES_BASE < unit.getValue()) {
                chosen = unit.getKey();
                break;
            }
        }
        return new ByteSize(bytes, bytes / UNIT_VALUES.get(chosen), chosen, UNIT_NAMES.get(chosen));
    }

    /**
     * Parses {@code "12.4 MB"}; the unit may also be spelled out ({@code megabytes}) or glued to the number.
     */
    public static ByteSize fromString(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidArgumentException("A size such as '12.4 MB' must be specified.");
        }
        String trimmed = text.trim();
        int split = 0;
        while (split < trimmed.length()
                && (Character.isDigit(trimmed.charAt(split)) || trimmed.charAt(split) == '.' || trimmed.charAt(split) == ',')) {
            split++;
        }
        return fromString(trimmed.substring(0, split), trimmed.substring(split));
    }

    public static ByteSize fromString(String number, String unit) {
        double value;
        try {
            value = Double.parseDouble(number.replace(",", "").trim());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("The specified value '" + number + "' is not a number.", e);
        }
        return fromBytes(value * multiplierOf(unit));
    }

    public static boolean isSizeUnit(String unit) {
        return unit != null && UNIT_VALUES.containsKey(unit.trim().toUpperCase(Locale.ROOT));
    }

    private static double multiplierOf(String unit) {
        String normalized = unit == null ? "" : unit.trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty() || normalized.equals("B") || normalized.startsWith("BYTE")) {
            return 1;
        }
        for (Map.Entry<String, Double> candidate : UNIT_VALUES.entrySet()) {
            if (normalized.charAt(0) == candidate.getKey().charAt(0)) {
                return candidate.getValue();
            }
        }
        throw new InvalidArgumentException("Unknown size unit '" + unit + "'. Valid units: " + UNIT_NAMES.keySet());
    }
}
