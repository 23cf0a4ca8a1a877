package com.routing.core;

import java.util.regex.Pattern;

/**
 * Parses {@code source|destination|claim_id|status_code} lines.
 * There is no escaping: a field cannot contain the delimiter.
 */
public final class RecordParser {

    private static final Pattern DELIMITER = Pattern.compile("\\|");
    private static final int FIELD_COUNT = 4;

    private RecordParser() {
    }

    /**
     * @param line one input line, with or without its line terminator
     * @return the parsed record, or {@code null} if the line is empty or does not
     *         have exactly four fields
     */
    public static RouteRecord parse(String line) {
        if (line == null) {
            return null;
        }
        String trimmed = stripLineTerminator(line);
        if (trimmed.isEmpty()) {
            return null;
        }
        String[] parts = DELIMITER.split(trimmed, -1);
        if (parts.length != FIELD_COUNT) {
            return null;
        }
        return new RouteRecord(parts[0], parts[1], new GroupKey(parts[2], parts[3]));
    }

    private static String stripLineTerminator(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }
}
