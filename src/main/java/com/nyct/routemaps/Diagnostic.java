package com.nyct.routemaps;

import lombok.Value;

/**
 * One condition observed while processing a feed. {@code table} and {@code line} are only set when the condition
 * can be pinned to a file or a row of it; {@code line} counts records, the header being line 1.
 */
@Value
public class Diagnostic {
    public static final long NO_LINE = -1;

    DiagnosticType type;
    GtfsTable table;
    long line;
    String detail;

    public String getMessage() {
        StringBuilder sb = new StringBuilder(type.getEnglishMessage());
        if (table != null) {
            sb.append(" [").append(table.getFileName());
            if (line != NO_LINE) {
                sb.append(" line ").append(line);
            }
            sb.append(']');
        }
        if (detail != null) {
            sb.append(' ').append(detail);
        }
        return sb.toString();
    }
}
