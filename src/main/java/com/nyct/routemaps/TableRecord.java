package com.nyct.routemaps;

import com.google.common.collect.ImmutableMap;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * One data row of a GTFS file, with its fields addressed by column name. Blank fields read as absent.
 */
@RequiredArgsConstructor
class TableRecord {
    private final ImmutableMap<String, Integer> columnIndex;
    private final String[] values;

    String get(String column) {
        final Integer index = columnIndex.get(column);
        if (index == null || index >= values.length) {
            return null;
        }
        return StringUtils.trimToNull(values[index]);
    }

    String require(String column) throws RowParseException {
        final String value = get(column);
        if (value == null) {
            throw new RowParseException(String.format("Required field '%s' is empty.", column));
        }
        return value;
    }

    int requireInt(String column) throws RowParseException {
        final String value = require(column);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new RowParseException(String.format("Field '%s' is not an integer: '%s'.", column, value));
        }
    }

    /**
     * @return the parsed value, or null when the field is absent or not a finite number.
     */
    Double getDouble(String column) {
        final String value = get(column);
        if (value == null) {
            return null;
        }
        try {
            final double d = Double.parseDouble(value);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
