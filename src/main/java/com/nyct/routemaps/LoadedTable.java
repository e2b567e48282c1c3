package com.nyct.routemaps;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import lombok.Value;

/**
 * The rows of one GTFS file that survived parsing, along with the columns its header declared.
 */
@Value
public class LoadedTable<T> {
    GtfsTable table;
    ImmutableSet<String> columns;
    ImmutableList<T> rows;

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public void requireColumns(String... required) throws MissingColumnException {
        for (String column : required) {
            if (!hasColumn(column)) {
                throw new MissingColumnException(table, column);
            }
        }
    }
}
