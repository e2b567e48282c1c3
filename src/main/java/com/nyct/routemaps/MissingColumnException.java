package com.nyct.routemaps;

import lombok.Getter;

public class MissingColumnException extends FeedException {
    @Getter
    private final String column;

    public MissingColumnException(GtfsTable table, String column) {
        super(table, String.format("Column '%s' missing in %s.", column, table.getFileName()));
        this.column = column;
    }

    @Override
    public DiagnosticType getDiagnosticType() {
        return DiagnosticType.MISSING_COLUMN;
    }
}
