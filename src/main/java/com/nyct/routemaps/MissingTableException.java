package com.nyct.routemaps;

public class MissingTableException extends FeedException {

    public MissingTableException(GtfsTable table) {
        super(table, String.format("Missing required file %s.", table.getFileName()));
    }

    @Override
    public DiagnosticType getDiagnosticType() {
        return DiagnosticType.MISSING_TABLE;
    }
}
