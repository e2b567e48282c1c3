package com.nyct.routemaps;

import lombok.Getter;

/**
 * A condition that stops one operation on a feed without affecting the rest of the run.
 */
@Getter
public abstract class FeedException extends Exception {
    private final GtfsTable table;

    protected FeedException(GtfsTable table, String message) {
        super(message);
        this.table = table;
    }

    public abstract DiagnosticType getDiagnosticType();
}
