package com.nyct.routemaps;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;

/**
 * Collects the diagnostics raised for one feed, logging each one as it is reported.
 */
public class FeedDiagnostics {
    private static final Logger LOG = LoggerFactory.getLogger(FeedDiagnostics.class);

    private final String feedName;

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public FeedDiagnostics(String feedName) {
        this.feedName = feedName;
    }

    public void report(DiagnosticType type, String detail) {
        report(type, null, Diagnostic.NO_LINE, detail);
    }

    public void report(DiagnosticType type, GtfsTable table, String detail) {
        report(type, table, Diagnostic.NO_LINE, detail);
    }

    public void report(DiagnosticType type, GtfsTable table, long line, String detail) {
        final Diagnostic diagnostic = new Diagnostic(type, table, line, detail);
        diagnostics.add(diagnostic);
        log(diagnostic);
    }

    public ImmutableList<Diagnostic> getDiagnostics() {
        return ImmutableList.copyOf(diagnostics);
    }

    public ImmutableList<Diagnostic> ofType(DiagnosticType type) {
        return diagnostics.stream()
                .filter(d -> d.getType() == type)
                .collect(toImmutableList());
    }

    public boolean has(DiagnosticType type) {
        return diagnostics.stream().anyMatch(d -> d.getType() == type);
    }

    private void log(Diagnostic diagnostic) {
        final String message = diagnostic.getMessage();
        switch (diagnostic.getType().getLevel()) {
            case ERROR:
                LOG.error("{}: {}", feedName, message);
                break;
            case WARN:
                LOG.warn("{}: {}", feedName, message);
                break;
            case INFO:
                LOG.info("{}: {}", feedName, message);
                break;
            default:
                LOG.debug("{}: {}", feedName, message);
        }
    }
}
