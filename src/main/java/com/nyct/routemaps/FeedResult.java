package com.nyct.routemaps;

import com.google.common.collect.ImmutableList;
import lombok.Value;

import java.nio.file.Path;

/**
 * What processing one feed directory produced. {@code mapFile} and {@code segmentCountsFile} are null when
 * nothing was saved.
 */
@Value
public class FeedResult {
    Path directory;
    SegmentCounts segmentCounts;
    Path mapFile;
    Path segmentCountsFile;
    ImmutableList<Diagnostic> diagnostics;

    public boolean isMapSaved() {
        return mapFile != null;
    }

    public boolean hasSaveFailure() {
        return diagnostics.stream().anyMatch(d -> d.getType() == DiagnosticType.SAVE_FAILED);
    }

    public boolean hasDiagnostic(DiagnosticType type) {
        return diagnostics.stream().anyMatch(d -> d.getType() == type);
    }
}
