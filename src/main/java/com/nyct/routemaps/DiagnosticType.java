package com.nyct.routemaps;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.slf4j.event.Level;

@Getter
@RequiredArgsConstructor
public enum DiagnosticType {
    // Loading.
    MISSING_DIRECTORY(Level.ERROR, "Feed directory does not exist or is not a directory."),
    MISSING_FILE(Level.WARN, "A required GTFS file was not found in the feed directory."),
    TABLE_UNREADABLE(Level.ERROR, "The file could not be parsed past this point."),
    ROW_PARSE(Level.WARN, "Malformed row was skipped."),
    DUPLICATE_ID(Level.WARN, "Row repeats an ID already loaded from this table and was skipped."),
    MISSING_COLUMN(Level.ERROR, "A required column was missing from a table."),
    INCOMPLETE_FEED(Level.WARN, "Feed is missing one or more required tables."),
    EMPTY_FEED(Level.ERROR, "None of the required tables could be loaded; feed skipped."),
    // Segments and rendering.
    MISSING_TABLE(Level.ERROR, "A table required by this operation is missing."),
    NO_STOP_COORDINATES(Level.ERROR, "No stop has valid coordinates, so the map cannot be centered."),
    EMPTY_COORDINATES(Level.WARN, "Trip has no stops with valid coordinates; its line was skipped."),
    SEGMENTS_COUNTED(Level.INFO, "Distinct stop sequences counted."),
    // Output.
    MAP_SAVED(Level.INFO, "Route map saved."),
    SEGMENTS_SAVED(Level.INFO, "Segment counts saved."),
    SAVE_FAILED(Level.ERROR, "An output file could not be written."),
    FEED_FAILED(Level.ERROR, "Processing of the feed failed unexpectedly.");

    private final Level level;
    private final String englishMessage;
}
