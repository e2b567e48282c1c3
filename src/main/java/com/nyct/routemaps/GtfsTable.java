package com.nyct.routemaps;

import com.google.common.collect.ImmutableList;
import lombok.Getter;

/**
 * The GTFS tables a feed directory must provide, with the columns each one cannot be loaded without.
 */
@Getter
public enum GtfsTable {
    TRIPS("trips.txt", "trip_id"),
    STOP_TIMES("stop_times.txt", "trip_id", "stop_id", "stop_sequence"),
    ROUTES("routes.txt", "route_id"),
    STOPS("stops.txt", "stop_id");

    private final String fileName;
    private final ImmutableList<String> requiredColumns;

    GtfsTable(String fileName, String... requiredColumns) {
        this.fileName = fileName;
        this.requiredColumns = ImmutableList.copyOf(requiredColumns);
    }
}
