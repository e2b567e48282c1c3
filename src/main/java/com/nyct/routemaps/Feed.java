package com.nyct.routemaps;

import com.google.common.collect.ImmutableSet;
import lombok.Value;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * The tables loaded from one feed directory. Any table that could not be loaded is null; each operation checks for
 * the tables it needs with {@link #require(GtfsTable...)}.
 */
@Value
public class Feed {
    Path directory;
    LoadedTable<TripRow> trips;
    LoadedTable<StopTimeRow> stopTimes;
    LoadedTable<RouteRow> routes;
    LoadedTable<StopRow> stops;

    /**
     * @return the base name of the feed directory, used to name the feed's output files.
     */
    public String getName() {
        return nameOf(directory);
    }

    static String nameOf(Path directory) {
        final Path fileName = directory.toAbsolutePath().normalize().getFileName();
        return fileName == null ? directory.toString() : fileName.toString();
    }

    public LoadedTable<?> get(GtfsTable table) {
        switch (table) {
            case TRIPS:
                return trips;
            case STOP_TIMES:
                return stopTimes;
            case ROUTES:
                return routes;
            case STOPS:
                return stops;
            default:
                throw new IllegalArgumentException("Unknown table " + table);
        }
    }

    public boolean has(GtfsTable table) {
        return get(table) != null;
    }

    public Set<GtfsTable> getMissingTables() {
        final EnumSet<GtfsTable> missing = EnumSet.noneOf(GtfsTable.class);
        for (GtfsTable table : GtfsTable.values()) {
            if (!has(table)) {
                missing.add(table);
            }
        }
        return ImmutableSet.copyOf(missing);
    }

    public boolean isComplete() {
        return getMissingTables().isEmpty();
    }

    public boolean isEmpty() {
        return Arrays.stream(GtfsTable.values()).noneMatch(this::has);
    }

    public void require(GtfsTable... tables) throws MissingTableException {
        for (GtfsTable table : tables) {
            if (!has(table)) {
                throw new MissingTableException(table);
            }
        }
    }
}
