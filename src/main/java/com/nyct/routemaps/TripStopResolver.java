package com.nyct.routemaps;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import se.sawano.java.text.AlphanumericComparator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableMap.toImmutableMap;

/**
 * Rebuilds the ordered stop visits of every trip by joining stop_times onto trips (and onto stops, for rendering).
 * Both joins are left joins: every stop_times row is kept whether or not its trip or stop exists.
 */
public class TripStopResolver {
    private static final Comparator<TripStops> TRIP_ORDER =
            Comparator.comparing(TripStops::getTripId, new AlphanumericComparator())
                    .thenComparing(TripStops::getTripId);

    private static final Comparator<TripStopRow> VISIT_ORDER = Comparator.comparingInt(TripStopRow::getStopSequence);

    /**
     * Resolves the stop sequences segments are counted from. Stops are not joined.
     */
    public ImmutableList<TripStops> resolveStopSequences(Feed feed) throws MissingTableException {
        feed.require(GtfsTable.TRIPS, GtfsTable.STOP_TIMES, GtfsTable.ROUTES);
        return resolve(feed, ImmutableMap.of());
    }

    /**
     * Resolves the stop sequences with the coordinates of each stop, for drawing. Routes are not needed.
     */
    public ImmutableList<TripStops> resolveStopLocations(Feed feed) throws MissingTableException {
        feed.require(GtfsTable.TRIPS, GtfsTable.STOP_TIMES, GtfsTable.STOPS);
        final ImmutableMap<String, StopRow> stopsById = index(feed.getStops().getRows(), StopRow::getStopId);
        return resolve(feed, stopsById);
    }

    private ImmutableList<TripStops> resolve(Feed feed, Map<String, StopRow> stopsById) {
        final ImmutableMap<String, TripRow> tripsById = index(feed.getTrips().getRows(), TripRow::getTripId);

        final Map<String, List<TripStopRow>> rowsByTrip = new LinkedHashMap<>();
        for (TripRow trip : feed.getTrips().getRows()) {
            rowsByTrip.put(trip.getTripId(), new ArrayList<>());
        }

        for (StopTimeRow stopTime : feed.getStopTimes().getRows()) {
            final TripRow trip = tripsById.get(stopTime.getTripId());
            final StopRow stop = stopsById.get(stopTime.getStopId());

            rowsByTrip.computeIfAbsent(stopTime.getTripId(), k -> new ArrayList<>())
                    .add(new TripStopRow(
                            stopTime.getTripId(),
                            stopTime.getStopSequence(),
                            stopTime.getStopId(),
                            trip == null ? null : trip.getRouteId(),
                            stop == null ? null : stop.getLat(),
                            stop == null ? null : stop.getLon()
                    ));
        }

        // sortedCopyOf is a stable sort, so stop_times rows sharing a stop_sequence keep their file order.
        return rowsByTrip.entrySet()
                .stream()
                .map(e -> {
                    final TripRow trip = tripsById.get(e.getKey());
                    return new TripStops(
                            e.getKey(),
                            trip == null ? null : trip.getRouteId(),
                            ImmutableList.sortedCopyOf(VISIT_ORDER, e.getValue())
                    );
                })
                .sorted(TRIP_ORDER)
                .collect(toImmutableList());
    }

    private static <T> ImmutableMap<String, T> index(List<T> rows, Function<T, String> idOf) {
        return rows.stream().collect(toImmutableMap(idOf, Function.identity(), (first, later) -> first));
    }
}
