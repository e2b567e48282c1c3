package com.nyct.routemaps;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Draws every trip of a feed as a line through its stops, on a map centered on the mean position of the feed's stops.
 */
public class RouteRenderer {
    public static final int DEFAULT_ZOOM = 12;

    private final TripStopResolver resolver;

    /** Creates the canvas for a feed, given the feed's name. */
    private final Function<String, ? extends MapCanvas> canvasFactory;

    public RouteRenderer(TripStopResolver resolver, Function<String, ? extends MapCanvas> canvasFactory) {
        this.resolver = resolver;
        this.canvasFactory = canvasFactory;
    }

    /**
     * @return the drawn map, or empty if the feed lacks what a map needs (the reason is reported to
     * {@code diagnostics}). A map with no lines at all is still returned.
     */
    public Optional<MapCanvas> render(Feed feed, FeedDiagnostics diagnostics) {
        final ImmutableList<TripStops> trips;
        try {
            feed.require(GtfsTable.STOPS);
            feed.getStops().requireColumns("stop_lat", "stop_lon");
            trips = resolver.resolveStopLocations(feed);
        } catch (FeedException e) {
            diagnostics.report(e.getDiagnosticType(), e.getTable(), "Cannot plot routes. " + e.getMessage());
            return Optional.empty();
        }

        final Optional<LatLon> center = centroid(feed.getStops().getRows());
        if (center.isEmpty()) {
            diagnostics.report(DiagnosticType.NO_STOP_COORDINATES, GtfsTable.STOPS, null);
            return Optional.empty();
        }

        final MapCanvas canvas = canvasFactory.apply(feed.getName());
        canvas.setCenter(center.get().getLat(), center.get().getLon(), DEFAULT_ZOOM);

        for (TripStops trip : trips) {
            final ImmutableList<LatLon> points = trip.getCoordinates();
            if (points.isEmpty()) {
                diagnostics.report(DiagnosticType.EMPTY_COORDINATES, String.format("Skipping trip %s.", trip.getTripId()));
                continue;
            }
            canvas.addPolyline(points);
        }

        return Optional.of(canvas);
    }

    /**
     * @return the unweighted mean position of the stops that have both coordinates, or empty if none does.
     */
    static Optional<LatLon> centroid(List<StopRow> stops) {
        double latSum = 0;
        double lonSum = 0;
        int count = 0;
        for (StopRow stop : stops) {
            if (stop.hasCoordinates()) {
                latSum += stop.getLat();
                lonSum += stop.getLon();
                count++;
            }
        }
        return count == 0 ? Optional.empty() : Optional.of(new LatLon(latSum / count, lonSum / count));
    }
}
