package com.nyct.routemaps;

import lombok.Value;

/**
 * A stop_times row joined with its trip, and with its stop when coordinates were asked for. Any side of the join
 * that did not match leaves its fields null.
 */
@Value
public class TripStopRow {
    String tripId;
    int stopSequence;
    String stopId;
    String routeId;
    Double lat;
    Double lon;

    public boolean hasCoordinates() {
        return lat != null && lon != null;
    }
}
