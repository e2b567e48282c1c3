package com.nyct.routemaps;

import com.google.common.collect.ImmutableList;
import lombok.Value;

import static com.google.common.collect.ImmutableList.toImmutableList;

/**
 * The stops visited by one trip, in ascending stop_sequence order.
 */
@Value
public class TripStops {
    String tripId;
    String routeId;
    ImmutableList<TripStopRow> rows;

    public ImmutableList<String> getStopIds() {
        return rows.stream()
                .map(TripStopRow::getStopId)
                .collect(toImmutableList());
    }

    /**
     * @return the coordinates of the visited stops in order, leaving out stops without coordinates.
     */
    public ImmutableList<LatLon> getCoordinates() {
        return rows.stream()
                .filter(TripStopRow::hasCoordinates)
                .map(r -> new LatLon(r.getLat(), r.getLon()))
                .collect(toImmutableList());
    }
}
