package com.nyct.routemaps;

import lombok.Value;

@Value
public class TripRow {
    String tripId;
    /** May be null; trips without a route still take part in segment counting. */
    String routeId;

    static TripRow parse(TableRecord record) throws RowParseException {
        return new TripRow(record.require("trip_id"), record.get("route_id"));
    }
}
