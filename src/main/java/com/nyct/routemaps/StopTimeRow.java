package com.nyct.routemaps;

import lombok.Value;

@Value
public class StopTimeRow {
    String tripId;
    String stopId;
    int stopSequence;

    static StopTimeRow parse(TableRecord record) throws RowParseException {
        return new StopTimeRow(
                record.require("trip_id"),
                record.require("stop_id"),
                record.requireInt("stop_sequence")
        );
    }
}
