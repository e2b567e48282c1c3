package com.nyct.routemaps;

import lombok.Value;

@Value
public class StopRow {
    String stopId;
    Double lat;
    Double lon;

    public boolean hasCoordinates() {
        return lat != null && lon != null;
    }

    static StopRow parse(TableRecord record) throws RowParseException {
        return new StopRow(record.require("stop_id"), record.getDouble("stop_lat"), record.getDouble("stop_lon"));
    }
}
