package com.nyct.routemaps;

import lombok.Value;

@Value
public class RouteRow {
    String routeId;

    static RouteRow parse(TableRecord record) throws RowParseException {
        return new RouteRow(record.require("route_id"));
    }
}
