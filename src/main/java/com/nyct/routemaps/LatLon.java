package com.nyct.routemaps;

import lombok.Value;

@Value
public class LatLon {
    double lat;
    double lon;
}
