package com.nyct.routemaps;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies.SnakeCaseStrategy;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

@Value
@JsonNaming(SnakeCaseStrategy.class)
@JsonPropertyOrder({"tripCount", "stopCount", "stopIds"})
public class SegmentCountEntry {
    int tripCount;
    int stopCount;
    /** Space separated. */
    String stopIds;
}
