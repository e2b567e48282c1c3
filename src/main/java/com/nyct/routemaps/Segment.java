package com.nyct.routemaps;

import com.google.common.collect.ImmutableList;
import lombok.Value;

/**
 * The full ordered sequence of stop_ids one trip visits. Two trips share a segment exactly when they visit the same
 * stops in the same order, whatever their routes.
 */
@Value
public class Segment {
    ImmutableList<String> stopIds;

    public static Segment of(String... stopIds) {
        return new Segment(ImmutableList.copyOf(stopIds));
    }

    public int size() {
        return stopIds.size();
    }
}
