package com.nyct.routemaps;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;

/**
 * Counts how many trips of a feed visit each distinct stop sequence.
 */
public class SegmentAggregator {
    private final TripStopResolver resolver;

    public SegmentAggregator(TripStopResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @return the feed's segment counts, or empty counts if the feed lacks trips, stop_times or routes (the missing
     * table is reported to {@code diagnostics}).
     */
    public SegmentCounts aggregate(Feed feed, FeedDiagnostics diagnostics) {
        final SegmentCounts counts;
        try {
            counts = aggregate(resolver.resolveStopSequences(feed));
        } catch (MissingTableException e) {
            diagnostics.report(e.getDiagnosticType(), e.getTable(), "Segments cannot be counted. " + e.getMessage());
            return SegmentCounts.empty();
        }

        diagnostics.report(DiagnosticType.SEGMENTS_COUNTED, String.format("%d distinct segments across %d trips.",
                counts.getDistinctSegments(), counts.getTotalTrips()));
        return counts;
    }

    public static SegmentCounts aggregate(Iterable<TripStops> trips) {
        final Multiset<Segment> segments = HashMultiset.create();
        for (TripStops trip : trips) {
            segments.add(new Segment(trip.getStopIds()));
        }
        return SegmentCounts.of(segments);
    }
}
