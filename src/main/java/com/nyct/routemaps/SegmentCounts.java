package com.nyct.routemaps;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import se.sawano.java.text.AlphanumericComparator;

import java.util.Comparator;
import java.util.Map;

import static com.google.common.collect.ImmutableList.toImmutableList;

/**
 * How many trips of a feed visit each distinct {@link Segment}.
 */
@EqualsAndHashCode
@ToString
public final class SegmentCounts {
    private static final SegmentCounts EMPTY = new SegmentCounts(ImmutableMap.of());

    private final ImmutableMap<Segment, Integer> counts;

    private SegmentCounts(ImmutableMap<Segment, Integer> counts) {
        this.counts = counts;
    }

    public static SegmentCounts empty() {
        return EMPTY;
    }

    static SegmentCounts of(Multiset<Segment> segments) {
        final ImmutableMap.Builder<Segment, Integer> builder = ImmutableMap.builder();
        for (Multiset.Entry<Segment> entry : segments.entrySet()) {
            builder.put(entry.getElement(), entry.getCount());
        }
        return new SegmentCounts(builder.build());
    }

    public int count(Segment segment) {
        return counts.getOrDefault(segment, 0);
    }

    public int getDistinctSegments() {
        return counts.size();
    }

    public int getTotalTrips() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public ImmutableMap<Segment, Integer> asMap() {
        return counts;
    }

    /**
     * @return the segments by descending trip count, ties ordered by their stop_ids.
     */
    public ImmutableList<Map.Entry<Segment, Integer>> mostFrequentFirst() {
        final Comparator<Segment> byStops = Comparator.comparing(
                (Segment s) -> String.join(" ", s.getStopIds()),
                new AlphanumericComparator()
        );
        return counts.entrySet()
                .stream()
                .sorted(Map.Entry.<Segment, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey(byStops)))
                .collect(toImmutableList());
    }
}
