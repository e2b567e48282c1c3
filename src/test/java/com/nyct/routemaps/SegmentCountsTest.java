package com.nyct.routemaps;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;

class SegmentCountsTest {

    @TempDir
    Path tempDir;

    private static SegmentCounts counts() {
        final Multiset<Segment> segments = HashMultiset.create();
        segments.add(Segment.of("S10", "S2"));
        segments.add(Segment.of("S1", "S2", "S3"), 3);
        segments.add(Segment.of("S9", "S2"));
        return SegmentCounts.of(segments);
    }

    @Test
    void listsMostFrequentSegmentFirst() {
        final SegmentCounts counts = counts();

        assertThat(counts.mostFrequentFirst().get(0).getKey(), equalTo(Segment.of("S1", "S2", "S3")));
        assertThat(counts.mostFrequentFirst().get(1).getKey(), equalTo(Segment.of("S9", "S2")));
        assertThat(counts.mostFrequentFirst().get(2).getKey(), equalTo(Segment.of("S10", "S2")));
    }

    @Test
    void unknownSegmentCountsZero() {
        assertThat(counts().count(Segment.of("S2", "S1")), equalTo(0));
        assertThat(SegmentCounts.empty().getTotalTrips(), equalTo(0));
    }

    @Test
    void writesCsvReport() throws IOException {
        final Path file = tempDir.resolve("segment_counts.csv");

        SegmentCountsWriter.write(counts(), file);

        // Whether the space separated ids get quoted is up to the CSV encoder.
        final List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8)
                .stream()
                .map(line -> line.replace("\"", ""))
                .collect(Collectors.toList());

        assertThat(lines, contains(
                "trip_count,stop_count,stop_ids",
                "3,3,S1 S2 S3",
                "1,2,S9 S2",
                "1,2,S10 S2"
        ));
    }
}
