package com.nyct.routemaps;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static com.google.common.collect.ImmutableList.toImmutableList;

/**
 * Runs every feed directory through loading, segment counting and rendering, one after the other. Whatever goes
 * wrong with one feed is reported on that feed's result and the next feed is processed regardless.
 */
public class FeedProcessor {
    private static final Logger LOG = LoggerFactory.getLogger(FeedProcessor.class);

    private final FeedLoader loader = new FeedLoader();
    private final SegmentAggregator aggregator;
    private final RouteRenderer renderer;

    private final Path outputDirectory;
    private final boolean writeSegmentCounts;

    public FeedProcessor(Path outputDirectory, boolean writeSegmentCounts) {
        this(outputDirectory, writeSegmentCounts, LeafletMapCanvas::new);
    }

    public FeedProcessor(Path outputDirectory,
                         boolean writeSegmentCounts,
                         Function<String, ? extends MapCanvas> canvasFactory) {
        final TripStopResolver resolver = new TripStopResolver();
        this.aggregator = new SegmentAggregator(resolver);
        this.renderer = new RouteRenderer(resolver, canvasFactory);
        this.outputDirectory = outputDirectory;
        this.writeSegmentCounts = writeSegmentCounts;
    }

    public ImmutableList<FeedResult> processAll(List<Path> directories) {
        return directories.stream()
                .map(this::process)
                .collect(toImmutableList());
    }

    public FeedResult process(Path directory) {
        LOG.info("Processing GTFS feed in directory {}...", directory);
        final FeedDiagnostics diagnostics = new FeedDiagnostics(Feed.nameOf(directory));
        try {
            return process(directory, diagnostics);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure while processing {}", directory, e);
            diagnostics.report(DiagnosticType.FEED_FAILED, e.toString());
            return new FeedResult(directory, SegmentCounts.empty(), null, null, diagnostics.getDiagnostics());
        }
    }

    private FeedResult process(Path directory, FeedDiagnostics diagnostics) {
        final Feed feed = loader.load(directory, diagnostics);
        if (feed.isEmpty()) {
            diagnostics.report(DiagnosticType.EMPTY_FEED, String.format("Skipping %s.", directory));
            return new FeedResult(directory, SegmentCounts.empty(), null, null, diagnostics.getDiagnostics());
        }

        final SegmentCounts segmentCounts = aggregator.aggregate(feed, diagnostics);
        Path segmentCountsFile = null;
        if (writeSegmentCounts && !segmentCounts.isEmpty()) {
            final Path target = outputDirectory.resolve(String.format("segment_counts_%s.csv", feed.getName()));
            try {
                Files.createDirectories(outputDirectory);
                SegmentCountsWriter.write(segmentCounts, target);
                segmentCountsFile = target;
                diagnostics.report(DiagnosticType.SEGMENTS_SAVED, String.format("Saved as '%s'.", target));
            } catch (IOException e) {
                diagnostics.report(DiagnosticType.SAVE_FAILED, String.format("%s: %s", target, e));
            }
        }

        final Optional<MapCanvas> map = renderer.render(feed, diagnostics);
        Path mapFile = null;
        if (map.isPresent()) {
            final MapCanvas canvas = map.get();
            final Path target = outputDirectory.resolve(
                    String.format("routes_map_%s.%s", feed.getName(), canvas.getFileExtension()));
            try {
                Files.createDirectories(outputDirectory);
                canvas.save(target);
                mapFile = target;
                diagnostics.report(DiagnosticType.MAP_SAVED, String.format("Map saved as '%s'.", target));
            } catch (IOException e) {
                diagnostics.report(DiagnosticType.SAVE_FAILED, String.format("%s: %s", target, e));
            }
        } else {
            LOG.warn("Failed to generate map for {}.", directory);
        }

        return new FeedResult(directory, segmentCounts, mapFile, segmentCountsFile, diagnostics.getDiagnostics());
    }
}
