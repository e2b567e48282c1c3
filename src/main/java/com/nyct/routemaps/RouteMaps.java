package com.nyct.routemaps;

import com.google.common.collect.ImmutableList;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "route-maps", mixinStandardHelpOptions = true, version = "1.0-SNAPSHOT",
        description = "Draw the trips of GTFS feeds on route maps and count their distinct stop sequences.")
public class RouteMaps implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "FEED_DIR", description = "Unzipped GTFS feed directories, processed in order")
    private List<Path> feedDirectories;

    @Option(names = {"--outputDir"}, defaultValue = ".", description = "Directory the maps are written to (default: ${DEFAULT-VALUE})")
    private Path outputDirectory;

    @Option(names = {"--segmentCounts"}, description = "Also write the segment counts of each feed as CSV")
    private boolean writeSegmentCounts;

    @Override
    public Integer call() {
        final ImmutableList<FeedResult> results = new FeedProcessor(outputDirectory, writeSegmentCounts)
                .processAll(feedDirectories);

        return results.stream().anyMatch(FeedResult::hasSaveFailure) ? 1 : 0;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new RouteMaps()).execute(args));
    }
}
