package com.nyct.routemaps;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.nyct.routemaps.TestFeeds.writeSimpleFeed;
import static com.nyct.routemaps.TestFeeds.writeTable;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

class FeedLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsEveryRowOfWellFormedFeed() throws IOException {
        final Path directory = writeSimpleFeed(tempDir, "simple");
        final FeedDiagnostics diagnostics = new FeedDiagnostics("simple");

        final Feed feed = new FeedLoader().load(directory, diagnostics);

        assertThat(feed.isComplete(), is(true));
        assertThat(feed.getTrips().getRows(), hasSize(3));
        assertThat(feed.getStopTimes().getRows(), hasSize(8));
        assertThat(feed.getRoutes().getRows(), hasSize(2));
        assertThat(feed.getStops().getRows(), hasSize(3));
        assertThat(feed.getTrips().getRows().get(0), equalTo(new TripRow("T1", "R1")));
        assertThat(feed.getStopTimes().getRows().get(3), equalTo(new StopTimeRow("T2", "S3", 3)));
        assertThat(feed.getStops().getRows().get(1), equalTo(new StopRow("S2", 37.1, -122.1)));
        assertThat(diagnostics.getDiagnostics(), empty());
    }

    @Test
    void skipsMalformedRowsAndKeepsTheRest() throws IOException {
        final Path directory = writeSimpleFeed(tempDir, "malformed");
        writeTable(directory, "stop_times.txt",
                "trip_id,stop_id,stop_sequence",
                "T1,S1,1",
                "T1,S2",
                "T1,S3,third",
                ",S4,4",
                "T1,S5,5,extra",
                "T1,S6,6");
        final FeedDiagnostics diagnostics = new FeedDiagnostics("malformed");

        final Feed feed = new FeedLoader().load(directory, diagnostics);

        assertThat(feed.getStopTimes().getRows(), contains(
                new StopTimeRow("T1", "S1", 1),
                new StopTimeRow("T1", "S6", 6)
        ));
        assertThat(diagnostics.ofType(DiagnosticType.ROW_PARSE), hasSize(4));
        assertThat(diagnostics.ofType(DiagnosticType.ROW_PARSE).get(0).getLine(), equalTo(3L));
        assertThat(diagnostics.ofType(DiagnosticType.ROW_PARSE).get(0).getTable(), equalTo(GtfsTable.STOP_TIMES));
        assertThat(feed.isComplete(), is(true));
    }

    @Test
    void reportsMissingFileAndIncompleteFeed() throws IOException {
        final Path directory = writeSimpleFeed(tempDir, "noroutes");
        Files.delete(directory.resolve("routes.txt"));
        final FeedDiagnostics diagnostics = new FeedDiagnostics("noroutes");

        final Feed feed = new FeedLoader().load(directory, diagnostics);

        assertThat(feed.getRoutes(), nullValue());
        assertThat(feed.getTrips(), notNullValue());
        assertThat(feed.isComplete(), is(false));
        assertThat(feed.isEmpty(), is(false));
        assertThat(feed.getMissingTables(), contains(GtfsTable.ROUTES));
        assertThat(diagnostics.ofType(DiagnosticType.MISSING_FILE).get(0).getTable(), equalTo(GtfsTable.ROUTES));
        assertThat(diagnostics.has(DiagnosticType.INCOMPLETE_FEED), is(true));
    }

    @Test
    void omitsTableMissingRequiredColumn() throws IOException {
        final Path directory = writeSimpleFeed(tempDir, "nosequence");
        writeTable(directory, "stop_times.txt",
                "trip_id,stop_id",
                "T1,S1");
        final FeedDiagnostics diagnostics = new FeedDiagnostics("nosequence");

        final Feed feed = new FeedLoader().load(directory, diagnostics);

        assertThat(feed.getStopTimes(), nullValue());
        assertThat(diagnostics.ofType(DiagnosticType.MISSING_COLUMN).get(0).getTable(), equalTo(GtfsTable.STOP_TIMES));
    }

    @Test
    void keepsStopsWithUnusableCoordinates() throws IOException {
        final Path directory = writeSimpleFeed(tempDir, "badcoords");
        writeTable(directory, "stops.txt",
                "stop_id,stop_lat,stop_lon",
                "S1,north,-122.0",
                "S2,,",
                "S3,37.2,-122.2");
        final FeedDiagnostics diagnostics = new FeedDiagnostics("badcoords");

        final Feed feed = new FeedLoader().load(directory, diagnostics);

        assertThat(feed.getStops().getRows(), contains(
                new StopRow("S1", null, -122.0),
                new StopRow("S2", null, null),
                new StopRow("S3", 37.2, -122.2)
        ));
        assertThat(diagnostics.has(DiagnosticType.ROW_PARSE), is(false));
    }

    @Test
    void stopsWithoutCoordinateColumnsStillLoad() throws IOException {
        final Path directory = writeSimpleFeed(tempDir, "nocoords");
        writeTable(directory, "stops.txt",
                "stop_id,stop_name",
                "S1,First Street");

        final Feed feed = TestFeeds.load(directory);

        assertThat(feed.getStops().getRows(), hasSize(1));
        assertThat(feed.getStops().hasColumn("stop_lat"), is(false));
    }

    @Test
    void keepsFirstRowOfDuplicateId() throws IOException {
        final Path directory = writeSimpleFeed(tempDir, "duplicates");
        writeTable(directory, "trips.txt",
                "trip_id,route_id",
                "T1,R1",
                "T1,R2");
        final FeedDiagnostics diagnostics = new FeedDiagnostics("duplicates");

        final Feed feed = new FeedLoader().load(directory, diagnostics);

        assertThat(feed.getTrips().getRows(), contains(new TripRow("T1", "R1")));
        assertThat(diagnostics.ofType(DiagnosticType.DUPLICATE_ID), hasSize(1));
    }

    @Test
    void readsHeaderWithByteOrderMarkAndPadding() throws IOException {
        final Path directory = writeSimpleFeed(tempDir, "bom");
        Files.write(directory.resolve("routes.txt"),
                "\uFEFFroute_id, route_type\n R1 ,3\n".getBytes(StandardCharsets.UTF_8));

        final Feed feed = TestFeeds.load(directory);

        assertThat(feed.getRoutes().getRows(), contains(new RouteRow("R1")));
        assertThat(feed.getRoutes().hasColumn("route_type"), is(true));
    }

    @Test
    void emptyFileIsOmitted() throws IOException {
        final Path directory = writeSimpleFeed(tempDir, "emptyfile");
        Files.write(directory.resolve("trips.txt"), new byte[0]);
        final FeedDiagnostics diagnostics = new FeedDiagnostics("emptyfile");

        final Feed feed = new FeedLoader().load(directory, diagnostics);

        assertThat(feed.getTrips(), nullValue());
        assertThat(diagnostics.has(DiagnosticType.TABLE_UNREADABLE), is(true));
    }

    @Test
    void missingDirectoryGivesEmptyFeed() {
        final FeedDiagnostics diagnostics = new FeedDiagnostics("nowhere");

        final Feed feed = new FeedLoader().load(tempDir.resolve("nowhere"), diagnostics);

        assertThat(feed.isEmpty(), is(true));
        assertThat(diagnostics.has(DiagnosticType.MISSING_DIRECTORY), is(true));
    }
}
