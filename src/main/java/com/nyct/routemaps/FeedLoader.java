package com.nyct.routemaps;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.nyct.routemaps.DiagnosticType.*;

/**
 * Reads the four required GTFS tables of a feed directory. Problems are reported to the feed's diagnostics and never
 * thrown: a missing or unusable file leaves its table out of the {@link Feed}, a malformed row is skipped.
 */
public class FeedLoader {
    private static final Logger LOG = LoggerFactory.getLogger(FeedLoader.class);

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private static final ObjectReader CSV_READER = new CsvMapper()
            .readerFor(String[].class)
            .with(CsvParser.Feature.WRAP_AS_ARRAY)
            .with(CsvParser.Feature.SKIP_EMPTY_LINES);

    public Feed load(Path directory, FeedDiagnostics diagnostics) {
        if (!Files.isDirectory(directory)) {
            diagnostics.report(MISSING_DIRECTORY, directory.toString());
            return new Feed(directory, null, null, null, null);
        }

        final Feed feed = new Feed(
                directory,
                loadTable(directory, GtfsTable.TRIPS, TripRow::parse, TripRow::getTripId, diagnostics),
                loadTable(directory, GtfsTable.STOP_TIMES, StopTimeRow::parse, null, diagnostics),
                loadTable(directory, GtfsTable.ROUTES, RouteRow::parse, RouteRow::getRouteId, diagnostics),
                loadTable(directory, GtfsTable.STOPS, StopRow::parse, StopRow::getStopId, diagnostics)
        );

        if (!feed.isComplete()) {
            diagnostics.report(INCOMPLETE_FEED, feed.getMissingTables()
                    .stream()
                    .map(GtfsTable::getFileName)
                    .collect(Collectors.joining(", ", "Missing: ", ".")));
        }

        return feed;
    }

    /**
     * @param idOf extracts the primary key of a row, or null when the table has no key of its own.
     * @return the loaded table, or null if the file is absent, unreadable or lacks a required column.
     */
    <T> LoadedTable<T> loadTable(Path directory,
                                 GtfsTable table,
                                 RowParser<T> parser,
                                 Function<T, String> idOf,
                                 FeedDiagnostics diagnostics) {
        final Path file = directory.resolve(table.getFileName());
        if (!Files.isRegularFile(file)) {
            diagnostics.report(MISSING_FILE, table, "Not found in " + directory + ".");
            return null;
        }

        try (final MappingIterator<String[]> it = CSV_READER.readValues(file.toFile())) {
            if (!it.hasNextValue()) {
                diagnostics.report(TABLE_UNREADABLE, table, 1, "File is empty.");
                return null;
            }
            final String[] header = it.nextValue();
            final ImmutableMap<String, Integer> columnIndex = indexColumns(header);

            for (String column : table.getRequiredColumns()) {
                if (!columnIndex.containsKey(column)) {
                    diagnostics.report(MISSING_COLUMN, table, String.format("Column '%s' is required.", column));
                    return null;
                }
            }

            final ImmutableList.Builder<T> rows = ImmutableList.builder();
            final Set<String> seenIds = new HashSet<>();
            long line = 1;
            int rowCount = 0;

            while (true) {
                final String[] values;
                try {
                    if (!it.hasNextValue()) {
                        break;
                    }
                    values = it.nextValue();
                } catch (IOException e) {
                    diagnostics.report(TABLE_UNREADABLE, table, line + 1, firstLine(e.getMessage()));
                    break;
                }
                line++;

                if (values.length != header.length) {
                    diagnostics.report(ROW_PARSE, table, line,
                            String.format("Expected %d fields but found %d.", header.length, values.length));
                    continue;
                }

                final T row;
                try {
                    row = parser.parse(new TableRecord(columnIndex, values));
                } catch (RowParseException e) {
                    diagnostics.report(ROW_PARSE, table, line, e.getMessage());
                    continue;
                }

                if (idOf != null && !seenIds.add(idOf.apply(row))) {
                    diagnostics.report(DUPLICATE_ID, table, line, String.format("ID '%s'.", idOf.apply(row)));
                    continue;
                }

                rows.add(row);
                rowCount++;
            }

            LOG.debug("Loaded {} rows from {}", rowCount, file);
            return new LoadedTable<>(table, ImmutableSet.copyOf(columnIndex.keySet()), rows.build());
        } catch (IOException e) {
            diagnostics.report(TABLE_UNREADABLE, table, firstLine(e.getMessage()));
            return null;
        }
    }

    private static ImmutableMap<String, Integer> indexColumns(String[] header) {
        final Map<String, Integer> columnIndex = new LinkedHashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = StringUtils.trimToEmpty(header[i]);
            if (i == 0) {
                name = StringUtils.removeStart(name, BYTE_ORDER_MARK);
            }
            columnIndex.putIfAbsent(name, i);
        }
        return ImmutableMap.copyOf(columnIndex);
    }

    private static String firstLine(String message) {
        return StringUtils.substringBefore(message, "\n");
    }
}
