package com.nyct.routemaps;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;

@UtilityClass
public class SegmentCountsWriter {

    private final CsvMapper MAPPER = new CsvMapper();

    public void write(SegmentCounts counts, Path outputFile) throws IOException {
        final List<SegmentCountEntry> entries = counts.mostFrequentFirst()
                .stream()
                .map(e -> new SegmentCountEntry(
                        e.getValue(),
                        e.getKey().size(),
                        String.join(" ", e.getKey().getStopIds())
                ))
                .collect(toImmutableList());

        final CsvSchema schema = MAPPER.schemaFor(SegmentCountEntry.class).withHeader();
        final ObjectWriter writer = MAPPER.writerFor(SegmentCountEntry.class).with(schema);

        try (final SequenceWriter sequenceWriter = writer.writeValues(outputFile.toFile())) {
            sequenceWriter.writeAll(entries);
        }
    }
}
