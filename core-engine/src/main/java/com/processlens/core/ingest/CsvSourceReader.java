package com.processlens.core.ingest;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reads a CSV file into a {@link SourceTable}.
 *
 * <p>
 * The first record is the header; the first column is the time column. A
 * leading UTF-8 byte-order mark is removed from the first header cell.
 * </p>
 *
 * @since 1.0.0
 */
public class CsvSourceReader implements SourceReader {

    private static final Logger LOG = LoggerFactory.getLogger(CsvSourceReader.class);

    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    @Override
    public SourceTable read(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(SourceReader.sourceIdOf(path), path.toString(), reader);
        }
    }

    /**
     * @param sourceId prefix for the source's series
     * @param origin   description used in messages
     * @param reader   CSV content; closed once fully read
     * @return the raw table (possibly empty)
     * @throws IOException if the content is not valid CSV
     */
    public SourceTable read(String sourceId, String origin, Reader reader) throws IOException {
        List<String> header = new ArrayList<>();
        List<List<String>> rows = new ArrayList<>();

        try (MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(reader)) {
            while (it.hasNextValue()) {
                String[] record = it.nextValue();
                if (header.isEmpty()) {
                    header.addAll(Arrays.asList(record));
                    if (!header.isEmpty() && header.get(0).startsWith("\uFEFF")) {
                        header.set(0, header.get(0).substring(1));
                    }
                } else {
                    rows.add(Arrays.asList(record));
                }
            }
        }

        LOG.debug("Read {} row(s) x {} column(s) from {}", rows.size(), header.size(), origin);
        return new SourceTable(sourceId, origin, header, rows);
    }
}
