package com.processlens.core.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.processlens.core.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes a {@link Dataset} as a time-indexed CSV table.
 *
 * <p>
 * Header {@code time,<series...>}; ISO-8601 local timestamps; missing values
 * as empty cells. Values are written with full precision so the file can be
 * loaded again as a source and yields the same timestamps and values.
 * </p>
 *
 * @since 1.0.0
 */
public class CsvTableExporter {

    private static final Logger LOG = LoggerFactory.getLogger(CsvTableExporter.class);

    static final String TIME_COLUMN = "time";

    private final CsvMapper mapper = new CsvMapper();

    /**
     * @param table table to write
     * @param path  target file, created or replaced
     * @throws IOException if the file cannot be written
     */
    public void export(Dataset table, Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(table, writer);
        }
        LOG.info("Exported {} row(s) x {} series to {}", table.rowCount(), table.seriesCount(), path);
    }

    /**
     * @param table  table to write
     * @param writer destination; flushed, not closed
     * @throws IOException if writing fails
     */
    public void write(Dataset table, Writer writer) throws IOException {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(writer, "writer must not be null");
        List<String> names = table.getSeriesNames();

        CsvSchema.Builder schema = CsvSchema.builder().addColumn(TIME_COLUMN);
        names.forEach(schema::addColumn);

        try (SequenceWriter rows = mapper.writer(schema.build().withHeader())
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValues(writer)) {
            for (int row = 0; row < table.rowCount(); row++) {
                Map<String, String> record = new LinkedHashMap<>();
                record.put(TIME_COLUMN, DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(table.getIndex().get(row)));
                for (String name : names) {
                    double v = table.valueAt(name, row);
                    record.put(name, Double.isNaN(v) ? "" : Double.toString(v));
                }
                rows.write(record);
            }
        }
        writer.flush();
    }
}
