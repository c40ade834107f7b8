package com.processlens.core.ingest;

import com.processlens.core.align.DatasetAligner;
import com.processlens.core.align.SourceFrame;
import com.processlens.core.model.AnalysisError;
import com.processlens.core.model.Dataset;
import com.processlens.core.model.ErrorKind;
import com.processlens.core.model.Outcome;
import com.processlens.core.model.SeriesInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Ingests source files into a {@link Dataset} snapshot.
 *
 * <h3>Per source</h3>
 * <ol>
 * <li>Read the table, as a workbook for {@code .xls}/{@code .xlsx} files and
 * as CSV otherwise; an empty or unreadable file is skipped and reported.</li>
 * <li>Parse the first column as time; rows whose time does not parse are
 * dropped, and a file with no parseable time is skipped.</li>
 * <li>Drop placeholder columns (blank, {@code Unnamed:*}) and columns without
 * a single numeric cell.</li>
 * <li>Prefix every column with the source id.</li>
 * </ol>
 * The parsed sources are then outer-joined by {@link DatasetAligner}. A
 * failure in one file never prevents the others from loading.
 *
 * @since 1.0.0
 */
public class DatasetLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetLoader.class);

    private static final Set<String> MISSING_TOKENS = Set.of("", "nan", "na", "n/a", "null", "none", "-");

    private final SourceReader csvReader;
    private final SourceReader spreadsheetReader;

    public DatasetLoader() {
        this(new CsvSourceReader(), new SpreadsheetSourceReader());
    }

    /**
     * @param csvReader         reader for delimited text files
     * @param spreadsheetReader reader for {@code .xls} / {@code .xlsx} workbooks
     */
    public DatasetLoader(SourceReader csvReader, SourceReader spreadsheetReader) {
        this.csvReader = Objects.requireNonNull(csvReader, "csvReader must not be null");
        this.spreadsheetReader = Objects.requireNonNull(spreadsheetReader, "spreadsheetReader must not be null");
    }

    /**
     * Load files into a fresh dataset.
     *
     * @param paths files in load order
     * @return the new snapshot with per-file errors
     */
    public IngestResult load(List<Path> paths) {
        return append(Dataset.empty(), paths);
    }

    /**
     * Merge further files into an existing snapshot. {@code base} is left
     * untouched; a new dataset is returned.
     *
     * @param base  current dataset
     * @param paths files in load order
     * @return the new snapshot with per-file errors
     */
    public IngestResult append(Dataset base, List<Path> paths) {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(paths, "paths must not be null");

        List<SourceTable> tables = new ArrayList<>();
        List<AnalysisError> errors = new ArrayList<>();
        for (Path path : paths) {
            try {
                tables.add(readerFor(path).read(path));
            } catch (IOException e) {
                LOG.warn("Failed to read {}: {}", path, e.getMessage());
                errors.add(new AnalysisError(ErrorKind.INGESTION, path.toString(),
                        "cannot read file: " + e.getMessage()));
            }
        }
        return appendTables(base, tables, errors);
    }

    private SourceReader readerFor(Path path) {
        return SpreadsheetSourceReader.supports(path) ? spreadsheetReader : csvReader;
    }

    /**
     * Merge already-read tables into {@code base}.
     *
     * @param base   current dataset
     * @param tables raw tables in load order
     * @return the new snapshot with per-table errors
     */
    public IngestResult appendTables(Dataset base, List<SourceTable> tables) {
        return appendTables(base, tables, new ArrayList<>());
    }

    private IngestResult appendTables(Dataset base, List<SourceTable> tables, List<AnalysisError> errors) {
        List<SourceFrame> frames = new ArrayList<>();
        List<String> loaded = new ArrayList<>();
        List<String> notes = new ArrayList<>();

        for (SourceTable table : tables) {
            Outcome<SourceFrame> frame = toFrame(table, notes);
            if (frame.isSuccess()) {
                frames.add(frame.getValue());
                loaded.add(table.getOrigin());
                LOG.info("Loaded source '{}' from {}", table.getSourceId(), table.getOrigin());
            } else {
                LOG.warn("Skipping {}: {}", table.getOrigin(), frame.getError().getMessage());
                errors.add(frame.getError());
            }
        }

        DatasetAligner.MergeResult merged = DatasetAligner.merge(base, frames);
        for (String name : merged.getDiscarded()) {
            notes.add("Discarded duplicate series '" + name + "' (first loaded source wins)");
        }
        return new IngestResult(merged.getDataset(), loaded, errors, notes);
    }

    // ---------------------------------------------------------------
    // Table → frame
    // ---------------------------------------------------------------

    Outcome<SourceFrame> toFrame(SourceTable table, List<String> notes) {
        String origin = table.getOrigin();
        if (table.isEmpty()) {
            return Outcome.failure(ErrorKind.INGESTION, origin, "file is empty");
        }

        // time → row, first occurrence wins
        TreeMap<LocalDateTime, Integer> rowByTime = new TreeMap<>();
        int unparsed = 0;
        int duplicates = 0;
        for (int r = 0; r < table.getRows().size(); r++) {
            Optional<LocalDateTime> time = TimestampParser.parse(table.cell(r, 0));
            if (time.isEmpty()) {
                unparsed++;
                LOG.trace("{}: row {} has no parseable time", origin, r);
                continue;
            }
            if (rowByTime.putIfAbsent(time.get(), r) != null) {
                duplicates++;
            }
        }
        if (rowByTime.isEmpty()) {
            return Outcome.failure(ErrorKind.INGESTION, origin,
                    "unable to parse time column '" + table.getTimeColumn() + "'");
        }
        if (unparsed > 0) {
            notes.add(origin + ": dropped " + unparsed + " row(s) with unparseable time");
        }
        if (duplicates > 0) {
            notes.add(origin + ": kept first of " + duplicates + " duplicate timestamp(s)");
        }

        List<LocalDateTime> times = new ArrayList<>(rowByTime.keySet());
        List<Integer> rows = new ArrayList<>(rowByTime.values());
        Map<String, double[]> columns = new LinkedHashMap<>();
        Map<String, SeriesInfo> info = new LinkedHashMap<>();

        List<String> header = table.getHeader();
        for (int c = 1; c < header.size(); c++) {
            String column = header.get(c) == null ? "" : header.get(c);
            if (isPlaceholder(column)) {
                LOG.debug("{}: dropping placeholder column {}", origin, c);
                continue;
            }
            double[] values = new double[rows.size()];
            int numeric = 0;
            int text = 0;
            for (int i = 0; i < rows.size(); i++) {
                String cell = table.cell(rows.get(i), c);
                values[i] = parseValue(cell);
                if (!Double.isNaN(values[i])) {
                    numeric++;
                } else if (cell != null && !MISSING_TOKENS.contains(cell.trim().toLowerCase(Locale.ROOT))) {
                    text++;
                }
            }
            if (numeric == 0 && text > 0) {
                notes.add(origin + ": dropped non-numeric column '" + column + "'");
                continue;
            }
            String name = table.getSourceId() + "_" + column;
            if (columns.containsKey(name)) {
                notes.add(origin + ": discarded repeated column '" + column + "'");
                continue;
            }
            columns.put(name, values);
            info.put(name, new SeriesInfo(name, ShortNames.shortName(column),
                    table.getSourceId(), ShortNames.units(column)));
        }

        return Outcome.success(new SourceFrame(table.getSourceId(), times, columns, info));
    }

    static boolean isPlaceholder(String column) {
        return column.isBlank() || column.startsWith("Unnamed:");
    }

    static double parseValue(String cell) {
        if (cell == null) {
            return Double.NaN;
        }
        String text = cell.trim();
        if (MISSING_TOKENS.contains(text.toLowerCase(Locale.ROOT))) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
