package com.processlens.core.ingest;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads the first sheet of an {@code .xls} or {@code .xlsx} workbook into a
 * {@link SourceTable}.
 *
 * <p>
 * The first non-blank row is the header and its first column is the time
 * column. Cells are turned into the same text a CSV export would hold:
 * date-formatted numbers become ISO timestamps, whole numbers lose their
 * fraction, formulas contribute their cached result and error cells are
 * treated as missing.
 * </p>
 *
 * @since 1.0.0
 */
public class SpreadsheetSourceReader implements SourceReader {

    private static final Logger LOG = LoggerFactory.getLogger(SpreadsheetSourceReader.class);

    /** Largest magnitude written without an exponent or fraction. */
    private static final double WHOLE_NUMBER_LIMIT = 1e15;

    /**
     * @param path workbook file name
     * @return {@code true} for {@code .xls} and {@code .xlsx} files
     */
    public static boolean supports(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".xlsx") || name.endsWith(".xls");
    }

    @Override
    public SourceTable read(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        String origin = path.toString();

        List<String> header = new ArrayList<>();
        List<List<String>> rows = new ArrayList<>();
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            if (workbook.getNumberOfSheets() == 0) {
                LOG.debug("Workbook {} has no sheet", origin);
                return new SourceTable(SourceReader.sourceIdOf(path), origin, header, rows);
            }
            Sheet sheet = workbook.getSheetAt(0);
            for (Row row : sheet) {
                List<String> cells = cellsOf(row);
                if (cells.isEmpty()) {
                    continue;
                }
                if (header.isEmpty()) {
                    header.addAll(cells);
                } else {
                    rows.add(cells);
                }
            }
            LOG.debug("Read {} row(s) x {} column(s) from sheet '{}' of {}",
                    rows.size(), header.size(), sheet.getSheetName(), origin);
        } catch (RuntimeException e) {
            // POI reports corrupt or unsupported content with unchecked exceptions
            throw new IOException("not a readable workbook: " + e.getMessage(), e);
        }
        return new SourceTable(SourceReader.sourceIdOf(path), origin, header, rows);
    }

    /**
     * @return cell text up to the last non-blank cell; empty for a blank row
     */
    private static List<String> cellsOf(Row row) {
        int last = row.getLastCellNum();
        if (last <= 0) {
            return Collections.emptyList();
        }
        List<String> cells = new ArrayList<>(last);
        int lastFilled = -1;
        for (int c = 0; c < last; c++) {
            Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            String text = cell == null ? "" : textOf(cell);
            cells.add(text);
            if (!text.isBlank()) {
                lastFilled = c;
            }
        }
        return cells.subList(0, lastFilled + 1);
    }

    static String textOf(Cell cell) {
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        return switch (type) {
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? cell.getLocalDateTimeCellValue().toString()
                    : numberText(cell.getNumericCellValue());
            case STRING -> cell.getStringCellValue();
            case BOOLEAN -> Boolean.toString(cell.getBooleanCellValue());
            default -> "";
        };
    }

    static String numberText(double value) {
        if (value == Math.rint(value) && Math.abs(value) < WHOLE_NUMBER_LIMIT) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
