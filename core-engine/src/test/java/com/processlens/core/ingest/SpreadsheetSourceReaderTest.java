package com.processlens.core.ingest;

import com.processlens.core.model.Dataset;
import com.processlens.core.model.ErrorKind;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SpreadsheetSourceReader}, mostly through
 * {@link DatasetLoader} so the workbook path is covered end to end.
 */
class SpreadsheetSourceReaderTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 1, 0, 0);

    @TempDir
    Path dir;

    private final DatasetLoader loader = new DatasetLoader();

    @Test
    @DisplayName("Should load an xlsx workbook with date-formatted time cells and formulas")
    void shouldLoadXlsx() throws IOException {
        Path file = dir.resolve("plant.xlsx");
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("data");
            header(sheet, "time", "Flow (m3/h)", "Doubled");
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd hh:mm:ss"));
            for (int i = 0; i < 3; i++) {
                Row row = sheet.createRow(i + 1);
                Cell time = row.createCell(0);
                time.setCellValue(T0.plusSeconds(i));
                time.setCellStyle(dateStyle);
                row.createCell(1).setCellValue(1.5 + i);
                row.createCell(2).setCellFormula("B" + (i + 2) + "*2");
            }
            workbook.getCreationHelper().createFormulaEvaluator().evaluateAll();
            save(workbook, file);
        }

        IngestResult result = loader.load(List.of(file));
        Dataset dataset = result.getDataset();

        assertThat(result.hasErrors()).isFalse();
        assertThat(dataset.getSeriesNames()).containsExactly("plant_Flow (m3/h)", "plant_Doubled");
        assertThat(dataset.getIndex()).containsExactly(T0, T0.plusSeconds(1), T0.plusSeconds(2));
        assertThat(dataset.getValues("plant_Flow (m3/h)")).containsExactly(1.5, 2.5, 3.5);
        assertThat(dataset.getValues("plant_Doubled")).containsExactly(3.0, 5.0, 7.0);
        assertThat(dataset.getInfo("plant_Flow (m3/h)").getUnits()).isEqualTo("m3/h");
    }

    @Test
    @DisplayName("Should load an xls workbook with text timestamps, gaps and a text column")
    void shouldLoadXls() throws IOException {
        Path file = dir.resolve("legacy.xls");
        try (Workbook workbook = new HSSFWorkbook()) {
            Sheet sheet = workbook.createSheet();
            header(sheet, "time", "mode", "level");
            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue("2024-01-01 00:00:00");
            first.createCell(1).setCellValue("AUTO");
            first.createCell(2).setCellValue(4);
            // row 2 left blank
            Row second = sheet.createRow(3);
            second.createCell(0).setCellValue("2024-01-01 00:00:05");
            second.createCell(1).setCellValue("MANUAL");
            save(workbook, file);
        }

        IngestResult result = loader.load(List.of(file));
        Dataset dataset = result.getDataset();

        assertThat(dataset.getSeriesNames()).containsExactly("legacy_level");
        assertThat(dataset.getIndex()).containsExactly(T0, T0.plusSeconds(5));
        assertThat(dataset.getValues("legacy_level")[0]).isEqualTo(4.0);
        assertThat(dataset.getValues("legacy_level")[1]).isNaN();
        assertThat(result.getNotes()).anyMatch(n -> n.contains("non-numeric column 'mode'"));
    }

    @Test
    @DisplayName("Should align a workbook with a CSV source on the shared time axis")
    void shouldMixWorkbookAndCsv() throws IOException {
        Path workbookFile = dir.resolve("a.xlsx");
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet();
            header(sheet, "time", "x");
            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue("2024-01-01T00:00:00");
            row.createCell(1).setCellValue(1);
            save(workbook, workbookFile);
        }
        Path csv = dir.resolve("b.csv");
        Files.writeString(csv, "time,y\n2024-01-01T00:00:01,2\n");

        Dataset dataset = loader.load(List.of(workbookFile, csv)).getDataset();

        assertThat(dataset.getSeriesNames()).containsExactly("a_x", "b_y");
        assertThat(dataset.getIndex()).containsExactly(T0, T0.plusSeconds(1));
        assertThat(dataset.getValues("a_x")[1]).isNaN();
    }

    @Test
    @DisplayName("Should report a corrupt workbook and keep loading the other files")
    void shouldReportCorruptWorkbook() throws IOException {
        Path broken = dir.resolve("broken.xlsx");
        Files.writeString(broken, "this is not a workbook");
        Path good = dir.resolve("good.csv");
        Files.writeString(good, "time,v\n2024-01-01T00:00:00,1\n");

        IngestResult result = loader.load(List.of(broken, good));

        assertThat(result.getDataset().getSeriesNames()).containsExactly("good_v");
        assertThat(result.getErrors()).singleElement()
                .satisfies(e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.INGESTION);
                    assertThat(e.getSubject()).isEqualTo(broken.toString());
                });
    }

    @Test
    @DisplayName("Should pick the workbook reader by file extension")
    void shouldRecognizeWorkbookExtensions() {
        assertThat(SpreadsheetSourceReader.supports(Path.of("data/Plant.XLSX"))).isTrue();
        assertThat(SpreadsheetSourceReader.supports(Path.of("plant.xls"))).isTrue();
        assertThat(SpreadsheetSourceReader.supports(Path.of("plant.csv"))).isFalse();
        assertThat(SpreadsheetSourceReader.supports(Path.of("xlsx"))).isFalse();
    }

    @Test
    @DisplayName("Should write whole numbers without a fraction")
    void shouldFormatNumbers() {
        assertThat(SpreadsheetSourceReader.numberText(1_704_067_200)).isEqualTo("1704067200");
        assertThat(SpreadsheetSourceReader.numberText(-3)).isEqualTo("-3");
        assertThat(SpreadsheetSourceReader.numberText(2.5)).isEqualTo("2.5");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static void header(Sheet sheet, String... names) {
        Row row = sheet.createRow(0);
        for (int c = 0; c < names.length; c++) {
            row.createCell(c).setCellValue(names[c]);
        }
    }

    private static void save(Workbook workbook, Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            workbook.write(out);
        }
    }
}
