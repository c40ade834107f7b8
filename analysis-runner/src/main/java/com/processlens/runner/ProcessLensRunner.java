package com.processlens.runner;

import com.processlens.core.config.AnalysisConfig;
import com.processlens.core.config.AnalysisConfigLoader;
import com.processlens.core.export.CsvTableExporter;
import com.processlens.core.ingest.DatasetLoader;
import com.processlens.core.ingest.IngestResult;
import com.processlens.core.model.Dataset;
import com.processlens.core.model.Outcome;
import com.processlens.core.report.AnalysisEngine;
import com.processlens.core.report.AnalysisKind;
import com.processlens.core.report.AnalysisReport;
import com.processlens.core.report.AnalysisRequest;
import com.processlens.core.report.PreparedSelection;
import com.processlens.core.report.ReportFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.EnumSet;
import java.util.Set;

/**
 * Batch entry point: load CSV or workbook files, analyse a selection, print the report.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   CSV or workbook files (args)
 *     → DatasetLoader (merge on the union of timestamps)
 *     → selection + time window + optional resampling
 *     → analyses (optionally on worker threads)
 *     → text report on stdout, optional JSON report and CSV exports
 * </pre>
 *
 * <p>
 * Settings come from {@link RunnerConfig}; analysis tunables from the YAML
 * file resolved by {@link AnalysisConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ProcessLensRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessLensRunner.class);

    private ProcessLensRunner() {
        // entry-point class — not instantiable
    }

    public static void main(String[] args) throws IOException {
        // 1. Load configuration
        RunnerConfig config = RunnerConfig.fromEnvironment(args);
        LOG.info("Starting Process Lens with config: {}", config);
        AnalysisConfig analysisConfig = loadAnalysisConfig(config);

        // 2. Run
        AnalysisReport report = run(config, analysisConfig);

        // 3. Print
        System.out.print(ReportFormatter.format(report));
        if (!report.isPrepared()) {
            System.exit(1);
        }
    }

    /**
     * Execute one run and write the configured output files.
     *
     * @param config         runner settings
     * @param analysisConfig analysis tunables
     * @return the report, also when the selection could not be prepared
     * @throws IOException           if an output file cannot be written
     * @throws IllegalStateException if no input file could be loaded
     */
    static AnalysisReport run(RunnerConfig config, AnalysisConfig analysisConfig) throws IOException {
        IngestResult ingest = new DatasetLoader().load(config.getInputFiles());
        ingest.getErrors().forEach(e -> LOG.warn("Ingestion: {}", e.describe()));
        ingest.getNotes().forEach(n -> LOG.info("Ingestion: {}", n));
        Dataset dataset = ingest.getDataset();
        if (dataset.isEmpty()) {
            throw new IllegalStateException("No data loaded from " + config.getInputFiles());
        }
        LOG.info("Loaded {} series over {} timestamps from {} file(s)",
                dataset.seriesCount(), dataset.rowCount(), ingest.getLoadedSources().size());

        AnalysisEngine engine = new AnalysisEngine(analysisConfig);
        AnalysisRequest request = buildRequest(config, dataset);
        AnalysisReport report = new ConcurrentAnalysisRunner(engine, config.getParallelism())
                .run(dataset, request);

        writeOutputs(config, engine, dataset, request, report);
        return report;
    }

    static AnalysisRequest buildRequest(RunnerConfig config, Dataset dataset) {
        AnalysisRequest.Builder request = AnalysisRequest.builder()
                .select(config.getSelection().isEmpty() ? dataset.getSeriesNames() : config.getSelection())
                .window(config.getWindow())
                .resample(config.getResamplePeriod(), config.getAggregator());
        if (!config.getAnalyses().isEmpty()) {
            Set<AnalysisKind> kinds = EnumSet.noneOf(AnalysisKind.class);
            config.getAnalyses().forEach(name -> kinds.add(AnalysisKind.fromName(name)));
            request.analyses(kinds);
        }
        return request.build();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnalysisConfig loadAnalysisConfig(RunnerConfig config) {
        if (config.getConfigPath() != null) {
            return AnalysisConfigLoader.fromFile(config.getConfigPath().toString());
        }
        return AnalysisConfigLoader.load();
    }

    private static void writeOutputs(RunnerConfig config, AnalysisEngine engine, Dataset dataset,
            AnalysisRequest request, AnalysisReport report) throws IOException {
        CsvTableExporter exporter = new CsvTableExporter();
        if (config.getExportPath() != null) {
            if (report.isPrepared()) {
                exporter.export(report.getTable(), config.getExportPath());
            } else {
                LOG.warn("Selection export skipped: {}", report.getPreparationError().describe());
            }
        }
        if (config.getExportAllPath() != null) {
            Outcome<PreparedSelection> all = engine.prepareAll(dataset, request);
            if (all.isSuccess()) {
                exporter.export(all.getValue().getTable(), config.getExportAllPath());
            } else {
                LOG.warn("Full export skipped: {}", all.getError().describe());
            }
        }
        if (config.getReportJsonPath() != null) {
            new ReportJsonWriter().write(report, config.getReportJsonPath());
        }
    }
}
