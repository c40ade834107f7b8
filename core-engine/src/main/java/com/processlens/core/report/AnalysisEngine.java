package com.processlens.core.report;

import com.processlens.core.align.Aggregator;
import com.processlens.core.align.Resampler;
import com.processlens.core.config.AnalysisConfig;
import com.processlens.core.fuzzy.FuzzyRuleMiner;
import com.processlens.core.fuzzy.FuzzyRuleSet;
import com.processlens.core.identification.FirstOrderIdentifier;
import com.processlens.core.identification.StepIdentificationResult;
import com.processlens.core.model.CausalityResult;
import com.processlens.core.model.CorrelationMatrix;
import com.processlens.core.model.Dataset;
import com.processlens.core.model.ErrorKind;
import com.processlens.core.model.Outcome;
import com.processlens.core.model.SeriesStatistics;
import com.processlens.core.stats.CausalityRanker;
import com.processlens.core.stats.CorrelationAnalyzer;
import com.processlens.core.stats.SeriesStatisticsCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point of the analytics core:
 * {@code analyze(dataset, request) → report}.
 *
 * <h3>Preparation</h3>
 * <ol>
 * <li>Select the requested series, in request order.</li>
 * <li>Keep rows inside the time window (inclusive).</li>
 * <li>Resample if a period is set; invalid settings keep the windowed data
 * and add a note.</li>
 * <li>Clean (interpolate, drop incomplete rows) for correlation, causality,
 * step identification and rule mining. Statistics use the uncleaned
 * rows.</li>
 * </ol>
 *
 * <p>
 * The dataset is never modified, and the engine holds no per-call state, so
 * analyses of one prepared selection may run concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisEngine.class);

    private final AnalysisConfig config;
    private final FirstOrderIdentifier identifier;
    private final FuzzyRuleMiner ruleMiner;
    private final CausalityRanker causalityRanker;

    /**
     * @param config validated analysis configuration; must not be {@code null}
     */
    public AnalysisEngine(AnalysisConfig config) {
        this(config, new FirstOrderIdentifier(config), new FuzzyRuleMiner(config), new CausalityRanker(config));
    }

    public AnalysisEngine(AnalysisConfig config, FirstOrderIdentifier identifier,
            FuzzyRuleMiner ruleMiner, CausalityRanker causalityRanker) {
        this.config = Objects.requireNonNull(config, "AnalysisConfig must not be null");
        this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
        this.ruleMiner = Objects.requireNonNull(ruleMiner, "ruleMiner must not be null");
        this.causalityRanker = Objects.requireNonNull(causalityRanker, "causalityRanker must not be null");
    }

    // ---------------------------------------------------------------
    // Whole request
    // ---------------------------------------------------------------

    /**
     * Run every requested analysis synchronously.
     *
     * @param dataset snapshot to analyze
     * @param request selection, window, resampling and analyses
     * @return the report; failures are recorded in it, never thrown
     */
    public AnalysisReport analyze(Dataset dataset, AnalysisRequest request) {
        AnalysisReport.Builder report = AnalysisReport.builder(request);
        Outcome<PreparedSelection> prepared = prepare(dataset, request);
        if (!prepared.isSuccess()) {
            LOG.warn("Analysis not run: {}", prepared.getError().describe());
            return report.preparationError(prepared.getError()).build();
        }
        report.prepared(prepared.getValue());
        for (AnalysisKind kind : analysesFor(request)) {
            report.section(kind, run(kind, prepared.getValue(), request));
        }
        return report.build();
    }

    /**
     * @param request analysis request
     * @return the analyses to run, in report order
     */
    public Set<AnalysisKind> analysesFor(AnalysisRequest request) {
        Set<AnalysisKind> requested = request.getAnalyses();
        if (requested != null) {
            return requested;
        }
        Set<AnalysisKind> kinds = EnumSet.noneOf(AnalysisKind.class);
        for (String name : config.getAnalyses()) {
            kinds.add(AnalysisKind.fromName(name));
        }
        return kinds;
    }

    /**
     * Select, window and resample.
     *
     * @return the prepared selection, or a selection / data-sufficiency
     *         failure
     */
    public Outcome<PreparedSelection> prepare(Dataset dataset, AnalysisRequest request) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        Objects.requireNonNull(request, "request must not be null");
        List<String> selection = request.getSelection();
        if (selection.isEmpty()) {
            return Outcome.failure(ErrorKind.SELECTION, null, "no series selected");
        }
        for (String name : selection) {
            if (!dataset.contains(name)) {
                return Outcome.failure(ErrorKind.SELECTION, name, "unknown series");
            }
        }
        return prepareView(dataset.select(selection), request);
    }

    /**
     * Window and resample every series of the dataset, for export of the whole
     * merged table.
     */
    public Outcome<PreparedSelection> prepareAll(Dataset dataset, AnalysisRequest request) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        Objects.requireNonNull(request, "request must not be null");
        return prepareView(dataset, request);
    }

    private Outcome<PreparedSelection> prepareView(Dataset view, AnalysisRequest request) {
        // rows stay on the shared time index even when every selected series is missing there
        Dataset windowed = view.slice(request.getWindow());
        if (windowed.isEmpty()) {
            return Outcome.failure(ErrorKind.DATA_SUFFICIENCY, null,
                    "no data in the selected time window " + request.getWindow());
        }

        List<String> notes = new ArrayList<>();
        String period = request.getResamplePeriod() != null
                ? request.getResamplePeriod()
                : config.getResamplePeriod();
        if (period != null && !period.isBlank()) {
            String aggregator = request.getAggregator() != null
                    ? request.getAggregator()
                    : config.getAggregator();
            Outcome<Dataset> resampled = Resampler.tryResample(windowed, period, aggregator);
            if (resampled.isSuccess()) {
                windowed = resampled.getValue();
                notes.add("resampled to " + period + " using " + Aggregator.fromName(aggregator).label() + ": "
                        + windowed.rowCount() + " row(s)");
            } else {
                notes.add(resampled.getError().describe());
            }
        }
        return Outcome.success(new PreparedSelection(windowed, notes));
    }

    // ---------------------------------------------------------------
    // Individual analyses
    // ---------------------------------------------------------------

    /**
     * Run one analysis over a prepared selection.
     */
    public Outcome<?> run(AnalysisKind kind, PreparedSelection prepared, AnalysisRequest request) {
        long started = System.nanoTime();
        Outcome<?> outcome = switch (kind) {
            case STATISTICS -> statistics(prepared);
            case CORRELATION -> correlation(prepared);
            case STEP_IDENTIFICATION -> stepIdentification(prepared);
            case FUZZY_RULES -> fuzzyRules(prepared,
                    request.getFuzzyTopK() != null ? request.getFuzzyTopK() : config.getFuzzyTopK());
            case CAUSALITY -> causality(prepared);
        };
        LOG.info("Analysis '{}' finished in {} ms ({})", kind.getConfigName(),
                (System.nanoTime() - started) / 1_000_000, outcome.isSuccess() ? "ok" : "failed");
        return outcome;
    }

    public Outcome<List<SeriesStatistics>> statistics(PreparedSelection prepared) {
        return Outcome.success(SeriesStatisticsCalculator.describe(prepared.getTable()));
    }

    public Outcome<CorrelationMatrix> correlation(PreparedSelection prepared) {
        return CorrelationAnalyzer.correlate(prepared.getCleaned());
    }

    /**
     * Step identification for every selected series. Series are cleaned
     * jointly, so a gap in one series removes those rows from all of them.
     */
    public Outcome<List<StepIdentificationResult>> stepIdentification(PreparedSelection prepared) {
        Dataset cleaned = prepared.getCleaned();
        if (cleaned.isEmpty()) {
            return Outcome.failure(ErrorKind.DATA_SUFFICIENCY, "step-identification",
                    "time range or data insufficient to identify steps");
        }
        List<StepIdentificationResult> results = new ArrayList<>();
        for (String name : cleaned.getSeriesNames()) {
            StepIdentificationResult result = identifier.identify(name, cleaned.getIndex(), cleaned.getValues(name));
            LOG.debug("Step identification for '{}': {}", name, result.getStatus());
            results.add(result);
        }
        return Outcome.success(results);
    }

    public Outcome<FuzzyRuleSet> fuzzyRules(PreparedSelection prepared, int topK) {
        return ruleMiner.mine(prepared.getCleaned(), topK);
    }

    public Outcome<List<CausalityResult>> causality(PreparedSelection prepared) {
        return causalityRanker.rank(prepared.getCleaned());
    }

    public AnalysisConfig getConfig() {
        return config;
    }
}
