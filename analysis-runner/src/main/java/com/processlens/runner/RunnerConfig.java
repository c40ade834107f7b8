package com.processlens.runner;

import com.processlens.core.ingest.TimestampParser;
import com.processlens.core.model.TimeWindow;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Typed, immutable settings for one batch run of the analysis runner.
 *
 * <p>
 * Input files come from the command line; everything else is resolved from
 * environment variables with defaults, so a run can be scripted from a shell
 * or a container without touching the YAML analysis configuration.
 * </p>
 *
 * <h3>Environment</h3>
 * <ul>
 * <li>{@value #ENV_SELECTION} comma-separated series names, inputs first and
 * output last; empty selects every loaded series</li>
 * <li>{@value #ENV_WINDOW_START} / {@value #ENV_WINDOW_END} inclusive window
 * bounds in any timestamp layout the loader accepts</li>
 * <li>{@value #ENV_RESAMPLE_PERIOD} / {@value #ENV_AGGREGATOR}</li>
 * <li>{@value #ENV_ANALYSES} comma-separated analysis names</li>
 * <li>{@value #ENV_PARALLELISM} worker threads; 1 runs analyses in the calling
 * thread</li>
 * <li>{@value #ENV_CONFIG_PATH} analysis YAML file</li>
 * <li>{@value #ENV_EXPORT_PATH}, {@value #ENV_EXPORT_ALL_PATH},
 * {@value #ENV_REPORT_JSON_PATH} optional output files</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class RunnerConfig {

    public static final String ENV_SELECTION = "PROCESSLENS_SELECTION";
    public static final String ENV_WINDOW_START = "PROCESSLENS_WINDOW_START";
    public static final String ENV_WINDOW_END = "PROCESSLENS_WINDOW_END";
    public static final String ENV_RESAMPLE_PERIOD = "PROCESSLENS_RESAMPLE_PERIOD";
    public static final String ENV_AGGREGATOR = "PROCESSLENS_AGGREGATOR";
    public static final String ENV_ANALYSES = "PROCESSLENS_ANALYSES";
    public static final String ENV_PARALLELISM = "PROCESSLENS_PARALLELISM";
    public static final String ENV_CONFIG_PATH = "PROCESSLENS_CONFIG_PATH";
    public static final String ENV_EXPORT_PATH = "PROCESSLENS_EXPORT_PATH";
    public static final String ENV_EXPORT_ALL_PATH = "PROCESSLENS_EXPORT_ALL_PATH";
    public static final String ENV_REPORT_JSON_PATH = "PROCESSLENS_REPORT_JSON_PATH";

    // ---------------------------------------------------------------
    // Inputs
    // ---------------------------------------------------------------
    private final List<Path> inputFiles;
    private final List<String> selection;
    private final TimeWindow window;

    // ---------------------------------------------------------------
    // Analysis
    // ---------------------------------------------------------------
    private final String resamplePeriod;
    private final String aggregator;
    private final List<String> analyses;
    private final int parallelism;
    private final Path configPath;

    // ---------------------------------------------------------------
    // Outputs
    // ---------------------------------------------------------------
    private final Path exportPath;
    private final Path exportAllPath;
    private final Path reportJsonPath;

    private RunnerConfig(Builder b) {
        this.inputFiles = List.copyOf(b.inputFiles);
        this.selection = List.copyOf(b.selection);
        this.window = b.window;
        this.resamplePeriod = b.resamplePeriod;
        this.aggregator = b.aggregator;
        this.analyses = List.copyOf(b.analyses);
        this.parallelism = b.parallelism;
        this.configPath = b.configPath;
        this.exportPath = b.exportPath;
        this.exportAllPath = b.exportAllPath;
        this.reportJsonPath = b.reportJsonPath;
    }

    // ---------------------------------------------------------------
    // Factory — resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link RunnerConfig} from the process environment.
     *
     * @param args input files (CSV, .xls or .xlsx)
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RunnerConfig fromEnvironment(String[] args) {
        return fromEnvironment(System.getenv(), Arrays.asList(args));
    }

    static RunnerConfig fromEnvironment(Map<String, String> env, List<String> args) {
        Objects.requireNonNull(env, "env must not be null");
        Builder b = new Builder();
        args.forEach(arg -> b.inputFile(Path.of(arg)));
        try {
            b.selection(splitList(value(env, ENV_SELECTION)))
                    .window(time(env, ENV_WINDOW_START), time(env, ENV_WINDOW_END))
                    .resample(value(env, ENV_RESAMPLE_PERIOD), value(env, ENV_AGGREGATOR))
                    .analyses(splitList(value(env, ENV_ANALYSES)))
                    .parallelism(Integer.parseInt(valueOr(env, ENV_PARALLELISM, "1")));
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
        return b.configPath(path(env, ENV_CONFIG_PATH))
                .exportPath(path(env, ENV_EXPORT_PATH))
                .exportAllPath(path(env, ENV_EXPORT_ALL_PATH))
                .reportJsonPath(path(env, ENV_REPORT_JSON_PATH))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public List<Path> getInputFiles() {
        return inputFiles;
    }

    /**
     * @return selected series, or an empty list for "every loaded series"
     */
    public List<String> getSelection() {
        return selection;
    }

    public TimeWindow getWindow() {
        return window;
    }

    public String getResamplePeriod() {
        return resamplePeriod;
    }

    public String getAggregator() {
        return aggregator;
    }

    /**
     * @return analysis names, or an empty list to use the YAML configuration
     */
    public List<String> getAnalyses() {
        return analyses;
    }

    public int getParallelism() {
        return parallelism;
    }

    public Path getConfigPath() {
        return configPath;
    }

    public Path getExportPath() {
        return exportPath;
    }

    public Path getExportAllPath() {
        return exportAllPath;
    }

    public Path getReportJsonPath() {
        return reportJsonPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RunnerConfig}.
     *
     * <p>
     * {@link #build()} requires at least one input file and a parallelism of
     * at least 1.
     * </p>
     */
    public static class Builder {
        private final List<Path> inputFiles = new ArrayList<>();
        private List<String> selection = List.of();
        private TimeWindow window = TimeWindow.ALL;
        private String resamplePeriod;
        private String aggregator;
        private List<String> analyses = List.of();
        private int parallelism = 1;
        private Path configPath;
        private Path exportPath;
        private Path exportAllPath;
        private Path reportJsonPath;

        public Builder inputFile(Path v) {
            this.inputFiles.add(Objects.requireNonNull(v, "input file must not be null"));
            return this;
        }

        public Builder selection(List<String> v) {
            this.selection = Objects.requireNonNull(v, "selection must not be null");
            return this;
        }

        public Builder window(LocalDateTime start, LocalDateTime end) {
            this.window = TimeWindow.of(start, end);
            return this;
        }

        public Builder resample(String period, String aggregator) {
            this.resamplePeriod = period;
            this.aggregator = aggregator;
            return this;
        }

        public Builder analyses(List<String> v) {
            this.analyses = Objects.requireNonNull(v, "analyses must not be null");
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder configPath(Path v) {
            this.configPath = v;
            return this;
        }

        public Builder exportPath(Path v) {
            this.exportPath = v;
            return this;
        }

        public Builder exportAllPath(Path v) {
            this.exportAllPath = v;
            return this;
        }

        public Builder reportJsonPath(Path v) {
            this.reportJsonPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RunnerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RunnerConfig build() {
            if (inputFiles.isEmpty()) {
                throw new IllegalArgumentException("at least one input file is required");
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            for (String name : selection) {
                if (name == null || name.isBlank()) {
                    throw new IllegalArgumentException("selection must not contain blank names");
                }
            }
            return new RunnerConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Map<String, String> env, String name) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : null;
    }

    private static String valueOr(Map<String, String> env, String name, String defaultValue) {
        String value = value(env, name);
        return value != null ? value : defaultValue;
    }

    private static Path path(Map<String, String> env, String name) {
        String value = value(env, name);
        return value != null ? Path.of(value) : null;
    }

    private static LocalDateTime time(Map<String, String> env, String name) {
        String value = value(env, name);
        if (value == null) {
            return null;
        }
        return TimestampParser.parse(value).orElseThrow(() -> new IllegalStateException(
                "Failed to parse timestamp in " + name + ": '" + value + "'"));
    }

    private static List<String> splitList(String value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "inputFiles=" + inputFiles +
                ", selection=" + selection +
                ", window=" + window +
                ", resample=" + resamplePeriod + "/" + aggregator +
                ", analyses=" + analyses +
                ", parallelism=" + parallelism +
                ", configPath=" + configPath +
                ", exportPath=" + exportPath +
                ", exportAllPath=" + exportAllPath +
                ", reportJsonPath=" + reportJsonPath +
                '}';
    }
}
