package com.processlens.runner;

import com.processlens.core.model.Dataset;
import com.processlens.core.model.ErrorKind;
import com.processlens.core.model.Outcome;
import com.processlens.core.report.AnalysisEngine;
import com.processlens.core.report.AnalysisKind;
import com.processlens.core.report.AnalysisReport;
import com.processlens.core.report.AnalysisRequest;
import com.processlens.core.report.PreparedSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the analyses of one request on worker threads.
 *
 * <p>
 * The selection is prepared once in the calling thread. Each requested
 * analysis then runs as an independent task over the same immutable
 * {@link PreparedSelection}; tasks hand their outcome to a queue that only
 * the calling thread drains, so the report is assembled by a single writer.
 * Sections end up in analysis order whatever order the tasks finish in.
 * </p>
 *
 * <p>
 * With a parallelism of 1 no pool is created and the request goes straight
 * through {@link AnalysisEngine#analyze}.
 * </p>
 *
 * @since 1.0.0
 */
public class ConcurrentAnalysisRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ConcurrentAnalysisRunner.class);

    private final AnalysisEngine engine;
    private final int parallelism;

    public ConcurrentAnalysisRunner(AnalysisEngine engine, int parallelism) {
        this.engine = Objects.requireNonNull(engine, "AnalysisEngine must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * @param dataset merged dataset snapshot; not modified
     * @param request what to analyse
     * @return the assembled report
     * @throws IllegalStateException if the calling thread is interrupted while
     *                               waiting for results
     */
    public AnalysisReport run(Dataset dataset, AnalysisRequest request) {
        if (parallelism == 1) {
            return engine.analyze(dataset, request);
        }

        AnalysisReport.Builder report = AnalysisReport.builder(request);
        Outcome<PreparedSelection> prepared = engine.prepare(dataset, request);
        if (!prepared.isSuccess()) {
            LOG.warn("Analysis not run: {}", prepared.getError().describe());
            return report.preparationError(prepared.getError()).build();
        }
        report.prepared(prepared.getValue());

        Set<AnalysisKind> kinds = engine.analysesFor(request);
        BlockingQueue<Section> results = new LinkedBlockingQueue<>();
        ExecutorService workers = Executors.newFixedThreadPool(
                Math.min(parallelism, Math.max(1, kinds.size())), new WorkerThreadFactory());
        try {
            for (AnalysisKind kind : kinds) {
                workers.submit(() -> results.add(new Section(kind,
                        runGuarded(kind, prepared.getValue(), request))));
            }
            for (int received = 0; received < kinds.size(); received++) {
                Section section = results.take();
                report.section(section.kind, section.outcome);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for analysis results", e);
        } finally {
            shutdown(workers);
        }
        return report.build();
    }

    public int getParallelism() {
        return parallelism;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Outcome<?> runGuarded(AnalysisKind kind, PreparedSelection prepared, AnalysisRequest request) {
        try {
            return engine.run(kind, prepared, request);
        } catch (RuntimeException e) {
            // a crashed task must still deliver a section, or the writer waits forever
            LOG.error("Analysis '{}' failed unexpectedly", kind.getConfigName(), e);
            return Outcome.failure(ErrorKind.NUMERICAL, kind.getConfigName(),
                    "analysis failed: " + e.getMessage());
        }
    }

    private static void shutdown(ExecutorService workers) {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Analysis workers did not stop within 30 s, forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class Section {
        private final AnalysisKind kind;
        private final Outcome<?> outcome;

        Section(AnalysisKind kind, Outcome<?> outcome) {
            this.kind = kind;
            this.outcome = outcome;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "analysis-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
