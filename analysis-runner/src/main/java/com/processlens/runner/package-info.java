/**
 * Batch command-line runner for Process Lens.
 *
 * <p>
 * This package wires the core analysis engine into a one-shot run: CSV or workbook files
 * in, a text report out, with optional JSON and CSV outputs.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.processlens.runner.ProcessLensRunner} — main entry point</li>
 * <li>{@link com.processlens.runner.RunnerConfig} — environment-driven
 * configuration</li>
 * <li>{@link com.processlens.runner.ConcurrentAnalysisRunner} — analyses on
 * worker threads with a single report writer</li>
 * <li>{@link com.processlens.runner.ReportJsonWriter} — JSON report
 * output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.processlens.runner;
