/**
 * Descriptive statistics, Pearson correlation and predictability ranking.
 *
 * <ul>
 * <li>{@link com.processlens.core.stats.SeriesStatisticsCalculator} — raw
 * windowed values</li>
 * <li>{@link com.processlens.core.stats.CorrelationAnalyzer} and
 * {@link com.processlens.core.stats.CausalityRanker} — cleaned values</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.processlens.core.stats;
