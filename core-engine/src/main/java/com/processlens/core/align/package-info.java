/**
 * Alignment and resampling of sources onto a shared time axis.
 *
 * <ul>
 * <li>{@link com.processlens.core.align.DatasetAligner} — full outer join,
 * first source wins on name collisions</li>
 * <li>{@link com.processlens.core.align.Resampler} — fixed-period
 * aggregation with {@link com.processlens.core.align.Aggregator}</li>
 * <li>{@link com.processlens.core.align.DataCleaner} — interpolate then drop
 * incomplete rows</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.processlens.core.align;
