/**
 * Step-change detection on single series.
 *
 * <p>
 * {@link com.processlens.core.detection.StepDetector} combines the robust
 * estimates of {@link com.processlens.core.detection.RobustStatistics} with
 * the {@link com.processlens.core.detection.PeakFinder}.
 * </p>
 *
 * @since 1.0.0
 */
package com.processlens.core.detection;
