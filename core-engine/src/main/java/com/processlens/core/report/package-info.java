/**
 * Request preparation, analysis orchestration and report rendering.
 *
 * <p>
 * {@link com.processlens.core.report.AnalysisEngine#analyze} is a pure
 * function of the dataset snapshot and the request; front ends call it on
 * demand.
 * </p>
 *
 * @since 1.0.0
 */
package com.processlens.core.report;
