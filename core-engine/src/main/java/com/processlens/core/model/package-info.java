/**
 * Value types produced and consumed by the Process Lens analytics engine.
 *
 * <p>
 * None of these types hold a reference back to a front end; they are derived
 * from a {@link com.processlens.core.model.Dataset} snapshot for one analysis
 * call and discarded afterwards.
 * </p>
 * <ul>
 * <li>{@link com.processlens.core.model.Dataset} — merged, time-indexed
 * table</li>
 * <li>{@link com.processlens.core.model.StepWindow},
 * {@link com.processlens.core.model.FittedStepModel},
 * {@link com.processlens.core.model.TuningRecommendation} — step
 * identification</li>
 * <li>{@link com.processlens.core.model.FuzzyRule} — mined rules</li>
 * <li>{@link com.processlens.core.model.Outcome} — per-item success or typed
 * error</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.processlens.core.model;
