package com.processlens.core.identification;

/**
 * Terminal state of step identification for one series.
 *
 * <p>
 * Every series starts pending and ends in exactly one of these states.
 * </p>
 *
 * @since 1.0.0
 */
public enum StepIdentificationStatus {

    /** The series, or the detected window, has too few samples. */
    TOO_SHORT,

    /** The detector found no step. */
    NO_STEP_FOUND,

    /** The optimizer did not produce a usable model. */
    FIT_FAILED,

    /** A model was fitted and tuning values derived. */
    FIT_SUCCEEDED
}
