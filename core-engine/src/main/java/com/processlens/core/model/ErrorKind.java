package com.processlens.core.model;

/**
 * Category of a reported (non-fatal) analysis failure.
 *
 * @since 1.0.0
 */
public enum ErrorKind {

    /** Unparseable time column, empty file, unreadable source. */
    INGESTION,

    /** Too few or unknown series selected for an analysis. */
    SELECTION,

    /** Window or series too short for the requested computation. */
    DATA_SUFFICIENCY,

    /** Fit non-convergence, degenerate variance, singular regression. */
    NUMERICAL,

    /** The predictability test failed for one pair. */
    EXTERNAL_TEST,

    /** Invalid resample period, aggregator or other run setting. */
    CONFIGURATION
}
