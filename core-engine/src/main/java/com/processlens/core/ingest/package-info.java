/**
 * Source ingestion: CSV and workbook reading, timestamp normalization, column naming and
 * the per-file error policy.
 *
 * <p>
 * {@link com.processlens.core.ingest.DatasetLoader} is the entry point. It
 * returns an {@link com.processlens.core.ingest.IngestResult} holding a new
 * {@link com.processlens.core.model.Dataset} snapshot and one
 * {@link com.processlens.core.model.AnalysisError} per skipped file.
 * </p>
 *
 * @since 1.0.0
 */
package com.processlens.core.ingest;
