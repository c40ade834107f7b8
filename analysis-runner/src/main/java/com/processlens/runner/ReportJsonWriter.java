package com.processlens.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.processlens.core.report.AnalysisReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Serializes an {@link AnalysisReport} to JSON.
 *
 * <p>
 * Timestamps are written as ISO-8601 strings; undefined numbers appear as
 * {@code "NaN"}. Sections that were not requested are omitted.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportJsonWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportJsonWriter.class);

    private final ObjectMapper mapper;

    public ReportJsonWriter() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(AnalysisReport report) throws JsonProcessingException {
        Objects.requireNonNull(report, "report must not be null");
        return mapper.writeValueAsString(report);
    }

    /**
     * @param report report to write
     * @param path   target file, created or replaced
     * @throws IOException if serialization or writing fails
     */
    public void write(AnalysisReport report, Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJson(report), StandardCharsets.UTF_8);
        LOG.info("Wrote JSON report to {}", path);
    }

    ObjectMapper getMapper() {
        return mapper;
    }
}
