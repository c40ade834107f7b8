package com.processlens.core.ingest;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads one source file into a raw {@link SourceTable}.
 *
 * <p>
 * Implementations only extract the header and cell text; timestamp parsing,
 * column filtering and prefixing happen in {@link DatasetLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public interface SourceReader {

    /**
     * @param path source file; must not be {@code null}
     * @return the raw table (possibly empty)
     * @throws IOException if the file cannot be read or has an unsupported
     *                     layout
     */
    SourceTable read(Path path) throws IOException;

    /**
     * @param path source file
     * @return file name up to its first {@code .}
     */
    static String sourceIdOf(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.indexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
