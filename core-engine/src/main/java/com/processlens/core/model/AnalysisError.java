package com.processlens.core.model;

import java.util.Objects;

/**
 * A readable, typed description of one failed item (a file, a series, a pair
 * or a whole analysis).
 *
 * @since 1.0.0
 */
public final class AnalysisError {

    private final ErrorKind kind;
    private final String subject;
    private final String message;

    /**
     * @param kind    error category; must not be {@code null}
     * @param subject what failed (file path, series name, "a -> b"); may be
     *                {@code null} for analysis-wide errors
     * @param message human-readable reason; must not be {@code null}
     */
    public AnalysisError(ErrorKind kind, String subject, String message) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.subject = subject;
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    public static AnalysisError of(ErrorKind kind, String message) {
        return new AnalysisError(kind, null, message);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return single-line rendering used in text reports
     */
    public String describe() {
        return subject == null
                ? "[" + kind + "] " + message
                : "[" + kind + "] " + subject + ": " + message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisError that))
            return false;
        return kind == that.kind
                && Objects.equals(subject, that.subject)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, subject, message);
    }

    @Override
    public String toString() {
        return "AnalysisError{" + describe() + '}';
    }
}
