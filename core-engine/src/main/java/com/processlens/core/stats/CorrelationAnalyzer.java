package com.processlens.core.stats;

import com.processlens.core.model.CorrelationMatrix;
import com.processlens.core.model.Dataset;
import com.processlens.core.model.ErrorKind;
import com.processlens.core.model.Outcome;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

import java.util.List;
import java.util.Objects;

/**
 * Pearson correlation matrix over cleaned data.
 *
 * <p>
 * The matrix is symmetric by construction. The diagonal is {@code 1.0} for
 * series with non-zero variance and {@code NaN} for constant series, as are
 * all coefficients involving a constant series.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationAnalyzer {

    private CorrelationAnalyzer() {
        // utility class — not instantiable
    }

    /**
     * @param cleaned dataset without missing values
     * @return the matrix, or a selection / data-sufficiency failure
     */
    public static Outcome<CorrelationMatrix> correlate(Dataset cleaned) {
        Objects.requireNonNull(cleaned, "dataset must not be null");
        List<String> names = cleaned.getSeriesNames();
        if (names.size() < 2) {
            return Outcome.failure(ErrorKind.SELECTION, "correlation", "select at least 2 series");
        }
        if (cleaned.rowCount() < 1) {
            return Outcome.failure(ErrorKind.DATA_SUFFICIENCY, "correlation",
                    "insufficient data to compute correlation");
        }

        int n = names.size();
        double[][] columns = new double[n][];
        boolean[] varying = new boolean[n];
        for (int i = 0; i < n; i++) {
            columns[i] = cleaned.getValues(names.get(i));
            varying[i] = columns[i].length > 1 && new Variance().evaluate(columns[i]) > 0;
        }

        PearsonsCorrelation pearson = new PearsonsCorrelation();
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = varying[i] ? 1.0 : Double.NaN;
            for (int j = i + 1; j < n; j++) {
                double r = varying[i] && varying[j]
                        ? pearson.correlation(columns[i], columns[j])
                        : Double.NaN;
                matrix[i][j] = r;
                matrix[j][i] = r;
            }
        }
        return Outcome.success(new CorrelationMatrix(names, matrix));
    }
}
