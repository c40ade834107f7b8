package com.processlens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Symmetric Pearson correlation matrix with row/column labels.
 *
 * @since 1.0.0
 */
public final class CorrelationMatrix {

    private final List<String> labels;
    private final double[][] values;

    /**
     * @param labels series names, row and column order
     * @param values square matrix matching {@code labels}; copied
     * @throws IllegalArgumentException if the matrix is not square or does not
     *                                  match the labels
     */
    public CorrelationMatrix(List<String> labels, double[][] values) {
        this.labels = List.copyOf(Objects.requireNonNull(labels, "labels must not be null"));
        Objects.requireNonNull(values, "values must not be null");
        if (values.length != labels.size()) {
            throw new IllegalArgumentException("Matrix has " + values.length
                    + " rows but " + labels.size() + " labels");
        }
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != labels.size()) {
                throw new IllegalArgumentException("Matrix row " + i + " is not square");
            }
            this.values[i] = values[i].clone();
        }
    }

    public List<String> getLabels() {
        return labels;
    }

    public int size() {
        return labels.size();
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    /**
     * @param a first series name
     * @param b second series name
     * @return coefficient between {@code a} and {@code b}
     * @throws IllegalArgumentException if either name is not a label
     */
    public double get(String a, String b) {
        return values[position(a)][position(b)];
    }

    /**
     * @return a copy of the coefficient matrix
     */
    public double[][] getValues() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    private int position(String label) {
        int i = labels.indexOf(label);
        if (i < 0) {
            throw new IllegalArgumentException("Unknown label: '" + label + "'");
        }
        return i;
    }

    @Override
    public String toString() {
        return "CorrelationMatrix{labels=" + labels + '}';
    }
}
