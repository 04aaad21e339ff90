package com.example.inpainting.core;

import java.util.Arrays;

/**
 * Collects one residual per completed sweep and decides when to stop.
 */
public class ConvergenceTracker {

    private final double tolerance;
    private double[] residuals = new double[16];
    private int size;

    public ConvergenceTracker(double tolerance) {
        this.tolerance = tolerance;
    }

    /**
     * Appends the residual of a finished sweep.
     *
     * @return true once the residual drops below the tolerance
     */
    public boolean record(double residual) {
        if (size == residuals.length) {
            residuals = Arrays.copyOf(residuals, size * 2);
        }
        residuals[size++] = residual;
        return residual < tolerance;
    }

    public int iterations() {
        return size;
    }

    public boolean converged() {
        return size > 0 && residuals[size - 1] < tolerance;
    }

    public double[] residuals() {
        return Arrays.copyOf(residuals, size);
    }
}
