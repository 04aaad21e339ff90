package com.example.inpainting.core;

/**
 * Solver knobs.
 *
 * @param maxIterations    hard upper bound on sweeps; values {@code <= 0} run none
 * @param tolerance        stop after the first sweep whose residual is below this value
 * @param fidelityWeight   lambda, accepted for interface compatibility, no numerical effect
 * @param smoothnessWeight beta, accepted for interface compatibility, no numerical effect
 */
public record ReconstructionParameters(
        int maxIterations,
        double tolerance,
        double fidelityWeight,
        double smoothnessWeight
) {
    public static final int DEFAULT_MAX_ITERATIONS = 1000;
    public static final double DEFAULT_TOLERANCE = 1e-4;
    public static final double DEFAULT_FIDELITY = 0.5;
    public static final double DEFAULT_SMOOTHNESS = 1.5;

    public static ReconstructionParameters of(int maxIterations, double tolerance) {
        return new ReconstructionParameters(maxIterations, tolerance, DEFAULT_FIDELITY, DEFAULT_SMOOTHNESS);
    }

    public static ReconstructionParameters defaultParameters() {
        return of(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }
}
