package com.example.inpainting.core;

/**
 * Turns the neighbour average of an unknown sample into its next value.
 * <p>
 * The fidelity and smoothness weights of {@link ReconstructionParameters} are handed over so a
 * weighted formulation can be plugged in here; {@link SuccessiveOverRelaxation} ignores them.
 */
@FunctionalInterface
public interface RelaxationRule {

    double relax(double current, double neighbourMean, ReconstructionParameters parameters);
}
