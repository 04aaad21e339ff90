package com.example.inpainting.core;

/**
 * Over-relaxed Gauss-Seidel step: {@code next = current + omega * (mean - current)}.
 */
public record SuccessiveOverRelaxation(double omega) implements RelaxationRule {

    public static final double DEFAULT_OMEGA = 1.25;

    public SuccessiveOverRelaxation {
        if (!(omega > 0 && omega < 2)) {
            throw new IllegalArgumentException("Fator de relaxação fora de (0,2): " + omega);
        }
    }

    public static SuccessiveOverRelaxation defaultRule() {
        return new SuccessiveOverRelaxation(DEFAULT_OMEGA);
    }

    @Override
    public double relax(double current, double neighbourMean, ReconstructionParameters parameters) {
        return current + omega * (neighbourMean - current);
    }
}
