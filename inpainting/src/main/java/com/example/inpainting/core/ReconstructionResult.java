package com.example.inpainting.core;

import java.util.Arrays;

public record ReconstructionResult(
        Tensor reconstructed,
        double[] residuals,
        double rmse,
        int iterations
) {
    public ReconstructionResult {
        residuals = residuals.clone();
    }

    /** Copy of the per-sweep residual sequence. */
    @Override
    public double[] residuals() {
        return residuals.clone();
    }

    public double finalResidual() {
        return residuals.length == 0 ? Double.NaN : residuals[residuals.length - 1];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReconstructionResult other)) return false;
        return Double.compare(rmse, other.rmse) == 0
                && iterations == other.iterations
                && reconstructed.equals(other.reconstructed)
                && Arrays.equals(residuals, other.residuals);
    }

    @Override
    public int hashCode() {
        int result = reconstructed.hashCode();
        result = 31 * result + Arrays.hashCode(residuals);
        result = 31 * result + Double.hashCode(rmse);
        return 31 * result + iterations;
    }

    @Override
    public String toString() {
        return "ReconstructionResult[" + reconstructed + ", iterations=" + iterations + ", rmse=" + rmse + "]";
    }
}
