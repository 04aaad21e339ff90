package com.example.inpainting.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills unknown pixels by in-place Gauss-Seidel relaxation of the 4-neighbour average.
 * <p>
 * Sweeps run row-major over a single working buffer, so neighbours above and to the left
 * already carry the current sweep's values. Known pixels are reset to the damaged value on
 * every sweep. Neighbour coordinates outside the image are clamped onto the border row or
 * column. Each call owns its buffer, so concurrent calls on independent inputs are safe;
 * splitting one sweep across threads would change the update order and the result.
 */
public class ReconstructionEngine {

    private static final Logger logger = LoggerFactory.getLogger(ReconstructionEngine.class);

    private final RelaxationRule rule;

    public ReconstructionEngine() {
        this(SuccessiveOverRelaxation.defaultRule());
    }

    public ReconstructionEngine(RelaxationRule rule) {
        this.rule = rule;
    }

    /**
     * Reconstructs without ground truth; the reported RMSE is measured against the damaged input.
     */
    public ReconstructionResult reconstruct(Tensor damaged, KnownMask known, ReconstructionParameters parameters) {
        return reconstruct(damaged, known, parameters, damaged);
    }

    /**
     * Reconstructs and measures the RMSE on missing pixels against {@code reference}.
     */
    public ReconstructionResult reconstruct(Tensor damaged, KnownMask known,
                                            ReconstructionParameters parameters, Tensor reference) {
        known.requireMatches(damaged);
        if (!reference.sameShape(damaged)) {
            throw new IllegalArgumentException("Referência " + reference + " incompatível com " + damaged);
        }
        logger.debug("Reconstrução: {}, desconhecidos={}, maxIter={}, tol={}, λ={}, β={}",
                damaged, known.unknownCount(), parameters.maxIterations(), parameters.tolerance(),
                parameters.fidelityWeight(), parameters.smoothnessWeight());

        final int h = damaged.height();
        final int w = damaged.width();
        final int ch = damaged.channels();
        final float[] fixed = damaged.buffer();
        final float[] u = damaged.data();

        ConvergenceTracker tracker = new ConvergenceTracker(parameters.tolerance());

        for (int iter = 0; iter < parameters.maxIterations(); iter++) {
            double totalChange = 0;
            long changeCount = 0;

            for (int y = 0; y < h; y++) {
                final int up = Math.max(0, y - 1) * w;
                final int down = Math.min(h - 1, y + 1) * w;
                final int row = y * w;
                for (int x = 0; x < w; x++) {
                    final int pixel = row + x;
                    final int base = pixel * ch;

                    if (known.isKnown(pixel)) {
                        System.arraycopy(fixed, base, u, base, ch);
                        continue;
                    }

                    final int left = Math.max(0, x - 1);
                    final int right = Math.min(w - 1, x + 1);
                    final int nUp = (up + x) * ch;
                    final int nDown = (down + x) * ch;
                    final int nLeft = (row + left) * ch;
                    final int nRight = (row + right) * ch;

                    for (int c = 0; c < ch; c++) {
                        double sum = (double) u[nUp + c] + u[nDown + c] + u[nLeft + c] + u[nRight + c];
                        double old = u[base + c];
                        u[base + c] = (float) rule.relax(old, sum / 4, parameters);
                        totalChange += Math.abs(u[base + c] - old);
                        changeCount++;
                    }
                }
            }

            double residual = changeCount > 0 ? totalChange / changeCount : 0;
            if (tracker.record(residual)) {
                break;
            }
        }

        if (parameters.maxIterations() > 0 && !tracker.converged()) {
            logger.warn("Sem convergência após {} iterações (resíduo final={}, tol={})",
                    tracker.iterations(), tracker.residuals()[tracker.iterations() - 1], parameters.tolerance());
        }

        Tensor reconstructed = new Tensor(h, w, ch, u);
        double rmse = QualityMetric.rmseOnMissing(reference, reconstructed, known);
        return new ReconstructionResult(reconstructed, tracker.residuals(), rmse, tracker.iterations());
    }
}
