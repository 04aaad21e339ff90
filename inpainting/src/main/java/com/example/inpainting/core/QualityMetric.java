package com.example.inpainting.core;

import org.nd4j.linalg.api.ndarray.INDArray;

public final class QualityMetric {

    private QualityMetric() {
    }

    /**
     * Root-mean-square error over every channel of the pixels the mask marks unknown.
     * Only meaningful against a ground truth; returns 0 when no pixel is unknown.
     */
    public static double rmseOnMissing(Tensor source, Tensor reconstructed, KnownMask known) {
        if (!source.sameShape(reconstructed)) {
            throw new IllegalArgumentException("Tensores com formatos diferentes: " + source + " vs " + reconstructed);
        }
        known.requireMatches(source);

        int unknown = known.unknownCount();
        if (unknown == 0) {
            return 0.0;
        }

        INDArray diff = source.toNdArray().subi(reconstructed.toNdArray());
        INDArray squared = diff.muli(diff).muliColumnVector(known.unknownIndicator());
        double sumSq = squared.sumNumber().doubleValue();
        long terms = (long) unknown * source.channels();
        return Math.sqrt(sumSq / terms);
    }
}
