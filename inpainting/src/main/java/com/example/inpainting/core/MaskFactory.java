package com.example.inpainting.core;

import com.example.inpainting.core.exceptions.EmptyMaskException;

import java.util.Random;

/**
 * Builds known-masks either from a painted damage mask or from random damage.
 */
public class MaskFactory {

    private final Random random;

    /**
     * @param random source for random damage; pass a seeded instance for reproducible masks
     */
    public MaskFactory(Random random) {
        this.random = random;
    }

    /**
     * Complements the painted mask: painted pixels become unknown, untouched pixels known.
     *
     * @throws EmptyMaskException if nothing was painted
     */
    public KnownMask buildKnownMaskFromPaint(PaintMask paint) {
        int painted = paint.paintedCount();
        if (painted == 0) {
            throw new EmptyMaskException("nenhum pixel pintado em " + paint.width() + "x" + paint.height());
        }
        byte[] known = new byte[paint.length()];
        for (int i = 0; i < known.length; i++) {
            known[i] = paint.isPainted(i) ? KnownMask.UNKNOWN : KnownMask.KNOWN;
        }
        return new KnownMask(paint.height(), paint.width(), known);
    }

    /**
     * Marks each pixel unknown independently with probability {@code damagePercent / 100}.
     */
    public KnownMask buildRandomKnownMask(int width, int height, double damagePercent) {
        if (Double.isNaN(damagePercent) || damagePercent < 0 || damagePercent > 100) {
            throw new IllegalArgumentException("Percentual de dano fora de [0,100]: " + damagePercent);
        }
        double p = damagePercent / 100.0;
        byte[] known = new byte[width * height];
        for (int i = 0; i < known.length; i++) {
            known[i] = random.nextDouble() < p ? KnownMask.UNKNOWN : KnownMask.KNOWN;
        }
        return new KnownMask(height, width, known);
    }
}
