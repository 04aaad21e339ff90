package com.example.inpainting.core;

import java.util.Arrays;

public final class DamageSimulator {

    private DamageSimulator() {
    }

    /**
     * Copy of {@code source} with every channel of each unknown pixel set to zero.
     */
    public static Tensor makeDamagedView(Tensor source, KnownMask known) {
        known.requireMatches(source);
        int c = source.channels();
        float[] samples = source.data();
        for (int i = 0; i < known.length(); i++) {
            if (!known.isKnown(i)) {
                Arrays.fill(samples, i * c, i * c + c, 0f);
            }
        }
        return new Tensor(source.height(), source.width(), c, samples);
    }
}
