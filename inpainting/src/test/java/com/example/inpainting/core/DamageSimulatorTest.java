package com.example.inpainting.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DamageSimulatorTest {

    @Test
    void unknownPixelsAreZeroedOnEveryChannel() {
        Tensor source = Tensor.rgb(1, 3, new float[]{
                0.1f, 0.2f, 0.3f,
                0.4f, 0.5f, 0.6f,
                0.7f, 0.8f, 0.9f});
        KnownMask known = new KnownMask(1, 3, new byte[]{1, 0, 1});

        Tensor damaged = DamageSimulator.makeDamagedView(source, known);

        assertArrayEquals(new float[]{
                0.1f, 0.2f, 0.3f,
                0f, 0f, 0f,
                0.7f, 0.8f, 0.9f}, damaged.data());
        assertEquals(0.5f, source.get(0, 1, 1), "source must stay untouched");
    }

    @Test
    void mismatchedMaskFailsFast() {
        Tensor source = Tensor.zeros(2, 2, 3);
        KnownMask known = KnownMask.allKnown(2, 3);
        assertThrows(IllegalArgumentException.class, () -> DamageSimulator.makeDamagedView(source, known));
    }
}
