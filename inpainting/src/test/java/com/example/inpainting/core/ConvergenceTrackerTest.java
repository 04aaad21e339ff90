package com.example.inpainting.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConvergenceTrackerTest {

    @Test
    void stopsOnceResidualFallsBelowTolerance() {
        ConvergenceTracker tracker = new ConvergenceTracker(0.01);
        assertFalse(tracker.record(0.5));
        assertFalse(tracker.record(0.01), "residual equal to tolerance does not stop");
        assertTrue(tracker.record(0.009));

        assertEquals(3, tracker.iterations());
        assertTrue(tracker.converged());
        assertArrayEquals(new double[]{0.5, 0.01, 0.009}, tracker.residuals());
    }

    @Test
    void growsPastInitialCapacity() {
        ConvergenceTracker tracker = new ConvergenceTracker(0);
        for (int i = 0; i < 100; i++) {
            tracker.record(1.0 / (i + 1));
        }
        assertEquals(100, tracker.residuals().length);
        assertEquals(0.01, tracker.residuals()[99], 1e-12);
        assertFalse(tracker.converged());
    }

    @Test
    void emptyTrackerHasNotConverged() {
        ConvergenceTracker tracker = new ConvergenceTracker(1);
        assertEquals(0, tracker.iterations());
        assertFalse(tracker.converged());
    }
}
