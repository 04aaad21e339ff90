package com.example.inpainting.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PaintMaskTest {

    @Test
    void discStampCoversPixelsWithinRadius() {
        PaintMask paint = new PaintMask(11, 11);
        paint.paintDisc(5, 5, 5);

        // radius 2: 13 lattice points with dx^2 + dy^2 <= 4
        assertEquals(13, paint.paintedCount());
        assertTrue(paint.isPainted(5 * 11 + 7));
        assertFalse(paint.isPainted(7 * 11 + 7));
    }

    @Test
    void discIsClippedAtImageBorder() {
        PaintMask paint = new PaintMask(4, 4);
        paint.paintDisc(0, 0, 3);

        // radius 1 around the corner leaves the centre, right and lower neighbours
        assertEquals(3, paint.paintedCount());
    }

    @Test
    void brushOfOnePaintsSinglePixel() {
        PaintMask paint = new PaintMask(3, 3);
        paint.paintDisc(1, 1, 1);
        assertEquals(1, paint.paintedCount());
    }

    @Test
    void strokesAccumulateUntilCleared() {
        PaintMask paint = new PaintMask(5, 5);
        paint.mark(0, 0);
        paint.mark(4, 4);
        paint.mark(4, 4);
        paint.mark(9, 9);
        assertEquals(2, paint.paintedCount());

        paint.clear();
        assertEquals(0, paint.paintedCount());
    }

    @Test
    void ofRejectsNonBinaryValues() {
        assertThrows(IllegalArgumentException.class, () -> PaintMask.of(1, 2, new byte[]{0, 2}));
        assertThrows(IllegalArgumentException.class, () -> PaintMask.of(1, 2, new byte[]{0}));
    }

    @Test
    void brushLargerThanImageCoversEveryPixel() {
        PaintMask paint = new PaintMask(3, 3);
        paint.paintDisc(1, 1, 92682);
        assertEquals(9, paint.paintedCount(), "radius beyond sqrt(Integer.MAX_VALUE) must still paint");
    }

    @Test
    void hugeBrushCostIsBoundedByImageSize() {
        PaintMask paint = new PaintMask(4, 5);
        assertTimeoutPreemptively(Duration.ofSeconds(2), () -> paint.paintDisc(2, 2, Integer.MAX_VALUE));
        assertEquals(20, paint.paintedCount());
    }

    @Test
    void discCentredOutsideImageOnlyPaintsOverlap() {
        PaintMask paint = new PaintMask(4, 4);
        paint.paintDisc(-2, 1, 5);
        // radius 2 reaches only column 0 at the centre row
        assertEquals(1, paint.paintedCount());
        assertTrue(paint.isPainted(1 * 4));

        paint.paintDisc(100, 100, 5);
        assertEquals(1, paint.paintedCount());
    }

    @Test
    void hugeBrushFarOutsideImagePaintsNothing() {
        PaintMask paint = new PaintMask(3, 3);
        paint.paintDisc(Integer.MIN_VALUE, Integer.MIN_VALUE, Integer.MAX_VALUE);
        paint.paintDisc(Integer.MAX_VALUE, 1, Integer.MAX_VALUE);
        assertEquals(0, paint.paintedCount());
    }

    @Test
    void nonPositiveBrushIsRejected() {
        PaintMask paint = new PaintMask(3, 3);
        assertThrows(IllegalArgumentException.class, () -> paint.paintDisc(1, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> paint.paintDisc(1, 1, -4));
    }
}
