package com.example.inpainting.core;

import java.util.Arrays;

/**
 * Caller-owned accumulator of brush strokes: 1 = marked as damaged, 0 = untouched.
 * Not thread-safe; one owner paints into it and then hands it to {@link MaskFactory}.
 */
public class PaintMask {

    private final int height;
    private final int width;
    private final byte[] painted;

    public PaintMask(int height, int width) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Dimensões inválidas: " + height + "x" + width);
        }
        this.height = height;
        this.width = width;
        this.painted = new byte[height * width];
    }

    /**
     * Builds an accumulator from an existing 0/1 buffer, e.g. one received over the wire.
     */
    public static PaintMask of(int height, int width, byte[] values) {
        PaintMask mask = new PaintMask(height, width);
        if (values == null || values.length != mask.painted.length) {
            throw new IllegalArgumentException("Tamanho da máscara pintada incorreto: esperado "
                    + mask.painted.length + ", recebido " + (values == null ? "null" : values.length));
        }
        for (int i = 0; i < values.length; i++) {
            if (values[i] != 0 && values[i] != 1) {
                throw new IllegalArgumentException("Valor de pintura inválido na posição " + i + ": " + values[i]);
            }
            mask.painted[i] = values[i];
        }
        return mask;
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public void mark(int x, int y) {
        if (x >= 0 && x < width && y >= 0 && y < height) {
            painted[y * width + x] = 1;
        }
    }

    /**
     * Stamps a filled disc of radius {@code brushSize / 2} centred on (cx, cy), clipped to the image.
     */
    public void paintDisc(int cx, int cy, int brushSize) {
        if (brushSize <= 0) {
            throw new IllegalArgumentException("Tamanho de pincel inválido: " + brushSize);
        }
        long radius = brushSize / 2;
        long r2 = radius * radius;
        long yFrom = Math.max(0, cy - radius);
        long yTo = Math.min(height - 1, cy + radius);
        long xFrom = Math.max(0, cx - radius);
        long xTo = Math.min(width - 1, cx + radius);
        if (yFrom > yTo || xFrom > xTo) {
            return;
        }
        int yMin = (int) yFrom;
        int yMax = (int) yTo;
        int xMin = (int) xFrom;
        int xMax = (int) xTo;
        for (int y = yMin; y <= yMax; y++) {
            long dy = (long) y - cy;
            for (int x = xMin; x <= xMax; x++) {
                long dx = (long) x - cx;
                if (dx * dx + dy * dy <= r2) {
                    painted[y * width + x] = 1;
                }
            }
        }
    }

    public void clear() {
        Arrays.fill(painted, (byte) 0);
    }

    public boolean isPainted(int pixel) {
        return painted[pixel] == 1;
    }

    public int length() {
        return painted.length;
    }

    public int paintedCount() {
        int count = 0;
        for (byte p : painted) {
            count += p;
        }
        return count;
    }
}
