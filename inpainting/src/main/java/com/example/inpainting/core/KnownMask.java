package com.example.inpainting.core;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.util.Arrays;

/**
 * Per-pixel classification aligned with {@code y * width + x}: 1 = known (fixed), 0 = unknown (to fill).
 * Each flag governs every channel of its pixel.
 */
public final class KnownMask {

    public static final byte KNOWN = 1;
    public static final byte UNKNOWN = 0;

    private final int height;
    private final int width;
    private final byte[] flags;

    public KnownMask(int height, int width, byte[] flags) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Dimensões inválidas: " + height + "x" + width);
        }
        if (flags == null || flags.length != height * width) {
            throw new IllegalArgumentException("Tamanho da máscara incorreto: esperado " + (height * width)
                    + ", recebido " + (flags == null ? "null" : flags.length));
        }
        for (int i = 0; i < flags.length; i++) {
            if (flags[i] != KNOWN && flags[i] != UNKNOWN) {
                throw new IllegalArgumentException("Valor de máscara inválido na posição " + i + ": " + flags[i]);
            }
        }
        this.height = height;
        this.width = width;
        this.flags = flags.clone();
    }

    public static KnownMask allKnown(int height, int width) {
        byte[] flags = new byte[height * width];
        Arrays.fill(flags, KNOWN);
        return new KnownMask(height, width, flags);
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public int length() {
        return flags.length;
    }

    public boolean isKnown(int pixel) {
        return flags[pixel] == KNOWN;
    }

    public boolean isKnown(int y, int x) {
        return flags[y * width + x] == KNOWN;
    }

    public int unknownCount() {
        int count = 0;
        for (byte f : flags) {
            if (f == UNKNOWN) count++;
        }
        return count;
    }

    public int knownCount() {
        return flags.length - unknownCount();
    }

    public byte[] flags() {
        return flags.clone();
    }

    /**
     * Fails fast when the mask does not cover the tensor pixel for pixel.
     */
    public void requireMatches(Tensor tensor) {
        if (tensor.height() != height || tensor.width() != width) {
            throw new IllegalArgumentException("Máscara " + height + "x" + width
                    + " incompatível com tensor " + tensor.height() + "x" + tensor.width());
        }
    }

    /**
     * Column vector {@code [height * width, 1]} holding 1.0 where the pixel is unknown.
     */
    INDArray unknownIndicator() {
        double[] column = new double[flags.length];
        for (int i = 0; i < flags.length; i++) {
            column[i] = flags[i] == UNKNOWN ? 1.0 : 0.0;
        }
        return Nd4j.createFromArray(column).reshape(flags.length, 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KnownMask other)) return false;
        return height == other.height && width == other.width && Arrays.equals(flags, other.flags);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * height + width) + Arrays.hashCode(flags);
    }

    @Override
    public String toString() {
        return "KnownMask[" + height + "x" + width + ", unknown=" + unknownCount() + "]";
    }
}
