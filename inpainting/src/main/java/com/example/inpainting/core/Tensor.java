package com.example.inpainting.core;

import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.util.Arrays;

/**
 * Dense raster of normalized samples in [0,1], row-major with the channel as
 * the fastest-varying axis: {@code index = (y * width + x) * channels + c}.
 * <p>
 * Instances never share their buffer: every constructor and accessor copies.
 */
public final class Tensor {

    public static final int RGB_CHANNELS = 3;

    private final int height;
    private final int width;
    private final int channels;
    private final float[] data;

    public Tensor(int height, int width, int channels, float[] data) {
        if (height <= 0 || width <= 0 || channels <= 0) {
            throw new IllegalArgumentException(
                    "Dimensões inválidas: " + height + "x" + width + "x" + channels);
        }
        long expected = (long) height * width * channels;
        if (data == null || data.length != expected) {
            throw new IllegalArgumentException("Tamanho do buffer incorreto: esperado " + expected
                    + ", recebido " + (data == null ? "null" : data.length));
        }
        this.height = height;
        this.width = width;
        this.channels = channels;
        this.data = data.clone();
    }

    public static Tensor rgb(int height, int width, float[] data) {
        return new Tensor(height, width, RGB_CHANNELS, data);
    }

    public static Tensor zeros(int height, int width, int channels) {
        return new Tensor(height, width, channels, new float[height * width * channels]);
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public int channels() {
        return channels;
    }

    public int pixelCount() {
        return height * width;
    }

    public int index(int y, int x, int c) {
        return (y * width + x) * channels + c;
    }

    public float get(int y, int x, int c) {
        return data[index(y, x, c)];
    }

    /** Copy of the sample buffer. */
    public float[] data() {
        return data.clone();
    }

    public Tensor copy() {
        return new Tensor(height, width, channels, data);
    }

    public boolean sameShape(Tensor other) {
        return height == other.height && width == other.width && channels == other.channels;
    }

    /**
     * Samples as a {@code [height * width, channels]} double matrix, one row per pixel.
     */
    public INDArray toNdArray() {
        return Nd4j.createFromArray(data)
                .castTo(DataType.DOUBLE)
                .reshape(pixelCount(), channels);
    }

    // read-only view for package collaborators, never written through
    float[] buffer() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tensor other)) return false;
        return sameShape(other) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int result = 31 * height + width;
        result = 31 * result + channels;
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Tensor[" + height + "x" + width + "x" + channels + "]";
    }
}
