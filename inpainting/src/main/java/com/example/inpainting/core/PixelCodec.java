package com.example.inpainting.core;

/**
 * Conversion between interleaved 8-bit samples and normalized tensors.
 */
public final class PixelCodec {

    private static final int RGBA = 4;

    private PixelCodec() {
    }

    public static Tensor decodeRgb(byte[] rgb, int width, int height) {
        return decode(rgb, width, height, Tensor.RGB_CHANNELS);
    }

    /** Alpha is dropped. */
    public static Tensor decodeRgba(byte[] rgba, int width, int height) {
        return decode(rgba, width, height, RGBA);
    }

    public static byte[] encodeRgb(Tensor tensor) {
        return encode(tensor, false);
    }

    /** Alpha is written as fully opaque. */
    public static byte[] encodeRgba(Tensor tensor) {
        return encode(tensor, true);
    }

    public static int toByte(float sample) {
        long v = Math.round(sample * 255.0);
        return (int) Math.max(0, Math.min(255, v));
    }

    private static Tensor decode(byte[] raw, int width, int height, int stride) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensões inválidas: " + width + "x" + height);
        }
        int pixels = width * height;
        if (raw == null || raw.length != pixels * stride) {
            throw new IllegalArgumentException("Tamanho incorreto do buffer de pixels: esperado " + (pixels * stride)
                    + ", recebido " + (raw == null ? "null" : raw.length));
        }
        int c = Tensor.RGB_CHANNELS;
        float[] data = new float[pixels * c];
        for (int i = 0; i < pixels; i++) {
            for (int k = 0; k < c; k++) {
                data[i * c + k] = (raw[i * stride + k] & 0xFF) / 255f;
            }
        }
        return Tensor.rgb(height, width, data);
    }

    private static byte[] encode(Tensor tensor, boolean alpha) {
        if (tensor.channels() != Tensor.RGB_CHANNELS) {
            throw new IllegalArgumentException("Esperado tensor RGB, recebido " + tensor);
        }
        int pixels = tensor.pixelCount();
        int stride = alpha ? RGBA : Tensor.RGB_CHANNELS;
        float[] data = tensor.buffer();
        byte[] out = new byte[pixels * stride];
        for (int i = 0; i < pixels; i++) {
            for (int k = 0; k < Tensor.RGB_CHANNELS; k++) {
                out[i * stride + k] = (byte) toByte(data[i * Tensor.RGB_CHANNELS + k]);
            }
            if (alpha) {
                out[i * stride + 3] = (byte) 255;
            }
        }
        return out;
    }
}
