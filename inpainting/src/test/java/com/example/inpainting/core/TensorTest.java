package com.example.inpainting.core;

import org.junit.jupiter.api.Test;
import org.nd4j.linalg.api.ndarray.INDArray;

import static org.junit.jupiter.api.Assertions.*;

class TensorTest {

    @Test
    void layoutIsRowMajorChannelMinor() {
        float[] data = new float[2 * 3 * 3];
        for (int i = 0; i < data.length; i++) {
            data[i] = i / 100f;
        }
        Tensor t = Tensor.rgb(2, 3, data);

        assertEquals((1 * 3 + 2) * 3 + 1, t.index(1, 2, 1));
        assertEquals(data[t.index(1, 2, 1)], t.get(1, 2, 1));
        assertEquals(6, t.pixelCount());
    }

    @Test
    void bufferLengthMustMatchShape() {
        assertThrows(IllegalArgumentException.class, () -> new Tensor(2, 2, 3, new float[11]));
        assertThrows(IllegalArgumentException.class, () -> new Tensor(0, 2, 3, new float[0]));
        assertThrows(IllegalArgumentException.class, () -> new Tensor(2, 2, 3, null));
    }

    @Test
    void copiesAreDeep() {
        float[] data = {0.1f, 0.2f, 0.3f};
        Tensor t = Tensor.rgb(1, 1, data);
        data[0] = 0.9f;
        assertEquals(0.1f, t.get(0, 0, 0), "constructor must copy the input");

        float[] out = t.data();
        out[1] = 0.9f;
        assertEquals(0.2f, t.get(0, 0, 1), "data() must hand out a copy");

        Tensor copy = t.copy();
        assertEquals(t, copy);
        assertNotSame(t.buffer(), copy.buffer());
    }

    @Test
    void ndArrayViewHasOneRowPerPixel() {
        Tensor t = Tensor.rgb(1, 2, new float[]{0f, 0.5f, 1f, 0.25f, 0.75f, 0f});
        INDArray m = t.toNdArray();

        assertArrayEquals(new long[]{2, 3}, m.shape());
        assertEquals(0.25, m.getDouble(1, 0), 1e-7);
        assertEquals(1.0, m.getDouble(0, 2), 1e-7);
    }
}
