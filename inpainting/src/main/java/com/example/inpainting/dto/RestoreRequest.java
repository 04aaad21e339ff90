package com.example.inpainting.dto;

import java.util.List;

/**
 * Restoration job. {@code pixels} holds interleaved 8-bit RGB samples.
 * {@code maskMode} is {@code "manual"} (damage from {@code paintMask} and/or {@code strokes})
 * or {@code "random"} (damage drawn with {@code damagePercent}).
 * Null numeric fields fall back to the configured defaults.
 */
public record RestoreRequest(
        int width,
        int height,
        byte[] pixels,
        String maskMode,
        byte[] paintMask,
        List<BrushStroke> strokes,
        Integer brushSize,
        Double damagePercent,
        Integer maxIterations,
        Double tolerance,
        Double fidelityWeight,
        Double smoothnessWeight
) {
    public static final String MANUAL = "manual";
    public static final String RANDOM = "random";
}
