package com.example.inpainting.dto;

import java.time.ZonedDateTime;

public record ReconstructionResponse(String algorithmUsed,
    String maskMode,
    ZonedDateTime startTime,
    ZonedDateTime endTime,
    long reconstructionTimeMs,
    String pixelSize,
    int unknownPixels,
    int iterationsExecuted,
    double[] residuals,
    double rmse,
    double cpuPercent,
    double memPercent,
    byte[] damagedImage,
    byte[] imageReconstructed) {
}
