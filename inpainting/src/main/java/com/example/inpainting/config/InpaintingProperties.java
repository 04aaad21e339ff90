package com.example.inpainting.config;

import com.example.inpainting.core.ReconstructionParameters;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults applied when a request leaves a parameter out.
 *
 * @param seed fixed seed for random damage; unset means a fresh random source
 */
@ConfigurationProperties(prefix = "inpainting")
public record InpaintingProperties(
        int maxIterations,
        double tolerance,
        double fidelityWeight,
        double smoothnessWeight,
        double damagePercent,
        int brushSize,
        Long seed
) {
    public ReconstructionParameters defaultParameters() {
        return new ReconstructionParameters(maxIterations, tolerance, fidelityWeight, smoothnessWeight);
    }
}
