package com.example.inpainting.config;

import com.example.inpainting.core.MaskFactory;
import com.example.inpainting.core.ReconstructionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
public class InpaintingConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(InpaintingConfiguration.class);

    @Bean
    public ReconstructionEngine reconstructionEngine() {
        return new ReconstructionEngine();
    }

    @Bean
    public MaskFactory maskFactory(InpaintingProperties properties) {
        if (properties.seed() != null) {
            logger.info("Dano aleatório com semente fixa {}", properties.seed());
            return new MaskFactory(new Random(properties.seed()));
        }
        return new MaskFactory(new Random());
    }
}
