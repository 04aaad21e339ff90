package com.example.inpainting.dto;

import java.time.LocalDateTime;

public record ImageResult(
        byte[] rgbData,
        String algoritmo,
        String tamanho,
        int iteracoes,
        int pixelsDesconhecidos,
        double residuoFinal,
        double rmse,
        double tempoSegundos,
        double cpuPercent,
        double memPercent,
        LocalDateTime startTime,
        LocalDateTime endTime
) {}
