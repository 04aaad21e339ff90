package com.example.inpainting.service;

import com.example.inpainting.config.InpaintingProperties;
import com.example.inpainting.core.DamageSimulator;
import com.example.inpainting.core.KnownMask;
import com.example.inpainting.core.MaskFactory;
import com.example.inpainting.core.PaintMask;
import com.example.inpainting.core.PixelCodec;
import com.example.inpainting.core.ReconstructionEngine;
import com.example.inpainting.core.ReconstructionParameters;
import com.example.inpainting.core.ReconstructionResult;
import com.example.inpainting.core.Tensor;
import com.example.inpainting.dto.BrushStroke;
import com.example.inpainting.dto.ImageResult;
import com.example.inpainting.dto.ReconstructionResponse;
import com.example.inpainting.dto.RestoreRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import oshi.SystemInfo;
import oshi.hardware.CentralProcessor;
import oshi.hardware.GlobalMemory;

import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class InpaintingService {

    public static final String ALGORITHM = "gauss-seidel-sor";

    private static final Logger logger = LoggerFactory.getLogger(InpaintingService.class);

    private final ReconstructionEngine engine;
    private final MaskFactory maskFactory;
    private final InpaintingProperties properties;
    private final SystemInfo systemInfo;
    private final CentralProcessor processor;

    private final ReentrantLock cpuLock = new ReentrantLock();
    private long[] prevTicks;

    public InpaintingService(ReconstructionEngine engine, MaskFactory maskFactory, InpaintingProperties properties) {
        this.engine = engine;
        this.maskFactory = maskFactory;
        this.properties = properties;
        this.systemInfo = new SystemInfo();
        this.processor = systemInfo.getHardware().getProcessor();
        this.prevTicks = processor.getSystemCpuLoadTicks();
    }

    private record Run(Tensor damaged, KnownMask known, ReconstructionResult result,
                       double cpuPercent, double memPercent, long elapsedNanos) {
    }

    /**
     * Full pipeline for a JSON job: mask, damage, reconstruct, measure against the source.
     */
    public ReconstructionResponse restore(RestoreRequest request) {
        ZonedDateTime startTime = ZonedDateTime.now();
        Tensor source = PixelCodec.decodeRgb(request.pixels(), request.width(), request.height());

        KnownMask known;
        String maskMode = request.maskMode() == null ? "" : request.maskMode().trim().toLowerCase(Locale.ROOT);
        if (RestoreRequest.MANUAL.equals(maskMode)) {
            known = maskFactory.buildKnownMaskFromPaint(toPaintMask(request));
            logger.info("Máscara manual aplicada: {} pixels marcados como desconhecidos, {} conhecidos",
                    known.unknownCount(), known.knownCount());
        } else if (RestoreRequest.RANDOM.equals(maskMode)) {
            double damage = orDefault(request.damagePercent(), properties.damagePercent());
            known = maskFactory.buildRandomKnownMask(request.width(), request.height(), damage);
            logger.info("Dano aleatório: {}% ({} pixels desconhecidos, {} conhecidos)",
                    damage, known.unknownCount(), known.knownCount());
        } else {
            throw new IllegalArgumentException("Modo de máscara desconhecido: " + request.maskMode());
        }

        ReconstructionParameters defaults = properties.defaultParameters();
        ReconstructionParameters parameters = new ReconstructionParameters(
                orDefault(request.maxIterations(), defaults.maxIterations()),
                orDefault(request.tolerance(), defaults.tolerance()),
                orDefault(request.fidelityWeight(), defaults.fidelityWeight()),
                orDefault(request.smoothnessWeight(), defaults.smoothnessWeight()));

        Run run = run(source, known, parameters);
        ZonedDateTime endTime = ZonedDateTime.now();

        return new ReconstructionResponse(
                ALGORITHM,
                maskMode,
                startTime,
                endTime,
                run.elapsedNanos() / 1_000_000,
                source.width() + "x" + source.height(),
                run.known().unknownCount(),
                run.result().iterations(),
                run.result().residuals(),
                run.result().rmse(),
                run.cpuPercent(),
                run.memPercent(),
                PixelCodec.encodeRgb(run.damaged()),
                PixelCodec.encodeRgb(run.result().reconstructed())
        );
    }

    /**
     * Raw 8-bit job with random damage; the reconstruction is returned in the input layout.
     *
     * @param rgba true for 4 samples per pixel (alpha ignored, written back opaque), false for RGB
     */
    public ImageResult reconstruct(byte[] pixels, int width, int height, boolean rgba, Double damagePercent,
                                   Integer maxIterations, Double tolerance) {
        logger.info("Iniciando reconstrução. Tamanho={}x{}, Formato={}, Dano={}, MaxIter={}, Tol={}",
                width, height, rgba ? "rgba" : "rgb", damagePercent, maxIterations, tolerance);
        LocalDateTime startTime = LocalDateTime.now();

        Tensor source = rgba
                ? PixelCodec.decodeRgba(pixels, width, height)
                : PixelCodec.decodeRgb(pixels, width, height);
        double damage = orDefault(damagePercent, properties.damagePercent());
        KnownMask known = maskFactory.buildRandomKnownMask(width, height, damage);

        ReconstructionParameters defaults = properties.defaultParameters();
        ReconstructionParameters parameters = new ReconstructionParameters(
                orDefault(maxIterations, defaults.maxIterations()),
                orDefault(tolerance, defaults.tolerance()),
                defaults.fidelityWeight(),
                defaults.smoothnessWeight());

        Run run = run(source, known, parameters);
        LocalDateTime endTime = LocalDateTime.now();

        Tensor reconstructed = run.result().reconstructed();
        return new ImageResult(
                rgba ? PixelCodec.encodeRgba(reconstructed) : PixelCodec.encodeRgb(reconstructed),
                ALGORITHM,
                width + "x" + height,
                run.result().iterations(),
                known.unknownCount(),
                run.result().finalResidual(),
                run.result().rmse(),
                run.elapsedNanos() / 1_000_000_000.0,
                run.cpuPercent(),
                run.memPercent(),
                startTime,
                endTime
        );
    }

    private Run run(Tensor source, KnownMask known, ReconstructionParameters parameters) {
        if (known.unknownCount() == 0) {
            logger.warn("Nenhum pixel desconhecido; a reconstrução devolverá a imagem original.");
        }
        long startNanos = System.nanoTime();

        Tensor damaged = DamageSimulator.makeDamagedView(source, known);
        ReconstructionResult result = engine.reconstruct(damaged, known, parameters, source);

        long elapsed = System.nanoTime() - startNanos;
        double cpuPercent = getCpuUsage();
        GlobalMemory memory = systemInfo.getHardware().getMemory();
        double memPercent = (memory.getTotal() - memory.getAvailable()) * 100.0 / memory.getTotal();

        logger.info("Reconstrução concluída: {} iterações, RMSE={}, tempo={} ms",
                result.iterations(), String.format("%.4f", result.rmse()), elapsed / 1_000_000);
        return new Run(damaged, known, result, cpuPercent, memPercent, elapsed);
    }

    private PaintMask toPaintMask(RestoreRequest request) {
        PaintMask paint = request.paintMask() != null
                ? PaintMask.of(request.height(), request.width(), request.paintMask())
                : new PaintMask(request.height(), request.width());
        if (request.strokes() != null) {
            int brush = orDefault(request.brushSize(), properties.brushSize());
            for (BrushStroke stroke : request.strokes()) {
                paint.paintDisc(stroke.x(), stroke.y(), brush);
            }
        }
        return paint;
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    private double getCpuUsage() {
        cpuLock.lock();
        try {
            double load = processor.getSystemCpuLoadBetweenTicks(this.prevTicks) * 100.0;
            this.prevTicks = processor.getSystemCpuLoadTicks();
            return load;
        } finally {
            cpuLock.unlock();
        }
    }
}
