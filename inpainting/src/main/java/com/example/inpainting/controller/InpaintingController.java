package com.example.inpainting.controller;

import com.example.inpainting.dto.ImageResult;
import com.example.inpainting.dto.ReconstructionResponse;
import com.example.inpainting.dto.RestoreRequest;
import com.example.inpainting.service.InpaintingService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.format.DateTimeFormatter;
import java.util.Locale;

@RestController
public class InpaintingController {

    private final InpaintingService inpaintingService;
    private final DateTimeFormatter formatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public InpaintingController(InpaintingService inpaintingService) {
        this.inpaintingService = inpaintingService;
    }

    @GetMapping("/ping")
    public ResponseEntity<String> ping() {
        return ResponseEntity.ok("OK");
    }

    @PostMapping(
            value = "/inpainting/restore",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<ReconstructionResponse> restore(@RequestBody RestoreRequest request) {
        return ResponseEntity.ok(inpaintingService.restore(request));
    }

    @PostMapping(
            value = "/inpainting/reconstruct",
            consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE
    )
    public ResponseEntity<byte[]> reconstruct(
            @RequestBody byte[] pixels,
            @RequestHeader("X-Largura") int width,
            @RequestHeader("X-Altura") int height,
            @RequestHeader(value = "X-Formato", defaultValue = "rgb") String format,
            @RequestHeader(value = "X-Dano", required = false) Double damagePercent,
            @RequestHeader(value = "X-Max-Iter", required = false) Integer maxIterations,
            @RequestHeader(value = "X-Tol", required = false) Double tolerance
    ) {
        boolean rgba = switch (format.trim().toLowerCase(Locale.ROOT)) {
            case "rgb" -> false;
            case "rgba" -> true;
            default -> throw new IllegalArgumentException("Formato de pixels desconhecido: " + format);
        };
        ImageResult result = inpaintingService.reconstruct(
                pixels, width, height, rgba, damagePercent, maxIterations, tolerance
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        headers.add("X-Algoritmo", result.algoritmo());
        headers.add("X-Inicio", result.startTime().format(formatter));
        headers.add("X-Fim", result.endTime().format(formatter));
        headers.add("X-Tamanho", result.tamanho());
        headers.add("X-Formato", rgba ? "rgba" : "rgb");
        headers.add("X-Iteracoes", String.valueOf(result.iteracoes()));
        headers.add("X-Desconhecidos", String.valueOf(result.pixelsDesconhecidos()));
        headers.add("X-Residuo", String.valueOf(result.residuoFinal()));
        headers.add("X-RMSE", String.valueOf(result.rmse()));
        headers.add("X-Tempo", String.valueOf(result.tempoSegundos()));
        headers.add("X-Cpu", String.format(Locale.ROOT, "%.1f", result.cpuPercent()));
        headers.add("X-Mem", String.format(Locale.ROOT, "%.1f", result.memPercent()));

        return ResponseEntity.ok()
                .headers(headers)
                .body(result.rgbData());
    }
}
