package com.example.inpainting.controller;

import com.example.inpainting.core.exceptions.EmptyMaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EmptyMaskException.class)
    public ResponseEntity<Map<String, String>> emptyMask(EmptyMaskException e) {
        logger.warn("Pedido recusado: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("erro", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        logger.warn("Parâmetros inválidos: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(Map.of("erro", e.getMessage()));
    }
}
