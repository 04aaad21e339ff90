package com.example.inpainting.core.exceptions;

public class EmptyMaskException extends RuntimeException {
    public EmptyMaskException(String message) {
        super("Máscara vazia: " + message);
    }
}
