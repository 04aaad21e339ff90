package com.example.inpainting.dto;

/** Brush centre in pixel coordinates. */
public record BrushStroke(int x, int y) {
}
