package com.project.image.anvil.DTOs;

/** One rendered style, PNG encoded. */
public record StyleResult(Style style, byte[] imageBytes, int width, int height) {
}
