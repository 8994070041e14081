package org.exquisite.model.dto;

import java.awt.image.BufferedImage;

public record CanvasSize(int width, int height) {

    public static CanvasSize of(BufferedImage image) {
        return new CanvasSize(image.getWidth(), image.getHeight());
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
