package org.exquisite.util;

import lombok.experimental.UtilityClass;
import org.exquisite.model.enums.GrowthMode;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Arrays;

@UtilityClass
public class RasterUtils {

    public BufferedImage blank(int width, int height) {
        return new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    }

    public BufferedImage filled(int width, int height, int rgb) {
        BufferedImage image = blank(width, height);
        int[] row = new int[width];
        Arrays.fill(row, rgb & 0xFFFFFF);
        for (int y = 0; y < height; y++) {
            image.setRGB(0, y, width, 1, row, 0, width);
        }
        return image;
    }

    /**
     * Returns the image itself when it already is packed RGB, otherwise an RGB copy.
     */
    public BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = blank(image.getWidth(), image.getHeight());
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    public BufferedImage copy(BufferedImage image) {
        return crop(image, 0, 0, image.getWidth(), image.getHeight());
    }

    /**
     * Detached copy of a rectangle; unlike {@link BufferedImage#getSubimage} the result shares no raster.
     */
    public BufferedImage crop(BufferedImage image, int x, int y, int width, int height) {
        if (x < 0 || y < 0 || width < 0 || height < 0
                || x + width > image.getWidth() || y + height > image.getHeight()) {
            throw new IllegalArgumentException("Crop " + width + "x" + height + "+" + x + "+" + y
                    + " outside " + image.getWidth() + "x" + image.getHeight());
        }
        BufferedImage out = blank(width, height);
        if (width == 0 || height == 0) {
            return out;
        }
        int[] pixels = image.getRGB(x, y, width, height, null, 0, width);
        out.setRGB(0, 0, width, height, pixels, 0, width);
        return out;
    }

    public void paste(BufferedImage target, BufferedImage source, int x, int y) {
        int width = source.getWidth();
        int height = source.getHeight();
        if (x < 0 || y < 0 || x + width > target.getWidth() || y + height > target.getHeight()) {
            throw new IllegalArgumentException("Paste " + width + "x" + height + "+" + x + "+" + y
                    + " outside " + target.getWidth() + "x" + target.getHeight());
        }
        if (width == 0 || height == 0) {
            return;
        }
        int[] pixels = source.getRGB(0, 0, width, height, null, 0, width);
        target.setRGB(x, y, width, height, pixels, 0, width);
    }

    /**
     * Cuts a slab spanning the full cross axis, {@code length} pixels thick from raster coordinate
     * {@code start} along the growth axis of {@code mode}.
     */
    public BufferedImage sliceAlong(BufferedImage image, GrowthMode mode, int start, int length) {
        return mode.isHorizontal()
                ? crop(image, start, 0, length, image.getHeight())
                : crop(image, 0, start, image.getWidth(), length);
    }

    public void pasteAlong(BufferedImage target, BufferedImage source, GrowthMode mode, int offset) {
        if (mode.isHorizontal()) {
            paste(target, source, offset, 0);
        } else {
            paste(target, source, 0, offset);
        }
    }

    public boolean pixelsEqual(BufferedImage a, BufferedImage b) {
        if (a.getWidth() != b.getWidth() || a.getHeight() != b.getHeight()) {
            return false;
        }
        int width = a.getWidth();
        int[] rowA = new int[width];
        int[] rowB = new int[width];
        for (int y = 0; y < a.getHeight(); y++) {
            a.getRGB(0, y, width, 1, rowA, 0, width);
            b.getRGB(0, y, width, 1, rowB, 0, width);
            for (int x = 0; x < width; x++) {
                if ((rowA[x] & 0xFFFFFF) != (rowB[x] & 0xFFFFFF)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * ITU-R 601 luminance scaled to [0, 1].
     */
    public float luminance(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return (0.299f * r + 0.587f * g + 0.114f * b) / 255f;
    }
}
