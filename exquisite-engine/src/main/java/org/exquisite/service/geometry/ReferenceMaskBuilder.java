package org.exquisite.service.geometry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.exquisite.config.ExquisiteProperties;
import org.exquisite.model.dto.ReferenceTile;
import org.exquisite.model.dto.TileContract;
import org.exquisite.model.enums.GrowthMode;
import org.exquisite.model.enums.MaskStyle;
import org.exquisite.util.RasterUtils;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;
import java.awt.image.WritableRaster;
import java.util.Arrays;

/**
 * Packages a band for generators that take a full-size reference image plus an edit mask.
 *
 * <p>Only the keep region is marked must-preserve. The overlap strip is either editable or ramps from
 * preserve toward free at the seam, and the generated half is editable. The optional scaffold and
 * continuation cue only touch the reference pixels, never the mask.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ReferenceMaskBuilder {

    public static final int PRESERVE = 255;
    public static final int EDITABLE = 0;

    private final TileGeometry geometry;
    private final ExquisiteProperties.Reference options;

    public ReferenceTile build(BufferedImage band, GrowthMode mode) {
        geometry.validateBand(band, mode);
        TileContract contract = geometry.getContract();
        int size = contract.getTileSize();
        int half = contract.half();

        BufferedImage rgbBand = RasterUtils.toRgb(band);
        BufferedImage reference = RasterUtils.filled(size, size, options.getBackgroundRgb());
        RasterUtils.pasteAlong(reference, rgbBand, mode, geometry.tileRasterStart(mode, 0, half));

        BufferedImage mask = new BufferedImage(size, size, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster maskRaster = mask.getRaster();
        for (int p = 0; p < half; p++) {
            int value = maskValue(p, contract);
            if (value != EDITABLE) {
                fillLine(maskRaster, mode, mode.rasterIndex(size, p), size, value);
            }
        }

        if (options.isScaffold()) {
            paintScaffold(reference, rgbBand, mode, contract);
        }
        if (options.isContinuationCue()) {
            paintContinuationCue(reference, mode, contract);
        }
        log.debug("Built {} reference tile (mask style {}, scaffold {}, cue {})",
                mode.getValue(), options.getMaskStyle(), options.isScaffold(), options.isContinuationCue());
        return new ReferenceTile(reference, mask);
    }

    /**
     * Mask value at oriented position {@code p} inside the conditioning half.
     */
    int maskValue(int p, TileContract contract) {
        int keep = contract.keep();
        if (p < keep) {
            return PRESERVE;
        }
        if (options.getMaskStyle() == MaskStyle.HARD) {
            return EDITABLE;
        }
        int seamDistance = contract.half() - 1 - p;
        return (int) Math.round(255.0 * seamDistance / contract.getOverlap());
    }

    private void paintScaffold(BufferedImage reference, BufferedImage band, GrowthMode mode, TileContract contract) {
        BufferedImage prior = lowFrequency(band);
        int size = contract.getTileSize();
        int half = contract.half();
        int bandSize = contract.getBandSize();
        for (int k = 0; k < size - half; k++) {
            int sourceRaster = mode.rasterIndex(bandSize, Math.max(0, half - 1 - k));
            int targetRaster = mode.rasterIndex(size, half + k);
            copyLine(prior, sourceRaster, reference, targetRaster, mode, size);
        }
    }

    private void paintContinuationCue(BufferedImage reference, GrowthMode mode, TileContract contract) {
        int size = contract.getTileSize();
        int boundary = contract.keep();
        for (int t = 0; t < options.getCueThicknessPx(); t++) {
            int p = boundary - options.getCueOffsetPx() - 1 - t;
            if (p < 0 || p >= boundary) {
                continue;
            }
            int r = mode.rasterIndex(size, p);
            for (int c = 0; c < size; c++) {
                int x = mode.isHorizontal() ? r : c;
                int y = mode.isHorizontal() ? c : r;
                reference.setRGB(x, y, darken(reference.getRGB(x, y)));
            }
        }
    }

    private BufferedImage lowFrequency(BufferedImage band) {
        int factor = Math.max(1, options.getScaffoldDownsample());
        int smallWidth = Math.max(1, band.getWidth() / factor);
        int smallHeight = Math.max(1, band.getHeight() / factor);
        BufferedImage small = resample(band, smallWidth, smallHeight);
        BufferedImage restored = resample(small, band.getWidth(), band.getHeight());

        int radius = Math.max(0, options.getScaffoldBlurRadius());
        if (radius == 0) {
            return restored;
        }
        int side = 2 * radius + 1;
        float[] weights = new float[side * side];
        Arrays.fill(weights, 1f / weights.length);
        ConvolveOp blur = new ConvolveOp(new Kernel(side, side, weights), ConvolveOp.EDGE_NO_OP, null);
        return RasterUtils.toRgb(blur.filter(restored, null));
    }

    private static BufferedImage resample(BufferedImage source, int width, int height) {
        BufferedImage out = RasterUtils.blank(width, height);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static void fillLine(WritableRaster raster, GrowthMode mode, int r, int cross, int value) {
        for (int c = 0; c < cross; c++) {
            if (mode.isHorizontal()) {
                raster.setSample(r, c, 0, value);
            } else {
                raster.setSample(c, r, 0, value);
            }
        }
    }

    private static void copyLine(BufferedImage source, int sourceRaster, BufferedImage target, int targetRaster,
                                 GrowthMode mode, int cross) {
        for (int c = 0; c < cross; c++) {
            int rgb = mode.isHorizontal() ? source.getRGB(sourceRaster, c) : source.getRGB(c, sourceRaster);
            if (mode.isHorizontal()) {
                target.setRGB(targetRaster, c, rgb);
            } else {
                target.setRGB(c, targetRaster, rgb);
            }
        }
    }

    private static int darken(int rgb) {
        int r = ((rgb >> 16) & 0xFF) / 2;
        int g = ((rgb >> 8) & 0xFF) / 2;
        int b = (rgb & 0xFF) / 2;
        return (r << 16) | (g << 8) | b;
    }
}
