package org.exquisite.service.geometry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.exquisite.model.dto.TileContract;
import org.exquisite.model.enums.GrowthMode;
import org.exquisite.util.RasterUtils;

import java.awt.image.BufferedImage;

/**
 * Glues a tile onto the canvas, optionally cross-fading canvas and tile inside the overlap strip.
 * Pixels outside the overlap strip always follow the hard glue contract.
 */
@Slf4j
@RequiredArgsConstructor
public class Stitcher {

    private final TileGeometry geometry;

    public BufferedImage glueWithFeather(BufferedImage canvas, BufferedImage tile, GrowthMode mode, int featherPx) {
        TileContract contract = geometry.getContract();
        int overlap = contract.getOverlap();
        if (featherPx <= 0 || overlap == 0) {
            return geometry.glue(canvas, tile, mode);
        }
        geometry.validateCanvas(canvas, mode);
        geometry.validateTile(tile);

        int feather = Math.max(1, Math.min(featherPx, overlap));
        int half = contract.half();
        int tileStart = geometry.tileRasterStart(mode, half - overlap, half);

        BufferedImage canvasStrip = geometry.canvasFrontierStrip(canvas, mode, overlap);
        BufferedImage tileStrip = RasterUtils.sliceAlong(RasterUtils.toRgb(tile), mode, tileStart, overlap);
        BufferedImage blended = blendStrips(canvasStrip, tileStrip, mode, feather);

        BufferedImage feathered = RasterUtils.copy(tile);
        RasterUtils.pasteAlong(feathered, blended, mode, tileStart);
        log.debug("Feathered {} px of the {} px overlap strip for {}", feather, overlap, mode.getValue());
        return geometry.glue(canvas, feathered, mode);
    }

    private BufferedImage blendStrips(BufferedImage canvasStrip, BufferedImage tileStrip, GrowthMode mode, int feather) {
        int thickness = mode.growthLength(tileStrip);
        int cross = mode.crossLength(tileStrip);
        BufferedImage out = RasterUtils.copy(tileStrip);
        for (int p = 0; p < thickness; p++) {
            int alpha = featherAlpha(thickness - 1 - p, feather);
            int r = mode.rasterIndex(thickness, p);
            for (int c = 0; c < cross; c++) {
                int x = mode.isHorizontal() ? r : c;
                int y = mode.isHorizontal() ? c : r;
                out.setRGB(x, y, mix(canvasStrip.getRGB(x, y), tileStrip.getRGB(x, y), alpha));
            }
        }
        return out;
    }

    /**
     * Tile weight at {@code seamDistance} pixels from the seam: 255 at the seam, falling linearly to 0
     * over {@code feather} pixels, 0 beyond.
     */
    static int featherAlpha(int seamDistance, int feather) {
        if (seamDistance >= feather) {
            return 0;
        }
        if (feather == 1) {
            return 255;
        }
        return (int) Math.round(255.0 * (feather - 1 - seamDistance) / (feather - 1));
    }

    static int mix(int canvasRgb, int tileRgb, int alpha) {
        int inverse = 255 - alpha;
        int r = (((canvasRgb >> 16) & 0xFF) * inverse + ((tileRgb >> 16) & 0xFF) * alpha + 127) / 255;
        int g = (((canvasRgb >> 8) & 0xFF) * inverse + ((tileRgb >> 8) & 0xFF) * alpha + 127) / 255;
        int b = ((canvasRgb & 0xFF) * inverse + (tileRgb & 0xFF) * alpha + 127) / 255;
        return (r << 16) | (g << 8) | b;
    }
}
