package org.exquisite.service.geometry;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.exquisite.exception.ExquisiteError;
import org.exquisite.model.dto.CanvasSize;
import org.exquisite.model.dto.TileContract;
import org.exquisite.model.dto.TileHalves;
import org.exquisite.model.enums.GrowthMode;
import org.exquisite.util.RasterUtils;

import java.awt.image.BufferedImage;

/**
 * Placement conventions for growing a canvas one tile at a time.
 *
 * <p>Every position along the growth axis is expressed in oriented coordinates (0 on the side away from
 * the growth direction) and converted to raster coordinates through {@link GrowthMode#rasterStart}, so
 * the reverse modes are exact mirrors of the forward ones.</p>
 *
 * <p>Tile layout in oriented coordinates:</p>
 * <pre>
 *   0          keep         half              half+advance   tile
 *   |---keep---|--overlap---|----generated-----|...
 *   |<--- conditioning ---->|<--- new half ---------------->|
 *              |<-------- patch window ------->|
 * </pre>
 */
@Slf4j
@Getter
public class TileGeometry {

    private final TileContract contract;

    public TileGeometry(TileContract contract) {
        this.contract = contract.validate();
    }

    public void validateCanvas(BufferedImage canvas, GrowthMode mode) {
        int cross = mode.crossLength(canvas);
        if (cross != contract.getTileSize()) {
            throw ExquisiteError.DIMENSION_MISMATCH.createException(
                    "canvas " + CanvasSize.of(canvas) + " must be " + contract.getTileSize()
                            + " px across the growth axis for " + mode.getValue());
        }
    }

    public void validateTile(BufferedImage tile) {
        int size = contract.getTileSize();
        if (tile == null) {
            throw ExquisiteError.DIMENSION_MISMATCH.createException("tile is missing");
        }
        if (tile.getWidth() != size || tile.getHeight() != size) {
            throw ExquisiteError.DIMENSION_MISMATCH.createException(
                    "tile " + CanvasSize.of(tile) + " must be " + size + "x" + size);
        }
    }

    public void validateBand(BufferedImage band, GrowthMode mode) {
        CanvasSize expected = bandSize(mode);
        if (band == null || !expected.equals(CanvasSize.of(band))) {
            throw ExquisiteError.DIMENSION_MISMATCH.createException(
                    "band " + (band == null ? "missing" : CanvasSize.of(band)) + " must be " + expected
                            + " for " + mode.getValue());
        }
    }

    public CanvasSize bandSize(GrowthMode mode) {
        return mode.sizeOf(contract.getBandSize(), contract.getTileSize());
    }

    /**
     * Crops the {@code bandSize}-thick strip at the frontier of the canvas.
     */
    public BufferedImage extractBand(BufferedImage canvas, GrowthMode mode) {
        validateCanvas(canvas, mode);
        int growth = mode.growthLength(canvas);
        int bandSize = contract.getBandSize();
        if (growth < bandSize) {
            throw ExquisiteError.DIMENSION_MISMATCH.createException(
                    "canvas " + CanvasSize.of(canvas) + " is shorter than the " + bandSize + " px band along the growth axis");
        }
        int start = mode.rasterStart(growth, growth - bandSize, growth);
        return RasterUtils.sliceAlong(RasterUtils.toRgb(canvas), mode, start, bandSize);
    }

    /**
     * Splits at the midpoint regardless of overlap and advance.
     */
    public TileHalves splitTile(BufferedImage tile, GrowthMode mode) {
        validateTile(tile);
        BufferedImage rgb = RasterUtils.toRgb(tile);
        int size = contract.getTileSize();
        int half = contract.half();
        BufferedImage conditioning = RasterUtils.sliceAlong(rgb, mode, mode.rasterStart(size, 0, half), half);
        BufferedImage generated = RasterUtils.sliceAlong(rgb, mode, mode.rasterStart(size, half, size), size - half);
        return new TileHalves(conditioning, generated);
    }

    /**
     * Region of the tile that is pasted onto the canvas: the last {@code overlap} pixels of the
     * conditioning half followed by the first {@code advance} pixels of the generated half.
     */
    public BufferedImage patchWindow(BufferedImage tile, GrowthMode mode) {
        validateTile(tile);
        int start = tileRasterStart(mode, contract.half() - contract.getOverlap(), contract.half() + contract.getAdvance());
        return RasterUtils.sliceAlong(RasterUtils.toRgb(tile), mode, start, contract.patchLength());
    }

    public BufferedImage glue(BufferedImage canvas, BufferedImage tile, GrowthMode mode) {
        validateCanvas(canvas, mode);
        validateTile(tile);
        int growth = mode.growthLength(canvas);
        int overlap = contract.getOverlap();
        if (growth < overlap) {
            throw ExquisiteError.DIMENSION_MISMATCH.createException(
                    "canvas " + CanvasSize.of(canvas) + " is shorter than the " + overlap + " px overlap");
        }

        BufferedImage patch = patchWindow(tile, mode);
        CanvasSize next = expectedNextSize(canvas, mode);
        int nextGrowth = mode.growthLength(next);
        BufferedImage out = RasterUtils.blank(next.width(), next.height());

        int canvasOffset = mode.rasterStart(nextGrowth, 0, growth);
        int patchOffset = mode.rasterStart(nextGrowth, growth - overlap, growth + contract.getAdvance());
        RasterUtils.pasteAlong(out, RasterUtils.toRgb(canvas), mode, canvasOffset);
        RasterUtils.pasteAlong(out, patch, mode, patchOffset);

        log.debug("Glued {} patch of {} px at offset {} (canvas at {}): {} -> {}",
                mode.getValue(), contract.patchLength(), patchOffset, canvasOffset, CanvasSize.of(canvas), next);
        return out;
    }

    public CanvasSize expectedNextSize(BufferedImage canvas, GrowthMode mode) {
        return expectedNextSize(CanvasSize.of(canvas), mode);
    }

    public CanvasSize expectedNextSize(CanvasSize size, GrowthMode mode) {
        return mode.sizeOf(mode.growthLength(size) + contract.getAdvance(), mode.crossLength(size));
    }

    /**
     * Copy of the tile with the keep region of its conditioning half overwritten from the band.
     */
    public BufferedImage enforceKeep(BufferedImage tile, BufferedImage band, GrowthMode mode) {
        validateTile(tile);
        validateBand(band, mode);
        BufferedImage out = RasterUtils.copy(tile);
        int keep = contract.keep();
        if (keep == 0) {
            return out;
        }
        BufferedImage keepPixels = RasterUtils.sliceAlong(RasterUtils.toRgb(band), mode, bandRasterStart(mode, 0, keep), keep);
        RasterUtils.pasteAlong(out, keepPixels, mode, tileRasterStart(mode, 0, keep));
        return out;
    }

    /**
     * Whether the keep region of the conditioning half is pixel-identical to the same region of the band.
     */
    public boolean matchesBandIdentity(BufferedImage tile, BufferedImage band, GrowthMode mode) {
        validateTile(tile);
        validateBand(band, mode);
        int keep = contract.keep();
        if (keep == 0) {
            return true;
        }
        BufferedImage fromTile = RasterUtils.sliceAlong(RasterUtils.toRgb(tile), mode, tileRasterStart(mode, 0, keep), keep);
        BufferedImage fromBand = RasterUtils.sliceAlong(RasterUtils.toRgb(band), mode, bandRasterStart(mode, 0, keep), keep);
        return RasterUtils.pixelsEqual(fromTile, fromBand);
    }

    /**
     * The {@code thickness} pixels of the canvas closest to its frontier.
     */
    public BufferedImage canvasFrontierStrip(BufferedImage canvas, GrowthMode mode, int thickness) {
        int growth = mode.growthLength(canvas);
        return RasterUtils.sliceAlong(RasterUtils.toRgb(canvas), mode,
                mode.rasterStart(growth, growth - thickness, growth), thickness);
    }

    public int tileRasterStart(GrowthMode mode, int orientedStart, int orientedEnd) {
        return mode.rasterStart(contract.getTileSize(), orientedStart, orientedEnd);
    }

    public int bandRasterStart(GrowthMode mode, int orientedStart, int orientedEnd) {
        return mode.rasterStart(contract.getBandSize(), orientedStart, orientedEnd);
    }
}
