package org.exquisite.service.generator;

import lombok.RequiredArgsConstructor;
import org.exquisite.model.dto.TileContract;
import org.exquisite.model.enums.GrowthMode;
import org.exquisite.service.geometry.TileGeometry;
import org.exquisite.util.HashUtils;
import org.exquisite.util.RasterUtils;

import java.awt.image.BufferedImage;

/**
 * Offline generator: the conditioning half is the band verbatim and the generated half is a gray
 * pattern seeded by the SHA-256 of {@code mode|stepIndex|prompt}. Same inputs, same tile.
 */
@RequiredArgsConstructor
public class DeterministicTileGenerator implements TileGenerator {

    private final TileGeometry geometry;

    @Override
    public BufferedImage generateTile(BufferedImage band, GrowthMode mode, String prompt, int stepIndex) {
        try {
            geometry.validateBand(band, mode);
        } catch (RuntimeException e) {
            throw GeneratorException.permanentFailure(e.getMessage());
        }
        TileContract contract = geometry.getContract();
        int size = contract.getTileSize();
        byte[] digest = HashUtils.sha256(mode.getValue() + "|" + stepIndex + "|" + prompt);

        BufferedImage tile = RasterUtils.blank(size, size);
        int[] row = new int[size];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                int b = digest[(x + 7 * y) % digest.length] & 0xFF;
                row[x] = (b << 16) | (b << 8) | b;
            }
            tile.setRGB(0, y, size, 1, row, 0, size);
        }
        RasterUtils.pasteAlong(tile, RasterUtils.toRgb(band), mode, geometry.tileRasterStart(mode, 0, contract.half()));
        return tile;
    }
}
