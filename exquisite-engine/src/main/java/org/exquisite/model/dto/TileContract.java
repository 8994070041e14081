package org.exquisite.model.dto;

import lombok.Builder;
import lombok.Value;
import org.exquisite.exception.ExquisiteError;

/**
 * Geometry of one growth step.
 *
 * <p>The generator always receives half context and returns half new content. Of the conditioning half,
 * the far {@link #keep()} pixels are trusted verbatim and the {@code overlap} pixels nearest the seam are
 * discarded for blending; {@code advance} pixels of the generated half become new canvas.</p>
 */
@Value
@Builder(toBuilder = true)
public class TileContract {

    public static final int DEFAULT_TILE_SIZE = 1024;
    public static final int DEFAULT_BAND_SIZE = 512;
    public static final int DEFAULT_OVERLAP = 256;
    public static final int DEFAULT_ADVANCE = 512;

    @Builder.Default
    int tileSize = DEFAULT_TILE_SIZE;
    @Builder.Default
    int bandSize = DEFAULT_BAND_SIZE;
    @Builder.Default
    int overlap = DEFAULT_OVERLAP;
    @Builder.Default
    int advance = DEFAULT_ADVANCE;

    public static TileContract defaults() {
        return TileContract.builder().build();
    }

    public int half() {
        return tileSize / 2;
    }

    public int keep() {
        return half() - overlap;
    }

    public int patchLength() {
        return overlap + advance;
    }

    public TileContract validate() {
        if (tileSize < 2 || tileSize % 2 != 0) {
            throw ExquisiteError.INVALID_CONTRACT.createException("tile size must be a positive even number, got " + tileSize);
        }
        if (bandSize != half()) {
            throw ExquisiteError.INVALID_CONTRACT.createException("band size " + bandSize + " must equal half the tile (" + half() + ")");
        }
        if (overlap < 0 || overlap >= half()) {
            throw ExquisiteError.INVALID_CONTRACT.createException("overlap " + overlap + " outside [0, " + half() + ")");
        }
        if (advance < 1 || advance > half()) {
            throw ExquisiteError.INVALID_CONTRACT.createException("advance " + advance + " outside [1, " + half() + "]");
        }
        return this;
    }
}
