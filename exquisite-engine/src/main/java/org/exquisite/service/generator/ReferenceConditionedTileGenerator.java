package org.exquisite.service.generator;

import org.exquisite.model.dto.ReferenceTile;
import org.exquisite.model.enums.GrowthMode;

import java.awt.image.BufferedImage;

/**
 * Generator that edits a full-size reference image under a mask instead of working from the bare band.
 * Steps hand these generators a {@link ReferenceTile} built from the band.
 */
public interface ReferenceConditionedTileGenerator extends TileGenerator {

    BufferedImage generateFromReference(ReferenceTile reference, BufferedImage band, GrowthMode mode,
                                        String prompt, int stepIndex);

    @Override
    default boolean acceptsReference() {
        return true;
    }
}
