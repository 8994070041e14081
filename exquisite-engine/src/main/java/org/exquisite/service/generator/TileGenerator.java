package org.exquisite.service.generator;

import org.exquisite.model.enums.GrowthMode;

import java.awt.image.BufferedImage;

/**
 * External collaborator that turns a band into a full square tile whose conditioning half sits on
 * the side of the tile facing away from the growth direction.
 */
public interface TileGenerator {

    /**
     * @throws GeneratorException when no tile can be produced; the kind decides whether a retry makes sense
     */
    BufferedImage generateTile(BufferedImage band, GrowthMode mode, String prompt, int stepIndex);

    /**
     * Whether steps should build a reference tile and call
     * {@link ReferenceConditionedTileGenerator#generateFromReference} instead.
     */
    default boolean acceptsReference() {
        return false;
    }
}
