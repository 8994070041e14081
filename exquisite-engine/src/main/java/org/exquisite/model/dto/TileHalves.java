package org.exquisite.model.dto;

import java.awt.image.BufferedImage;

/**
 * A tile split at its midpoint: the half that must reflect the band and the freshly generated half.
 */
public record TileHalves(BufferedImage conditioning, BufferedImage generated) {
}
