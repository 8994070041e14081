package org.exquisite.model.dto;

import org.exquisite.model.enums.MaskClass;

import java.awt.image.BufferedImage;

/**
 * Input pair for image-conditioned generators. The mask is single-channel: 255 marks pixels that must be
 * preserved, 0 pixels that may be regenerated, anything in between partial trust.
 */
public record ReferenceTile(BufferedImage reference, BufferedImage mask) {

    public MaskClass classify(int x, int y) {
        return MaskClass.of(mask.getRaster().getSample(x, y, 0));
    }
}
