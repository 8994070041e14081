package org.exquisite.model.dto;

import org.exquisite.exception.ExquisiteError;
import org.exquisite.model.enums.GeneratorFailureKind;

import java.awt.image.BufferedImage;

/**
 * A generator answer for one candidate slot: a tile, or the reason there is none.
 */
public record CandidateTile(int index,
                            BufferedImage tile,
                            GeneratorFailureKind failureKind,
                            ExquisiteError failureError,
                            String failureReason) {

    public static CandidateTile of(int index, BufferedImage tile) {
        return new CandidateTile(index, tile, null, null, null);
    }

    public static CandidateTile generatorFailure(int index, GeneratorFailureKind kind, String reason) {
        return new CandidateTile(index, null, kind, null, reason);
    }

    public static CandidateTile rejected(int index, BufferedImage tile, ExquisiteError error, String reason) {
        return new CandidateTile(index, tile, null, error, reason);
    }

    public boolean isViable() {
        return tile != null && failureKind == null && failureError == null;
    }
}
