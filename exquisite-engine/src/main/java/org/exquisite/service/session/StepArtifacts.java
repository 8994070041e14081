package org.exquisite.service.session;

import org.exquisite.model.dto.CandidateTile;
import org.exquisite.model.dto.ReferenceTile;
import org.exquisite.model.dto.ScoreReport;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Everything a committed step leaves behind in its step directory.
 */
public record StepArtifacts(int stepIndex,
                            String prompt,
                            BufferedImage band,
                            ReferenceTile reference,
                            List<CandidateTile> candidates,
                            BufferedImage selectedTile,
                            BufferedImage newHalf,
                            ScoreReport report,
                            BufferedImage canvasBefore,
                            BufferedImage canvasAfter) {
}
