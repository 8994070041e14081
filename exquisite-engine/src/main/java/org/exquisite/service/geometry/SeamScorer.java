package org.exquisite.service.geometry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.exquisite.model.dto.CandidateScore;
import org.exquisite.model.dto.CandidateTile;
import org.exquisite.model.enums.GrowthMode;
import org.exquisite.util.RasterUtils;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;
import java.util.function.IntUnaryOperator;

/**
 * Ranks candidate tiles by how well the edges of their generated half continue the edges already at the
 * canvas frontier.
 *
 * <p>Both strips are sampled by distance from the seam, so pixel {@code d} of the canvas strip and pixel
 * {@code d} of the tile strip mirror each other across it. The score is the negative weighted mean squared
 * difference of their Sobel magnitudes; weights fall from 1.0 at the seam to 0.2 at the far edge.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class SeamScorer {

    static final double SEAM_WEIGHT = 1.0;
    static final double FAR_WEIGHT = 0.2;

    private final TileGeometry geometry;

    public List<CandidateScore> scoreAll(BufferedImage canvas, GrowthMode mode, List<CandidateTile> candidates) {
        return candidates.stream()
                .map(candidate -> evaluate(canvas, mode, candidate))
                .toList();
    }

    public CandidateScore evaluate(BufferedImage canvas, GrowthMode mode, CandidateTile candidate) {
        CandidateScore.CandidateScoreBuilder builder = CandidateScore.builder()
                .index(candidate.index())
                .failureKind(candidate.failureKind())
                .failureError(candidate.failureError() != null ? candidate.failureError().name() : null)
                .failureReason(candidate.failureReason());
        if (!candidate.isViable()) {
            return builder.viable(false).build();
        }
        double score = score(canvas, candidate.tile(), mode);
        log.debug("Candidate {} seam score {}", candidate.index(), score);
        return builder.viable(true).score(score).build();
    }

    /**
     * Arg-max over viable candidates; the lowest index wins ties. Empty when nothing is viable.
     */
    public Optional<CandidateScore> select(List<CandidateScore> scores) {
        CandidateScore best = null;
        for (CandidateScore candidate : scores) {
            if (!candidate.isViable()) {
                continue;
            }
            if (best == null
                    || candidate.effectiveScore() > best.effectiveScore()
                    || (candidate.effectiveScore() == best.effectiveScore() && candidate.getIndex() < best.getIndex())) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    public double score(BufferedImage canvas, BufferedImage tile, GrowthMode mode) {
        geometry.validateCanvas(canvas, mode);
        geometry.validateTile(tile);
        int thickness = stripThickness(canvas, mode);
        int canvasGrowth = mode.growthLength(canvas);
        int tileSize = geometry.getContract().getTileSize();
        int half = geometry.getContract().half();

        float[][] canvasEdges = sobelMagnitude(seamField(canvas, mode, thickness,
                d -> mode.rasterIndex(canvasGrowth, canvasGrowth - 1 - d)));
        float[][] tileEdges = sobelMagnitude(seamField(tile, mode, thickness,
                d -> mode.rasterIndex(tileSize, half + d)));

        double weighted = 0.0;
        double weightSum = 0.0;
        for (int d = 0; d < thickness; d++) {
            double w = weight(d, thickness);
            for (int c = 0; c < canvasEdges.length; c++) {
                double diff = canvasEdges[c][d] - tileEdges[c][d];
                weighted += w * diff * diff;
                weightSum += w;
            }
        }
        return weightSum == 0.0 ? 0.0 : -(weighted / weightSum);
    }

    private int stripThickness(BufferedImage canvas, GrowthMode mode) {
        int overlap = Math.max(1, geometry.getContract().getOverlap());
        return Math.min(overlap, Math.min(geometry.getContract().half(), mode.growthLength(canvas)));
    }

    static double weight(int seamDistance, int thickness) {
        if (thickness <= 1) {
            return SEAM_WEIGHT;
        }
        return SEAM_WEIGHT - (SEAM_WEIGHT - FAR_WEIGHT) * seamDistance / (thickness - 1);
    }

    /**
     * Luminance indexed as {@code [cross][seamDistance]}.
     */
    private static float[][] seamField(BufferedImage image, GrowthMode mode, int thickness, IntUnaryOperator rasterIndexAtDistance) {
        int cross = mode.crossLength(image);
        float[][] field = new float[cross][thickness];
        for (int d = 0; d < thickness; d++) {
            int r = rasterIndexAtDistance.applyAsInt(d);
            for (int c = 0; c < cross; c++) {
                int rgb = mode.isHorizontal() ? image.getRGB(r, c) : image.getRGB(c, r);
                field[c][d] = RasterUtils.luminance(rgb);
            }
        }
        return field;
    }

    static float[][] sobelMagnitude(float[][] gray) {
        int rows = gray.length;
        int cols = rows == 0 ? 0 : gray[0].length;
        float[][] out = new float[rows][cols];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                float tl = at(gray, y - 1, x - 1), tc = at(gray, y - 1, x), tr = at(gray, y - 1, x + 1);
                float ml = at(gray, y, x - 1), mr = at(gray, y, x + 1);
                float bl = at(gray, y + 1, x - 1), bc = at(gray, y + 1, x), br = at(gray, y + 1, x + 1);
                float gx = (tr + 2 * mr + br) - (tl + 2 * ml + bl);
                float gy = (bl + 2 * bc + br) - (tl + 2 * tc + tr);
                out[y][x] = (float) Math.sqrt(gx * gx + gy * gy);
            }
        }
        return out;
    }

    private static float at(float[][] gray, int y, int x) {
        int cy = Math.max(0, Math.min(gray.length - 1, y));
        int cx = Math.max(0, Math.min(gray[cy].length - 1, x));
        return gray[cy][cx];
    }
}
