package org.exquisite.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.exquisite.model.enums.GrowthMode;

import java.time.Instant;
import java.util.List;

/**
 * Step record written as {@code score_report.json} on commit, or {@code rejected.json} on rejection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScoreReport {
    private int stepIndex;
    private String sessionId;
    private GrowthMode mode;
    private String promptSha256;
    private int tileSize;
    private int overlap;
    private int advance;
    private int featherPx;
    private boolean enforceBandIdentity;
    private boolean postEnforceKeep;
    private List<CandidateScore> candidates;
    private Integer selectedCandidate;
    private CanvasSize canvasSizeBefore;
    private CanvasSize canvasSizeAfter;
    private String rejectionError;
    private String rejectionReason;
    private Instant recordedAt;
}
