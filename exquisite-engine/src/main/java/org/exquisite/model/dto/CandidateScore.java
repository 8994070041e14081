package org.exquisite.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.exquisite.model.enums.GeneratorFailureKind;

/**
 * Outcome of one candidate tile: either viable with a seam score, or excluded with a reason and no
 * score, which ranks as negative infinity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CandidateScore {
    private int index;
    private boolean viable;
    private Double score;
    private GeneratorFailureKind failureKind;
    private String failureError;
    private String failureReason;

    public double effectiveScore() {
        return viable && score != null ? score : Double.NEGATIVE_INFINITY;
    }
}
