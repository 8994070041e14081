package org.exquisite.model.dto;

import lombok.Builder;
import lombok.Value;
import org.exquisite.exception.ExquisiteError;
import org.exquisite.model.enums.StepStatus;

import java.nio.file.Path;

@Value
@Builder
public class StepResult {
    StepStatus status;
    int stepIndex;
    CanvasSize canvasSizeBefore;
    CanvasSize canvasSizeAfter;
    Path stepDirectory;
    String rejectionReason;
    ExquisiteError rejectionError;
    Integer selectedCandidate;

    public boolean isCommitted() {
        return status == StepStatus.COMMITTED;
    }
}
