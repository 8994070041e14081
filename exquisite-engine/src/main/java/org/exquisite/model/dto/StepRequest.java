package org.exquisite.model.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class StepRequest {
    String prompt;
    @Builder.Default
    int candidateCount = 1;
    @Builder.Default
    int featherPx = 0;
    @Builder.Default
    boolean enforceBandIdentity = true;
    @Builder.Default
    boolean postEnforceKeep = true;
}
