package org.exquisite.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum GeneratorFailureKind {
    TRANSIENT(true),
    PERMANENT(false),
    SAFETY_REFUSAL(false),
    BILLING_LIMIT(false);

    private final boolean retryable;
}
