package org.exquisite.service.generator;

import lombok.Getter;
import org.exquisite.model.enums.GeneratorFailureKind;

@Getter
public class GeneratorException extends RuntimeException {

    private final GeneratorFailureKind kind;

    public GeneratorException(GeneratorFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GeneratorException(GeneratorFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static GeneratorException transientFailure(String message) {
        return new GeneratorException(GeneratorFailureKind.TRANSIENT, message);
    }

    public static GeneratorException permanentFailure(String message) {
        return new GeneratorException(GeneratorFailureKind.PERMANENT, message);
    }

    public static GeneratorException safetyRefusal(String message) {
        return new GeneratorException(GeneratorFailureKind.SAFETY_REFUSAL, message);
    }

    public static GeneratorException billingLimit(String message) {
        return new GeneratorException(GeneratorFailureKind.BILLING_LIMIT, message);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
