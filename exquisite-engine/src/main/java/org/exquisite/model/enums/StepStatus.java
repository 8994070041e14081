package org.exquisite.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StepStatus {
    COMMITTED,
    REJECTED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
