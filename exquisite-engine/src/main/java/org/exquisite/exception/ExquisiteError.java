package org.exquisite.exception;

import lombok.Getter;

@Getter
public enum ExquisiteError {
    DIMENSION_MISMATCH(Category.DIMENSION, "Dimension mismatch: %s"),
    CANVAS_SIZE_INVARIANT(Category.DIMENSION, "Canvas size after glue is %s, expected %s"),
    BAND_IDENTITY_VIOLATION(Category.BAND_IDENTITY, "Conditioning half does not match the band keep region (candidate %s)"),
    NO_VIABLE_CANDIDATE(Category.GENERATOR, "No viable candidate among %s requested"),
    PERSISTENCE_FAILURE(Category.PERSISTENCE, "Failed to persist %s: %s"),
    SESSION_NOT_FOUND(Category.NOT_FOUND, "No readable session state at %s"),
    SESSION_ROOT_MISMATCH(Category.CONSISTENCY, "Session root mismatch: state records %s, opened at %s"),
    SESSION_BUSY(Category.CONSISTENCY, "Another step is already running for session %s"),
    SESSION_CORRUPT(Category.CONSISTENCY, "Session at %s cannot be recovered: %s"),
    STEP_ALREADY_COMMITTED(Category.CONSISTENCY, "Step %s of session %s is already committed"),
    INVALID_CONTRACT(Category.CONFIGURATION, "Invalid tile contract: %s"),
    INVALID_MODE(Category.CONFIGURATION, "Unknown growth mode: %s"),
    INVALID_STEP_REQUEST(Category.CONFIGURATION, "Invalid step request: %s"),
    UNREADABLE_IMAGE(Category.CONFIGURATION, "Cannot read image %s");

    private final Category category;
    private final String message;

    ExquisiteError(Category category, String message) {
        this.category = category;
        this.message = message;
    }

    public ExquisiteException createException(Object... details) {
        String formattedMessage = (details.length > 0) ? String.format(message, details) : message;
        return new ExquisiteException(formattedMessage, this);
    }

    public ExquisiteException createException(Throwable cause, Object... details) {
        String formattedMessage = (details.length > 0) ? String.format(message, details) : message;
        return new ExquisiteException(formattedMessage, this, cause);
    }

    public enum Category {
        DIMENSION,
        BAND_IDENTITY,
        GENERATOR,
        PERSISTENCE,
        NOT_FOUND,
        CONSISTENCY,
        CONFIGURATION
    }
}
