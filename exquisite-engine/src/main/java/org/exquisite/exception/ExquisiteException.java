package org.exquisite.exception;

import lombok.Getter;

@Getter
public class ExquisiteException extends RuntimeException {

    private final ExquisiteError error;

    public ExquisiteException(String message, ExquisiteError error) {
        super(message);
        this.error = error;
    }

    public ExquisiteException(String message, ExquisiteError error, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public ExquisiteError.Category getCategory() {
        return error.getCategory();
    }

    public boolean isPersistenceFailure() {
        return error.getCategory() == ExquisiteError.Category.PERSISTENCE;
    }
}
