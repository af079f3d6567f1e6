package com.fdb.error;

import lombok.Getter;

/**
 * Exception thrown when a store does not match the schema a typed table expects.
 */
@Getter
public class FdbException extends Exception {
    private final ErrorType errorType;

    public FdbException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public FdbException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    @Override
    public String toString() {
        return String.format("FdbException{type=%s, message='%s'}", errorType, getMessage());
    }
}
