package com.intelplatform.common.exception;

/**
 * Root of the orchestration error hierarchy. {@code code} is the machine-readable
 * identifier surfaced in stream chunks and HTTP error bodies.
 */
public class IntelException extends RuntimeException {
    private final String code;

    public IntelException(String code, String message) {
        super(message);
        this.code = code;
    }

    public IntelException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
