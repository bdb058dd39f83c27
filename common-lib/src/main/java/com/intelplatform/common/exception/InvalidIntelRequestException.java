package com.intelplatform.common.exception;

public class InvalidIntelRequestException extends IntelException {

    public InvalidIntelRequestException(String message) {
        super("INVALID_REQUEST", message);
    }
}
