package com.intelplatform.common.exception;

public class UnknownProviderException extends IntelException {

    public UnknownProviderException(String providerId) {
        super("UNKNOWN_PROVIDER", "Unknown provider: " + providerId);
    }
}
