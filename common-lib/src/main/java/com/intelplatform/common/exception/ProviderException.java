package com.intelplatform.common.exception;

/**
 * Failure of a single provider call. Never aborts sibling providers or the request.
 */
public class ProviderException extends IntelException {
    private final String providerId;

    public ProviderException(String providerId, String message) {
        this(providerId, "PROVIDER_ERROR", message);
    }

    public ProviderException(String providerId, String message, Throwable cause) {
        super("PROVIDER_ERROR", "[" + providerId + "] " + message, cause);
        this.providerId = providerId;
    }

    protected ProviderException(String providerId, String code, String message) {
        super(code, "[" + providerId + "] " + message);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
