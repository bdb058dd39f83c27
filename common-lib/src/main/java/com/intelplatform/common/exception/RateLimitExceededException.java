package com.intelplatform.common.exception;

public class RateLimitExceededException extends ProviderException {

    public RateLimitExceededException(String providerId) {
        super(providerId, "RATE_LIMITED", "Rate limit exceeded");
    }
}
