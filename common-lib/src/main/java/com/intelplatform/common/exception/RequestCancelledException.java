package com.intelplatform.common.exception;

/**
 * Raised inside a provider call once its request has been cancelled by the caller.
 * Cancellation is a termination state, not a retryable failure.
 */
public class RequestCancelledException extends IntelException {

    public RequestCancelledException(String requestId) {
        super("REQUEST_CANCELLED", "Request cancelled: " + requestId);
    }
}
