package com.intelplatform.common.exception;

/**
 * Planning found no healthy, admissible provider for the requested types.
 */
public class NoEligibleProvidersException extends IntelException {

    public NoEligibleProvidersException(String message) {
        super("NO_ELIGIBLE_PROVIDERS", message);
    }
}
