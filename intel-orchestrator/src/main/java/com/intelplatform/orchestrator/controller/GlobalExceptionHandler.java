package com.intelplatform.orchestrator.controller;

import com.intelplatform.common.exception.IntelException;
import com.intelplatform.common.exception.InvalidIntelRequestException;
import com.intelplatform.common.exception.NoEligibleProvidersException;
import com.intelplatform.common.exception.RequestCancelledException;
import com.intelplatform.common.exception.UnknownProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps the {@link IntelException} hierarchy to {@code {code, message}} error bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidIntelRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidIntelRequestException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(ServerWebInputException ex) {
        String message = ex.getMostSpecificCause().getMessage();
        log.warn("Unreadable request: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_REQUEST", message != null ? message : ex.getReason()));
    }

    @ExceptionHandler(UnknownProviderException.class)
    public ResponseEntity<ErrorResponse> handleUnknownProvider(UnknownProviderException ex) {
        log.warn("Unknown provider: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(NoEligibleProvidersException.class)
    public ResponseEntity<ErrorResponse> handleNoEligibleProviders(NoEligibleProvidersException ex) {
        log.warn("No eligible providers: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(RequestCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(RequestCancelledException ex) {
        log.info("Request cancelled: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(IntelException.class)
    public ResponseEntity<ErrorResponse> handleIntelException(IntelException ex) {
        log.error("Orchestration failure: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    record ErrorResponse(String code, String message) {}
}
