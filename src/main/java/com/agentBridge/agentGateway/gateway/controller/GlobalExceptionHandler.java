package com.agentBridge.agentGateway.gateway.controller;

import com.agentBridge.agentGateway.context.RequestContext;
import com.agentBridge.agentGateway.gateway.dto.ErrorResponse;
import com.agentBridge.agentGateway.gateway.exception.ApiError;
import com.agentBridge.agentGateway.gateway.filter.RequestContextFilter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to the Anthropic error envelope, see {@link ApiError} for the
 * status and type of each failure kind.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex,
                                                                   HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");

        log.warn("Validation error: {}", message);
        RequestContextFilter.contextOf(request).recordError(message);
        return respond(ApiError.INVALID_REQUEST, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                              HttpServletRequest request) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        RequestContextFilter.contextOf(request).recordError("Malformed request body");
        return respond(ApiError.INVALID_REQUEST, "Malformed request body");
    }

    /**
     * Framework errors (unknown route, wrong method, missing parameter) keep their own status.
     */
    private static ResponseEntity<ErrorResponse> frameworkError(org.springframework.web.ErrorResponse ex) {
        int status = ex.getStatusCode().value();
        String type = status == 404 ? ApiError.NOT_FOUND.getType()
                : status >= 500 ? ApiError.INTERNAL.getType() : ApiError.INVALID_REQUEST.getType();
        String message = ex.getBody().getDetail() != null ? ex.getBody().getDetail() : ex.getStatusCode().toString();
        log.warn("Request rejected by framework - status: {}, error: {}", status, message);
        return ResponseEntity.status(status).body(ErrorResponse.of(type, message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception ex, HttpServletRequest request) {
        if (ex instanceof org.springframework.web.ErrorResponse frameworkError) {
            return frameworkError(frameworkError);
        }
        ApiError error = ApiError.of(ex);
        RequestContext context = RequestContextFilter.contextOf(request);
        if (context.getError() == null) {
            context.recordError(ex);
        }

        if (error == ApiError.INTERNAL) {
            log.error("Unexpected error - requestId: {}", context.getRequestId(), ex);
            return respond(error, "An unexpected error occurred");
        }
        log.warn("Request failed - requestId: {}, errorType: {}, error: {}",
                context.getRequestId(), error.getType(), ex.getMessage());
        return respond(error, ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(ApiError error, String message) {
        return ResponseEntity.status(error.getStatus()).body(ErrorResponse.of(error.getType(), message));
    }
}
