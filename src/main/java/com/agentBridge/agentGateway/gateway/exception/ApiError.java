package com.agentBridge.agentGateway.gateway.exception;

import com.agentBridge.agentGateway.backend.exception.BackendRejectedException;
import com.agentBridge.agentGateway.backend.exception.BackendTimeoutException;
import com.agentBridge.agentGateway.backend.exception.BackendUnavailableException;
import com.agentBridge.agentGateway.batch.exception.BatchNotFoundException;
import com.agentBridge.agentGateway.batch.exception.InvalidBatchException;
import com.agentBridge.agentGateway.cancellation.CanceledException;
import com.agentBridge.agentGateway.session.exception.PoolExhaustedException;
import com.agentBridge.agentGateway.session.exception.SessionNotFoundException;

/**
 * HTTP status and Anthropic {@code error.type} for each failure kind.
 * Shared by the HTTP error handler and batch entry results.
 */
public enum ApiError {

    INVALID_REQUEST(400, "invalid_request_error"),
    NOT_FOUND(404, "not_found_error"),
    REQUEST_TIMEOUT(408, "timeout_error"),
    OVERLOADED(529, "overloaded_error"),
    BACKEND_UNAVAILABLE(503, "api_error"),
    BACKEND_TIMEOUT(504, "timeout_error"),
    INTERNAL(500, "api_error");

    private final int status;
    private final String type;

    ApiError(int status, String type) {
        this.status = status;
        this.type = type;
    }

    public int getStatus() {
        return status;
    }

    public String getType() {
        return type;
    }

    public static ApiError of(Throwable error) {
        if (error instanceof InvalidRequestException
                || error instanceof InvalidBatchException
                || error instanceof BackendRejectedException) {
            return INVALID_REQUEST;
        }
        if (error instanceof SessionNotFoundException
                || error instanceof BatchNotFoundException
                || error instanceof ModelNotFoundException) {
            return NOT_FOUND;
        }
        if (error instanceof CanceledException) {
            return REQUEST_TIMEOUT;
        }
        if (error instanceof PoolExhaustedException) {
            return OVERLOADED;
        }
        if (error instanceof BackendTimeoutException) {
            return BACKEND_TIMEOUT;
        }
        if (error instanceof BackendUnavailableException) {
            return BACKEND_UNAVAILABLE;
        }
        return INTERNAL;
    }
}
