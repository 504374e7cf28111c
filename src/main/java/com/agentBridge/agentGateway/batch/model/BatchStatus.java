package com.agentBridge.agentGateway.batch.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Processing status of a batch job. {@code IN_PROGRESS} is the only
 * non-terminal state.
 */
public enum BatchStatus {

    IN_PROGRESS("in_progress"),
    ENDED("ended"),
    CANCELED("canceled");

    private final String value;

    BatchStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
