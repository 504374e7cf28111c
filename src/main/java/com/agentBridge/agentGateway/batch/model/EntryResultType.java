package com.agentBridge.agentGateway.batch.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EntryResultType {

    PENDING("pending"),
    SUCCEEDED("succeeded"),
    ERRORED("errored"),
    CANCELED("canceled");

    private final String value;

    EntryResultType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
