package com.agentBridge.agentGateway.streaming;

/**
 * How a bridged stream ended. Exactly one cause is recorded per stream.
 */
public enum CompletionCause {

    /**
     * The terminal event was reached and handed to the consumer.
     */
    SUCCESS("success"),

    /**
     * The upstream sequence raised a failure, or the call was cancelled or timed out.
     */
    ERROR("error"),

    /**
     * The consumer stopped pulling before the terminal event.
     */
    CLIENT_DISCONNECTED("client_disconnected");

    private final String value;

    CompletionCause(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
