package com.agentBridge.agentGateway.cancellation;

/**
 * Exception thrown when cooperative cancellation is observed at a suspension point.
 */
public class CanceledException extends RuntimeException {

    private final boolean timedOut;

    public CanceledException(String reason) {
        this(reason, false);
    }

    public CanceledException(String reason, boolean timedOut) {
        super("Operation canceled: " + reason);
        this.timedOut = timedOut;
    }

    /**
     * @return true when the cancellation came from a per-call timeout
     */
    public boolean isTimedOut() {
        return timedOut;
    }
}
