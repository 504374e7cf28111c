package com.agentBridge.agentGateway.audit;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured completion/audit record handed to a {@link LogSink}.
 * Fields keep their insertion order so log lines read consistently.
 */
@Getter
@ToString
public final class AuditRecord {

    public static final String REQUEST_COMPLETED = "request_completed";
    public static final String STREAM_COMPLETED = "stream_completed";
    public static final String BATCH_ENTRY_COMPLETED = "batch_entry_completed";

    private final String event;
    private final Outcome outcome;
    private final Map<String, Object> fields;

    private AuditRecord(String event, Outcome outcome, Map<String, Object> fields) {
        this.event = event;
        this.outcome = outcome;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Builder builder(String event) {
        return new Builder(event);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * Coarse result of the audited operation, used by sinks to pick a severity.
     */
    public enum Outcome {
        SUCCESS,
        WARNING,
        FAILURE
    }

    public static final class Builder {
        private final String event;
        private Outcome outcome = Outcome.SUCCESS;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(String event) {
            this.event = event;
        }

        public Builder outcome(Outcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder field(String name, Object value) {
            fields.put(name, value);
            return this;
        }

        public Builder fields(Map<String, ?> values) {
            fields.putAll(values);
            return this;
        }

        public AuditRecord build() {
            return new AuditRecord(event, outcome, new LinkedHashMap<>(fields));
        }
    }
}
