package com.agentBridge.agentGateway.audit;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Default {@link LogSink}: writes each record as one key=value log line.
 * Successful records log at INFO, warnings (client disconnects, canceled work)
 * at WARN and failures at ERROR. Keeps in-memory counters per event, outcome
 * and model for {@link #stats()}.
 */
@Slf4j
public class Slf4jLogSink implements LogSink {

    private static final int TOP_MODELS = 5;

    private final LongAdder total = new LongAdder();
    private final Map<String, LongAdder> byEvent = new ConcurrentHashMap<>();
    private final Map<AuditRecord.Outcome, LongAdder> byOutcome = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> byModel = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> firstRecordAt = new AtomicReference<>();
    private final AtomicReference<Instant> lastRecordAt = new AtomicReference<>();

    @Override
    public void record(AuditRecord record) {
        count(record);
        String line = format(record);
        switch (record.getOutcome()) {
            case SUCCESS -> log.info(line);
            case WARNING -> log.warn(line);
            case FAILURE -> log.error(line);
        }
    }

    @Override
    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("available", true);
        stats.put("total_records", total.sum());
        stats.put("first_record_at", toText(firstRecordAt.get()));
        stats.put("last_record_at", toText(lastRecordAt.get()));
        stats.put("events", sums(byEvent));

        Map<String, Long> outcomes = new LinkedHashMap<>();
        for (AuditRecord.Outcome outcome : AuditRecord.Outcome.values()) {
            LongAdder counter = byOutcome.get(outcome);
            outcomes.put(outcome.name().toLowerCase(Locale.ROOT), counter == null ? 0 : counter.sum());
        }
        stats.put("outcomes", outcomes);

        Map<String, Long> topModels = new LinkedHashMap<>();
        sums(byModel).entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .limit(TOP_MODELS)
                .forEach(entry -> topModels.put(entry.getKey(), entry.getValue()));
        stats.put("top_models", topModels);
        return stats;
    }

    private void count(AuditRecord record) {
        Instant now = Instant.now();
        firstRecordAt.compareAndSet(null, now);
        lastRecordAt.set(now);
        total.increment();
        byEvent.computeIfAbsent(record.getEvent(), event -> new LongAdder()).increment();
        byOutcome.computeIfAbsent(record.getOutcome(), outcome -> new LongAdder()).increment();
        Object model = record.get("model");
        if (model != null) {
            byModel.computeIfAbsent(model.toString(), name -> new LongAdder()).increment();
        }
    }

    private static Map<String, Long> sums(Map<String, LongAdder> counters) {
        Map<String, Long> sums = new LinkedHashMap<>();
        counters.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> sums.put(entry.getKey(), entry.getValue().sum()));
        return sums;
    }

    private static String toText(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    static String format(AuditRecord record) {
        StringBuilder line = new StringBuilder(record.getEvent());
        for (Map.Entry<String, Object> field : record.getFields().entrySet()) {
            if (field.getValue() == null) {
                continue;
            }
            line.append(' ').append(field.getKey()).append('=');
            String value = String.valueOf(field.getValue());
            if (value.indexOf(' ') >= 0) {
                line.append('"').append(value.replace("\"", "'")).append('"');
            } else {
                line.append(value);
            }
        }
        return line.toString();
    }
}
