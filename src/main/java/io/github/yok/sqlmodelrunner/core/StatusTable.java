package io.github.yok.sqlmodelrunner.core;

import io.github.yok.sqlmodelrunner.exception.StatementExecutionException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Status of every model in a run, owned by {@link ExecutionOrchestrator}.
 *
 * <p>
 * Each transition is validated against the state machine of {@link ModelStatus} and performed as
 * one synchronized write, so readers never observe a half-updated record.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
final class StatusTable {

    // Insertion order = execution order
    private final Map<String, ExecutionRecord> records = new LinkedHashMap<>();

    StatusTable(Collection<String> modelNames) {
        for (String name : modelNames) {
            records.put(name, ExecutionRecord.pending(name));
        }
    }

    synchronized ModelStatus statusOf(String name) {
        return require(name).getStatus();
    }

    synchronized void markRunning(String name) {
        ExecutionRecord current = expect(name, ModelStatus.PENDING, ModelStatus.RUNNING);
        records.put(name, current.running());
    }

    synchronized void markSucceeded(String name, long elapsedMillis) {
        ExecutionRecord current = expect(name, ModelStatus.RUNNING, ModelStatus.SUCCEEDED);
        records.put(name, current.succeeded(elapsedMillis));
    }

    synchronized void markFailed(String name, StatementExecutionException error,
            long elapsedMillis) {
        ExecutionRecord current = expect(name, ModelStatus.RUNNING, ModelStatus.FAILED);
        records.put(name, current.failed(error, elapsedMillis));
    }

    synchronized void markSkipped(String name, String blockedBy, String reason) {
        ExecutionRecord current = expect(name, ModelStatus.PENDING, ModelStatus.SKIPPED);
        records.put(name, current.skipped(blockedBy, reason));
    }

    synchronized List<String> namesWithStatus(ModelStatus status) {
        List<String> result = new ArrayList<>();
        records.forEach((name, record) -> {
            if (record.getStatus() == status) {
                result.add(name);
            }
        });
        return result;
    }

    synchronized List<ExecutionRecord> snapshot() {
        return new ArrayList<>(records.values());
    }

    private ExecutionRecord require(String name) {
        ExecutionRecord record = records.get(name);
        if (record == null) {
            throw new IllegalArgumentException("Model not part of this run: " + name);
        }
        return record;
    }

    private ExecutionRecord expect(String name, ModelStatus expected, ModelStatus next) {
        ExecutionRecord record = require(name);
        if (record.getStatus() != expected) {
            throw new IllegalStateException("Illegal status transition for model '" + name + "': "
                    + record.getStatus() + " -> " + next);
        }
        return record;
    }
}
