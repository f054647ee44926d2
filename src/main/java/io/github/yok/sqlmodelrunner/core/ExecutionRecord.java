package io.github.yok.sqlmodelrunner.core;

import io.github.yok.sqlmodelrunner.exception.StatementExecutionException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable snapshot of one model's run state.
 *
 * <p>
 * {@link StatusTable} replaces the record of a model on each transition; a record itself never
 * changes.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ExecutionRecord {

    private final String modelName;

    private final ModelStatus status;

    // Set only when FAILED
    private final StatementExecutionException error;

    // Upstream model whose outcome caused the skip; null for other skip reasons
    private final String blockedBy;

    // Why the model was skipped; null unless SKIPPED
    private final String skipReason;

    // Wall-clock time spent executing statements; 0 unless SUCCEEDED or FAILED
    private final long elapsedMillis;

    static ExecutionRecord pending(String modelName) {
        return new ExecutionRecord(modelName, ModelStatus.PENDING, null, null, null, 0L);
    }

    ExecutionRecord running() {
        return new ExecutionRecord(modelName, ModelStatus.RUNNING, null, null, null, 0L);
    }

    ExecutionRecord succeeded(long elapsed) {
        return new ExecutionRecord(modelName, ModelStatus.SUCCEEDED, null, null, null, elapsed);
    }

    ExecutionRecord failed(StatementExecutionException cause, long elapsed) {
        return new ExecutionRecord(modelName, ModelStatus.FAILED, cause, null, null, elapsed);
    }

    ExecutionRecord skipped(String upstream, String reason) {
        return new ExecutionRecord(modelName, ModelStatus.SKIPPED, null, upstream, reason, 0L);
    }

    /**
     * Returns the failing statement, or {@code null} unless FAILED.
     *
     * @return statement text
     */
    public String getFailedStatement() {
        return error == null ? null : error.getStatement();
    }
}
