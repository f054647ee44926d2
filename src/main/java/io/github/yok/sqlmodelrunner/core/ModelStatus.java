package io.github.yok.sqlmodelrunner.core;

/**
 * Per-model run state.
 *
 * <pre>
 * PENDING -&gt; RUNNING -&gt; SUCCEEDED | FAILED
 * PENDING -&gt; SKIPPED
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
public enum ModelStatus {
    // Not dispatched yet
    PENDING,
    // Statements are being executed
    RUNNING,
    // Every statement completed
    SUCCEEDED,
    // A statement failed
    FAILED,
    // Never attempted
    SKIPPED;

    /**
     * Returns whether no further transition is possible.
     *
     * @return {@code true} for SUCCEEDED, FAILED and SKIPPED
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
