package io.github.yok.sqlmodelrunner.config;

/**
 * What the orchestrator does after a model fails.
 *
 * <p>
 * Profile values are bound leniently, so {@code fail-fast}, {@code FAIL_FAST} and
 * {@code failFast} all name the same constant.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum FailureMode {
    // Stop on the first failure; every model not yet reached is skipped
    FAIL_FAST,
    // Keep running independent branches; only descendants of a failed model are skipped
    CONTINUE_ON_ERROR
}
