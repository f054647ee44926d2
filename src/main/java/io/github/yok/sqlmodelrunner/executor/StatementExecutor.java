package io.github.yok.sqlmodelrunner.executor;

import io.github.yok.sqlmodelrunner.exception.StatementExecutionException;

/**
 * Boundary to the target SQL engine: runs one DDL/DML string and reports success or a structured
 * error.
 *
 * <p>
 * Implementations own connection lifecycle. When the orchestrator runs with more than one worker,
 * {@link #execute(String)} is called concurrently from several threads and must be safe for that.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface StatementExecutor extends AutoCloseable {

    /**
     * Executes one statement and returns when the engine has completed it.
     *
     * @param statement SQL statement
     * @throws StatementExecutionException if the engine rejects or fails the statement
     */
    void execute(String statement);

    /**
     * Releases every resource held by this executor.
     */
    @Override
    void close();
}
