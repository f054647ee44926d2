/**
 * Target engine boundary.
 *
 * <p>
 * {@link io.github.yok.sqlmodelrunner.executor.StatementExecutor} is the only way statements reach
 * the engine; {@link io.github.yok.sqlmodelrunner.executor.JdbcStatementExecutor} implements it
 * over JDBC.
 * </p>
 */
package io.github.yok.sqlmodelrunner.executor;
