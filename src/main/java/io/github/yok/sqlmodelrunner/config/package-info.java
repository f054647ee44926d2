/**
 * Configuration models of SqlModelRunner.
 *
 * <p>
 * Defines the Spring Boot bound settings from {@code application.yml} ({@code runner},
 * {@code lint}) and the per-run profile read from the {@code --profile} file (connection, naming
 * policy inputs, failure policy).
 * </p>
 *
 * <p>
 * This package primarily holds configuration data; execution logic is implemented in {@code core}
 * and {@code executor}.
 * </p>
 */
package io.github.yok.sqlmodelrunner.config;
