/**
 * Error taxonomy of SqlModelRunner.
 *
 * <p>
 * All exceptions are unchecked and extend
 * {@link io.github.yok.sqlmodelrunner.exception.ModelRunnerException}.
 * </p>
 */
package io.github.yok.sqlmodelrunner.exception;
