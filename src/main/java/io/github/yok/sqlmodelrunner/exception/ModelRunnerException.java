package io.github.yok.sqlmodelrunner.exception;

/**
 * Base class of every error raised by SqlModelRunner.
 *
 * <p>
 * Subclasses split errors by the phase in which they are detected:
 * </p>
 * <ul>
 * <li>{@link ConfigurationException}: profile or models directory problems, detected at
 * startup</li>
 * <li>{@link ModelParseException}: a model file cannot be parsed</li>
 * <li>{@link GraphException}: the model set does not form a valid dependency graph</li>
 * <li>{@link StatementExecutionException}: a statement failed on the target engine</li>
 * </ul>
 *
 * <p>
 * The first three abort a run before any statement is executed. The last one is captured per model
 * in the run report.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ModelRunnerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message error message
     */
    public ModelRunnerException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message error message
     * @param cause root cause
     */
    public ModelRunnerException(String message, Throwable cause) {
        super(message, cause);
    }
}
