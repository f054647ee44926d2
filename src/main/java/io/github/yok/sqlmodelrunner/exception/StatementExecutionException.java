package io.github.yok.sqlmodelrunner.exception;

import lombok.Getter;

/**
 * Raised when a statement fails on the target engine.
 *
 * <p>
 * Keeps the model name, the exact failing statement, and the engine's own error message so the
 * run report can show all three.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class StatementExecutionException extends ModelRunnerException {

    private static final long serialVersionUID = 1L;

    // Model whose statement failed; null when raised directly by an executor
    private final String modelName;

    // Statement text sent to the engine
    private final String statement;

    // Error message returned by the engine
    private final String engineMessage;

    /**
     * Creates an exception raised by an executor, before the model is known.
     *
     * @param statement failing statement
     * @param engineMessage engine error message
     * @param cause engine exception
     */
    public StatementExecutionException(String statement, String engineMessage, Throwable cause) {
        this(null, statement, engineMessage, cause);
    }

    /**
     * Creates an exception for a known model.
     *
     * @param modelName model name
     * @param statement failing statement
     * @param engineMessage engine error message
     * @param cause engine exception
     */
    public StatementExecutionException(String modelName, String statement, String engineMessage,
            Throwable cause) {
        super(buildMessage(modelName, engineMessage), cause);
        this.modelName = modelName;
        this.statement = statement;
        this.engineMessage = engineMessage;
    }

    /**
     * Returns a copy of this exception attributed to the given model.
     *
     * @param model model name
     * @return new exception carrying the model name
     */
    public StatementExecutionException forModel(String model) {
        return new StatementExecutionException(model, statement, engineMessage, getCause());
    }

    private static String buildMessage(String modelName, String engineMessage) {
        if (modelName == null) {
            return "Statement failed: " + engineMessage;
        }
        return "[" + modelName + "] Statement failed: " + engineMessage;
    }
}
