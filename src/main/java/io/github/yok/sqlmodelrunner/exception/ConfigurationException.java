package io.github.yok.sqlmodelrunner.exception;

/**
 * Raised when the profile file or the models directory is missing or invalid.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigurationException extends ModelRunnerException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message error message
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message error message
     * @param cause root cause
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
