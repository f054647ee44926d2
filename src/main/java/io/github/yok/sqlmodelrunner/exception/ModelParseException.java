package io.github.yok.sqlmodelrunner.exception;

import lombok.Getter;

/**
 * Raised when a model file has a malformed header, an unknown materialization, an empty body, or
 * cannot be read.
 *
 * <p>
 * The message always starts with the source path so that the offending file can be located from
 * the log alone.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ModelParseException extends ModelRunnerException {

    private static final long serialVersionUID = 1L;

    // Path of the model file that failed to parse
    private final String sourcePath;

    /**
     * Creates an exception for the given file.
     *
     * @param sourcePath model file path
     * @param message error detail
     */
    public ModelParseException(String sourcePath, String message) {
        super(sourcePath + ": " + message);
        this.sourcePath = sourcePath;
    }

    /**
     * Creates an exception for the given file with a cause.
     *
     * @param sourcePath model file path
     * @param message error detail
     * @param cause root cause
     */
    public ModelParseException(String sourcePath, String message, Throwable cause) {
        super(sourcePath + ": " + message, cause);
        this.sourcePath = sourcePath;
    }
}
