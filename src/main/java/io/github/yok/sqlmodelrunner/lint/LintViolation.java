package io.github.yok.sqlmodelrunner.lint;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * One naming rule violation.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class LintViolation {

    // Rule name, e.g. model_name
    private final String rule;

    // Where the offending name was found (model file path or "profile sources")
    private final String subject;

    // Offending name
    private final String value;

    // Rule message
    private final String message;

    /**
     * Formats the violation as {@code subject: [rule] 'value' message}.
     *
     * @return display text
     */
    public String format() {
        return subject + ": [" + rule + "] '" + value + "' " + message;
    }
}
