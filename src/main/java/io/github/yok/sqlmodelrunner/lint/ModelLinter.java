package io.github.yok.sqlmodelrunner.lint;

import io.github.yok.sqlmodelrunner.config.LintConfig;
import io.github.yok.sqlmodelrunner.exception.ConfigurationException;
import io.github.yok.sqlmodelrunner.model.Model;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Checks model and source names against naming rules.
 *
 * <p>
 * Built-in rules:
 * </p>
 * <ul>
 * <li>{@code model_name}: every model name</li>
 * <li>{@code source_name}: every source name declared in the profile</li>
 * </ul>
 *
 * <p>
 * Both default to {@value #DEFAULT_PATTERN}. The pattern and message of each rule can be replaced
 * through {@link LintConfig}. Rules under other names in the configuration are ignored with a
 * warning.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ModelLinter {

    static final String RULE_MODEL_NAME = "model_name";
    static final String RULE_SOURCE_NAME = "source_name";
    static final String DEFAULT_PATTERN = "^[a-z0-9_]+$";
    static final String DEFAULT_MESSAGE = "must be snake_case (lowercase, numbers, underscores)";

    private static final String SOURCES_SUBJECT = "profile sources";

    // Rule name -> compiled rule, in check order
    private final Map<String, CompiledRule> rules = new LinkedHashMap<>();

    private static final class CompiledRule {
        private final Pattern pattern;
        private final String message;

        CompiledRule(Pattern pattern, String message) {
            this.pattern = pattern;
            this.message = message;
        }
    }

    /**
     * Creates a linter with the default rules.
     */
    public ModelLinter() {
        this(new LintConfig());
    }

    /**
     * Creates a linter applying the overrides of {@code config}.
     *
     * @param config lint configuration
     * @throws ConfigurationException if an override pattern is not a valid regular expression
     */
    public ModelLinter(LintConfig config) {
        Validate.notNull(config, "config must not be null.");
        Map<String, LintConfig.Rule> overrides =
                config.getRules() == null ? Map.of() : config.getRules();
        for (String name : overrides.keySet()) {
            if (!RULE_MODEL_NAME.equals(name) && !RULE_SOURCE_NAME.equals(name)) {
                log.warn("Unknown lint rule ignored: {}", name);
            }
        }
        rules.put(RULE_MODEL_NAME, compile(RULE_MODEL_NAME, overrides.get(RULE_MODEL_NAME)));
        rules.put(RULE_SOURCE_NAME, compile(RULE_SOURCE_NAME, overrides.get(RULE_SOURCE_NAME)));
    }

    /**
     * Lints models and source names.
     *
     * @param models parsed models
     * @param sourceNames source names from the profile
     * @return violations, models first (in the given order), then sources (ascending)
     */
    public List<LintViolation> lint(List<Model> models, Collection<String> sourceNames) {
        Validate.notNull(models, "models must not be null.");
        Validate.notNull(sourceNames, "sourceNames must not be null.");

        List<LintViolation> violations = new ArrayList<>();
        CompiledRule modelRule = rules.get(RULE_MODEL_NAME);
        for (Model model : models) {
            check(RULE_MODEL_NAME, modelRule, model.getSourcePath(), model.getName(), violations);
        }
        CompiledRule sourceRule = rules.get(RULE_SOURCE_NAME);
        for (String source : new TreeSet<>(sourceNames)) {
            check(RULE_SOURCE_NAME, sourceRule, SOURCES_SUBJECT, source, violations);
        }
        log.info("Lint finished: {} violation(s)", violations.size());
        return violations;
    }

    private static void check(String ruleName, CompiledRule rule, String subject, String value,
            List<LintViolation> out) {
        if (!rule.pattern.matcher(value).matches()) {
            LintViolation violation = new LintViolation(ruleName, subject, value, rule.message);
            log.warn("{}", violation.format());
            out.add(violation);
        }
    }

    private static CompiledRule compile(String name, LintConfig.Rule override) {
        String pattern = DEFAULT_PATTERN;
        String message = DEFAULT_MESSAGE;
        if (override != null) {
            pattern = StringUtils.defaultIfBlank(override.getPattern(), pattern);
            message = StringUtils.defaultIfBlank(override.getMessage(), message);
        }
        try {
            return new CompiledRule(Pattern.compile(pattern), message);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException(
                    "Invalid pattern for lint rule '" + name + "': " + pattern, e);
        }
    }
}
