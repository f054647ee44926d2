package io.github.yok.sqlmodelrunner.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code lint} section of {@code application.yml}.
 *
 * <p>
 * Each entry overrides the pattern and/or message of a built-in naming rule
 * ({@code model_name}, {@code source_name}). Omitted attributes keep their defaults.
 * </p>
 *
 * <pre>
 * lint:
 *   rules:
 *     model_name:
 *       pattern: "^(stg|int|fct|dim)_[a-z0-9_]+$"
 *       message: "Model names need a layer prefix"
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "lint")
@Data
public class LintConfig {

    /**
     * Rule name to override.
     */
    private Map<String, Rule> rules = new LinkedHashMap<>();

    /**
     * Override of one naming rule.
     */
    @Data
    public static class Rule {
        // Regular expression the name must match; null keeps the default
        private String pattern;
        // Message shown on violation; null keeps the default
        private String message;
    }
}
