package io.github.yok.sqlmodelrunner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code runner} section of {@code application.yml}: the defaults used when the
 * corresponding command-line options are omitted.
 *
 * <pre>
 * runner:
 *   models-dir: models
 *   profile: profiles.yml
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "runner")
@Data
public class RunnerConfig {

    /**
     * Directory containing the model files ({@code --models-dir}).
     */
    private String modelsDir = "models";

    /**
     * Path of the profile file ({@code --profile}).
     */
    private String profile = "profiles.yml";
}
