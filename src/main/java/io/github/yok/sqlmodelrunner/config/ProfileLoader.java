package io.github.yok.sqlmodelrunner.config;

import io.github.yok.sqlmodelrunner.exception.ConfigurationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationProperty;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a profile file (YAML) into a {@link RunProfile}.
 *
 * <pre>
 * connection:
 *   url: jdbc:...
 *   user: token
 *   password: secret
 *   driver-class: com.databricks.client.jdbc.Driver
 * catalog: main
 * schema: analytics
 * sources:
 *   raw_events: main.raw.events
 * failure-mode: fail-fast
 * threads: 4
 * </pre>
 *
 * <p>
 * The file is flattened with {@link YamlPropertiesFactoryBean} and bound with Spring Boot's
 * {@link Binder}, so keys follow the same relaxed rules as {@code application.yml} (kebab-case,
 * snake_case or camelCase). Every problem (missing file, unparsable YAML, missing
 * {@code connection.url} or {@code schema}, unknown {@code failure-mode}, {@code threads} below 1)
 * is reported as a {@link ConfigurationException} before any model is touched.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class ProfileLoader {

    // Root name the profile properties are bound under
    private static final String PREFIX = "profile";

    /**
     * Loads and validates a profile.
     *
     * @param profilePath profile file
     * @return validated profile
     * @throws ConfigurationException if the file is missing or invalid
     */
    public RunProfile load(Path profilePath) {
        if (profilePath == null || !Files.isRegularFile(profilePath)) {
            throw new ConfigurationException("Profile file not found: "
                    + (profilePath == null ? "null" : profilePath.toAbsolutePath()));
        }

        Properties properties;
        try {
            YamlPropertiesFactoryBean factory = new YamlPropertiesFactoryBean();
            factory.setResources(new FileSystemResource(profilePath));
            properties = factory.getObject();
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed profile file: " + profilePath, e);
        } catch (IllegalStateException e) {
            // YamlProcessor reports I/O errors this way
            throw new ConfigurationException("Failed to read profile file: " + profilePath, e);
        }

        RunProfile profile =
                bind(properties == null ? new Properties() : properties, profilePath.toString());
        log.info("Profile loaded: {} (schema={}, sources={}, failureMode={}, threads={})",
                profilePath, qualifiedSchema(profile), profile.getSources().keySet(),
                profile.getFailureMode(), profile.getThreads());
        return profile;
    }

    /**
     * Binds flattened profile properties ({@code connection.url}, {@code sources.raw_events},
     * ...) and validates the result.
     *
     * @param properties flattened properties
     * @param origin description of the origin for error messages
     * @return validated profile
     * @throws ConfigurationException if a value cannot be bound or a required value is missing
     */
    RunProfile bind(Properties properties, String origin) {
        MapConfigurationPropertySource source = new MapConfigurationPropertySource();
        for (Map.Entry<Object, Object> entry : properties.entrySet()) {
            source.put(PREFIX + "." + entry.getKey(), entry.getValue());
        }

        RunProfile profile;
        try {
            profile = new Binder(source).bindOrCreate(PREFIX, RunProfile.class);
        } catch (BindException e) {
            throw new ConfigurationException(
                    "Invalid value for " + describe(e) + " in " + origin, e);
        }
        validate(profile, origin);
        return profile;
    }

    private static void validate(RunProfile profile, String origin) {
        if (StringUtils.isBlank(profile.getConnection().getUrl())) {
            throw new ConfigurationException("connection.url is not configured in " + origin);
        }
        if (StringUtils.isBlank(profile.getSchema())) {
            throw new ConfigurationException("schema is not configured in " + origin);
        }
        for (Map.Entry<String, String> entry : profile.getSources().entrySet()) {
            if (StringUtils.isBlank(entry.getValue())) {
                throw new ConfigurationException(
                        "sources." + entry.getKey() + " has no identifier in " + origin);
            }
            entry.setValue(entry.getValue().trim());
        }
        if (profile.getThreads() < 1) {
            throw new ConfigurationException("threads must be at least 1 in " + origin);
        }
    }

    private static String describe(BindException e) {
        ConfigurationProperty property = e.getProperty();
        if (property == null) {
            return StringUtils.removeStart(e.getName().toString(), PREFIX + ".");
        }
        return StringUtils.removeStart(property.getName().toString(), PREFIX + ".") + " '"
                + property.getValue() + "'";
    }

    private static String qualifiedSchema(RunProfile profile) {
        return StringUtils.isBlank(profile.getCatalog()) ? profile.getSchema()
                : profile.getCatalog() + "." + profile.getSchema();
    }
}
