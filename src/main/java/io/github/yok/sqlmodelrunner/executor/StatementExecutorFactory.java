package io.github.yok.sqlmodelrunner.executor;

import io.github.yok.sqlmodelrunner.config.ConnectionConfig;
import io.github.yok.sqlmodelrunner.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Creates the {@link StatementExecutor} for a run.
 *
 * <p>
 * When {@code driver-class} is configured it is loaded explicitly; otherwise JDBC 4 driver
 * auto-loading is relied on. No connection is opened here: the executor connects on its first
 * statement.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class StatementExecutorFactory {

    /**
     * Creates a JDBC executor for the given connection settings.
     *
     * @param config connection settings
     * @return executor; the caller must close it
     * @throws ConfigurationException if the URL is missing or the driver class cannot be loaded
     */
    public StatementExecutor create(ConnectionConfig config) {
        if (config == null || StringUtils.isBlank(config.getUrl())) {
            throw new ConfigurationException("connection.url is not configured.");
        }
        loadDriverIfConfigured(config.getDriverClass());
        log.info("Target engine: {}", config.getUrl());
        return new JdbcStatementExecutor(config);
    }

    private static void loadDriverIfConfigured(String driverClass) {
        if (StringUtils.isBlank(driverClass)) {
            return;
        }
        try {
            Class.forName(driverClass);
        } catch (ClassNotFoundException e) {
            throw new ConfigurationException("JDBC driver class not found: " + driverClass, e);
        }
    }
}
