package io.github.yok.sqlmodelrunner.executor;

import io.github.yok.sqlmodelrunner.config.ConnectionConfig;
import io.github.yok.sqlmodelrunner.exception.StatementExecutionException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * {@link StatementExecutor} backed by plain JDBC.
 *
 * <p>
 * Each calling thread gets its own {@link Connection}, opened on first use and kept until
 * {@link #close()}. Connections run in auto-commit mode, so every statement is committed by the
 * engine as soon as it completes.
 * </p>
 *
 * <p>
 * A {@link SQLException}, whether raised while connecting or while executing, is converted to a
 * {@link StatementExecutionException} carrying the statement and the driver message.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcStatementExecutor implements StatementExecutor {

    /**
     * Opens a new JDBC connection (replaceable in tests).
     */
    @FunctionalInterface
    interface ConnectionProvider {

        /**
         * Opens a connection.
         *
         * @return new connection
         * @throws SQLException connection failure
         */
        Connection open() throws SQLException;
    }

    private final ConnectionProvider connectionProvider;

    private final ThreadLocal<Connection> threadConnection = new ThreadLocal<>();

    // Every connection opened so far, closed together by close()
    private final List<Connection> openedConnections = new CopyOnWriteArrayList<>();

    private volatile boolean closed;

    /**
     * Creates an executor for the given connection settings.
     *
     * @param config connection settings; {@code url} must be set
     */
    public JdbcStatementExecutor(ConnectionConfig config) {
        this(providerFor(config));
    }

    /**
     * Creates an executor with a custom connection provider.
     *
     * @param connectionProvider connection provider
     */
    JdbcStatementExecutor(ConnectionProvider connectionProvider) {
        Validate.notNull(connectionProvider, "connectionProvider must not be null.");
        this.connectionProvider = connectionProvider;
    }

    private static ConnectionProvider providerFor(ConnectionConfig config) {
        Validate.notNull(config, "config must not be null.");
        Validate.notBlank(config.getUrl(), "connection url must not be blank.");
        Properties props = new Properties();
        if (config.getProperties() != null) {
            props.putAll(config.getProperties());
        }
        if (config.getUser() != null) {
            props.setProperty("user", config.getUser());
        }
        if (config.getPassword() != null) {
            props.setProperty("password", config.getPassword());
        }
        String url = config.getUrl();
        return () -> DriverManager.getConnection(url, props);
    }

    @Override
    public void execute(String statement) {
        Validate.notBlank(statement, "statement must not be blank.");
        if (closed) {
            throw new IllegalStateException("JdbcStatementExecutor is already closed.");
        }

        try {
            Connection conn = currentConnection();
            try (Statement st = conn.createStatement()) {
                log.debug("Executing statement: {}", statement);
                st.execute(statement);
            }
        } catch (SQLException e) {
            throw new StatementExecutionException(statement, describe(e), e);
        }
    }

    private Connection currentConnection() throws SQLException {
        Connection conn = threadConnection.get();
        if (conn != null && !conn.isClosed()) {
            return conn;
        }
        conn = connectionProvider.open();
        conn.setAutoCommit(true);
        threadConnection.set(conn);
        openedConnections.add(conn);
        log.debug("Opened JDBC connection for thread {}", Thread.currentThread().getName());
        return conn;
    }

    /**
     * Builds the engine message from a driver exception, SQLState first when available.
     *
     * @param e driver exception
     * @return message
     */
    static String describe(SQLException e) {
        String message = StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getName());
        if (StringUtils.isNotBlank(e.getSQLState())) {
            return "[SQLState " + e.getSQLState() + "] " + message;
        }
        return message;
    }

    @Override
    public void close() {
        closed = true;
        for (Connection conn : openedConnections) {
            try {
                conn.close();
            } catch (SQLException e) {
                log.warn("Failed to close JDBC connection: {}", e.getMessage(), e);
            }
        }
        openedConnections.clear();
        threadConnection.remove();
    }
}
