package io.github.yok.sqlmodelrunner.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.ToString;

/**
 * Target engine connection settings, read from the {@code connection} section of the profile.
 *
 * <pre>
 * connection:
 *   url: jdbc:databricks://adb-123.azuredatabricks.net:443/default;httpPath=/sql/1.0/warehouses/abc
 *   user: token
 *   password: dapi0123
 *   driver-class: com.databricks.client.jdbc.Driver
 *   properties:
 *     ConnCatalog: main
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class ConnectionConfig {

    // JDBC connection URL
    private String url;

    // Database user name; may be null when the URL carries credentials
    private String user;

    // Password or access token
    @ToString.Exclude
    private String password;

    // Fully qualified JDBC driver class name; optional (JDBC 4 auto-loading otherwise)
    private String driverClass;

    // Additional driver properties passed to DriverManager
    private Map<String, String> properties = new LinkedHashMap<>();
}
