package io.github.yok.sqlmodelrunner.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * Resolved run configuration loaded from the profile file by {@link ProfileLoader}.
 *
 * <p>
 * Holds the target connection, the naming policy inputs ({@code catalog}, {@code schema},
 * {@code sources}), and the execution policy ({@code failureMode}, {@code threads}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class RunProfile {

    // Engine connection
    private ConnectionConfig connection = new ConnectionConfig();

    // Optional catalog of the target objects
    private String catalog;

    // Schema that receives every model
    private String schema;

    // External source name -> fully-qualified identifier
    private Map<String, String> sources = new LinkedHashMap<>();

    // Failure policy
    private FailureMode failureMode = FailureMode.FAIL_FAST;

    // Worker count; 1 runs models sequentially
    private int threads = 1;
}
