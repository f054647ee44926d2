package io.github.yok.sqlmodelrunner.resolve;

import java.util.Optional;

/**
 * Maps a logical model or source name to a fully-qualified object identifier in the target
 * engine.
 *
 * @author Yasuharu.Okawauchi
 */
public interface NamingPolicy {

    /**
     * Returns the identifier a model is materialized as.
     *
     * @param modelName model name
     * @return fully-qualified identifier, e.g. {@code catalog.schema.model}
     */
    String modelIdentifier(String modelName);

    /**
     * Resolves a referenced name, which may be a model or an external source.
     *
     * @param name referenced name
     * @return fully-qualified identifier, or empty if the name is unknown to this policy
     */
    Optional<String> resolve(String name);
}
