package io.github.yok.sqlmodelrunner.resolve;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * {@link NamingPolicy} that places models under {@code [catalog.]schema} and maps sources through
 * the profile's {@code sources} section.
 *
 * <pre>
 * catalog = main, schema = analytics
 *   model  orders      -&gt; main.analytics.orders
 *   source raw_events  -&gt; value configured for raw_events (e.g. main.raw.events)
 * </pre>
 *
 * <p>
 * When a name is both a model and a source, the model wins, matching the graph builder.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class CatalogSchemaNamingPolicy implements NamingPolicy {

    // Optional catalog; blank means "schema.model"
    private final String catalog;

    // Target schema for every model
    private final String schema;

    // Names of the models in the current run
    private final Set<String> modelNames;

    // Source name -> fully-qualified identifier
    private final Map<String, String> sources;

    /**
     * Creates a policy.
     *
     * @param catalog catalog; may be {@code null} or blank
     * @param schema schema; must not be blank
     * @param modelNames names of the models in the run
     * @param sources source name to identifier map; may be {@code null}
     */
    public CatalogSchemaNamingPolicy(String catalog, String schema, Set<String> modelNames,
            Map<String, String> sources) {
        Validate.notBlank(schema, "schema must not be blank.");
        Validate.notNull(modelNames, "modelNames must not be null.");
        this.catalog = StringUtils.trimToNull(catalog);
        this.schema = schema.trim();
        this.modelNames = ImmutableSet.copyOf(modelNames);
        this.sources = sources == null ? ImmutableMap.of() : ImmutableMap.copyOf(sources);
    }

    @Override
    public String modelIdentifier(String modelName) {
        Validate.notBlank(modelName, "modelName must not be blank.");
        if (catalog == null) {
            return schema + "." + modelName;
        }
        return catalog + "." + schema + "." + modelName;
    }

    @Override
    public Optional<String> resolve(String name) {
        if (modelNames.contains(name)) {
            return Optional.of(modelIdentifier(name));
        }
        return Optional.ofNullable(sources.get(name));
    }
}
