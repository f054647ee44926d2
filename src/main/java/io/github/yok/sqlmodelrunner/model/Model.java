package io.github.yok.sqlmodelrunner.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * One named, file-defined transformation.
 *
 * <p>
 * Instances are created by {@link io.github.yok.sqlmodelrunner.parser.ModelParser} once per model
 * file and never change afterwards. Collections are defensively copied into immutable Guava
 * collections.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString(exclude = "body")
@EqualsAndHashCode
public final class Model {

    // Unique model name (header "name" or file base name)
    private final String name;

    // Physical form of the output
    private final Materialization materialization;

    // Partition columns in declaration order; empty when not partitioned
    private final List<String> partitionBy;

    // Names listed in the "depends_on" header, in declaration order
    private final Set<String> explicitDependencies;

    // SQL body including reference tokens, stored verbatim
    private final String body;

    // Origin file, used for error messages only
    private final String sourcePath;

    /**
     * Creates a model.
     *
     * @param name model name; must not be blank
     * @param materialization materialization; must not be {@code null}
     * @param partitionBy partition columns; may be {@code null}
     * @param explicitDependencies header dependencies; may be {@code null}
     * @param body SQL body; must not be {@code null}
     * @param sourcePath origin file; must not be {@code null}
     */
    public Model(String name, Materialization materialization, Collection<String> partitionBy,
            Collection<String> explicitDependencies, String body, String sourcePath) {
        Validate.notBlank(name, "name must not be blank.");
        this.name = name;
        this.materialization =
                Objects.requireNonNull(materialization, "materialization must not be null.");
        this.partitionBy =
                partitionBy == null ? ImmutableList.of() : ImmutableList.copyOf(partitionBy);
        this.explicitDependencies = explicitDependencies == null ? ImmutableSet.of()
                : ImmutableSet.copyOf(explicitDependencies);
        this.body = Objects.requireNonNull(body, "body must not be null.");
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath must not be null.");
    }

    /**
     * Returns whether partition columns were declared.
     *
     * @return {@code true} if {@code partition_by} is set
     */
    public boolean isPartitioned() {
        return !partitionBy.isEmpty();
    }
}
