package io.github.yok.sqlmodelrunner.exception;

import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Raised when the model set does not form a valid dependency graph.
 *
 * <p>
 * Three situations are reported:
 * </p>
 * <ul>
 * <li>a dependency cycle ({@link #getCyclePath()} holds the cycle, first node repeated at the
 * end)</li>
 * <li>references that match neither a model nor a declared source
 * ({@link #getUnresolvedReferences()} holds every {@code model -> reference} pair)</li>
 * <li>two model files declaring the same name</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class GraphException extends ModelRunnerException {

    private static final long serialVersionUID = 1L;

    // Cycle path such as [a, b, c, a]; empty unless this is a cycle error
    private final List<String> cyclePath;

    // "model -> reference" pairs; empty unless this is an unresolved reference error
    private final List<String> unresolvedReferences;

    private GraphException(String message, List<String> cyclePath,
            List<String> unresolvedReferences) {
        super(message);
        this.cyclePath = Collections.unmodifiableList(cyclePath);
        this.unresolvedReferences = Collections.unmodifiableList(unresolvedReferences);
    }

    /**
     * Creates a cycle error.
     *
     * @param cyclePath cycle path, first node repeated at the end
     * @return exception
     */
    public static GraphException cycle(List<String> cyclePath) {
        return new GraphException("Cyclic dependency detected: " + String.join(" -> ", cyclePath),
                List.copyOf(cyclePath), List.of());
    }

    /**
     * Creates an unresolved reference error.
     *
     * @param unresolved {@code model -> reference} pairs
     * @return exception
     */
    public static GraphException unresolved(List<String> unresolved) {
        return new GraphException(
                "Unresolved model or source reference(s): " + String.join(", ", unresolved),
                List.of(), List.copyOf(unresolved));
    }

    /**
     * Creates a duplicate model name error.
     *
     * @param name duplicated model name
     * @param firstPath file that declared the name first
     * @param secondPath file that declared it again
     * @return exception
     */
    public static GraphException duplicate(String name, String firstPath, String secondPath) {
        return new GraphException("Duplicate model name '" + name + "' declared in " + firstPath
                + " and " + secondPath, List.of(), List.of());
    }
}
