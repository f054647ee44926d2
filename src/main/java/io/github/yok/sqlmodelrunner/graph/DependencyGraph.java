package io.github.yok.sqlmodelrunner.graph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import io.github.yok.sqlmodelrunner.model.Model;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.apache.commons.lang3.Validate;

/**
 * Validated dependency graph of a model set.
 *
 * <p>
 * Nodes are model names. An edge {@code a -> b} means model {@code a} must run before model
 * {@code b} ({@code b} references {@code a} inline or lists it in {@code depends_on}). Instances
 * are only created by {@link DependencyGraphBuilder}, which guarantees that the graph is acyclic
 * and that every reference is resolved.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class DependencyGraph {

    private final Map<String, Model> models;
    private final Map<String, SortedSet<String>> upstream;
    private final Map<String, SortedSet<String>> downstream;
    private final Map<String, SortedSet<String>> sources;
    private final List<String> executionOrder;

    DependencyGraph(Map<String, Model> models, Map<String, SortedSet<String>> upstream,
            Map<String, SortedSet<String>> downstream, Map<String, SortedSet<String>> sources,
            List<String> executionOrder) {
        this.models = ImmutableMap.copyOf(models);
        this.upstream = freeze(upstream);
        this.downstream = freeze(downstream);
        this.sources = freeze(sources);
        this.executionOrder = ImmutableList.copyOf(executionOrder);
    }

    private static Map<String, SortedSet<String>> freeze(Map<String, SortedSet<String>> map) {
        ImmutableMap.Builder<String, SortedSet<String>> builder = ImmutableMap.builder();
        map.forEach((k, v) -> builder.put(k, ImmutableSortedSet.copyOf(v)));
        return builder.build();
    }

    /**
     * Returns the deterministic topological order (ties broken by ascending name).
     *
     * @return model names, dependencies first
     */
    public List<String> getExecutionOrder() {
        return executionOrder;
    }

    /**
     * Returns the model with the given name.
     *
     * @param name model name
     * @return model
     * @throws IllegalArgumentException if the name is not a node of this graph
     */
    public Model getModel(String name) {
        Model model = models.get(name);
        Validate.isTrue(model != null, "Unknown model: %s", name);
        return model;
    }

    /**
     * Returns whether a model with the given name exists.
     *
     * @param name model name
     * @return {@code true} if present
     */
    public boolean containsModel(String name) {
        return models.containsKey(name);
    }

    /**
     * Returns the models that must run before {@code name} (direct dependencies only).
     *
     * @param name model name
     * @return dependency names, ascending
     */
    public SortedSet<String> getUpstream(String name) {
        getModel(name);
        return upstream.get(name);
    }

    /**
     * Returns the models that directly depend on {@code name}.
     *
     * @param name model name
     * @return dependent names, ascending
     */
    public SortedSet<String> getDownstream(String name) {
        getModel(name);
        return downstream.get(name);
    }

    /**
     * Returns the external sources referenced by {@code name}.
     *
     * @param name model name
     * @return source names, ascending
     */
    public SortedSet<String> getSources(String name) {
        getModel(name);
        return sources.get(name);
    }

    /**
     * Returns every model reachable downstream from {@code name}, excluding itself.
     *
     * @param name model name
     * @return transitive dependents, ascending
     */
    public SortedSet<String> getDescendants(String name) {
        SortedSet<String> result = new TreeSet<>();
        Deque<String> queue = new ArrayDeque<>(getDownstream(name));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (result.add(current)) {
                queue.addAll(downstream.get(current));
            }
        }
        return result;
    }

    /**
     * Returns the number of models.
     *
     * @return node count
     */
    public int size() {
        return models.size();
    }

    /**
     * Returns all model names, ascending.
     *
     * @return model names
     */
    public Set<String> getModelNames() {
        return ImmutableSortedSet.copyOf(models.keySet());
    }
}
