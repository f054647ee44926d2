package io.github.yok.sqlmodelrunner.graph;

import io.github.yok.sqlmodelrunner.exception.GraphException;
import io.github.yok.sqlmodelrunner.model.Model;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Builds and validates the {@link DependencyGraph} of a model set.
 *
 * <h2>Edges</h2>
 *
 * <p>
 * For each model, the references are the names listed in {@code depends_on} plus the names of all
 * reference tokens found by {@link ReferenceScanner}. A name listed both ways yields one edge.
 * </p>
 *
 * <h2>Validation (in this order)</h2>
 *
 * <ol>
 * <li>Duplicate model names: {@link GraphException} naming both files.</li>
 * <li>Unresolved references: a reference that matches neither a model nor a declared source. All
 * offending {@code model -> reference} pairs are reported together.</li>
 * <li>Cycles: depth-first traversal tracking the active path. The first cycle found is reported as
 * a path whose first node is repeated at the end. Traversal starts from nodes in ascending name
 * order, so the same input always reports the same cycle.</li>
 * </ol>
 *
 * <h2>Order</h2>
 *
 * <p>
 * Kahn's topological sort with a priority queue: among models whose dependencies are all
 * scheduled, the alphabetically smallest name goes first. The result therefore does not depend on
 * the order in which model files were discovered.
 * </p>
 *
 * <p>
 * A name that is both a model and a source resolves to the model.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DependencyGraphBuilder {

    /**
     * Builds a graph without external sources.
     *
     * @param models parsed models
     * @return validated graph
     * @throws GraphException if the model set is invalid
     */
    public DependencyGraph build(Collection<Model> models) {
        return build(models, Set.of());
    }

    /**
     * Builds and validates the dependency graph.
     *
     * @param models parsed models
     * @param sourceNames names of external sources declared in the profile
     * @return validated graph
     * @throws GraphException if the model set is invalid
     */
    public DependencyGraph build(Collection<Model> models, Set<String> sourceNames) {
        Validate.notNull(models, "models must not be null.");
        Validate.notNull(sourceNames, "sourceNames must not be null.");

        // Step 1: index by name
        Map<String, Model> byName = new TreeMap<>();
        for (Model model : models) {
            Model previous = byName.putIfAbsent(model.getName(), model);
            if (previous != null) {
                throw GraphException.duplicate(model.getName(), previous.getSourcePath(),
                        model.getSourcePath());
            }
        }

        // Step 2: collect edges (dependency -> dependent) and source references
        Map<String, SortedSet<String>> upstream = new HashMap<>();
        Map<String, SortedSet<String>> downstream = new HashMap<>();
        Map<String, SortedSet<String>> sources = new HashMap<>();
        for (String name : byName.keySet()) {
            upstream.put(name, new TreeSet<>());
            downstream.put(name, new TreeSet<>());
            sources.put(name, new TreeSet<>());
        }

        List<String> unresolved = new ArrayList<>();
        for (Model model : byName.values()) {
            String name = model.getName();
            for (String ref : collectReferences(model)) {
                if (byName.containsKey(ref)) {
                    if (sourceNames.contains(ref)) {
                        log.warn("[{}] '{}' is both a model and a source; using the model", name,
                                ref);
                    }
                    upstream.get(name).add(ref);
                    downstream.get(ref).add(name);
                    log.debug("Dependency detected: '{}' -> '{}'", ref, name);
                } else if (sourceNames.contains(ref)) {
                    sources.get(name).add(ref);
                } else {
                    unresolved.add(name + " -> " + ref);
                }
            }
        }
        if (!unresolved.isEmpty()) {
            throw GraphException.unresolved(unresolved);
        }

        // Step 3: cycle detection
        detectCycle(byName.keySet(), upstream);

        // Step 4: Kahn's topological sort with alphabetical tie-break
        List<String> order = topologicalOrder(byName.keySet(), upstream, downstream);

        log.info("Resolved model order: {}", order);
        return new DependencyGraph(byName, upstream, downstream, sources, order);
    }

    /**
     * Returns the explicit and inline references of a model, explicit ones first, without
     * duplicates.
     *
     * @param model model
     * @return referenced names
     */
    Set<String> collectReferences(Model model) {
        Set<String> refs = new LinkedHashSet<>(model.getExplicitDependencies());
        refs.addAll(ReferenceScanner.referencedNames(model.getBody()));
        return refs;
    }

    private void detectCycle(Set<String> names, Map<String, SortedSet<String>> upstream) {
        Map<String, Boolean> onPath = new HashMap<>();
        List<String> path = new ArrayList<>();
        for (String name : names) {
            if (!onPath.containsKey(name)) {
                visit(name, upstream, onPath, path);
            }
        }
    }

    /**
     * Depth-first visit along dependency edges. {@code onPath} holds {@code true} while a node is
     * on the active path and {@code false} once it is finished.
     */
    private void visit(String name, Map<String, SortedSet<String>> upstream,
            Map<String, Boolean> onPath, List<String> path) {
        onPath.put(name, Boolean.TRUE);
        path.add(name);
        for (String dep : upstream.get(name)) {
            Boolean state = onPath.get(dep);
            if (Boolean.TRUE.equals(state)) {
                throw GraphException.cycle(cycleFrom(path, dep));
            }
            if (state == null) {
                visit(dep, upstream, onPath, path);
            }
        }
        path.remove(path.size() - 1);
        onPath.put(name, Boolean.FALSE);
    }

    /**
     * Converts the active path segment starting at {@code repeated} into a cycle in edge direction
     * (dependency before dependent), first node repeated at the end.
     */
    private static List<String> cycleFrom(List<String> path, String repeated) {
        // path runs dependent -> dependency; the segment is reversed to follow edge direction
        List<String> segment = new ArrayList<>(path.subList(path.indexOf(repeated), path.size()));
        List<String> cycle = new ArrayList<>(segment.size() + 1);
        cycle.add(repeated);
        for (int i = segment.size() - 1; i >= 1; i--) {
            cycle.add(segment.get(i));
        }
        cycle.add(repeated);
        return cycle;
    }

    private static List<String> topologicalOrder(Set<String> names,
            Map<String, SortedSet<String>> upstream, Map<String, SortedSet<String>> downstream) {
        Map<String, Integer> inDegree = new HashMap<>();
        PriorityQueue<String> queue = new PriorityQueue<>();
        for (String name : names) {
            int degree = upstream.get(name).size();
            inDegree.put(name, degree);
            if (degree == 0) {
                queue.offer(name);
            }
        }

        List<String> sorted = new ArrayList<>(names.size());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            sorted.add(current);
            for (String child : downstream.get(current)) {
                int newDegree = inDegree.merge(child, -1, Integer::sum);
                if (newDegree == 0) {
                    queue.offer(child);
                }
            }
        }

        if (sorted.size() != names.size()) {
            // detectCycle runs first, so this cannot happen for a consistent edge set
            throw new IllegalStateException("Topological sort left "
                    + (names.size() - sorted.size()) + " model(s) unscheduled");
        }
        return sorted;
    }
}
