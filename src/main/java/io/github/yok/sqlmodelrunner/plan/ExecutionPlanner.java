package io.github.yok.sqlmodelrunner.plan;

import io.github.yok.sqlmodelrunner.graph.DependencyGraph;
import io.github.yok.sqlmodelrunner.model.Model;
import io.github.yok.sqlmodelrunner.resolve.NamingPolicy;
import io.github.yok.sqlmodelrunner.resolve.ReferenceResolver;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Resolves and plans every model of a graph into an {@link ExecutionPlan}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class ExecutionPlanner {

    private final ReferenceResolver resolver;
    private final MaterializationPlanner planner;

    /**
     * Creates a planner with the default resolver and materialization planner.
     */
    public ExecutionPlanner() {
        this(new ReferenceResolver(), new MaterializationPlanner());
    }

    /**
     * Builds the plan for every model of the graph, in execution order.
     *
     * @param graph validated graph
     * @param policy naming policy
     * @return plan
     * @throws IllegalStateException if a reference cannot be resolved by {@code policy}
     */
    public ExecutionPlan plan(DependencyGraph graph, NamingPolicy policy) {
        Validate.notNull(graph, "graph must not be null.");
        Validate.notNull(policy, "policy must not be null.");

        List<PlannedModel> planned = new ArrayList<>(graph.size());
        for (String name : graph.getExecutionOrder()) {
            Model model = graph.getModel(name);
            String target = policy.modelIdentifier(name);
            String resolvedBody = resolver.resolve(model, policy);
            List<String> statements = planner.plan(resolvedBody, model.getMaterialization(),
                    model.getPartitionBy(), target);
            planned.add(new PlannedModel(model, target, statements));
            log.debug("[{}] Planned {} statement(s) for {}", name, statements.size(), target);
        }
        return new ExecutionPlan(graph, planned);
    }
}
