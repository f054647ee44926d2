package io.github.yok.sqlmodelrunner.plan;

import com.google.common.collect.ImmutableMap;
import io.github.yok.sqlmodelrunner.graph.DependencyGraph;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.apache.commons.lang3.Validate;

/**
 * Statements for every model of a run, in execution order.
 *
 * <p>
 * A plan is built before the first statement is sent to the engine. It is also what the
 * {@code --preview} option prints.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ExecutionPlan {

    @Getter
    private final DependencyGraph graph;

    // Model name -> planned model, in execution order
    private final Map<String, PlannedModel> planned;

    /**
     * Creates a plan.
     *
     * @param graph validated graph
     * @param plannedModels planned models in the graph's execution order
     */
    public ExecutionPlan(DependencyGraph graph, Collection<PlannedModel> plannedModels) {
        this.graph = graph;
        ImmutableMap.Builder<String, PlannedModel> builder = ImmutableMap.builder();
        for (PlannedModel pm : plannedModels) {
            builder.put(pm.getName(), pm);
        }
        this.planned = builder.build();
    }

    /**
     * Returns the planned models in execution order.
     *
     * @return planned models
     */
    public List<PlannedModel> getModels() {
        return new ArrayList<>(planned.values());
    }

    /**
     * Returns the planned model with the given name.
     *
     * @param name model name
     * @return planned model
     * @throws IllegalArgumentException if the model is not part of this plan
     */
    public PlannedModel get(String name) {
        PlannedModel pm = planned.get(name);
        Validate.isTrue(pm != null, "Model not in plan: %s", name);
        return pm;
    }

    /**
     * Returns the total number of statements in the plan.
     *
     * @return statement count
     */
    public int statementCount() {
        return planned.values().stream().mapToInt(pm -> pm.getStatements().size()).sum();
    }

    /**
     * Renders the plan as human-readable text, one model per block.
     *
     * @return plan text
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Execution plan (").append(planned.size()).append(" model(s)):")
                .append(System.lineSeparator());
        int index = 1;
        for (PlannedModel pm : planned.values()) {
            sb.append(String.format("%3d. %s [%s] -> %s", index++, pm.getName(),
                    pm.getModel().getMaterialization().headerValue(), pm.getTargetName()))
                    .append(System.lineSeparator());
            for (String statement : pm.getStatements()) {
                sb.append("       ").append(statement.replace("\n", "\n       "))
                        .append(System.lineSeparator());
            }
        }
        return sb.toString();
    }
}
