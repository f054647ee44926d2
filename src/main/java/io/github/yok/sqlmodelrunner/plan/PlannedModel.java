package io.github.yok.sqlmodelrunner.plan;

import com.google.common.collect.ImmutableList;
import io.github.yok.sqlmodelrunner.model.Model;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * A model together with its output identifier and the statements that build it.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class PlannedModel {

    private final Model model;
    private final String targetName;
    private final List<String> statements;

    /**
     * Creates a planned model.
     *
     * @param model model
     * @param targetName fully-qualified output name
     * @param statements statements in execution order
     */
    public PlannedModel(Model model, String targetName, List<String> statements) {
        this.model = model;
        this.targetName = targetName;
        this.statements = ImmutableList.copyOf(statements);
    }

    /**
     * Returns the model name.
     *
     * @return model name
     */
    public String getName() {
        return model.getName();
    }
}
