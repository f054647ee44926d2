package io.github.yok.sqlmodelrunner.core;

import io.github.yok.sqlmodelrunner.config.ConnectionConfig;
import io.github.yok.sqlmodelrunner.config.RunProfile;
import io.github.yok.sqlmodelrunner.exception.ConfigurationException;
import io.github.yok.sqlmodelrunner.executor.StatementExecutor;
import io.github.yok.sqlmodelrunner.executor.StatementExecutorFactory;
import io.github.yok.sqlmodelrunner.graph.DependencyGraph;
import io.github.yok.sqlmodelrunner.graph.DependencyGraphBuilder;
import io.github.yok.sqlmodelrunner.lint.LintViolation;
import io.github.yok.sqlmodelrunner.lint.ModelLinter;
import io.github.yok.sqlmodelrunner.model.Model;
import io.github.yok.sqlmodelrunner.parser.ModelLoader;
import io.github.yok.sqlmodelrunner.plan.ExecutionPlan;
import io.github.yok.sqlmodelrunner.plan.ExecutionPlanner;
import io.github.yok.sqlmodelrunner.resolve.CatalogSchemaNamingPolicy;
import io.github.yok.sqlmodelrunner.resolve.NamingPolicy;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Runs a model project: load, validate, plan, execute.
 *
 * <p>
 * Everything that can fail without touching the engine (model files, graph, plan, selection)
 * is checked first; the executor is created only once the plan is complete. The executor is
 * closed when the run ends, whatever its outcome.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class ProjectRunner {

    private final ModelLoader loader;
    private final DependencyGraphBuilder graphBuilder;
    private final ExecutionPlanner planner;
    private final Function<ConnectionConfig, StatementExecutor> executorProvider;

    // Orchestrator of the run in progress, for abort()
    private volatile ExecutionOrchestrator current;

    /**
     * Creates a runner with default components.
     *
     * @param executorProvider creates the executor for a connection
     */
    public ProjectRunner(Function<ConnectionConfig, StatementExecutor> executorProvider) {
        this(new ModelLoader(), new DependencyGraphBuilder(), new ExecutionPlanner(),
                executorProvider);
    }

    /**
     * Creates a runner using {@link StatementExecutorFactory}.
     *
     * @param factory executor factory
     */
    public ProjectRunner(StatementExecutorFactory factory) {
        this(factory::create);
    }

    /**
     * Runs every model.
     *
     * @param modelsDir models directory
     * @param profile run profile
     * @return run report
     */
    public RunReport run(Path modelsDir, RunProfile profile) {
        return run(modelsDir, profile, Set.of());
    }

    /**
     * Runs the selected models; an empty selection runs every model.
     *
     * @param modelsDir models directory
     * @param profile run profile
     * @param selection model names to run
     * @return run report
     * @throws ConfigurationException if a selected name is not a model
     */
    public RunReport run(Path modelsDir, RunProfile profile, Set<String> selection) {
        Validate.notNull(selection, "selection must not be null.");
        ExecutionPlan plan = preview(modelsDir, profile);
        Collection<String> names = resolveSelection(plan.getGraph(), selection);

        try (StatementExecutor executor = executorProvider.apply(profile.getConnection())) {
            ExecutionOrchestrator orchestrator = new ExecutionOrchestrator(executor,
                    profile.getFailureMode(), profile.getThreads());
            current = orchestrator;
            try {
                return orchestrator.run(plan, names);
            } finally {
                current = null;
            }
        }
    }

    /**
     * Loads, validates and plans the project without executing anything.
     *
     * @param modelsDir models directory
     * @param profile run profile
     * @return execution plan
     */
    public ExecutionPlan preview(Path modelsDir, RunProfile profile) {
        Validate.notNull(modelsDir, "modelsDir must not be null.");
        Validate.notNull(profile, "profile must not be null.");

        List<Model> models = loader.load(modelsDir);
        DependencyGraph graph = graphBuilder.build(models, profile.getSources().keySet());
        NamingPolicy policy = new CatalogSchemaNamingPolicy(profile.getCatalog(),
                profile.getSchema(), graph.getModelNames(), profile.getSources());
        ExecutionPlan plan = planner.plan(graph, policy);
        log.info("Planned {} model(s), {} statement(s)", graph.size(), plan.statementCount());
        return plan;
    }

    /**
     * Lints model and source names.
     *
     * @param modelsDir models directory
     * @param profile run profile, for source names
     * @param linter linter
     * @return violations
     */
    public List<LintViolation> lint(Path modelsDir, RunProfile profile, ModelLinter linter) {
        Validate.notNull(profile, "profile must not be null.");
        Validate.notNull(linter, "linter must not be null.");
        List<Model> models = loader.load(modelsDir);
        return linter.lint(models, profile.getSources().keySet());
    }

    /**
     * Aborts the run in progress, if any.
     */
    public void abort() {
        ExecutionOrchestrator orchestrator = current;
        if (orchestrator != null) {
            orchestrator.abort();
        }
    }

    private static Collection<String> resolveSelection(DependencyGraph graph,
            Set<String> selection) {
        if (selection.isEmpty()) {
            return graph.getExecutionOrder();
        }
        Set<String> unknown = new TreeSet<>();
        for (String name : selection) {
            if (!graph.containsModel(name)) {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("Selected model(s) not found: " + unknown);
        }
        log.info("Running selected model(s) only: {}", new TreeSet<>(selection));
        return selection;
    }
}
