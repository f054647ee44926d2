package io.github.yok.sqlmodelrunner.core;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.sqlmodelrunner.config.FailureMode;
import io.github.yok.sqlmodelrunner.exception.StatementExecutionException;
import io.github.yok.sqlmodelrunner.executor.StatementExecutor;
import io.github.yok.sqlmodelrunner.graph.DependencyGraph;
import io.github.yok.sqlmodelrunner.plan.ExecutionPlan;
import io.github.yok.sqlmodelrunner.plan.ExecutionPlanner;
import io.github.yok.sqlmodelrunner.plan.PlannedModel;
import io.github.yok.sqlmodelrunner.resolve.NamingPolicy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Executes the models of a plan in dependency order and tracks the outcome of each.
 *
 * <h2>Per model</h2>
 *
 * <ol>
 * <li>If a transitive dependency that is part of the run did not succeed, the model is
 * {@code SKIPPED} and never attempted.</li>
 * <li>Otherwise it is marked {@code RUNNING} and its planned statements are sent to the
 * {@link StatementExecutor} one by one.</li>
 * <li>It is {@code SUCCEEDED} when every statement completed, {@code FAILED} at the first failing
 * statement (later statements are not sent).</li>
 * </ol>
 *
 * <h2>Failure policy</h2>
 *
 * <ul>
 * <li>{@link FailureMode#FAIL_FAST}: after the first failure nothing new is dispatched; every model
 * not yet reached is skipped.</li>
 * <li>{@link FailureMode#CONTINUE_ON_ERROR}: independent branches keep running; only descendants of
 * a failed model are skipped.</li>
 * </ul>
 *
 * <p>
 * Failed statements are never retried. The report keeps each model's error so a caller can rerun a
 * selection.
 * </p>
 *
 * <h2>Concurrency</h2>
 *
 * <p>
 * With {@code threads == 1} models run one after another on the calling thread, in the graph's
 * execution order. With more threads, models whose dependencies have all reached a terminal state
 * are dispatched to a fixed pool in execution-order position. Only the calling thread reads and
 * writes the {@link StatusTable}; workers just execute statements and return an outcome.
 * </p>
 *
 * <p>
 * {@link #abort()} (or interrupting the calling thread) stops new dispatches. Models already
 * running finish, and every model still pending is marked skipped, so the report never contains a
 * pending or running record.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ExecutionOrchestrator {

    static final String REASON_UPSTREAM = "upstream model did not succeed";
    static final String REASON_FAIL_FAST = "fail-fast: an earlier model failed";
    static final String REASON_ABORTED = "run aborted";

    private final StatementExecutor executor;

    @Getter
    private final FailureMode failureMode;

    @Getter
    private final int threads;

    private final ExecutionPlanner planner;

    private final AtomicBoolean abortRequested = new AtomicBoolean(false);

    /**
     * Result of executing one model on a worker.
     */
    private static final class Outcome {
        private final String modelName;
        private final StatementExecutionException error;
        private final long elapsedMillis;

        Outcome(String modelName, StatementExecutionException error, long elapsedMillis) {
            this.modelName = modelName;
            this.error = error;
            this.elapsedMillis = elapsedMillis;
        }
    }

    /**
     * Creates an orchestrator.
     *
     * @param executor statement executor
     * @param failureMode failure policy
     * @param threads worker count, at least 1
     */
    public ExecutionOrchestrator(StatementExecutor executor, FailureMode failureMode, int threads) {
        this(executor, failureMode, threads, new ExecutionPlanner());
    }

    /**
     * Creates an orchestrator with a custom planner.
     *
     * @param executor statement executor
     * @param failureMode failure policy
     * @param threads worker count, at least 1
     * @param planner execution planner
     */
    public ExecutionOrchestrator(StatementExecutor executor, FailureMode failureMode, int threads,
            ExecutionPlanner planner) {
        Validate.notNull(executor, "executor must not be null.");
        Validate.notNull(failureMode, "failureMode must not be null.");
        Validate.isTrue(threads >= 1, "threads must be at least 1: %d", threads);
        Validate.notNull(planner, "planner must not be null.");
        this.executor = executor;
        this.failureMode = failureMode;
        this.threads = threads;
        this.planner = planner;
    }

    /**
     * Plans and runs every model of the graph.
     *
     * @param graph validated graph
     * @param policy naming policy
     * @return run report
     */
    public RunReport run(DependencyGraph graph, NamingPolicy policy) {
        ExecutionPlan plan = planner.plan(graph, policy);
        return run(plan, graph.getExecutionOrder());
    }

    /**
     * Runs every model of a plan.
     *
     * @param plan execution plan
     * @return run report
     */
    public RunReport run(ExecutionPlan plan) {
        return run(plan, plan.getGraph().getExecutionOrder());
    }

    /**
     * Runs the selected models of a plan.
     *
     * <p>
     * Models outside the selection are not built and are assumed to exist in the target already.
     * They are looked through, not treated as a boundary: with {@code A -> B -> C} and the
     * selection {@code A, C}, {@code C} waits for {@code A} and is skipped if {@code A} did not
     * succeed.
     * </p>
     *
     * @param plan execution plan
     * @param selection names of the models to run; each must be part of the plan
     * @return run report with one record per selected model, in execution order
     */
    public RunReport run(ExecutionPlan plan, Collection<String> selection) {
        Validate.notNull(plan, "plan must not be null.");
        Validate.notNull(selection, "selection must not be null.");
        Set<String> selected = new HashSet<>(selection);
        List<String> order = new ArrayList<>();
        for (String name : plan.getGraph().getExecutionOrder()) {
            if (selected.remove(name)) {
                order.add(name);
            }
        }
        Validate.isTrue(selected.isEmpty(), "Models not in plan: %s", selected);

        Map<String, SortedSet<String>> upstream = upstreamInRun(plan.getGraph(), order);
        StatusTable table = new StatusTable(order);
        log.info("Running {} model(s) (failureMode={}, threads={})", order.size(), failureMode,
                threads);

        boolean aborted;
        if (threads == 1) {
            aborted = runSequential(plan, order, upstream, table);
        } else {
            aborted = runParallel(plan, order, upstream, table);
        }

        RunReport report = new RunReport(table.snapshot(), aborted);
        if (report.isSuccess()) {
            log.info("Run completed: {}", report.summary());
        } else {
            log.warn("Run completed with problems: {}", report.summary());
        }
        return report;
    }

    /**
     * Requests the current run to stop. Running models finish; pending models are skipped.
     */
    public void abort() {
        if (abortRequested.compareAndSet(false, true)) {
            log.warn("Abort requested; no further models will be started");
        }
    }

    /**
     * Maps every model of the run to the nearest ancestors that are also part of the run. Paths
     * through models outside the run are followed until a model of the run is reached.
     */
    private static Map<String, SortedSet<String>> upstreamInRun(DependencyGraph graph,
            List<String> order) {
        Set<String> inRun = new HashSet<>(order);
        Map<String, SortedSet<String>> result = new HashMap<>();
        for (String name : order) {
            SortedSet<String> found = new TreeSet<>();
            Set<String> visited = new HashSet<>();
            Deque<String> pending = new ArrayDeque<>(graph.getUpstream(name));
            while (!pending.isEmpty()) {
                String dep = pending.pop();
                if (!visited.add(dep)) {
                    continue;
                }
                if (inRun.contains(dep)) {
                    found.add(dep);
                } else {
                    pending.addAll(graph.getUpstream(dep));
                }
            }
            result.put(name, found);
        }
        return result;
    }

    private boolean runSequential(ExecutionPlan plan, List<String> order,
            Map<String, SortedSet<String>> upstream, StatusTable table) {
        String stopReason = null;
        for (String name : order) {
            if (stopReason == null && isAbortRequested()) {
                stopReason = REASON_ABORTED;
            }
            if (stopReason != null) {
                skip(table, name, null, stopReason);
                continue;
            }
            String blocker = findBlocker(upstream.get(name), table);
            if (blocker != null) {
                skip(table, name, blocker, REASON_UPSTREAM);
                continue;
            }

            table.markRunning(name);
            Outcome outcome = execute(plan.get(name));
            if (!recordOutcome(table, outcome) && failureMode == FailureMode.FAIL_FAST) {
                stopReason = REASON_FAIL_FAST;
            }
        }
        return REASON_ABORTED.equals(stopReason);
    }

    private boolean runParallel(ExecutionPlan plan, List<String> order,
            Map<String, SortedSet<String>> upstream, StatusTable table) {
        ExecutorService pool = Executors.newFixedThreadPool(threads,
                new ThreadFactoryBuilder().setNameFormat("model-worker-%d").build());
        CompletionService<Outcome> completion = new ExecutorCompletionService<>(pool);

        String stopReason = null;
        boolean interrupted = false;
        int running = 0;
        try {
            while (true) {
                if (stopReason == null && (interrupted || isAbortRequested())) {
                    stopReason = REASON_ABORTED;
                }
                if (stopReason == null) {
                    running += dispatchReady(plan, order, upstream, table, completion, running);
                }
                if (running == 0) {
                    break;
                }

                Future<Outcome> done;
                try {
                    done = completion.take();
                } catch (InterruptedException e) {
                    // keep collecting running models so that their outcome is recorded
                    interrupted = true;
                    continue;
                }
                running--;
                if (!recordOutcome(table, outcomeOf(done)) && failureMode == FailureMode.FAIL_FAST
                        && stopReason == null) {
                    stopReason = REASON_FAIL_FAST;
                }
            }
        } finally {
            pool.shutdown();
            awaitTermination(pool);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        for (String name : table.namesWithStatus(ModelStatus.PENDING)) {
            String blocker = findBlocker(upstream.get(name), table);
            if (stopReason == null && blocker != null) {
                skip(table, name, blocker, REASON_UPSTREAM);
            } else {
                skip(table, name, null, stopReason == null ? REASON_ABORTED : stopReason);
            }
        }
        return REASON_ABORTED.equals(stopReason);
    }

    /**
     * Dispatches every pending model whose dependencies are terminal, up to the free worker count.
     * Models with a dependency that did not succeed are skipped during the same pass.
     *
     * @return number of models dispatched
     */
    private int dispatchReady(ExecutionPlan plan, List<String> order,
            Map<String, SortedSet<String>> upstream, StatusTable table,
            CompletionService<Outcome> completion, int running) {
        int dispatched = 0;
        for (String name : order) {
            if (table.statusOf(name) != ModelStatus.PENDING
                    || !upstreamTerminal(upstream.get(name), table)) {
                continue;
            }
            String blocker = findBlocker(upstream.get(name), table);
            if (blocker != null) {
                skip(table, name, blocker, REASON_UPSTREAM);
                continue;
            }
            if (running + dispatched >= threads) {
                continue;
            }
            table.markRunning(name);
            PlannedModel pm = plan.get(name);
            completion.submit(() -> execute(pm));
            dispatched++;
        }
        return dispatched;
    }

    private Outcome outcomeOf(Future<Outcome> done) {
        try {
            return done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading a completed model", e);
        } catch (ExecutionException e) {
            // execute() catches every RuntimeException; reaching here means an Error on a worker
            throw new IllegalStateException("Model worker terminated abnormally", e.getCause());
        }
    }

    private static void awaitTermination(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                log.warn("Model worker pool did not terminate within 1 minute");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Sends the statements of one model to the executor. Runs on a worker in parallel mode.
     *
     * @param pm planned model
     * @return outcome; never throws for statement failures
     */
    private Outcome execute(PlannedModel pm) {
        String name = pm.getName();
        log.info("[{}] Building {} {}", name, pm.getModel().getMaterialization().headerValue(),
                pm.getTargetName());
        long start = System.nanoTime();
        String current = null;
        try {
            for (String statement : pm.getStatements()) {
                current = statement;
                executor.execute(statement);
            }
            return new Outcome(name, null, elapsedSince(start));
        } catch (StatementExecutionException e) {
            return new Outcome(name, e.forModel(name), elapsedSince(start));
        } catch (RuntimeException e) {
            return new Outcome(name,
                    new StatementExecutionException(name, current, e.toString(), e),
                    elapsedSince(start));
        }
    }

    /**
     * Records an outcome.
     *
     * @return {@code true} if the model succeeded
     */
    private static boolean recordOutcome(StatusTable table, Outcome outcome) {
        if (outcome.error == null) {
            table.markSucceeded(outcome.modelName, outcome.elapsedMillis);
            log.info("[{}] Succeeded in {} ms", outcome.modelName, outcome.elapsedMillis);
            return true;
        }
        table.markFailed(outcome.modelName, outcome.error, outcome.elapsedMillis);
        log.error("[{}] Failed: {}\n  statement: {}", outcome.modelName,
                outcome.error.getEngineMessage(), outcome.error.getStatement());
        return false;
    }

    private static void skip(StatusTable table, String name, String blocker, String reason) {
        table.markSkipped(name, blocker, reason);
        if (blocker != null) {
            log.warn("[{}] Skipped: upstream '{}' did not succeed", name, blocker);
        } else {
            log.warn("[{}] Skipped: {}", name, reason);
        }
    }

    /**
     * Returns the first upstream model of the run (ascending name) that did not succeed, or
     * {@code null} if none.
     */
    private static String findBlocker(SortedSet<String> upstream, StatusTable table) {
        for (String dep : upstream) {
            if (table.statusOf(dep) != ModelStatus.SUCCEEDED) {
                return dep;
            }
        }
        return null;
    }

    private static boolean upstreamTerminal(SortedSet<String> upstream, StatusTable table) {
        for (String dep : upstream) {
            if (!table.statusOf(dep).isTerminal()) {
                return false;
            }
        }
        return true;
    }

    private boolean isAbortRequested() {
        return abortRequested.get() || Thread.currentThread().isInterrupted();
    }

    private static long elapsedSince(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
