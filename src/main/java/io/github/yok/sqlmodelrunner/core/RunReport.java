package io.github.yok.sqlmodelrunner.core;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Outcome of a run: one {@link ExecutionRecord} per model, in execution order.
 *
 * <p>
 * The report is the single source of truth about a run. A run is successful only when every
 * record is {@link ModelStatus#SUCCEEDED}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class RunReport {

    @Getter
    private final List<ExecutionRecord> records;

    // true when the caller aborted the run
    @Getter
    private final boolean aborted;

    /**
     * Creates a report.
     *
     * @param records records in execution order
     * @param aborted whether the run was aborted
     */
    public RunReport(List<ExecutionRecord> records, boolean aborted) {
        this.records = ImmutableList.copyOf(records);
        this.aborted = aborted;
    }

    /**
     * Returns whether every model succeeded.
     *
     * @return {@code true} on full success
     */
    public boolean isSuccess() {
        return records.stream().allMatch(r -> r.getStatus() == ModelStatus.SUCCEEDED);
    }

    /**
     * Returns the record of a model.
     *
     * @param modelName model name
     * @return record, or empty if the model was not part of the run
     */
    public Optional<ExecutionRecord> getRecord(String modelName) {
        return records.stream().filter(r -> r.getModelName().equals(modelName)).findFirst();
    }

    /**
     * Returns the final status of every model, in execution order.
     *
     * @return model name to status
     */
    public Map<String, ModelStatus> statusByModel() {
        Map<String, ModelStatus> result = new LinkedHashMap<>();
        records.forEach(r -> result.put(r.getModelName(), r.getStatus()));
        return result;
    }

    /**
     * Returns the records with the given status.
     *
     * @param status status
     * @return matching records in execution order
     */
    public List<ExecutionRecord> withStatus(ModelStatus status) {
        return records.stream().filter(r -> r.getStatus() == status).collect(Collectors.toList());
    }

    /**
     * Returns the failed records.
     *
     * @return failed records
     */
    public List<ExecutionRecord> getFailed() {
        return withStatus(ModelStatus.FAILED);
    }

    /**
     * Returns the skipped records.
     *
     * @return skipped records
     */
    public List<ExecutionRecord> getSkipped() {
        return withStatus(ModelStatus.SKIPPED);
    }

    /**
     * Returns a one-line summary such as {@code "3 model(s): 1 succeeded, 1 failed, 1 skipped"}.
     *
     * @return summary
     */
    public String summary() {
        return String.format("%d model(s): %d succeeded, %d failed, %d skipped%s", records.size(),
                withStatus(ModelStatus.SUCCEEDED).size(), getFailed().size(),
                getSkipped().size(), aborted ? " (aborted)" : "");
    }
}
