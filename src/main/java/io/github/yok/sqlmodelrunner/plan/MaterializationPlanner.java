package io.github.yok.sqlmodelrunner.plan;

import io.github.yok.sqlmodelrunner.model.Materialization;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Generates the statements that materialize one model.
 *
 * <ul>
 * <li>{@code view}: {@code CREATE OR REPLACE VIEW <name> AS <query>}</li>
 * <li>{@code table}:
 * {@code CREATE OR REPLACE TABLE <name> [PARTITIONED BY (<cols>)] AS <query>}</li>
 * <li>{@code incremental}: same statement as a partitioned table. The table is fully rebuilt on
 * every run; append or merge semantics are not generated.</li>
 * </ul>
 *
 * <p>
 * The query is the resolved body with surrounding whitespace and one trailing {@code ;} removed.
 * Generation is pure: the same arguments always produce identical statements.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class MaterializationPlanner {

    /**
     * Plans the statements for one model.
     *
     * @param resolvedBody body with references already substituted
     * @param materialization materialization kind
     * @param partitionBy partition columns; may be empty
     * @param targetName fully-qualified output name
     * @return statements in execution order
     */
    public List<String> plan(String resolvedBody, Materialization materialization,
            List<String> partitionBy, String targetName) {
        Validate.notNull(materialization, "materialization must not be null.");
        Validate.notBlank(targetName, "targetName must not be blank.");
        String query = toQuery(resolvedBody);
        Validate.notBlank(query, "resolved body must not be blank.");

        switch (materialization) {
            case VIEW:
                return List.of("CREATE OR REPLACE VIEW " + targetName + " AS " + query);
            case TABLE:
            case INCREMENTAL:
                return List.of("CREATE OR REPLACE TABLE " + targetName
                        + partitionClause(partitionBy) + " AS " + query);
            default:
                throw new IllegalArgumentException(
                        "Unsupported materialization: " + materialization);
        }
    }

    static String toQuery(String resolvedBody) {
        String query = StringUtils.strip(resolvedBody);
        if (query != null && query.endsWith(";")) {
            query = StringUtils.stripEnd(query.substring(0, query.length() - 1), null);
        }
        return query;
    }

    private static String partitionClause(List<String> partitionBy) {
        if (partitionBy == null || partitionBy.isEmpty()) {
            return "";
        }
        return " PARTITIONED BY (" + String.join(", ", partitionBy) + ")";
    }
}
