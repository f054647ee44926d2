package io.github.yok.sqlmodelrunner.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.sqlmodelrunner.graph.DependencyGraph;
import io.github.yok.sqlmodelrunner.graph.DependencyGraphBuilder;
import io.github.yok.sqlmodelrunner.model.Materialization;
import io.github.yok.sqlmodelrunner.model.Model;
import io.github.yok.sqlmodelrunner.resolve.CatalogSchemaNamingPolicy;
import io.github.yok.sqlmodelrunner.resolve.NamingPolicy;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExecutionPlannerTest {

    private DependencyGraph graph;
    private NamingPolicy policy;

    @BeforeEach
    void setup() {
        List<Model> models = List.of(
                new Model("A", Materialization.TABLE, null, null, "SELECT * FROM {raw}",
                        "A.sql"),
                new Model("B", Materialization.VIEW, null, null, "SELECT * FROM {A};", "B.sql"),
                new Model("C", Materialization.INCREMENTAL, List.of("dt"), null,
                        "SELECT * FROM {B}", "C.sql"));
        graph = new DependencyGraphBuilder().build(models, Map.of("raw", "ext.raw").keySet());
        policy = new CatalogSchemaNamingPolicy("main", "an", graph.getModelNames(),
                Map.of("raw", "ext.raw"));
    }

    @Test
    void plan_正常ケース_3モデル_実行順に全ての文が計画されること() {
        ExecutionPlan plan = new ExecutionPlanner().plan(graph, policy);

        assertEquals(List.of("A", "B", "C"),
                plan.getModels().stream().map(PlannedModel::getName)
                        .collect(Collectors.toList()));
        assertEquals(List.of("CREATE OR REPLACE TABLE main.an.A AS SELECT * FROM ext.raw"),
                plan.get("A").getStatements());
        assertEquals(List.of("CREATE OR REPLACE VIEW main.an.B AS SELECT * FROM main.an.A"),
                plan.get("B").getStatements());
        assertEquals(List.of("CREATE OR REPLACE TABLE main.an.C PARTITIONED BY (dt) AS "
                + "SELECT * FROM main.an.B"), plan.get("C").getStatements());
        assertEquals("main.an.C", plan.get("C").getTargetName());
        assertEquals(3, plan.statementCount());
        assertEquals(graph, plan.getGraph());
    }

    @Test
    void render_正常ケース_計画を文字列化する_モデル名と文が含まれること() {
        String text = new ExecutionPlanner().plan(graph, policy).render();

        assertTrue(text.contains("3 model(s)"));
        assertTrue(text.contains("A [table] -> main.an.A"));
        assertTrue(text.contains("C [incremental] -> main.an.C"));
        assertTrue(text.contains("CREATE OR REPLACE VIEW main.an.B"));
    }

    @Test
    void get_異常ケース_計画にないモデル_IllegalArgumentExceptionが送出されること() {
        ExecutionPlan plan = new ExecutionPlanner().plan(graph, policy);
        assertThrows(IllegalArgumentException.class, () -> plan.get("Z"));
    }
}
