package io.github.yok.sqlmodelrunner.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.sqlmodelrunner.config.ConnectionConfig;
import io.github.yok.sqlmodelrunner.config.FailureMode;
import io.github.yok.sqlmodelrunner.config.RunProfile;
import io.github.yok.sqlmodelrunner.exception.ConfigurationException;
import io.github.yok.sqlmodelrunner.exception.GraphException;
import io.github.yok.sqlmodelrunner.exception.ModelParseException;
import io.github.yok.sqlmodelrunner.executor.StatementExecutor;
import io.github.yok.sqlmodelrunner.executor.StatementExecutorFactory;
import io.github.yok.sqlmodelrunner.lint.LintViolation;
import io.github.yok.sqlmodelrunner.lint.ModelLinter;
import io.github.yok.sqlmodelrunner.plan.ExecutionPlan;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectRunnerTest {

    @TempDir
    Path modelsDir;

    private String url;
    private RunProfile profile;

    @BeforeEach
    void setup() throws Exception {
        url = "jdbc:h2:mem:runner_" + UUID.randomUUID().toString().replace("-", "")
                + ";DB_CLOSE_DELAY=-1";
        try (Connection conn = DriverManager.getConnection(url);
                Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE RAW_ORDERS (ID INT, AMOUNT INT)");
            st.execute("INSERT INTO RAW_ORDERS VALUES (1, 100), (2, 250), (3, 50)");
        }

        profile = new RunProfile();
        profile.getConnection().setUrl(url);
        profile.setSchema("PUBLIC");
        profile.getSources().put("raw_orders", "PUBLIC.RAW_ORDERS");
    }

    private void writeModel(String fileName, String text) throws Exception {
        Files.writeString(modelsDir.resolve(fileName), text, StandardCharsets.UTF_8);
    }

    private int queryInt(String sql) throws Exception {
        try (Connection conn = DriverManager.getConnection(url);
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    @Test
    void run_正常ケース_H2に対してビューを構築する_依存順に作成され成功となること() throws Exception {
        writeModel("stg_orders.sql",
                "-- materialized: view\nSELECT ID, AMOUNT FROM {raw_orders} WHERE AMOUNT > 60;\n");
        writeModel("order_totals.sql", "-- name: order_totals\n"
                + "-- depends_on: stg_orders\n" + "SELECT SUM(AMOUNT) AS TOTAL FROM {stg_orders}");

        RunReport report = new ProjectRunner(new StatementExecutorFactory()).run(modelsDir,
                profile);

        assertTrue(report.isSuccess(), report.summary());
        assertEquals(List.of("stg_orders", "order_totals"),
                List.copyOf(report.statusByModel().keySet()));
        assertEquals(350, queryInt("SELECT TOTAL FROM PUBLIC.ORDER_TOTALS"));
    }

    @Test
    void run_異常ケース_エンジンでエラー_失敗とスキップが報告されること() throws Exception {
        writeModel("broken.sql", "SELECT NO_SUCH_COLUMN FROM {raw_orders}");
        writeModel("downstream.sql", "SELECT * FROM {broken}");
        writeModel("independent.sql", "SELECT COUNT(*) AS N FROM {raw_orders}");
        profile.setFailureMode(FailureMode.CONTINUE_ON_ERROR);

        RunReport report = new ProjectRunner(new StatementExecutorFactory()).run(modelsDir,
                profile);

        assertFalse(report.isSuccess());
        assertEquals(ModelStatus.FAILED, report.getRecord("broken").orElseThrow().getStatus());
        assertEquals(ModelStatus.SKIPPED,
                report.getRecord("downstream").orElseThrow().getStatus());
        assertEquals(ModelStatus.SUCCEEDED,
                report.getRecord("independent").orElseThrow().getStatus());
        String message =
                report.getRecord("broken").orElseThrow().getError().getEngineMessage();
        assertTrue(message.startsWith("[SQLState "), message);
        assertEquals(3, queryInt("SELECT N FROM PUBLIC.INDEPENDENT"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void run_正常ケース_実行後_エグゼキュータがクローズされること() throws Exception {
        writeModel("m.sql", "SELECT 1 AS X");
        StatementExecutor executor = mock(StatementExecutor.class);
        Function<ConnectionConfig, StatementExecutor> provider = mock(Function.class);
        when(provider.apply(any())).thenReturn(executor);

        RunReport report = new ProjectRunner(provider).run(modelsDir, profile);

        assertTrue(report.isSuccess());
        verify(executor).execute("CREATE OR REPLACE VIEW PUBLIC.m AS SELECT 1 AS X");
        verify(executor).close();
    }

    @Test
    @SuppressWarnings("unchecked")
    void run_異常ケース_循環依存_エグゼキュータが作成されないこと() throws Exception {
        writeModel("a.sql", "SELECT * FROM {b}");
        writeModel("b.sql", "SELECT * FROM {a}");
        Function<ConnectionConfig, StatementExecutor> provider = mock(Function.class);

        assertThrows(GraphException.class,
                () -> new ProjectRunner(provider).run(modelsDir, profile));
        verify(provider, never()).apply(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void run_異常ケース_不正なmaterialized_文が1つも実行されないこと() throws Exception {
        writeModel("a.sql", "SELECT 1");
        writeModel("b.sql", "-- materialized: bogus\nSELECT 1");
        Function<ConnectionConfig, StatementExecutor> provider = mock(Function.class);

        assertThrows(ModelParseException.class,
                () -> new ProjectRunner(provider).run(modelsDir, profile));
        verify(provider, never()).apply(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void run_異常ケース_存在しないモデルを選択_ConfigurationExceptionが送出されること()
            throws Exception {
        writeModel("a.sql", "SELECT 1");
        Function<ConnectionConfig, StatementExecutor> provider = mock(Function.class);

        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> new ProjectRunner(provider).run(modelsDir, profile, Set.of("a", "zzz")));
        assertTrue(ex.getMessage().contains("zzz"));
        verify(provider, never()).apply(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void run_正常ケース_モデルを選択_選択したモデルのみ実行されること() throws Exception {
        writeModel("a.sql", "SELECT 1 AS X");
        writeModel("b.sql", "SELECT * FROM {a}");
        StatementExecutor executor = mock(StatementExecutor.class);
        Function<ConnectionConfig, StatementExecutor> provider = mock(Function.class);
        when(provider.apply(any())).thenReturn(executor);

        RunReport report = new ProjectRunner(provider).run(modelsDir, profile, Set.of("b"));

        assertEquals(List.of("b"), List.copyOf(report.statusByModel().keySet()));
        verify(executor).execute("CREATE OR REPLACE VIEW PUBLIC.b AS SELECT * FROM PUBLIC.a");
        verify(executor, never()).execute("CREATE OR REPLACE VIEW PUBLIC.a AS SELECT 1 AS X");
    }

    @Test
    @SuppressWarnings("unchecked")
    void preview_正常ケース_計画のみ作成_エグゼキュータが作成されないこと() throws Exception {
        writeModel("stg.sql", "-- materialized: table\nSELECT * FROM {raw_orders}");
        profile.setCatalog("main");
        Function<ConnectionConfig, StatementExecutor> provider = mock(Function.class);

        ExecutionPlan plan = new ProjectRunner(provider).preview(modelsDir, profile);

        assertEquals(List.of("CREATE OR REPLACE TABLE main.PUBLIC.stg AS SELECT * FROM "
                + "PUBLIC.RAW_ORDERS"), plan.get("stg").getStatements());
        verify(provider, never()).apply(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void lint_正常ケース_規則違反の名前_違反が返ること() throws Exception {
        writeModel("BadName.sql", "SELECT 1");
        writeModel("good_name.sql", "SELECT 1");
        profile.getSources().put("RawEvents", "x.y");
        Function<ConnectionConfig, StatementExecutor> provider = mock(Function.class);

        List<LintViolation> violations =
                new ProjectRunner(provider).lint(modelsDir, profile, new ModelLinter());

        assertEquals(2, violations.size());
        assertEquals("BadName", violations.get(0).getValue());
        assertEquals("RawEvents", violations.get(1).getValue());
    }

    @Test
    @SuppressWarnings("unchecked")
    void abort_正常ケース_実行中でない_何も起きないこと() {
        new ProjectRunner(mock(Function.class)).abort();
    }
}
