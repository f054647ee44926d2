package io.github.yok.sqlmodelrunner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.sqlmodelrunner.config.FailureMode;
import io.github.yok.sqlmodelrunner.config.LintConfig;
import io.github.yok.sqlmodelrunner.config.ProfileLoader;
import io.github.yok.sqlmodelrunner.config.RunProfile;
import io.github.yok.sqlmodelrunner.config.RunnerConfig;
import io.github.yok.sqlmodelrunner.core.ProjectRunner;
import io.github.yok.sqlmodelrunner.core.RunReport;
import io.github.yok.sqlmodelrunner.exception.ConfigurationException;
import io.github.yok.sqlmodelrunner.executor.StatementExecutorFactory;
import io.github.yok.sqlmodelrunner.lint.LintViolation;
import io.github.yok.sqlmodelrunner.plan.ExecutionPlan;
import io.github.yok.sqlmodelrunner.util.ErrorHandler;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private RunnerConfig runnerConfig;
    private ProfileLoader profileLoader;
    private RunProfile profile;

    private Main main;

    @BeforeEach
    void setup() {
        runnerConfig = new RunnerConfig();
        profileLoader = mock(ProfileLoader.class);
        profile = new RunProfile();
        profile.getConnection().setUrl("jdbc:h2:mem:main");
        profile.setSchema("s");
        when(profileLoader.load(any())).thenReturn(profile);

        main = new Main(runnerConfig, new LintConfig(), profileLoader,
                mock(StatementExecutorFactory.class));
    }

    private static RunReport report(boolean success) {
        RunReport report = mock(RunReport.class);
        when(report.isSuccess()).thenReturn(success);
        when(report.getRecords()).thenReturn(List.of());
        when(report.summary()).thenReturn("summary");
        return report;
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    // run(String...) をスタブ
                    when(mock.run(any(String[].class))).thenReturn(null);

                    // コンストラクタ引数を検証
                    Class<?>[] sources = (Class<?>[]) ctx.arguments().get(0);
                    assertEquals(1, sources.length);
                    assertEquals(Main.class, sources[0]);
                })) {

            Main.main(new String[] {"--models-dir", "models"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("--models-dir"), eq("models"));
        }
    }

    @Test
    void run_正常ケース_引数なし_設定の既定値で全モデルが実行されること() {
        RunReport success = report(true);
        try (MockedConstruction<ProjectRunner> mocked = mockConstruction(ProjectRunner.class,
                (mock, ctx) -> when(mock.run(any(), any(), anySet())).thenReturn(success))) {

            main.run();

            ProjectRunner runner = mocked.constructed().get(0);
            verify(runner).run(eq(Paths.get("models")), eq(profile), eq(Set.of()));
            verify(profileLoader).load(Paths.get("profiles.yml"));
            assertEquals(0, main.getExitCode());
        }
    }

    @Test
    void run_正常ケース_全オプション指定_プロファイルが上書きされ選択実行されること() {
        RunReport success = report(true);
        try (MockedConstruction<ProjectRunner> mocked = mockConstruction(ProjectRunner.class,
                (mock, ctx) -> when(mock.run(any(), any(), anySet())).thenReturn(success))) {

            main.run("-m", "my_models", "-p", "dev.yml", "--continue-on-error", "--threads", "3",
                    "--select", "a, b");

            ProjectRunner runner = mocked.constructed().get(0);
            verify(profileLoader).load(Paths.get("dev.yml"));
            verify(runner).run(eq(Paths.get("my_models")), eq(profile), eq(Set.of("a", "b")));
            assertEquals(FailureMode.CONTINUE_ON_ERROR, profile.getFailureMode());
            assertEquals(3, profile.getThreads());
        }
    }

    @Test
    void run_正常ケース_failFast指定_プロファイルの設定より優先されること() {
        profile.setFailureMode(FailureMode.CONTINUE_ON_ERROR);
        RunReport success = report(true);
        try (MockedConstruction<ProjectRunner> mocked = mockConstruction(ProjectRunner.class,
                (mock, ctx) -> when(mock.run(any(), any(), anySet())).thenReturn(success))) {

            main.run("--fail-fast");

            assertEquals(FailureMode.FAIL_FAST, profile.getFailureMode());
        }
    }

    @Test
    void run_異常ケース_失敗したモデルがある_終了コード1となること() {
        RunReport failure = report(false);
        try (MockedConstruction<ProjectRunner> mocked = mockConstruction(ProjectRunner.class,
                (mock, ctx) -> when(mock.run(any(), any(), anySet())).thenReturn(failure))) {

            main.run();

            assertEquals(1, main.getExitCode());
        }
    }

    @Test
    void run_正常ケース_preview指定_計画が出力され実行されないこと() {
        ExecutionPlan plan = mock(ExecutionPlan.class);
        when(plan.render()).thenReturn("PLAN");
        try (MockedConstruction<ProjectRunner> mocked = mockConstruction(ProjectRunner.class,
                (mock, ctx) -> when(mock.preview(any(), any())).thenReturn(plan))) {

            main.run("--preview");

            ProjectRunner runner = mocked.constructed().get(0);
            verify(runner).preview(Paths.get("models"), profile);
            verify(runner, never()).run(any(), any(), anySet());
            verify(plan).render();
            assertEquals(0, main.getExitCode());
        }
    }

    @Test
    void run_異常ケース_lint違反あり_終了コード1となること() {
        List<LintViolation> violations =
                List.of(new LintViolation("model_name", "a.sql", "Bad", "must be snake_case"));
        try (MockedConstruction<ProjectRunner> mocked = mockConstruction(ProjectRunner.class,
                (mock, ctx) -> when(mock.lint(any(), any(), any())).thenReturn(violations))) {

            main.run("--lint");

            ProjectRunner runner = mocked.constructed().get(0);
            verify(runner, never()).run(any(), any(), anySet());
            assertEquals(1, main.getExitCode());
        }
    }

    @Test
    void run_正常ケース_lint違反なし_終了コード0となること() {
        try (MockedConstruction<ProjectRunner> mocked = mockConstruction(ProjectRunner.class,
                (mock, ctx) -> when(mock.lint(any(), any(), any())).thenReturn(List.of()))) {

            main.run("--lint");

            assertEquals(0, main.getExitCode());
        }
    }

    @Test
    void run_異常ケース_プロファイル読込失敗_ErrorHandlerが呼ばれ終了コード1となること() {
        ConfigurationException error = new ConfigurationException("Profile file not found");
        when(profileLoader.load(any())).thenThrow(error);

        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run();

            mocked.verify(() -> ErrorHandler.fatal(anyString(), eq(error)));
            assertEquals(1, main.getExitCode());
        }
    }

    @Test
    void run_異常ケース_threadsが数値でない_ErrorHandlerが呼ばれ終了コード1となること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class);
                MockedConstruction<ProjectRunner> runners =
                        mockConstruction(ProjectRunner.class)) {

            main.run("--threads", "many");

            mocked.verify(() -> ErrorHandler.fatal(anyString(), any(ConfigurationException.class)));
            assertTrue(runners.constructed().isEmpty());
            assertEquals(1, main.getExitCode());
        }
    }

    @Test
    void run_正常ケース_未知の引数_無視して実行されること() {
        RunReport success = report(true);
        try (MockedConstruction<ProjectRunner> mocked = mockConstruction(ProjectRunner.class,
                (mock, ctx) -> when(mock.run(any(), any(), anySet())).thenReturn(success))) {

            main.run("--verbose");

            assertEquals(1, mocked.constructed().size());
            assertEquals(0, main.getExitCode());
        }
    }
}
