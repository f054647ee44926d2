package io.github.yok.sqlmodelrunner;

import io.github.yok.sqlmodelrunner.config.FailureMode;
import io.github.yok.sqlmodelrunner.config.LintConfig;
import io.github.yok.sqlmodelrunner.config.ProfileLoader;
import io.github.yok.sqlmodelrunner.config.RunProfile;
import io.github.yok.sqlmodelrunner.config.RunnerConfig;
import io.github.yok.sqlmodelrunner.core.ExecutionRecord;
import io.github.yok.sqlmodelrunner.core.ProjectRunner;
import io.github.yok.sqlmodelrunner.core.RunReport;
import io.github.yok.sqlmodelrunner.exception.ConfigurationException;
import io.github.yok.sqlmodelrunner.executor.StatementExecutorFactory;
import io.github.yok.sqlmodelrunner.lint.LintViolation;
import io.github.yok.sqlmodelrunner.lint.ModelLinter;
import io.github.yok.sqlmodelrunner.plan.ExecutionPlan;
import io.github.yok.sqlmodelrunner.util.ErrorHandler;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Provides the application entry point.
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --models-dir <dir>} or {@code -m <dir>}: models directory. Defaults to
 * {@code runner.models-dir} in {@code application.yml}.</li>
 * <li>{@code --profile <file>} or {@code -p <file>}: profile file. Defaults to
 * {@code runner.profile}.</li>
 * <li>{@code --fail-fast} / {@code --continue-on-error}: overrides the profile's failure mode.</li>
 * <li>{@code --threads <n>}: overrides the profile's worker count.</li>
 * <li>{@code --select <m1,m2,…>} or {@code -s <m1,m2,…>}: runs only the named models.</li>
 * <li>{@code --preview}: prints the execution plan without executing anything.</li>
 * <li>{@code --lint}: checks model and source names instead of running.</li>
 * </ul>
 *
 * <p>
 * Unknown arguments are logged and ignored. The process exits with 0 when every model succeeded
 * (or, with {@code --lint}, when no violation was found) and with 1 otherwise.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ProjectRunner
 * @see ProfileLoader
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final RunnerConfig runnerConfig;
    private final LintConfig lintConfig;
    private final ProfileLoader profileLoader;
    private final StatementExecutorFactory executorFactory;

    // Process exit code decided by run()
    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext ctx = app.run(args);
        if (ctx != null) {
            System.exit(SpringApplication.exit(ctx));
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String modelsDir = runnerConfig.getModelsDir();
        String profilePath = runnerConfig.getProfile();
        FailureMode failureMode = null;
        String threads = null;
        Set<String> selection = new LinkedHashSet<>();
        String mode = "run";
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--models-dir":
                case "-m":
                    modelsDir = (i + 1 < args.length ? args[++i] : modelsDir);
                    break;
                case "--profile":
                case "-p":
                    profilePath = (i + 1 < args.length ? args[++i] : profilePath);
                    break;
                case "--fail-fast":
                    failureMode = FailureMode.FAIL_FAST;
                    break;
                case "--continue-on-error":
                    failureMode = FailureMode.CONTINUE_ON_ERROR;
                    break;
                case "--threads":
                    threads = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--select":
                case "-s":
                    if (i + 1 < args.length) {
                        selection = Arrays.stream(args[++i].split(",")).map(String::trim)
                                .filter(StringUtils::isNotEmpty)
                                .collect(Collectors.toCollection(LinkedHashSet::new));
                    }
                    break;
                case "--preview":
                    mode = "preview";
                    break;
                case "--lint":
                    mode = "lint";
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        log.info("Mode: {}, Models: {}, Profile: {}", mode, modelsDir, profilePath);

        // Execute
        try {
            RunProfile profile = profileLoader.load(Paths.get(profilePath));
            if (failureMode != null) {
                profile.setFailureMode(failureMode);
            }
            if (threads != null) {
                profile.setThreads(parseThreads(threads));
            }

            ProjectRunner runner = new ProjectRunner(executorFactory);
            Path models = Paths.get(modelsDir);
            if ("lint".equals(mode)) {
                exitCode = lint(runner, models, profile);
            } else if ("preview".equals(mode)) {
                ExecutionPlan plan = runner.preview(models, profile);
                System.out.print(plan.render());
                exitCode = 0;
            } else {
                RunReport report = runner.run(models, profile, selection);
                printReport(report);
                exitCode = report.isSuccess() ? 0 : 1;
            }
        } catch (RuntimeException e) {
            exitCode = 1;
            ErrorHandler.fatal("Fatal error (mode=" + mode + ")", e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int lint(ProjectRunner runner, Path models, RunProfile profile) {
        List<LintViolation> violations =
                runner.lint(models, profile, new ModelLinter(lintConfig));
        violations.forEach(v -> System.out.println(v.format()));
        System.out.println(violations.isEmpty() ? "No lint violations found."
                : violations.size() + " lint violation(s) found.");
        return violations.isEmpty() ? 0 : 1;
    }

    private static int parseThreads(String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("--threads must be an integer: " + value, e);
        }
        if (parsed < 1) {
            throw new ConfigurationException("--threads must be at least 1: " + value);
        }
        return parsed;
    }

    private static void printReport(RunReport report) {
        for (ExecutionRecord record : report.getRecords()) {
            StringBuilder line = new StringBuilder(
                    String.format("%-10s %s", record.getStatus(), record.getModelName()));
            if (record.getError() != null) {
                line.append(": ").append(record.getError().getEngineMessage());
            } else if (record.getSkipReason() != null) {
                line.append(" (").append(record.getSkipReason());
                if (record.getBlockedBy() != null) {
                    line.append(": ").append(record.getBlockedBy());
                }
                line.append(')');
            }
            System.out.println(line);
        }
        System.out.println(report.summary());
    }
}
