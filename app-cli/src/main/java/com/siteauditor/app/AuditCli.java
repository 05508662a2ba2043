package com.siteauditor.app;

import com.siteauditor.app.logging.LogSetup;
import com.siteauditor.core.model.AuditConfig;
import com.siteauditor.core.model.AuditProfile;
import com.siteauditor.core.model.RunStatus;
import com.siteauditor.core.service.AuditOrchestrator;
import com.siteauditor.core.service.AuditOutcome;
import com.siteauditor.core.service.ReportPersistenceException;
import com.siteauditor.core.util.ProgressListener;
import com.siteauditor.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * 감사 1회를 실행하는 CLI.
 *
 * <pre>
 * # audit.yml 기준
 * site-auditor
 *
 * # 설정 파일 없이 대상만 지정
 * site-auditor --target https://example.test --profile performance --max-pages 10
 * </pre>
 *
 * 종료 코드: 0 complete, 1 partial, 2 설정 오류, 3 failed(시드 접속 불가), 4 리포트 기록 실패, 130 취소.
 */
@Command(
    name = "site-auditor",
    description = "Crawls a site, runs the configured audit scanners and writes a JSON + HTML report",
    mixinStandardHelpOptions = true,
    version = "site-auditor 0.3.0"
)
public class AuditCli implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(AuditCli.class);

    public static final int EXIT_COMPLETE = 0;
    public static final int EXIT_PARTIAL = 1;
    public static final int EXIT_CONFIG = 2;
    public static final int EXIT_FAILED = 3;
    public static final int EXIT_REPORT = 4;
    public static final int EXIT_CANCELLED = 130;

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Path to the audit YAML (default: ${DEFAULT-VALUE}; optional when --target is given)",
        defaultValue = YamlConfigLoader.DEFAULT_FILE
    )
    private Path configFile;

    @Option(names = {"-t", "--target"}, description = "Seed URL (overrides the YAML target)")
    private String target;

    @Option(names = {"-n", "--max-pages"}, description = "Maximum pages to crawl")
    private Integer maxPages;

    @Option(
        names = {"-p", "--profile"},
        description = "Audit profile: ${COMPLETION-CANDIDATES}"
    )
    private AuditProfile profile;

    @Option(names = {"-o", "--out"}, description = "Report output directory")
    private Path outDir;

    @Option(names = {"-v", "--verbose"}, description = "Debug logging")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Do not print progress")
    private boolean quiet;

    private final Function<AuditConfig, AuditOrchestrator> orchestrators;

    public AuditCli() {
        this(AuditOrchestrator::new);
    }

    /** 테스트용: 오케스트레이터 생성 주입 */
    AuditCli(Function<AuditConfig, AuditOrchestrator> orchestrators) {
        this.orchestrators = orchestrators;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        AuditConfig cfg;
        try {
            cfg = buildConfig();
            cfg.validate();
        } catch (IOException | IllegalArgumentException e) {
            err.println("ERROR: invalid configuration: " + e.getMessage());
            return EXIT_CONFIG;
        }

        LogSetup.configure(cfg.getOutputDir());
        if (verbose) LogSetup.setLevel(Level.FINE);

        AtomicBoolean cancel = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            cancel.set(true);
            try {
                // 스테이징 정리까지 잠시 기다린다
                finished.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, "audit-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            AuditOutcome outcome = orchestrators.apply(cfg).run(progress(err), cancel);
            out.println(outcome.preview());
            if (outcome.getStatus() == RunStatus.FAILED) {
                err.println("Audit failed: " + outcome.getFailureReason());
                return EXIT_FAILED;
            }
            out.println("Report: " + outcome.getLocation().map(Path::toString).orElse("-"));
            return outcome.getStatus() == RunStatus.PARTIAL ? EXIT_PARTIAL : EXIT_COMPLETE;
        } catch (CancellationException e) {
            err.println("Audit cancelled, no report written.");
            return EXIT_CANCELLED;
        } catch (ReportPersistenceException e) {
            LOG.error("Report could not be written", e);
            err.println("ERROR: " + e.getMessage());
            return EXIT_REPORT;
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    /** YAML(있으면) + CLI 오버라이드 */
    AuditConfig buildConfig() throws IOException {
        AuditConfig cfg;
        if (Files.exists(configFile)) {
            cfg = YamlConfigLoader.load(configFile);
        } else if (target != null) {
            cfg = AuditConfig.defaults();
        } else {
            throw new IOException("config file not found: " + configFile + " (or pass --target)");
        }
        if (target != null) cfg.setTarget(target);
        if (maxPages != null) cfg.setMaxPages(maxPages);
        if (profile != null) cfg.setProfile(profile);
        if (outDir != null) cfg.setOutputDir(outDir);
        return cfg;
    }

    private ProgressListener progress(PrintWriter err) {
        if (quiet) return ProgressListener.NONE;
        return (ratio, phase, done, total) -> {
            String count = total < 0 ? String.valueOf(done) : done + "/" + total;
            err.printf(Locale.ROOT, "[%-6s] %5.1f%% %s%n", phase, ratio * 100.0, count);
            err.flush();
        };
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM 종료 중: 훅이 이미 실행 중이다
            LOG.debug("shutdown in progress: {}", e.getMessage());
        }
    }

    static CommandLine commandLine(AuditCli cli) {
        return new CommandLine(cli).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new AuditCli()).execute(args);
        System.exit(exitCode);
    }
}
