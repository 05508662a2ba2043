package com.siteauditor.core.service;

import com.siteauditor.core.api.IAuthTester;
import com.siteauditor.core.api.ICrawler;
import com.siteauditor.core.api.IScanner;
import com.siteauditor.core.auth.AuthTester;
import com.siteauditor.core.crawler.Crawler;
import com.siteauditor.core.http.HttpFetcher;
import com.siteauditor.core.http.NetworkException;
import com.siteauditor.core.model.AuditConfig;
import com.siteauditor.core.model.AuditRun;
import com.siteauditor.core.model.AuthCheckResult;
import com.siteauditor.core.model.CrawlResult;
import com.siteauditor.core.model.LoginConfig;
import com.siteauditor.core.model.RunPhase;
import com.siteauditor.core.model.RunStatus;
import com.siteauditor.core.model.ScanResult;
import com.siteauditor.core.model.ScanStatus;
import com.siteauditor.core.model.Target;
import com.siteauditor.core.scanner.ScanGranularity;
import com.siteauditor.core.scanner.ScannerRegistry;
import com.siteauditor.core.scanner.tool.DefaultProcessRunner;
import com.siteauditor.core.scanner.tool.ToolLocator;
import com.siteauditor.core.service.export.ReportWriter;
import com.siteauditor.core.util.ProgressListener;
import com.siteauditor.core.util.StructuredLog;
import com.siteauditor.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 감사 오케스트레이터:
 *  - crawl → scan (URL × 스캐너) → auth → aggregate → persist
 *  - 기본 구현체(Crawler/HttpFetcher/레지스트리/AuthTester/ReportWriter)
 *  - DI 생성자는 테스트/플러그인 주입용
 *  - 고정 스레드풀(동시성=concurrency), 결과는 완료 순서와 무관하게 (발견 순서, 등록 순서)로 저장
 *
 * 실패 정책:
 *  - 시드 접속 불가 → FAILED, 리포트 없음
 *  - 스캐너 예외 → 해당 결과만 error
 *  - 취소 → CancellationException, 리포트 없음
 */
public final class AuditOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(AuditOrchestrator.class);
    private static final StructuredLog SLOG = StructuredLog.get(AuditOrchestrator.class);

    /** 인증 플로우가 예외로 끝났을 때 남기는 단일 결과 이름 */
    public static final String AUTH_FLOW_RESULT = "auth-flow";

    private static final long POLL_MS = 250;

    private final AuditConfig config;
    private final ICrawler crawler;
    private final ScannerRegistry registry;
    private final IAuthTester authTester;    // null이면 인증 점검 안 함
    private final ReportWriter writer;
    private final Clock clock;

    /** 기본 구현 */
    public AuditOrchestrator(AuditConfig config) {
        this(config,
                new Crawler(config),
                ScannerRegistry.fromConfig(config, new HttpFetcher(config),
                        ToolLocator.systemPath(), new DefaultProcessRunner()),
                config.authFlowEnabled() ? new AuthTester(config) : null,
                new ReportWriter(config.getOutputDir()),
                Clock.systemUTC());
    }

    /** DI/테스트용 */
    public AuditOrchestrator(AuditConfig config, ICrawler crawler, ScannerRegistry registry,
                             IAuthTester authTester, ReportWriter writer, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.crawler = Objects.requireNonNull(crawler, "crawler");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.authTester = authTester;
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /* =========================
       실행 API
       ========================= */

    public AuditOutcome run() throws ReportPersistenceException {
        return run(ProgressListener.NONE, null);
    }

    /**
     * 진행률 + 취소 플래그(옵션).
     * @throws CancellationException 플래그가 켜지거나 호출 스레드가 인터럽트된 경우 (리포트 없음)
     * @throws ReportPersistenceException 리포트 기록 실패 (실행은 FAILED 단계)
     */
    public AuditOutcome run(ProgressListener listener, AtomicBoolean cancelFlag) throws ReportPersistenceException {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final Target target = config.toTarget();
        final AuditRun run = new AuditRun(target, config.getProfile(), clock.instant());
        final int cc = config.getConcurrency();

        LOG.info("Audit start: target={}, profile={}, maxPages={}, scanners={}, cc={}",
                target.getSeed(), config.getProfile(), config.getMaxPages(), registry.ids(), cc);
        SLOG.info("audit-start",
                "target", String.valueOf(target.getSeed()),
                "profile", config.getProfile().name(),
                "maxPages", config.getMaxPages(),
                "scanners", String.join(",", registry.ids()),
                "auth", authTester != null && target.getLogin().isPresent(),
                "cc", cc);

        if (crawler instanceof Crawler c) c.withProgress(pl);

        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("audit-worker"));

        try {
            // ---- 1) 크롤 ----
            run.moveTo(RunPhase.CRAWLING);
            pl.onProgress(0.0, "crawl", 0, -1);
            CrawlResult crawl;
            try {
                crawl = await(exec.submit(() -> crawler.crawl(target.getSeed(), config.getMaxPages())), cancelFlag);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof CancellationException ce) throw ce;
                return failed(run, e.getCause());
            }
            crawl = withProtectedPage(crawl, target);
            run.setCrawl(crawl);
            LOG.info("Crawl done: pages={}, skipped={}", crawl.getUrls().size(), crawl.getSkipped().size());
            SLOG.info("crawl-done", "pages", crawl.getUrls().size(), "skipped", crawl.getSkipped().size());

            // ---- 2) 스캔 ----
            run.moveTo(RunPhase.SCANNING);
            for (ScanResult r : scanAll(exec, crawl, pl, cancelFlag)) {
                run.addScanResult(r);
            }

            // ---- 3) 인증 플로우 ----
            if (authTester != null && target.getLogin().isPresent()) {
                run.moveTo(RunPhase.AUTH_CHECKING);
                pl.onProgress(0.0, "auth", 0, 1);
                run.setAuthResults(authChecks(exec, target, target.getLogin().get(), cancelFlag));
                pl.onProgress(1.0, "auth", 1, 1);
            }

            // ---- 4) 집계 ----
            checkCancel(cancelFlag);
            run.moveTo(RunPhase.AGGREGATING);
            run.aggregate();
            run.finish(clock.instant());
            run.freeze();
        } catch (CancellationException ce) {
            if (!run.isFrozen() && !run.getPhase().isTerminal()) {
                run.fail("cancelled");
                run.finish(clock.instant());
            }
            LOG.info("Audit cancelled: target={}", target.getSeed());
            SLOG.warn("audit-cancelled", "target", String.valueOf(target.getSeed()));
            throw ce;
        } finally {
            // ---- 종료 ----
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            closeCrawler();
        }

        // ---- 5) 기록 ----
        pl.onProgress(0.0, "report", 0, 1);
        Path location;
        try {
            location = writer.write(run);
        } catch (IOException e) {
            run.moveTo(RunPhase.FAILED);
            LOG.error("Report write failed: {}", e.toString());
            SLOG.error("report-failed", e, "outputDir", String.valueOf(writer.getOutputDir()));
            throw new ReportPersistenceException(run, e);
        }
        run.moveTo(RunPhase.PERSISTED);
        pl.onProgress(1.0, "report", 1, 1);

        LOG.info("Audit done: status={}, results={}, report={}",
                run.getStatus().label(), run.getScanResults().size(), location);
        SLOG.info("audit-done",
                "status", run.getStatus().label(),
                "results", run.getScanResults().size(),
                "authChecks", run.getAuthResults().map(List::size).orElse(0),
                "report", location.toString());
        return new AuditOutcome(run.getStatus(), location, run);
    }

    /* =========================
       단계별 헬퍼
       ========================= */

    private AuditOutcome failed(AuditRun run, Throwable cause) {
        String reason = (cause instanceof NetworkException ne)
                ? "seed unreachable: " + ne.reason()
                : "crawl failed: " + describe(cause);
        run.fail(reason);
        run.finish(clock.instant());
        LOG.warn("Audit failed: target={}, reason={}", run.getTarget().getSeed(), reason);
        SLOG.warn("audit-failed", "target", String.valueOf(run.getTarget().getSeed()), "reason", reason);
        return new AuditOutcome(RunStatus.FAILED, null, run);
    }

    /** 보호 페이지도 스캔 대상에 포함 (같은 origin, 한도 안에서만) */
    private static CrawlResult withProtectedPage(CrawlResult crawl, Target target) {
        URI protectedUrl = target.getLogin().map(LoginConfig::getProtectedUrl).map(UrlUtils::normalize).orElse(null);
        if (protectedUrl == null || !target.getOrigin().matches(protectedUrl)) return crawl;
        return crawl.plus(protectedUrl);
    }

    private List<ScanResult> scanAll(ExecutorService exec, CrawlResult crawl,
                                     ProgressListener pl, AtomicBoolean cancel) {
        // 제출 순서 = 저장 순서
        List<Future<ScanResult>> futures = new ArrayList<>();
        for (URI url : crawl.getUrls()) {
            for (IScanner s : registry.scanners()) {
                if (s.granularity() == ScanGranularity.ORIGIN && !url.equals(crawl.getSeed())) continue;
                checkCancel(cancel);
                futures.add(exec.submit(scanTask(s, url, cancel)));
            }
        }

        final int total = futures.size();
        pl.onProgress(0.0, "scan", 0, total);
        List<ScanResult> results = new ArrayList<>(total);
        int done = 0;
        for (Future<ScanResult> f : futures) {
            try {
                results.add(await(f, cancel));
            } catch (ExecutionException e) {
                if (e.getCause() instanceof CancellationException ce) throw ce;
                // scanTask가 예외를 결과로 바꾸므로 여기 오면 버그
                throw new IllegalStateException("scan task escaped its error capture", e.getCause());
            }
            done++;
            pl.onProgress(total == 0 ? 1.0 : (double) done / total, "scan", done, total);
        }
        return results;
    }

    private static Callable<ScanResult> scanTask(IScanner s, URI url, AtomicBoolean cancel) {
        return () -> {
            checkCancel(cancel);
            long t0 = System.nanoTime();
            ScanResult r;
            try {
                if (!s.isAvailable()) {
                    r = ScanResult.skipped(s.id(), url, ScanStatus.TOOL_NOT_INSTALLED);
                } else {
                    LOG.debug("scan: {} {}", s.id(), url);
                    r = s.scan(url);
                    if (r == null) r = ScanResult.error(s.id(), url, "scanner returned no result");
                }
            } catch (CancellationException ce) {
                throw ce;
            } catch (RuntimeException e) {
                LOG.warn("Scanner {} crashed on {}: {}", s.id(), url, e.toString());
                SLOG.error("scanner-crashed", e, "scanner", s.id(), "url", url.toString());
                r = ScanResult.error(s.id(), url, describe(e));
            }
            long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
            ScanResult stamped = r.withDuration(ms);
            SLOG.info("scan-result",
                    "scanner", s.id(),
                    "url", url.toString(),
                    "status", stamped.getStatus().toString(),
                    "findings", stamped.getFindings().size(),
                    "ms", ms);
            return stamped;
        };
    }

    private List<AuthCheckResult> authChecks(ExecutorService exec, Target target, LoginConfig login,
                                             AtomicBoolean cancel) {
        try {
            List<AuthCheckResult> results = await(exec.submit(() -> authTester.runAuthChecks(target, login)), cancel);
            return results != null ? results
                    : List.of(AuthCheckResult.inconclusive(AUTH_FLOW_RESULT, "auth tester returned no results"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.warn("Auth flow crashed: {}", cause.toString());
            SLOG.error("auth-crashed", cause, "target", String.valueOf(target.getSeed()));
            return List.of(AuthCheckResult.inconclusive(AUTH_FLOW_RESULT, "auth flow aborted: " + describe(cause)));
        }
    }

    /** 취소를 주기적으로 확인하며 대기 */
    private static <T> T await(Future<T> f, AtomicBoolean cancel) throws ExecutionException {
        while (true) {
            checkCancel(cancel);
            try {
                return f.get(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException te) {
                LOG.trace("still waiting on {}", f);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for audit task");
            }
        }
    }

    private void closeCrawler() {
        try {
            crawler.close();
        } catch (Exception e) {
            LOG.debug("crawler close failed: {}", e.toString());
        }
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown";
        return t.getMessage() == null ? t.getClass().getSimpleName()
                : t.getClass().getSimpleName() + ": " + t.getMessage();
    }

    private static void checkCancel(AtomicBoolean flag) {
        if (Thread.currentThread().isInterrupted() || (flag != null && flag.get())) {
            throw new CancellationException();
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
