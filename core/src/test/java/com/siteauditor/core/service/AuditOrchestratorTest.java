package com.siteauditor.core.service;

import com.siteauditor.core.api.IAuthTester;
import com.siteauditor.core.api.ICrawler;
import com.siteauditor.core.api.IScanner;
import com.siteauditor.core.http.NetworkException;
import com.siteauditor.core.model.AuditConfig;
import com.siteauditor.core.model.AuthCheckResult;
import com.siteauditor.core.model.CrawlResult;
import com.siteauditor.core.model.LoginConfig;
import com.siteauditor.core.model.RunPhase;
import com.siteauditor.core.model.RunStatus;
import com.siteauditor.core.model.ScanResult;
import com.siteauditor.core.model.Severity;
import com.siteauditor.core.scanner.ScanGranularity;
import com.siteauditor.core.scanner.ScannerRegistry;
import com.siteauditor.core.service.export.ReportNaming;
import com.siteauditor.core.service.export.ReportWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class AuditOrchestratorTest {

    static final URI SEED = URI.create("https://site.test/");
    static final URI PAGE_A = URI.create("https://site.test/a");
    static final URI PAGE_B = URI.create("https://site.test/b");
    static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path out;

    /** 호출 횟수를 세는 테스트용 스캐너 */
    static final class FakeScanner implements IScanner {
        final String id;
        final ScanGranularity granularity;
        final boolean available;
        final Function<URI, ScanResult> body;
        final AtomicInteger calls = new AtomicInteger();

        FakeScanner(String id, ScanGranularity granularity, boolean available, Function<URI, ScanResult> body) {
            this.id = id;
            this.granularity = granularity;
            this.available = available;
            this.body = body;
        }

        static FakeScanner finding(String id, ScanGranularity g) {
            return new FakeScanner(id, g, true, url -> {
                sleepRandomly();
                return ScanResult.builder(id, url).finding("k:" + url.getPath(), Severity.LOW, "seen").build();
            });
        }

        @Override public String id() { return id; }
        @Override public ScanGranularity granularity() { return granularity; }
        @Override public boolean isAvailable() { return available; }
        @Override public ScanResult scan(URI target) {
            calls.incrementAndGet();
            return body.apply(target);
        }
    }

    static void sleepRandomly() {
        try {
            Thread.sleep(ThreadLocalRandom.current().nextInt(1, 40));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private AuditConfig config() {
        return AuditConfig.defaults()
                .setTarget(SEED.toString())
                .setMaxPages(10)
                .setConcurrency(4)
                .setOutputDir(out);
    }

    private static ICrawler threePages() {
        return (seed, max) -> new CrawlResult(max, List.of(seed, PAGE_A, PAGE_B),
                List.of(new CrawlResult.SkippedPage(URI.create("https://site.test/gone"), "HTTP 404")));
    }

    private AuditOrchestrator orchestrator(AuditConfig cfg, ICrawler crawler, IAuthTester auth, IScanner... scanners) {
        return new AuditOrchestrator(cfg, crawler, ScannerRegistry.of(scanners), auth,
                new ReportWriter(cfg.getOutputDir()), CLOCK);
    }

    private static LoginConfig login() {
        return LoginConfig.builder()
                .loginUrl(URI.create("https://site.test/login"))
                .username("auditor")
                .password("pw".toCharArray())
                .protectedUrl(URI.create("https://site.test/account"))
                .build();
    }

    @Test
    @DisplayName("결과 순서는 완료 순서와 무관하게 (URL 발견 순서, 등록 순서)")
    void results_follow_url_then_registry_order() throws Exception {
        FakeScanner alpha = FakeScanner.finding("alpha", ScanGranularity.PER_URL);
        FakeScanner beta = FakeScanner.finding("beta", ScanGranularity.PER_URL);
        FakeScanner gamma = FakeScanner.finding("gamma", ScanGranularity.ORIGIN);

        AuditOutcome outcome = orchestrator(config(), threePages(), null, alpha, beta, gamma).run();

        assertThat(outcome.getStatus()).isEqualTo(RunStatus.COMPLETE);
        assertThat(outcome.getRun().getScanResults())
                .extracting(ScanResult::getTarget, ScanResult::getScannerId)
                .containsExactly(
                        tuple(SEED, "alpha"), tuple(SEED, "beta"), tuple(SEED, "gamma"),
                        tuple(PAGE_A, "alpha"), tuple(PAGE_A, "beta"),
                        tuple(PAGE_B, "alpha"), tuple(PAGE_B, "beta"));
        // ORIGIN 스캐너는 시드에서만
        assertThat(gamma.calls.get()).isEqualTo(1);
        assertThat(outcome.getRun().getPhase()).isEqualTo(RunPhase.PERSISTED);
        assertThat(outcome.getRun().getAuthResults()).isEmpty();
    }

    @Test
    void report_lands_in_timestamped_dir() throws Exception {
        AuditOutcome outcome = orchestrator(config(), threePages(), null,
                FakeScanner.finding("alpha", ScanGranularity.PER_URL)).run();

        Path dir = out.resolve("20260301_101530");
        assertThat(outcome.getLocation()).contains(dir);
        assertThat(dir.resolve(ReportNaming.JSON_FILE)).isRegularFile();
        assertThat(dir.resolve(ReportNaming.HTML_FILE)).isRegularFile();
        try (Stream<Path> entries = Files.list(out)) {
            assertThat(entries.filter(ReportNaming::isStaging)).isEmpty();
        }
        assertThat(outcome.preview()).contains("\"pagesScanned\"").contains("alpha");
    }

    @Test
    @DisplayName("스캐너 예외는 해당 결과만 error, 실행은 partial")
    void crashing_scanner_yields_error_and_partial() throws Exception {
        FakeScanner ok = FakeScanner.finding("alpha", ScanGranularity.PER_URL);
        FakeScanner boom = new FakeScanner("boom", ScanGranularity.ORIGIN, true, url -> {
            throw new IllegalStateException("exploded");
        });

        AuditOutcome outcome = orchestrator(config(), threePages(), null, ok, boom).run();

        assertThat(outcome.getStatus()).isEqualTo(RunStatus.PARTIAL);
        ScanResult failed = outcome.getRun().getScanResults().stream()
                .filter(r -> r.getScannerId().equals("boom")).findFirst().orElseThrow();
        assertThat(failed.getStatus().toString()).isEqualTo("error:IllegalStateException: exploded");
        assertThat(failed.getFindings()).isEmpty();
        assertThat(outcome.getRun().getScanResults()).hasSize(4);
        assertThat(outcome.getLocation()).isPresent();
    }

    @Test
    void null_result_is_recorded_as_error() throws Exception {
        FakeScanner lazy = new FakeScanner("lazy", ScanGranularity.ORIGIN, true, url -> null);

        AuditOutcome outcome = orchestrator(config(), threePages(), null, lazy).run();

        assertThat(outcome.getStatus()).isEqualTo(RunStatus.PARTIAL);
        assertThat(outcome.getRun().getScanResults().get(0).getStatus().getReason())
                .isEqualTo("scanner returned no result");
    }

    @Test
    @DisplayName("도구가 없으면 scan()을 부르지 않고 skipped, 실행은 complete")
    void unavailable_scanner_is_skipped_without_scanning() throws Exception {
        FakeScanner missing = new FakeScanner("nuclei", ScanGranularity.ORIGIN, false,
                url -> ScanResult.builder("nuclei", url).cleanOutcomeAllowed(true).build());

        AuditOutcome outcome = orchestrator(config(), threePages(), null, missing).run();

        assertThat(missing.calls.get()).isZero();
        assertThat(outcome.getStatus()).isEqualTo(RunStatus.COMPLETE);
        assertThat(outcome.getRun().getScanResults()).singleElement()
                .extracting(r -> r.getStatus().toString())
                .isEqualTo("skipped:tool-not-installed");
    }

    @Test
    @DisplayName("시드 접속 불가: FAILED, 리포트 디렉터리 없음")
    void unreachable_seed_fails_without_report() throws Exception {
        ICrawler dead = (seed, max) -> {
            throw new NetworkException(seed, "connection refused");
        };
        FakeScanner alpha = FakeScanner.finding("alpha", ScanGranularity.PER_URL);

        AuditOutcome outcome = orchestrator(config(), dead, null, alpha).run();

        assertThat(outcome.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(outcome.getLocation()).isEmpty();
        assertThat(outcome.getFailureReason()).isEqualTo("seed unreachable: connection refused");
        assertThat(outcome.getRun().getPhase()).isEqualTo(RunPhase.FAILED);
        assertThat(alpha.calls.get()).isZero();
        try (Stream<Path> entries = Files.list(out)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    void cancellation_during_scan_writes_nothing() throws Exception {
        AtomicBoolean cancel = new AtomicBoolean(false);
        FakeScanner tripwire = new FakeScanner("tripwire", ScanGranularity.PER_URL, true, url -> {
            cancel.set(true);
            return ScanResult.builder("tripwire", url).cleanOutcomeAllowed(true).build();
        });

        AuditOrchestrator orch = orchestrator(config(), threePages(), null, tripwire);

        assertThatThrownBy(() -> orch.run(null, cancel)).isInstanceOf(CancellationException.class);
        try (Stream<Path> entries = Files.list(out)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    void cancel_flag_set_up_front_stops_before_crawling() {
        ICrawler seedOnly = (seed, max) -> CrawlResult.seedOnly(seed);
        AuditOrchestrator orch = orchestrator(config(), seedOnly, null,
                FakeScanner.finding("alpha", ScanGranularity.PER_URL));

        assertThatThrownBy(() -> orch.run(null, new AtomicBoolean(true))).isInstanceOf(CancellationException.class);
        assertThat(out.toFile().list()).isEmpty();
    }

    @Test
    @DisplayName("인증 점검 FAIL은 전체 상태에 영향이 없다")
    void auth_results_do_not_change_status() throws Exception {
        AuditConfig cfg = config().setLogin(login());
        IAuthTester auth = (target, login) -> List.of(
                AuthCheckResult.fail("session-cookie-httponly", "cookie 'sid' lacks HttpOnly"),
                AuthCheckResult.pass("login", "HTTP 200"));

        AuditOutcome outcome = orchestrator(cfg, threePages(), auth,
                FakeScanner.finding("alpha", ScanGranularity.PER_URL)).run();

        assertThat(outcome.getStatus()).isEqualTo(RunStatus.COMPLETE);
        assertThat(outcome.getRun().getAuthResults().orElseThrow())
                .extracting(AuthCheckResult::getName)
                .containsExactly("session-cookie-httponly", "login");
    }

    @Test
    void protected_page_is_added_to_the_scan_set() throws Exception {
        AuditConfig cfg = config().setLogin(login());
        FakeScanner alpha = FakeScanner.finding("alpha", ScanGranularity.PER_URL);

        AuditOutcome outcome = orchestrator(cfg, threePages(), (t, l) -> List.of(), alpha).run();

        assertThat(outcome.getRun().getCrawl().getUrls()).endsWith(URI.create("https://site.test/account"));
        assertThat(alpha.calls.get()).isEqualTo(4);
    }

    @Test
    void crashing_auth_flow_becomes_single_inconclusive_result() throws Exception {
        AuditConfig cfg = config().setLogin(login());
        IAuthTester broken = (target, login) -> {
            throw new IllegalArgumentException("form parser blew up");
        };

        AuditOutcome outcome = orchestrator(cfg, threePages(), broken,
                FakeScanner.finding("alpha", ScanGranularity.PER_URL)).run();

        assertThat(outcome.getStatus()).isEqualTo(RunStatus.COMPLETE);
        List<AuthCheckResult> auth = outcome.getRun().getAuthResults().orElseThrow();
        assertThat(auth).singleElement().satisfies(r -> {
            assertThat(r.getName()).isEqualTo(AuditOrchestrator.AUTH_FLOW_RESULT);
            assertThat(r.getEvidence()).contains("form parser blew up");
        });
    }

    @Test
    @DisplayName("리포트 기록 실패: 예외 + FAILED 단계, 상태는 그대로")
    void unwritable_output_raises_persistence_error() throws Exception {
        Path blocker = Files.writeString(out.resolve("not-a-dir"), "x");
        AuditConfig cfg = config().setOutputDir(blocker);

        AuditOrchestrator orch = orchestrator(cfg, threePages(), null,
                FakeScanner.finding("alpha", ScanGranularity.PER_URL));

        assertThatThrownBy(orch::run)
                .isInstanceOf(ReportPersistenceException.class)
                .satisfies(e -> {
                    ReportPersistenceException rpe = (ReportPersistenceException) e;
                    assertThat(rpe.getRun().getPhase()).isEqualTo(RunPhase.FAILED);
                    assertThat(rpe.getRun().getStatus()).isEqualTo(RunStatus.COMPLETE);
                });
    }
}
