package com.siteauditor.core.service.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.siteauditor.core.model.AuditRun;
import com.siteauditor.core.model.AuthCheckResult;
import com.siteauditor.core.model.CrawlResult;
import com.siteauditor.core.model.Finding;
import com.siteauditor.core.model.ScanResult;
import com.siteauditor.core.model.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 리포트 공통 뷰 모델. JSON/HTML 두 표현이 같은 모델에서 렌더링되므로 결과 집합과 id가 항상 같다.
 * id 규칙: 스캔 결과 "scan-1.."(저장 순서), 인증 점검 "auth-1..".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportModel(
        String title,
        String reportType,
        String target,
        String status,
        Instant startedAt,
        Instant endedAt,
        Long durationMs,
        Summary summary,
        Crawl crawl,
        List<ScanEntry> results,
        List<AuthEntry> auth) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Summary(
            String target,
            String reportType,
            String status,
            int pagesScanned,
            List<String> checks,
            Map<String, Integer> scanStatus,
            Map<String, Integer> findingsBySeverity,
            String failureReason) {}

    public record Crawl(List<String> urls, List<Skipped> skipped) {}

    public record Skipped(String url, String reason) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ScanEntry(
            String id,
            String scanner,
            String target,
            String status,
            long durationMs,
            List<FindingEntry> findings,
            Map<String, Double> measurements,
            String rawOutput) {}

    public record FindingEntry(String key, String severity, String detail) {}

    public record AuthEntry(String id, String name, String outcome, String evidence) {}

    public static final String AUTH_FLOW_CHECK = "auth_flow";

    /** 동결된 실행만 리포트로 만든다 */
    public static ReportModel from(AuditRun run) {
        Objects.requireNonNull(run, "run");
        if (!run.isFrozen()) throw new IllegalStateException("run must be frozen before reporting");

        List<ScanEntry> results = new ArrayList<>();
        int n = 0;
        for (ScanResult r : run.getScanResults()) {
            List<FindingEntry> findings = new ArrayList<>();
            for (Finding f : r.getFindings().values()) {
                findings.add(new FindingEntry(f.getKey(), f.getSeverity().name(), f.getDetail()));
            }
            results.add(new ScanEntry("scan-" + (++n), r.getScannerId(), r.getTarget().toString(),
                    r.getStatus().toString(), r.getDurationMs(), findings,
                    new LinkedHashMap<>(r.getMeasurements()), r.getRawOutput()));
        }

        List<AuthEntry> auth = null;
        if (run.getAuthResults().isPresent()) {
            auth = new ArrayList<>();
            int a = 0;
            for (AuthCheckResult c : run.getAuthResults().get()) {
                auth.add(new AuthEntry("auth-" + (++a), c.getName(), c.getOutcome().name(), c.getEvidence()));
            }
        }

        Crawl crawl = null;
        CrawlResult cr = run.getCrawl();
        if (cr != null) {
            crawl = new Crawl(cr.getUrls().stream().map(Object::toString).toList(),
                    cr.getSkipped().stream().map(s -> new Skipped(s.url().toString(), s.reason())).toList());
        }

        return new ReportModel(
                run.getProfile().reportTitle(),
                reportType(run),
                run.getTarget().getSeed().toString(),
                run.getStatus().label(),
                run.getStartedAt(),
                run.getEndedAt(),
                Duration.between(run.getStartedAt(), run.getEndedAt()).toMillis(),
                summaryOf(run),
                crawl,
                List.copyOf(results),
                auth == null ? null : List.copyOf(auth));
    }

    /** 실패한(동결 전) 실행에도 쓸 수 있는 요약. CLI 프리뷰용 */
    public static Summary summaryOf(AuditRun run) {
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        byStatus.put("ok", 0);
        byStatus.put("skipped", 0);
        byStatus.put("error", 0);
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (Severity s : Severity.values()) bySeverity.put(s.name(), 0);

        LinkedHashSet<String> checks = new LinkedHashSet<>();
        for (ScanResult r : run.getScanResults()) {
            checks.add(r.getScannerId());
            byStatus.merge(r.getStatus().getKind().name().toLowerCase(Locale.ROOT), 1, Integer::sum);
            for (Finding f : r.getFindings().values()) bySeverity.merge(f.getSeverity().name(), 1, Integer::sum);
        }
        if (run.getAuthResults().isPresent()) checks.add(AUTH_FLOW_CHECK);

        return new Summary(
                run.getTarget().getSeed().toString(),
                reportType(run),
                run.getStatus() == null ? null : run.getStatus().label(),
                run.getCrawl() == null ? 0 : run.getCrawl().getUrls().size(),
                List.copyOf(checks),
                byStatus,
                bySeverity,
                run.getFailureReason());
    }

    private static String reportType(AuditRun run) {
        return run.getProfile().name().toLowerCase(Locale.ROOT);
    }

    /** JSON/HTML 공통: 모든 결과 id (저장 순서) */
    public List<String> resultIds() {
        List<String> ids = new ArrayList<>();
        results.forEach(r -> ids.add(r.id()));
        if (auth != null) auth.forEach(a -> ids.add(a.id()));
        return ids;
    }
}
