package com.siteauditor.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 감사 1회의 집계 루트.
 * - 오케스트레이터만 변경한다(단일 writer)
 * - freeze() 이후 모든 변경 메서드는 IllegalStateException
 * - 식별자는 시작 시각(리포트 디렉터리 키)
 */
public final class AuditRun {
    private final Target target;
    private final AuditProfile profile;
    private final Instant startedAt;

    private Instant endedAt;
    private RunPhase phase = RunPhase.CREATED;
    private RunStatus status;
    private String failureReason;
    private CrawlResult crawl;
    private final List<ScanResult> scanResults = new ArrayList<>();
    private List<AuthCheckResult> authResults;   // null이면 인증 점검 미실행
    private volatile boolean frozen;

    public AuditRun(Target target, AuditProfile profile, Instant startedAt) {
        this.target = Objects.requireNonNull(target, "target");
        this.profile = Objects.requireNonNull(profile, "profile");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    // ---------- 읽기 ----------
    public Target getTarget() { return target; }
    public AuditProfile getProfile() { return profile; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getEndedAt() { return endedAt; }
    public RunPhase getPhase() { return phase; }
    public RunStatus getStatus() { return status; }
    public String getFailureReason() { return failureReason; }
    public CrawlResult getCrawl() { return crawl; }
    public List<ScanResult> getScanResults() { return Collections.unmodifiableList(scanResults); }
    public Optional<List<AuthCheckResult>> getAuthResults() {
        return authResults == null ? Optional.empty() : Optional.of(Collections.unmodifiableList(authResults));
    }
    public boolean isFrozen() { return frozen; }

    // ---------- 변경 (오케스트레이터 전용) ----------
    public void moveTo(RunPhase next) {
        // 동결 후에는 AGGREGATING → PERSISTED/FAILED 종결 전이만 허용 (내용은 그대로)
        boolean closing = phase == RunPhase.AGGREGATING && next.isTerminal();
        if (!closing) checkMutable();
        if (!phase.canMoveTo(next)) {
            throw new IllegalStateException("illegal phase transition " + phase + " -> " + next);
        }
        this.phase = next;
    }

    public void setCrawl(CrawlResult crawl) {
        checkMutable();
        this.crawl = Objects.requireNonNull(crawl, "crawl");
    }

    public void addScanResult(ScanResult result) {
        checkMutable();
        scanResults.add(Objects.requireNonNull(result, "result"));
    }

    public void setAuthResults(List<AuthCheckResult> results) {
        checkMutable();
        this.authResults = new ArrayList<>(Objects.requireNonNull(results, "results"));
    }

    /**
     * ScanResult 상태만으로 전체 상태를 계산한다. 인증 점검 결과는 반영하지 않는다.
     * error가 하나라도 있으면 PARTIAL, 아니면 COMPLETE.
     */
    public RunStatus aggregate() {
        checkMutable();
        boolean anyError = scanResults.stream().anyMatch(r -> r.getStatus().isError());
        this.status = anyError ? RunStatus.PARTIAL : RunStatus.COMPLETE;
        return status;
    }

    public void fail(String reason) {
        checkMutable();
        moveTo(RunPhase.FAILED);
        this.status = RunStatus.FAILED;
        this.failureReason = reason;
    }

    public void finish(Instant endedAt) {
        checkMutable();
        this.endedAt = Objects.requireNonNull(endedAt, "endedAt");
    }

    /** 리포트 기록 직전 호출. 이후 읽기 전용 */
    public void freeze() {
        if (status == null) throw new IllegalStateException("aggregate() before freeze()");
        if (endedAt == null) throw new IllegalStateException("finish() before freeze()");
        this.frozen = true;
    }

    private void checkMutable() {
        if (frozen) throw new IllegalStateException("AuditRun is frozen (started " + startedAt + ")");
    }
}
