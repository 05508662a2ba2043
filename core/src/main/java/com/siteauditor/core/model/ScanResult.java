package com.siteauditor.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 스캐너 1개 × 대상 1개의 결과.
 * - skipped/error는 findings/measurements를 갖지 않는다(부분 결과 금지)
 * - ok + 빈 findings + 빈 measurements는 스캐너가 "클린"을 유효 결과로 선언한 경우만 허용
 */
public final class ScanResult {
    private final String scannerId;
    private final URI target;
    private final ScanStatus status;
    private final Map<String, Finding> findings;
    private final Map<String, Double> measurements;
    private final String rawOutput;   // nullable, 사람용 리포트 부록
    private final long durationMs;

    private ScanResult(Builder b) {
        this.scannerId = b.scannerId;
        this.target = b.target;
        this.status = b.status;
        this.findings = Collections.unmodifiableMap(new LinkedHashMap<>(b.findings));
        this.measurements = Collections.unmodifiableMap(new LinkedHashMap<>(b.measurements));
        this.rawOutput = b.rawOutput;
        this.durationMs = b.durationMs;
    }

    public String getScannerId() { return scannerId; }
    public URI getTarget() { return target; }
    public ScanStatus getStatus() { return status; }
    public Map<String, Finding> getFindings() { return findings; }
    public Map<String, Double> getMeasurements() { return measurements; }
    public String getRawOutput() { return rawOutput; }
    public long getDurationMs() { return durationMs; }

    // ----- 편의 팩토리 -----
    public static ScanResult skipped(String scannerId, URI target, String reason) {
        return builder(scannerId, target).status(ScanStatus.skipped(reason)).build();
    }

    public static ScanResult error(String scannerId, URI target, String reason) {
        return builder(scannerId, target).status(ScanStatus.error(reason)).build();
    }

    public static Builder builder(String scannerId, URI target) {
        return new Builder().scannerId(scannerId).target(target);
    }

    /** durationMs만 바꾼 사본 (오케스트레이터 계측용) */
    public ScanResult withDuration(long ms) {
        Builder b = new Builder()
                .scannerId(scannerId).target(target).status(status)
                .rawOutput(rawOutput).durationMs(ms).cleanOutcomeAllowed(true);
        b.findings.putAll(findings);
        b.measurements.putAll(measurements);
        return new ScanResult(b);
    }

    @Override
    public String toString() {
        return scannerId + "@" + target + " -> " + status + " (" + findings.size() + " findings)";
    }

    public static final class Builder {
        private String scannerId;
        private URI target;
        private ScanStatus status = ScanStatus.ok();
        private final Map<String, Finding> findings = new LinkedHashMap<>();
        private final Map<String, Double> measurements = new LinkedHashMap<>();
        private String rawOutput;
        private long durationMs;
        private boolean cleanOutcomeAllowed;

        public Builder scannerId(String id) { this.scannerId = id; return this; }
        public Builder target(URI target) { this.target = target; return this; }
        public Builder status(ScanStatus status) { this.status = status; return this; }
        public Builder rawOutput(String raw) { this.rawOutput = raw; return this; }
        public Builder durationMs(long ms) { this.durationMs = ms; return this; }

        /** "발견 없음"을 정상 결과로 인정 (헤더가 모두 갖춰진 페이지 등) */
        public Builder cleanOutcomeAllowed(boolean v) { this.cleanOutcomeAllowed = v; return this; }

        /** 같은 key가 다시 오면 나중 값이 이긴다 */
        public Builder finding(Finding f) {
            findings.put(f.getKey(), f);
            return this;
        }

        public Builder finding(String key, Severity severity, String detail) {
            return finding(new Finding(key, severity, detail));
        }

        public Builder measurement(String name, double value) {
            measurements.put(name, value);
            return this;
        }

        public ScanResult build() {
            Objects.requireNonNull(scannerId, "scannerId");
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(status, "status");
            if (!status.isOk() && (!findings.isEmpty() || !measurements.isEmpty())) {
                throw new IllegalStateException("non-ok result must not carry findings: " + status);
            }
            if (status.isOk() && findings.isEmpty() && measurements.isEmpty() && !cleanOutcomeAllowed) {
                throw new IllegalStateException(
                        "scanner " + scannerId + " produced ok without findings but does not allow a clean outcome");
            }
            return new ScanResult(this);
        }
    }
}
