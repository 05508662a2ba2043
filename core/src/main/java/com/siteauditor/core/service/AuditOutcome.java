package com.siteauditor.core.service;

import com.siteauditor.core.model.AuditRun;
import com.siteauditor.core.model.RunStatus;
import com.siteauditor.core.service.export.JsonReportExporter;
import com.siteauditor.core.service.export.ReportModel;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/** 감사 1회의 결과: 상태, 리포트 위치(실패 시 없음), 요약 프리뷰 */
public final class AuditOutcome {
    private final RunStatus status;
    private final Path location;
    private final AuditRun run;

    AuditOutcome(RunStatus status, Path location, AuditRun run) {
        this.status = Objects.requireNonNull(status, "status");
        this.location = location;
        this.run = Objects.requireNonNull(run, "run");
    }

    public RunStatus getStatus() { return status; }
    public Optional<Path> getLocation() { return Optional.ofNullable(location); }
    public AuditRun getRun() { return run; }
    public String getFailureReason() { return run.getFailureReason(); }

    /** 요약 JSON (report.json의 summary와 같은 구조) */
    public String preview() {
        return JsonReportExporter.toJson(ReportModel.summaryOf(run));
    }

    @Override
    public String toString() {
        return "AuditOutcome{status=" + status.label() + ", location=" + location + "}";
    }
}
