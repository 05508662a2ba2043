package com.siteauditor.core.service;

import com.siteauditor.core.model.AuditRun;

import java.io.IOException;

/** 리포트 기록 실패. 실행은 FAILED로 표시되고 호출자에게 그대로 전달된다. */
public class ReportPersistenceException extends IOException {

    private final transient AuditRun run;

    public ReportPersistenceException(AuditRun run, IOException cause) {
        super("report could not be written: " + cause.getMessage(), cause);
        this.run = run;
    }

    public AuditRun getRun() { return run; }
}
