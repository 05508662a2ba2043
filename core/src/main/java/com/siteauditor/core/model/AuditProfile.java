package com.siteauditor.core.model;

/**
 * 감사 종류. 기본 스캐너 구성을 고른다 (scanners: 토글이 있으면 그쪽이 우선).
 * - PERFORMANCE: lighthouse + JS 라이브러리 + 헤더, 인증 플로우 없음
 * - SECURITY   : 헤더 + JS 라이브러리 + sslscan + nuclei + 인증 플로우
 */
public enum AuditProfile {
    PERFORMANCE("Performance Audit Report"),
    SECURITY("Security Audit Report");

    private final String reportTitle;

    AuditProfile(String reportTitle) { this.reportTitle = reportTitle; }

    public String reportTitle() { return reportTitle; }
}
