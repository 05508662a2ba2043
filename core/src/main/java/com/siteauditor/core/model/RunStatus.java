package com.siteauditor.core.model;

import java.util.Locale;

/** 실행 전체 상태 */
public enum RunStatus {
    COMPLETE,
    PARTIAL,
    FAILED;

    /** 리포트/프리뷰 표기 (complete/partial/failed) */
    public String label() { return name().toLowerCase(Locale.ROOT); }
}
