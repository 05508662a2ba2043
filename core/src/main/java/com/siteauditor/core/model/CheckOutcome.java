package com.siteauditor.core.model;

/** 인증 점검 결과 분류 */
public enum CheckOutcome {
    PASS,
    FAIL,
    /** 네트워크 실패, 전제조건 부족, 또는 확증이 아닌 신호 */
    INCONCLUSIVE
}
