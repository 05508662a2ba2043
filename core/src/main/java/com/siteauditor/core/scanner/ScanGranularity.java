package com.siteauditor.core.scanner;

/** 스캐너가 짝지어지는 단위 */
public enum ScanGranularity {
    /** 크롤로 발견된 URL마다 1회 */
    PER_URL,
    /** 시드(origin)에 대해 1회. 외부 도구 기반 스캐너 */
    ORIGIN
}
