package com.siteauditor.core.model;

import java.util.Locale;

/** 파인딩 심각도 (높은 순) */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    /** 외부 도구 표기(critical/high/medium/low/info/unknown) → enum. 모르면 INFO. */
    public static Severity parse(String raw) {
        if (raw == null) return INFO;
        String s = raw.trim().toUpperCase(Locale.ROOT);
        switch (s) {
            case "CRITICAL": return CRITICAL;
            case "HIGH":     return HIGH;
            case "MEDIUM":
            case "MODERATE": return MEDIUM;
            case "LOW":      return LOW;
            default:         return INFO;
        }
    }
}
