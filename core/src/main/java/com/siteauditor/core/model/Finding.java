package com.siteauditor.core.model;

import java.util.Objects;

/** 스캐너가 남기는 단일 관찰: key(이슈 식별자) + severity + detail */
public final class Finding {
    private final String key;
    private final Severity severity;
    private final String detail;

    public Finding(String key, Severity severity, String detail) {
        this.key = Objects.requireNonNull(key, "key");
        this.severity = Objects.requireNonNull(severity, "severity");
        if (detail == null || detail.isBlank()) {
            throw new IllegalArgumentException("finding detail must not be blank: " + key);
        }
        this.detail = detail;
    }

    public String getKey() { return key; }
    public Severity getSeverity() { return severity; }
    public String getDetail() { return detail; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Finding f)) return false;
        return key.equals(f.key) && severity == f.severity && detail.equals(f.detail);
    }

    @Override
    public int hashCode() { return Objects.hash(key, severity, detail); }

    @Override
    public String toString() { return "[" + severity + "] " + key + ": " + detail; }
}
