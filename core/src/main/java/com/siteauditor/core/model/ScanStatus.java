package com.siteauditor.core.model;

import java.util.Objects;

/**
 * 스캔 상태. 문자열 표기는 "ok" / "skipped:&lt;reason&gt;" / "error:&lt;reason&gt;".
 * skipped/error는 항상 사유를 가진다.
 */
public final class ScanStatus {

    public enum Kind { OK, SKIPPED, ERROR }

    public static final String TOOL_NOT_INSTALLED = "tool-not-installed";

    private static final ScanStatus OK = new ScanStatus(Kind.OK, null);

    private final Kind kind;
    private final String reason;

    private ScanStatus(Kind kind, String reason) {
        this.kind = kind;
        this.reason = reason;
    }

    public static ScanStatus ok() { return OK; }

    public static ScanStatus skipped(String reason) {
        return new ScanStatus(Kind.SKIPPED, requireReason(reason));
    }

    public static ScanStatus error(String reason) {
        return new ScanStatus(Kind.ERROR, requireReason(reason));
    }

    /** 리포트 재해석용 역변환 */
    public static ScanStatus parse(String s) {
        Objects.requireNonNull(s, "status");
        if (s.equals("ok")) return OK;
        if (s.startsWith("skipped:")) return skipped(s.substring("skipped:".length()));
        if (s.startsWith("error:")) return error(s.substring("error:".length()));
        throw new IllegalArgumentException("unknown status: " + s);
    }

    public Kind getKind() { return kind; }
    public String getReason() { return reason; }
    public boolean isOk() { return kind == Kind.OK; }
    public boolean isSkipped() { return kind == Kind.SKIPPED; }
    public boolean isError() { return kind == Kind.ERROR; }

    private static String requireReason(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("skipped/error status requires a reason");
        }
        // 한 줄 요약만 유지
        String oneLine = reason.strip().replaceAll("\\s+", " ");
        return oneLine.length() > 300 ? oneLine.substring(0, 300) + "…" : oneLine;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScanStatus st)) return false;
        return kind == st.kind && Objects.equals(reason, st.reason);
    }

    @Override
    public int hashCode() { return Objects.hash(kind, reason); }

    @Override
    public String toString() {
        switch (kind) {
            case OK: return "ok";
            case SKIPPED: return "skipped:" + reason;
            default: return "error:" + reason;
        }
    }
}
