package com.siteauditor.core.model;

import java.util.Objects;

/** 인증 플로우 점검 1건의 결과. evidence에는 자격증명이 들어가지 않는다. */
public final class AuthCheckResult {
    private final String name;
    private final CheckOutcome outcome;
    private final String evidence;

    public AuthCheckResult(String name, CheckOutcome outcome, String evidence) {
        this.name = Objects.requireNonNull(name, "name");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.evidence = evidence == null ? "" : evidence;
    }

    public static AuthCheckResult pass(String name, String evidence) {
        return new AuthCheckResult(name, CheckOutcome.PASS, evidence);
    }

    public static AuthCheckResult fail(String name, String evidence) {
        return new AuthCheckResult(name, CheckOutcome.FAIL, evidence);
    }

    public static AuthCheckResult inconclusive(String name, String evidence) {
        return new AuthCheckResult(name, CheckOutcome.INCONCLUSIVE, evidence);
    }

    public String getName() { return name; }
    public CheckOutcome getOutcome() { return outcome; }
    public String getEvidence() { return evidence; }

    @Override
    public String toString() { return name + "=" + outcome + " (" + evidence + ")"; }
}
