package com.siteauditor.core.model;

/**
 * 실행 상태 머신.
 * CREATED → CRAWLING → SCANNING → (AUTH_CHECKING) → AGGREGATING → PERSISTED, 또는 FAILED.
 */
public enum RunPhase {
    CREATED,
    CRAWLING,
    SCANNING,
    AUTH_CHECKING,
    AGGREGATING,
    PERSISTED,
    FAILED;

    public boolean isTerminal() {
        return this == PERSISTED || this == FAILED;
    }

    /** 허용된 전이인지 */
    public boolean canMoveTo(RunPhase next) {
        if (next == FAILED) return !isTerminal();
        switch (this) {
            case CREATED:       return next == CRAWLING;
            case CRAWLING:      return next == SCANNING;
            case SCANNING:      return next == AUTH_CHECKING || next == AGGREGATING;
            case AUTH_CHECKING: return next == AGGREGATING;
            case AGGREGATING:   return next == PERSISTED;
            default:            return false;
        }
    }
}
