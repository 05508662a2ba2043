package com.siteauditor.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거.
 * LogSetup(콘솔/파일 핸들러) 세팅 후 여기서 호출하면 JSON 문자열로 찍힘.
 * 민감 키(password/username/token/cookie 포함)는 값 대신 "***".
 */
public final class StructuredLog {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<String> SENSITIVE = Set.of("password", "username", "token", "cookie", "secret");
    static final String REDACTED = "***";

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,   event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,   event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING,event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ts", Instant.now().toString());
        m.put("lvl", lvl.getName());
        m.put("comp", comp);
        m.put("thread", Thread.currentThread().getName());
        m.put("event", event);
        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                String k = String.valueOf(kvs[i]);
                m.put(k, isSensitive(k) ? REDACTED : scalar(kvs[i + 1]));
            }
            if (kvs.length % 2 == 1) m.put("_kv_mismatch", true);
        }
        if (t != null) {
            m.put("error", t.getClass().getSimpleName());
            m.put("message", t.getMessage());
        }
        try {
            return MAPPER.writeValueAsString(m);
        } catch (JsonProcessingException e) {
            // 직렬화 실패 시 최소 정보만
            return "{\"event\":\"" + event + "\",\"_serialization_error\":true}";
        }
    }

    static boolean isSensitive(String key) {
        String k = key.toLowerCase(Locale.ROOT);
        for (String s : SENSITIVE) if (k.contains(s)) return true;
        return false;
    }

    private static Object scalar(Object v) {
        if (v == null || v instanceof Number || v instanceof Boolean) return v;
        return String.valueOf(v);
    }
}
