package com.siteauditor.core.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Set-Cookie 원문 1개 파싱 결과. 속성 이름은 소문자 키.
 * 값 없는 속성(Secure, HttpOnly)은 빈 문자열로 저장한다.
 */
public final class SetCookie {
    private final String name;
    private final String value;
    private final Map<String, String> attributes;
    private final String raw;

    private SetCookie(String name, String value, Map<String, String> attributes, String raw) {
        this.name = name;
        this.value = value;
        this.attributes = Collections.unmodifiableMap(attributes);
        this.raw = raw;
    }

    public static SetCookie parse(String raw) {
        String[] parts = (raw == null ? "" : raw).split(";");
        String first = parts[0].trim();
        int eq = first.indexOf('=');
        String name = (eq <= 0 ? first : first.substring(0, eq)).trim();
        String value = (eq <= 0 ? "" : first.substring(eq + 1)).trim();

        Map<String, String> attrs = new LinkedHashMap<>();
        for (int i = 1; i < parts.length; i++) {
            String p = parts[i].trim();
            if (p.isEmpty()) continue;
            int e = p.indexOf('=');
            String k = (e < 0 ? p : p.substring(0, e)).trim().toLowerCase(Locale.ROOT);
            String v = (e < 0 ? "" : p.substring(e + 1)).trim();
            attrs.putIfAbsent(k, v);
        }
        return new SetCookie(name, value, attrs, raw);
    }

    public String getName() { return name; }
    public String getValue() { return value; }
    public String getRaw() { return raw; }

    public boolean has(String attribute) {
        return attributes.containsKey(attribute.toLowerCase(Locale.ROOT));
    }

    public String attribute(String attribute) {
        return attributes.get(attribute.toLowerCase(Locale.ROOT));
    }

    public boolean isSecure() { return has("secure"); }
    public boolean isHttpOnly() { return has("httponly"); }

    /** SameSite 값(없으면 null) */
    public String sameSite() { return attribute("samesite"); }

    /** 값은 가리고 속성만 보여주는 요약(증거 문자열용) */
    public String describeAttributes() {
        return name + "=...; " + String.join("; ", attributes.keySet());
    }

    @Override
    public String toString() { return describeAttributes(); }
}
