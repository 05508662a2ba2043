package com.siteauditor.core.util;

import com.siteauditor.core.model.Origin;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화 + same-origin 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거), userinfo 제거
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈/누락 경로를 "/"로, 중복 슬래시 축소
     * host가 없는 URI(mailto:, 상대경로 등)는 null.
     */
    public static URI normalize(URI u) {
        if (u == null || u.getScheme() == null || u.getHost() == null) return null;

        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        String host = u.getHost().toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        // raw 값 그대로 써야 %26 %3D %2F 같은 이스케이프가 구분자로 풀리지 않는다
        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        path = path.replaceAll("/{2,}", "/");

        StringBuilder sb = new StringBuilder(scheme).append("://");
        sb.append(host.contains(":") && !host.startsWith("[") ? "[" + host + "]" : host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());

        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** 문자열 → 정규화 URI. 파싱 불가면 null */
    public static URI parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return normalize(new URI(raw.trim()));
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static boolean isHttp(URI u) {
        if (u == null || u.getScheme() == null) return false;
        String s = u.getScheme();
        return s.equalsIgnoreCase("http") || s.equalsIgnoreCase("https");
    }

    /** scheme + host + port 기준 동일 origin 판정 */
    public static boolean sameOrigin(URI a, URI b) {
        if (a == null || b == null || a.getHost() == null || b.getHost() == null) return false;
        try {
            return Origin.of(a).matches(b);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
