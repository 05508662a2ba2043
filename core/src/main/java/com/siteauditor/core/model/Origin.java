package com.siteauditor.core.model;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * same-origin 판정 단위: scheme + host + port.
 * 기본 포트는 명시값으로 채워서 비교한다(http:80, https:443).
 */
public record Origin(String scheme, String host, int port) {

    public Origin {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        scheme = scheme.toLowerCase(Locale.ROOT);
        host = host.toLowerCase(Locale.ROOT);
    }

    public static Origin of(URI uri) {
        Objects.requireNonNull(uri, "uri");
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("URI has no scheme/host: " + uri);
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (port < 0) port = defaultPort(scheme);
        return new Origin(scheme, uri.getHost(), port);
    }

    /** uri가 이 origin에 속하는지. 파싱 불가/상대 URI는 false */
    public boolean matches(URI uri) {
        if (uri == null || uri.getScheme() == null || uri.getHost() == null) return false;
        try {
            return equals(of(uri));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** sslscan 등 외부 도구용 "host:port" */
    public String hostPort() {
        return host + ":" + port;
    }

    public URI toUri() {
        boolean defaultPort = port == defaultPort(scheme);
        return URI.create(scheme + "://" + host + (defaultPort ? "" : ":" + port) + "/");
    }

    private static int defaultPort(String scheme) {
        if ("https".equals(scheme)) return 443;
        if ("http".equals(scheme)) return 80;
        return -1;
    }

    @Override
    public String toString() {
        return scheme + "://" + host + ":" + port;
    }
}
