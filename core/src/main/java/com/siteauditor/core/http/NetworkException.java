package com.siteauditor.core.http;

import java.io.IOException;
import java.net.URI;

/** 대상에 도달하지 못함(연결 실패/타임아웃/중단). 크롤 시드에서만 치명적이다. */
public class NetworkException extends IOException {
    private final URI url;

    public NetworkException(URI url, String message, Throwable cause) {
        super(message + " (" + url + ")", cause);
        this.url = url;
    }

    public NetworkException(URI url, String message) {
        this(url, message, null);
    }

    public URI getUrl() { return url; }

    /** 원인 예외까지 포함한 한 줄 사유 (status 문자열용) */
    public String reason() {
        Throwable c = getCause();
        if (c == null) return getMessage();
        String m = c.getMessage();
        return c.getClass().getSimpleName() + (m == null || m.isBlank() ? "" : ": " + m);
    }
}
