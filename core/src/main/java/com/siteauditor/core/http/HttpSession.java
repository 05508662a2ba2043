package com.siteauditor.core.http;

import com.siteauditor.core.model.HttpResponseData;
import com.siteauditor.core.model.Origin;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * 쿠키를 유지하는 세션 클라이언트 (인증 플로우 점검용).
 * - 리다이렉트는 자동으로 따라가지 않는다(3xx 자체가 판정 근거)
 * - 받은 Set-Cookie 원문을 기록한다(SameSite 등 CookieManager가 버리는 속성 확인용)
 */
public final class HttpSession {

    private static final int MAX_HOPS = 5;

    private final HttpClient client;
    private final Duration timeout;
    private final String userAgent;
    private final List<String> observedSetCookies = Collections.synchronizedList(new ArrayList<>());

    public HttpSession(Duration timeout, String userAgent) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.client = HttpClient.newBuilder()
                .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ALL))
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(timeout)
                .build();
    }

    public HttpResponseData get(URI url) throws NetworkException {
        return send(url, base(url).GET().build());
    }

    public HttpResponseData postForm(URI url, Map<String, String> form) throws NetworkException {
        HttpRequest req = base(url)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(encode(form)))
                .build();
        return send(url, req);
    }

    /** 3xx면 Location을 GET으로 따라간다(최대 5홉, allowed origin 안에서만). 아니면 그대로 반환 */
    public HttpResponseData follow(HttpResponseData resp, Origin allowed) throws NetworkException {
        HttpResponseData cur = resp;
        for (int hop = 0; hop < MAX_HOPS && cur.isRedirect(); hop++) {
            String location = cur.header("Location");
            if (location == null || location.isBlank()) break;
            URI next;
            try {
                next = cur.getUrl().resolve(location.trim());
            } catch (IllegalArgumentException e) {
                throw new NetworkException(cur.getUrl(), "bad redirect location", e);
            }
            if (!allowed.matches(next)) break;
            cur = get(next);
        }
        return cur;
    }

    /** 지금까지 받은 Set-Cookie 원문(수신 순서) */
    public List<String> observedSetCookies() {
        synchronized (observedSetCookies) {
            return List.copyOf(observedSetCookies);
        }
    }

    public int observedSetCookieCount() {
        return observedSetCookies.size();
    }

    /** from번째 이후에 받은 Set-Cookie */
    public List<String> observedSetCookiesSince(int from) {
        synchronized (observedSetCookies) {
            return List.copyOf(observedSetCookies.subList(Math.min(from, observedSetCookies.size()), observedSetCookies.size()));
        }
    }

    private HttpRequest.Builder base(URI url) {
        return HttpRequest.newBuilder(url)
                .timeout(timeout)
                .header("User-Agent", userAgent);
    }

    private HttpResponseData send(URI url, HttpRequest req) throws NetworkException {
        long start = System.nanoTime();
        try {
            HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
            observedSetCookies.addAll(resp.headers().allValues("Set-Cookie"));
            return HttpFetcher.toData(url, resp, (System.nanoTime() - start) / 1_000_000);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new NetworkException(url, "interrupted", ie);
        } catch (IOException e) {
            throw new NetworkException(url, "request failed", e);
        }
    }

    static String encode(Map<String, String> form) {
        StringJoiner sj = new StringJoiner("&");
        for (var e : form.entrySet()) {
            sj.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                    + "=" + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8));
        }
        return sj.toString();
    }
}
