package com.siteauditor.core.http;

import com.siteauditor.core.api.IHttpFetcher;
import com.siteauditor.core.model.AuditConfig;
import com.siteauditor.core.model.HttpResponseData;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/** 단발 GET 전송 후 HttpResponseData로 매핑. 스캐너 공용. */
public class HttpFetcher implements IHttpFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final Duration timeout;
    private final String userAgent;
    private final HttpSender sender;

    public HttpFetcher(AuditConfig config) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpFetcher(AuditConfig config, HttpSender testSender) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public HttpResponseData fetch(URI url) throws NetworkException {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();
        HttpRequest req = HttpRequest.newBuilder(url)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/xhtml+xml,*/*;q=0.8")
                .GET()
                .build();
        try {
            HttpResponse<String> resp = sender.send(req);
            return toData(url, resp, (System.nanoTime() - start) / 1_000_000);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new NetworkException(url, "interrupted", ie);
        } catch (IOException e) {
            throw new NetworkException(url, "fetch failed", e);
        }
    }

    static HttpResponseData toData(URI url, HttpResponse<String> resp, long elapsedMs) {
        HttpHeaders hh = resp.headers();
        return HttpResponseData.builder()
                .url(resp.uri() != null ? resp.uri() : url)
                .statusCode(resp.statusCode())
                .headers(hh.map())
                .body(resp.body() == null ? "" : resp.body())
                .contentType(hh.firstValue("Content-Type").orElse(null))
                .responseTimeMs(elapsedMs)
                .build();
    }
}
