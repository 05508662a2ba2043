package com.siteauditor.core.model;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 결과: 발견 순서 그대로의 same-origin URL 목록(시드가 항상 첫 번째).
 * 가져오지 못한 페이지는 skipped에 사유와 함께 남긴다.
 */
public final class CrawlResult {

    public record SkippedPage(URI url, String reason) {}

    private final int maxPages;
    private final List<URI> urls;
    private final List<SkippedPage> skipped;

    public CrawlResult(int maxPages, List<URI> urls, List<SkippedPage> skipped) {
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        Objects.requireNonNull(urls, "urls");
        if (urls.isEmpty()) throw new IllegalArgumentException("crawl result must contain the seed");
        if (urls.size() > maxPages) {
            throw new IllegalArgumentException("urls(" + urls.size() + ") exceed maxPages(" + maxPages + ")");
        }
        this.maxPages = maxPages;
        this.urls = List.copyOf(urls);
        this.skipped = List.copyOf(skipped == null ? List.of() : skipped);
    }

    /** 시드 하나만 있는 결과 (크롤 생략/대체용) */
    public static CrawlResult seedOnly(URI seed) {
        return new CrawlResult(1, List.of(seed), List.of());
    }

    public int getMaxPages() { return maxPages; }
    public List<URI> getUrls() { return urls; }
    public List<SkippedPage> getSkipped() { return skipped; }
    public URI getSeed() { return urls.get(0); }

    /** 같은 maxPages 한도 안에서 URL 하나를 뒤에 붙인 사본. 한도 초과/중복이면 그대로 */
    public CrawlResult plus(URI extra) {
        if (extra == null || urls.contains(extra) || urls.size() >= maxPages) return this;
        List<URI> next = new ArrayList<>(urls);
        next.add(extra);
        return new CrawlResult(maxPages, next, skipped);
    }
}
