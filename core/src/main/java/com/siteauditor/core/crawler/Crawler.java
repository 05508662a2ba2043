package com.siteauditor.core.crawler;

import com.siteauditor.core.api.ICrawler;
import com.siteauditor.core.http.NetworkException;
import com.siteauditor.core.model.AuditConfig;
import com.siteauditor.core.model.CrawlResult;
import com.siteauditor.core.model.CrawlResult.SkippedPage;
import com.siteauditor.core.model.Origin;
import com.siteauditor.core.util.ProgressListener;
import com.siteauditor.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * BFS 기반 Crawler
 * - 시드와 같은 origin(scheme+host+port)만 따라간다
 * - 결과에는 실제로 가져온 페이지만, 발견 순서대로 (시드가 항상 첫 번째)
 * - 시드 연결 실패만 치명적(NetworkException), 나머지 페이지 실패는 skipped로 기록
 * - 링크 추출은 LinkExtractor에 위임
 */
public class Crawler implements ICrawler {
    private static final Logger log = LoggerFactory.getLogger(Crawler.class);

    private final LinkExtractor extractor;
    private ProgressListener progress = ProgressListener.NONE;

    public Crawler(AuditConfig config) {
        this(new JsoupLinkExtractor(config.getTimeout().toMillis(), config.isFollowRedirects(), config.getUserAgent()));
    }

    public Crawler(LinkExtractor extractor) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    public Crawler withProgress(ProgressListener listener) {
        this.progress = (listener != null ? listener : ProgressListener.NONE);
        return this;
    }

    @Override
    public CrawlResult crawl(URI seedUri, int maxPages) throws NetworkException {
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        URI seed = UrlUtils.normalize(Objects.requireNonNull(seedUri, "seed"));
        if (seed == null || !UrlUtils.isHttp(seed)) {
            throw new IllegalArgumentException("seed must be an absolute http(s) URL: " + seedUri);
        }
        Origin origin = Origin.of(seed);

        Set<URI> seen = new HashSet<>();           // 방문 + 대기열 (중복 방지)
        List<URI> fetched = new ArrayList<>();     // 실제 방문 성공 목록
        List<SkippedPage> skipped = new ArrayList<>();
        Deque<URI> q = new ArrayDeque<>();
        seen.add(seed);
        q.addLast(seed);

        while (!q.isEmpty() && fetched.size() < maxPages) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("crawl cancelled");
            }
            URI cur = q.pollFirst();
            boolean isSeed = fetched.isEmpty() && cur.equals(seed);

            List<URI> links;
            try {
                links = extractor.extract(cur);
            } catch (NetworkException e) {
                if (isSeed) throw e;
                log.debug("crawl skip {}: {}", cur, e.reason());
                skipped.add(new SkippedPage(cur, e.reason()));
                continue;
            } catch (IOException e) {
                if (isSeed) {
                    // 시드는 응답은 했으므로 결과에 남기고(헤더 스캔 대상) 링크만 포기
                    log.warn("seed {} returned no crawlable page: {}", cur, e.getMessage());
                    fetched.add(cur);
                    continue;
                }
                log.debug("crawl skip {}: {}", cur, e.getMessage());
                skipped.add(new SkippedPage(cur, e.getMessage()));
                continue;
            } catch (RuntimeException e) {
                if (isSeed) throw new NetworkException(cur, "seed could not be parsed", e);
                skipped.add(new SkippedPage(cur, "malformed: " + e.getClass().getSimpleName()));
                continue;
            }

            fetched.add(cur);
            progress.onProgress(fetched.size() / (double) maxPages, "crawl", fetched.size(), maxPages);

            for (URI raw : links) {
                URI n = UrlUtils.normalize(raw);
                if (n == null || !origin.matches(n)) continue;
                if (seen.add(n)) q.addLast(n);
            }
        }
        log.info("crawl done: {} page(s), {} skipped (seed {})", fetched.size(), skipped.size(), seed);
        return new CrawlResult(maxPages, fetched, skipped);
    }
}
