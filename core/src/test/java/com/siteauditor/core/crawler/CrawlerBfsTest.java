package com.siteauditor.core.crawler;

import com.siteauditor.core.http.NetworkException;
import com.siteauditor.core.model.CrawlResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlerBfsTest {

    /** 맵 기반 링크 그래프 (방문 순서 기록) */
    static final class GraphExtractor implements LinkExtractor {
        final Map<URI, List<URI>> graph = new HashMap<>();
        final List<URI> visits = new ArrayList<>();

        GraphExtractor link(String from, String... to) {
            List<URI> out = new ArrayList<>();
            for (String t : to) out.add(URI.create(t));
            graph.put(URI.create(from), out);
            return this;
        }

        @Override public List<URI> extract(URI base) throws IOException {
            visits.add(base);
            return graph.getOrDefault(base, List.of());
        }
    }

    @Test
    @DisplayName("seed + same-origin 1개 + cross-origin 1개, maxPages=2 → [seed, same-origin]")
    void cross_origin_link_is_never_followed() throws Exception {
        GraphExtractor g = new GraphExtractor()
                .link("https://example.test/", "https://other.test/x", "https://example.test/about");

        CrawlResult r = new Crawler(g).crawl(URI.create("https://example.test"), 2);

        assertThat(r.getUrls()).containsExactly(
                URI.create("https://example.test/"),
                URI.create("https://example.test/about"));
        assertThat(g.visits).noneMatch(u -> "other.test".equals(u.getHost()));
    }

    @Test
    void bfs_order_dedup_normalization_and_cap() throws Exception {
        GraphExtractor g = new GraphExtractor()
                .link("https://example.test/",
                        "https://example.test/a", "https://EXAMPLE.test:443/b#top", "https://example.test/a",
                        "https://example.test/")
                .link("https://example.test/a", "https://example.test/c", "https://example.test/d")
                .link("https://example.test/b", "https://example.test/e");

        CrawlResult r = new Crawler(g).crawl(URI.create("https://example.test/"), 4);

        assertThat(r.getUrls()).containsExactly(
                URI.create("https://example.test/"),
                URI.create("https://example.test/a"),
                URI.create("https://example.test/b"),
                URI.create("https://example.test/c"));
        assertThat(r.getUrls()).hasSizeLessThanOrEqualTo(r.getMaxPages());
        assertThat(g.visits).hasSize(4);
    }

    @Test
    void port_and_scheme_are_part_of_origin() throws Exception {
        GraphExtractor g = new GraphExtractor()
                .link("http://example.test:8080/",
                        "http://example.test/x", "https://example.test:8080/y", "http://example.test:8080/z");

        CrawlResult r = new Crawler(g).crawl(URI.create("http://example.test:8080/"), 10);
        assertThat(r.getUrls()).containsExactly(
                URI.create("http://example.test:8080/"),
                URI.create("http://example.test:8080/z"));
    }

    @Test
    void maxPages_one_returns_seed_only() throws Exception {
        GraphExtractor g = new GraphExtractor().link("https://example.test/", "https://example.test/a");
        CrawlResult r = new Crawler(g).crawl(URI.create("https://example.test/"), 1);
        assertThat(r.getUrls()).containsExactly(URI.create("https://example.test/"));
        assertThat(r.getSeed()).isEqualTo(URI.create("https://example.test/"));
    }

    @Test
    void rejects_non_http_seed_and_bad_cap() {
        Crawler c = new Crawler(new GraphExtractor());
        assertThatThrownBy(() -> c.crawl(URI.create("ftp://example.test/"), 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> c.crawl(URI.create("https://example.test/"), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unreachable_seed_is_network_error() {
        LinkExtractor down = base -> { throw new NetworkException(base, "unreachable", new java.net.ConnectException("refused")); };
        assertThatThrownBy(() -> new Crawler(down).crawl(URI.create("https://example.test/"), 5))
                .isInstanceOf(NetworkException.class);
    }
}
