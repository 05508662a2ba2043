package com.siteauditor.core.scanner;

import com.siteauditor.core.model.HttpResponseData;
import com.siteauditor.core.model.ScanResult;
import com.siteauditor.core.model.Severity;
import com.siteauditor.core.scanner.JsLibraryCatalog.Detection;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsVulnerabilityScannerTest {

    private static final JsLibraryCatalog CATALOG = JsLibraryCatalog.loadDefault();
    private static final URI PAGE = URI.create("https://example.test/");

    @Test
    void detects_common_url_shapes() {
        assertThat(CATALOG.detect("https://code.jquery.com/jquery-1.12.4.min.js"))
                .contains(new Detection("jquery", "1.12.4"));
        assertThat(CATALOG.detect("https://cdnjs.cloudflare.com/ajax/libs/lodash.js/4.17.11/lodash.min.js"))
                .contains(new Detection("lodash", "4.17.11"));
        assertThat(CATALOG.detect("https://cdn.jsdelivr.net/npm/bootstrap@4.1.3/dist/js/bootstrap.min.js"))
                .contains(new Detection("bootstrap", "4.1.3"));
        assertThat(CATALOG.detect("/wp-includes/js/jquery/jquery.min.js?ver=3.6.0"))
                .contains(new Detection("jquery", "3.6.0"));
        assertThat(CATALOG.detect("https://unpkg.com/react-dom@16.4.0/umd/react-dom.production.min.js"))
                .contains(new Detection("react-dom", "16.4.0"));
        assertThat(CATALOG.detect("/static/app.bundle.js")).isEmpty();
        assertThat(CATALOG.detect("/js/jquery.min.js")).isEmpty();
    }

    @Test
    void advisory_ranges_are_half_open() {
        assertThat(CATALOG.advisoriesFor(new Detection("jquery", "3.4.1")))
                .extracting(JsLibraryCatalog.Advisory::id)
                .containsExactly("CVE-2020-11022", "CVE-2020-11023");
        assertThat(CATALOG.advisoriesFor(new Detection("jquery", "3.5.0"))).isEmpty();
        assertThat(CATALOG.advisoriesFor(new Detection("react", "16.8.0"))).isEmpty();
        assertThat(JsLibraryCatalog.compareVersions("4.17", "4.17.0")).isZero();
        assertThat(JsLibraryCatalog.compareVersions("1.10.2", "1.9.9")).isPositive();
    }

    @Test
    void one_finding_per_library_with_worst_severity() {
        String html = """
                <html><head>
                  <script src="https://code.jquery.com/jquery-1.12.4.min.js"></script>
                  <script src="/vendor/jquery-1.12.4.js"></script>
                  <script src="https://cdnjs.cloudflare.com/ajax/libs/lodash.js/4.17.11/lodash.min.js"></script>
                  <script src="https://unpkg.com/react@16.8.0/umd/react.production.min.js"></script>
                  <script>inline()</script>
                </head></html>
                """;
        JsVulnerabilityScanner s = new JsVulnerabilityScanner(u -> null, CATALOG);
        ScanResult r = s.evaluate(PAGE, Jsoup.parse(html, PAGE.toString()));

        assertThat(r.getStatus().isOk()).isTrue();
        assertThat(r.getFindings()).containsOnlyKeys("jquery@1.12.4", "lodash@4.17.11");
        assertThat(r.getFindings().get("lodash@4.17.11").getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(r.getFindings().get("jquery@1.12.4").getDetail()).contains("CVE-2019-11358");
    }

    @Test
    void patched_copy_does_not_hide_a_vulnerable_one() {
        String html = """
                <html><head>
                  <script src="https://code.jquery.com/jquery-3.7.1.min.js"></script>
                  <script src="/legacy/jquery-1.12.4.js"></script>
                </head></html>
                """;
        JsVulnerabilityScanner s = new JsVulnerabilityScanner(u -> null, CATALOG);
        ScanResult r = s.evaluate(PAGE, Jsoup.parse(html, PAGE.toString()));

        assertThat(r.getFindings()).containsOnlyKeys("jquery@1.12.4");
        assertThat(r.getFindings().get("jquery@1.12.4").getDetail()).contains("/legacy/jquery-1.12.4.js");
    }

    @Test
    void page_without_known_libraries_is_clean_ok() {
        HttpResponseData resp = HttpResponseData.builder().url(PAGE).statusCode(200)
                .headers(Map.of()).body("<script src='/app.js'></script>").build();
        ScanResult r = new JsVulnerabilityScanner(u -> resp, CATALOG).scan(PAGE);
        assertThat(r.getStatus().isOk()).isTrue();
        assertThat(r.getFindings()).isEmpty();
    }
}
