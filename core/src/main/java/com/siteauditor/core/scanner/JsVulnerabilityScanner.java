package com.siteauditor.core.scanner;

import com.siteauditor.core.api.IHttpFetcher;
import com.siteauditor.core.api.IScanner;
import com.siteauditor.core.http.NetworkException;
import com.siteauditor.core.model.HttpResponseData;
import com.siteauditor.core.model.ScanResult;
import com.siteauditor.core.model.Severity;
import com.siteauditor.core.scanner.JsLibraryCatalog.Advisory;
import com.siteauditor.core.scanner.JsLibraryCatalog.Detection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * script[src]에서 라이브러리/버전을 추정해 알려진 취약 범위와 대조한다.
 * 파일명 기반 추정이라 휴리스틱. 버전 없는 스크립트는 무시.
 * finding 키: "library@version" (라이브러리+버전당 1건, 최고 심각도)
 */
public final class JsVulnerabilityScanner implements IScanner {

    public static final String ID = "js-vulnerabilities";

    private final IHttpFetcher fetcher;
    private final JsLibraryCatalog catalog;

    public JsVulnerabilityScanner(IHttpFetcher fetcher, JsLibraryCatalog catalog) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @Override public String id() { return ID; }
    @Override public ScanGranularity granularity() { return ScanGranularity.PER_URL; }
    @Override public boolean isAvailable() { return true; }

    @Override
    public ScanResult scan(URI target) {
        HttpResponseData resp;
        try {
            resp = fetcher.fetch(target);
        } catch (NetworkException e) {
            return ScanResult.error(ID, target, e.reason());
        }
        Document doc = Jsoup.parse(resp.getBody(), resp.getUrl().toString());
        return evaluate(target, doc);
    }

    ScanResult evaluate(URI target, Document doc) {
        ScanResult.Builder b = ScanResult.builder(ID, target).cleanOutcomeAllowed(true);
        // 같은 라이브러리라도 버전이 다르면 따로 본다
        Set<Detection> seen = new HashSet<>();

        for (Element s : doc.select("script[src]")) {
            String src = s.attr("abs:src");
            if (src.isBlank()) src = s.attr("src");
            Detection d = catalog.detect(src).orElse(null);
            if (d == null || !seen.add(d)) continue;

            List<Advisory> hits = catalog.advisoriesFor(d);
            if (hits.isEmpty()) continue;

            Severity worst = hits.stream().map(Advisory::severity)
                    .min(Comparator.naturalOrder()).orElse(Severity.INFO);
            String ids = hits.stream().map(Advisory::id).distinct().collect(Collectors.joining(", "));
            String detail = d + " is affected by " + ids + ": " + hits.get(0).summary() + " (script: " + src + ")";
            b.finding(d.toString(), worst, detail);
        }
        return b.build();
    }
}
