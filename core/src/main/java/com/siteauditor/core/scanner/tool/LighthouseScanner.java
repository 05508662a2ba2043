package com.siteauditor.core.scanner.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteauditor.core.model.ScanResult;
import com.siteauditor.core.model.Severity;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lighthouse CLI 래퍼 (성능/접근성/모범사례/SEO 점수 + 핵심 지표).
 * lighthouse &lt;url&gt; --quiet --chrome-flags=--headless --output=json --output-path=stdout
 */
public final class LighthouseScanner extends ExternalToolScanner {

    public static final String ID = "lighthouse";

    static final List<String> CATEGORIES = List.of("performance", "accessibility", "best-practices", "seo");
    static final double PASS_SCORE = 0.9;
    static final double MEDIUM_BELOW = 0.5;

    /** 지표 이름 → Lighthouse audit id */
    static final Map<String, String> METRICS = new LinkedHashMap<>();
    static {
        METRICS.put("FCP", "first-contentful-paint");
        METRICS.put("LCP", "largest-contentful-paint");
        METRICS.put("TTI", "interactive");
        METRICS.put("TBT", "total-blocking-time");
        METRICS.put("CLS", "cumulative-layout-shift");
    }

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public LighthouseScanner(String executable, ToolLocator locator, ProcessRunner runner, Duration timeout) {
        super(executable, locator, runner, timeout);
    }

    @Override public String id() { return ID; }

    @Override
    protected List<String> command(Path exe, URI target) {
        return List.of(exe.toString(), target.toString(),
                "--quiet", "--chrome-flags=--headless", "--output=json", "--output-path=stdout");
    }

    @Override
    protected ScanResult parse(URI target, ProcessOutput out) throws ToolExecutionException {
        String json = out.stdout();
        int brace = json.indexOf('{');
        if (brace < 0) throw ToolExecutionException.unparsable("no JSON report on stdout");

        JsonNode root;
        try {
            root = MAPPER.readTree(json.substring(brace));
        } catch (JsonProcessingException e) {
            throw ToolExecutionException.unparsable("invalid JSON");
        }
        if (root == null || !root.isObject()) throw ToolExecutionException.unparsable("report is not an object");

        JsonNode runtimeError = root.path("runtimeError");
        if (runtimeError.hasNonNull("code")) {
            throw new ToolExecutionException("lighthouse runtime error: " + runtimeError.get("code").asText());
        }

        ScanResult.Builder b = ScanResult.builder(ID, target);
        JsonNode categories = root.path("categories");
        // 점수 4개가 모두 있어야 결과로 인정(부분 결과 금지)
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String cat : CATEGORIES) {
            JsonNode score = categories.path(cat).path("score");
            if (!score.isNumber()) throw ToolExecutionException.unparsable("missing category " + cat);
            scores.put(cat, score.asDouble());
        }
        scores.forEach((cat, score) -> {
            b.measurement("score." + cat, score);
            if (score < PASS_SCORE) {
                Severity sev = score < MEDIUM_BELOW ? Severity.MEDIUM : Severity.LOW;
                b.finding(cat, sev, String.format(Locale.ROOT,
                        "Lighthouse %s score %.2f is below %.2f", cat, score, PASS_SCORE));
            }
        });

        JsonNode audits = root.path("audits");
        METRICS.forEach((name, auditId) -> {
            JsonNode v = audits.path(auditId).path("numericValue");
            if (v.isNumber()) b.measurement(name, v.asDouble());
        });

        String version = root.path("lighthouseVersion").asText("");
        if (!version.isEmpty()) b.rawOutput("lighthouse " + version + ", final URL " + root.path("finalUrl").asText(target.toString()));
        return b.build();
    }
}
