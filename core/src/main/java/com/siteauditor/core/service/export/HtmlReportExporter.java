package com.siteauditor.core.service.export;

import static com.siteauditor.core.service.export.HtmlReportTemplates.esc;

import com.siteauditor.core.service.export.ReportModel.AuthEntry;
import com.siteauditor.core.service.export.ReportModel.FindingEntry;
import com.siteauditor.core.service.export.ReportModel.ScanEntry;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * 사람용 report.html.
 * - 결과마다 data-result-id 속성(JSON의 id와 동일)
 * - 모든 텍스트는 jsoup Entities로 이스케이프
 */
public class HtmlReportExporter implements ReportExporter {

    @Override
    public String fileName() { return ReportNaming.HTML_FILE; }

    @Override
    public Path export(ReportModel model, Path dir) throws IOException {
        Path out = dir.resolve(fileName());
        Files.writeString(out, render(model), StandardCharsets.UTF_8);
        return out;
    }

    String render(ReportModel m) {
        StringBuilder sb = new StringBuilder(16_384);
        sb.append("<!DOCTYPE html><html lang='en'><head><meta charset='utf-8'>")
          .append("<meta name='viewport' content='width=device-width,initial-scale=1'>")
          .append("<title>").append(esc(m.title())).append(" - ").append(esc(m.target())).append("</title>")
          .append(HtmlReportTemplates.css())
          .append("</head><body>");

        String subtitle = "Target: " + m.target()
                + " · Status: " + m.status()
                + " · Started: " + m.startedAt()
                + " · Duration: " + m.durationMs() + " ms";
        sb.append(HtmlReportTemplates.header(m.title(), subtitle));

        // 요약
        ReportModel.Summary s = m.summary();
        sb.append("<section class='card' id='summary'><h2>Summary</h2>")
          .append("<p>Pages scanned: <strong>").append(s.pagesScanned()).append("</strong>");
        for (Map.Entry<String, Integer> e : s.scanStatus().entrySet()) {
            sb.append(" · ").append(esc(e.getKey())).append(": ").append(e.getValue());
        }
        sb.append("</p><p class='muted'>Checks: ").append(esc(String.join(", ", s.checks()))).append("</p>")
          .append(HtmlReportTemplates.severityChips(s.findingsBySeverity()))
          .append("</section>");

        // 크롤
        if (m.crawl() != null) {
            sb.append("<section class='card' id='crawl'><h2>Crawled pages</h2><ol>");
            for (String u : m.crawl().urls()) sb.append("<li class='url'>").append(esc(u)).append("</li>");
            sb.append("</ol>");
            if (!m.crawl().skipped().isEmpty()) {
                sb.append("<p class='muted'>Skipped:</p><ul>");
                for (ReportModel.Skipped k : m.crawl().skipped()) {
                    sb.append("<li class='url'>").append(esc(k.url())).append(" <span class='muted'>(")
                      .append(esc(k.reason())).append(")</span></li>");
                }
                sb.append("</ul>");
            }
            sb.append("</section>");
        }

        // 스캔 결과
        sb.append("<section class='card' id='results'><h2>Scan results</h2>");
        for (ScanEntry r : m.results()) renderScan(sb, r);
        sb.append("</section>");

        // 인증 점검
        if (m.auth() != null) {
            sb.append("<section class='card' id='auth'><h2>Authentication flow</h2>")
              .append("<table><thead><tr><th>#</th><th>Check</th><th>Outcome</th><th>Evidence</th></tr></thead><tbody>");
            for (AuthEntry a : m.auth()) {
                sb.append("<tr data-result-id='").append(esc(a.id())).append("'>")
                  .append("<td>").append(esc(a.id())).append("</td>")
                  .append("<td>").append(esc(a.name())).append("</td>")
                  .append("<td class='out-").append(esc(a.outcome())).append("'>").append(esc(a.outcome())).append("</td>")
                  .append("<td>").append(esc(a.evidence())).append("</td></tr>");
            }
            sb.append("</tbody></table></section>");
        }

        sb.append(HtmlReportTemplates.footer()).append("</body></html>");
        return sb.toString();
    }

    private static void renderScan(StringBuilder sb, ScanEntry r) {
        String kind = r.status().split(":", 2)[0].toLowerCase(Locale.ROOT);
        sb.append("<div class='result' data-result-id='").append(esc(r.id())).append("'>")
          .append("<h3>").append(esc(r.id())).append(" · ").append(esc(r.scanner()))
          .append(" <span class='url muted'>").append(esc(r.target())).append("</span></h3>")
          .append("<p>Status: <span class='st-").append(esc(kind)).append("'>").append(esc(r.status()))
          .append("</span> <span class='muted'>(").append(r.durationMs()).append(" ms)</span></p>");

        if (!r.findings().isEmpty()) {
            sb.append("<table><thead><tr><th>Severity</th><th>Key</th><th>Detail</th></tr></thead><tbody>");
            for (FindingEntry f : r.findings()) {
                sb.append("<tr><td class='sev-").append(esc(f.severity())).append("'>").append(esc(f.severity())).append("</td>")
                  .append("<td><code>").append(esc(f.key())).append("</code></td>")
                  .append("<td>").append(esc(f.detail())).append("</td></tr>");
            }
            sb.append("</tbody></table>");
        }
        if (!r.measurements().isEmpty()) {
            sb.append("<table><thead><tr><th>Measurement</th><th>Value</th></tr></thead><tbody>");
            r.measurements().forEach((k, v) -> sb.append("<tr><td>").append(esc(k)).append("</td><td>")
                    .append(String.format(Locale.ROOT, "%.3f", v)).append("</td></tr>"));
            sb.append("</tbody></table>");
        }
        if (r.rawOutput() != null && !r.rawOutput().isBlank()) {
            sb.append("<details><summary class='muted'>Raw output</summary><pre>")
              .append(esc(r.rawOutput())).append("</pre></details>");
        }
        sb.append("</div>");
    }
}
