package com.siteauditor.core.service.export;

import org.jsoup.nodes.Entities;

import java.util.Map;

final class HtmlReportTemplates {
    private HtmlReportTemplates() {}

    static String css() {
        return """
        <style>
        /* ===== Dark (default) ===== */
        :root{
          --bg:#020617; --fg:#e2e8f0; --muted:#94a3b8;
          --card:#0b1220; --bd:#334155; --row:#0e1624; --chip:#1f2937; --barbg:#1f2937;
          --crit:#dc2626; --hi:#ef4444; --med:#f59e0b; --low:#22c55e; --info:#60a5fa;
          --pass:#22c55e; --fail:#ef4444; --inc:#f59e0b; --accent:#22d3ee;
          --code-bg:#111827; --code-fg:#e5e7eb;
        }
        /* ===== Light ===== */
        @media (prefers-color-scheme: light){
          :root{
            --bg:#ffffff; --fg:#0f172a; --muted:#475569;
            --card:#ffffff; --bd:#e2e8f0; --row:#f8fafc; --chip:#e5e7eb; --barbg:#e5e7eb;
            --crit:#b91c1c; --hi:#dc2626; --med:#d97706; --low:#16a34a; --info:#2563eb;
            --pass:#16a34a; --fail:#dc2626; --inc:#d97706; --accent:#0891b2;
            --code-bg:#f3f4f6; --code-fg:#111827;
          }
        }
        html,body{margin:0;padding:0;background:var(--bg);color:var(--fg);font:14px/1.6 system-ui,-apple-system,Segoe UI,Roboto,'Noto Sans',sans-serif}
        .muted{color:var(--muted)}
        .wrap{padding:12px 24px 48px}
        header{padding:16px 24px;border-bottom:1px solid var(--bd)}
        header h1{font-size:20px;margin:0 0 6px}
        h2{color:var(--accent);font-size:16px;margin:0 0 8px}
        section.card{background:var(--card);border:1px solid var(--bd);border-radius:12px;padding:14px;margin:12px 0}
        .chip{display:inline-block;padding:.2rem .55rem;border-radius:.6rem;background:var(--chip);margin-right:.35rem;font-weight:700}
        .sev-CRITICAL{color:var(--crit);font-weight:700}
        .sev-HIGH{color:var(--hi);font-weight:700}
        .sev-MEDIUM{color:var(--med);font-weight:700}
        .sev-LOW{color:var(--low);font-weight:700}
        .sev-INFO{color:var(--info)}
        .chip.sev-CRITICAL{background:var(--crit);color:#fff}
        .chip.sev-HIGH{background:var(--hi);color:#fff}
        .chip.sev-MEDIUM{background:var(--med);color:#111}
        .chip.sev-LOW{background:var(--low);color:#0b1220}
        .st-ok{color:var(--pass);font-weight:700}
        .st-skipped{color:var(--muted);font-weight:700}
        .st-error{color:var(--fail);font-weight:700}
        .out-PASS{color:var(--pass);font-weight:700}
        .out-FAIL{color:var(--fail);font-weight:700}
        .out-INCONCLUSIVE{color:var(--inc);font-weight:700}
        table{width:100%;border-collapse:separate;border-spacing:0;border:1px solid var(--bd);border-radius:12px;overflow:hidden;background:var(--card);margin:6px 0}
        thead th{border-bottom:1px solid var(--bd);padding:8px;text-align:left;font-weight:800}
        tbody td{padding:8px;border-bottom:1px solid var(--bd);vertical-align:top}
        tbody tr:nth-child(even){background:var(--row)}
        .url{word-break:break-all}
        pre,code{background:var(--code-bg);color:var(--code-fg);border-radius:6px}
        pre{padding:8px;white-space:pre-wrap;word-break:break-word;max-height:24em;overflow:auto}
        @media print{ a{text-decoration:none;color:#000} header{border:none} }
        </style>
        """;
    }

    static String header(String title, String subtitle) {
        return """
        <header id="top">
          <h1>%s</h1>
          <div class="muted">%s</div>
        </header>
        <div class="wrap">
        """.formatted(esc(title), esc(subtitle));
    }

    /** 심각도별 건수 칩 (0건은 생략) */
    static String severityChips(Map<String, Integer> bySeverity) {
        StringBuilder sb = new StringBuilder("<div class='chips'>");
        bySeverity.forEach((sev, n) -> {
            if (n > 0) {
                sb.append("<span class='chip sev-").append(esc(sev)).append("'>")
                  .append(esc(sev)).append(": ").append(n).append("</span>");
            }
        });
        return sb.append("</div>").toString();
    }

    static String footer() {
        return """
        <footer class='muted' style='margin-top:16px'>
          <a href="#top" style="text-decoration:none">Back to top</a>
        </footer>
        </div>
        """;
    }

    static String esc(String s) {
        return s == null ? "" : Entities.escape(s);
    }
}
