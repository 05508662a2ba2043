package com.siteauditor.core.scanner;

import com.siteauditor.core.api.IHttpFetcher;
import com.siteauditor.core.api.IScanner;
import com.siteauditor.core.model.AuditConfig;
import com.siteauditor.core.scanner.tool.LighthouseScanner;
import com.siteauditor.core.scanner.tool.NucleiScanner;
import com.siteauditor.core.scanner.tool.ProcessRunner;
import com.siteauditor.core.scanner.tool.SslScanner;
import com.siteauditor.core.scanner.tool.ToolLocator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 등록 순서가 곧 결과 순서인 고정 스캐너 목록.
 * 설정(프로필 + 토글)에서 명시적으로 조립한다. 리플렉션/자동 탐색 없음.
 */
public final class ScannerRegistry {

    private final List<IScanner> scanners;

    private ScannerRegistry(List<IScanner> scanners) {
        Set<String> ids = new HashSet<>();
        for (IScanner s : scanners) {
            Objects.requireNonNull(s, "scanner");
            if (!ids.add(s.id())) throw new IllegalArgumentException("duplicate scanner id: " + s.id());
        }
        this.scanners = List.copyOf(scanners);
    }

    public static ScannerRegistry of(IScanner... scanners) {
        return new ScannerRegistry(List.of(scanners));
    }

    public static ScannerRegistry of(List<IScanner> scanners) {
        return new ScannerRegistry(scanners);
    }

    /** 고정 순서: security-headers, js-vulnerabilities, lighthouse, sslscan, nuclei */
    public static ScannerRegistry fromConfig(AuditConfig cfg, IHttpFetcher fetcher,
                                             ToolLocator locator, ProcessRunner runner) {
        List<IScanner> list = new ArrayList<>();
        if (cfg.securityHeadersEnabled()) {
            list.add(new SecurityHeadersScanner(fetcher));
        }
        if (cfg.jsVulnerabilitiesEnabled()) {
            list.add(new JsVulnerabilityScanner(fetcher, JsLibraryCatalog.loadDefault()));
        }
        if (cfg.lighthouseEnabled()) {
            list.add(new LighthouseScanner(cfg.getTools().getLighthouse(), locator, runner, cfg.getToolTimeout()));
        }
        if (cfg.sslScanEnabled()) {
            list.add(new SslScanner(cfg.getTools().getSslscan(), locator, runner, cfg.getToolTimeout()));
        }
        if (cfg.nucleiEnabled()) {
            list.add(new NucleiScanner(cfg.getTools().getNuclei(), locator, runner, cfg.getToolTimeout(),
                    cfg.getNucleiTemplates(), cfg.getNucleiSeverities()));
        }
        return new ScannerRegistry(list);
    }

    public List<IScanner> scanners() { return scanners; }

    public List<String> ids() {
        return scanners.stream().map(IScanner::id).toList();
    }

    public boolean isEmpty() { return scanners.isEmpty(); }
}
