package com.siteauditor.core.model;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * 감사 설정 (audit.yml 매핑 대상). 순수 설정 보관용.
 * 스캐너 토글은 null이면 profile 기본값을 따른다.
 */
public final class AuditConfig {

    /** YAML `scanners:` 섹션. null = 프로필 기본값 */
    public static final class ScannerToggles {
        private Boolean securityHeaders;
        private Boolean jsVulnerabilities;
        private Boolean lighthouse;
        private Boolean sslScan;
        private Boolean nuclei;

        public Boolean getSecurityHeaders() { return securityHeaders; }
        public void setSecurityHeaders(Boolean v) { this.securityHeaders = v; }
        public Boolean getJsVulnerabilities() { return jsVulnerabilities; }
        public void setJsVulnerabilities(Boolean v) { this.jsVulnerabilities = v; }
        public Boolean getLighthouse() { return lighthouse; }
        public void setLighthouse(Boolean v) { this.lighthouse = v; }
        public Boolean getSslScan() { return sslScan; }
        public void setSslScan(Boolean v) { this.sslScan = v; }
        public Boolean getNuclei() { return nuclei; }
        public void setNuclei(Boolean v) { this.nuclei = v; }
    }

    /** YAML `tools:` 섹션: 실행 파일 이름 또는 절대 경로 */
    public static final class ToolPaths {
        private String lighthouse = "lighthouse";
        private String sslscan = "sslscan";
        private String nuclei = "nuclei";

        public String getLighthouse() { return lighthouse; }
        public void setLighthouse(String v) { this.lighthouse = v; }
        public String getSslscan() { return sslscan; }
        public void setSslscan(String v) { this.sslscan = v; }
        public String getNuclei() { return nuclei; }
        public void setNuclei(String v) { this.nuclei = v; }
    }

    // ---------- 기본 필드 ----------
    private String target;                                  // 시드 URL (필수)
    private AuditProfile profile = AuditProfile.SECURITY;
    private int maxPages = 50;
    private Duration timeout = Duration.ofSeconds(15);      // HTTP 요청 타임아웃
    private Duration toolTimeout = Duration.ofMinutes(3);   // 외부 도구 1회 실행 상한
    private int concurrency = 4;
    private boolean followRedirects = true;
    private String userAgent = "SiteAuditor/0.3 (+audit)";
    private Path outputDir = Path.of("reports");

    private ScannerToggles scanners = new ScannerToggles();
    private ToolPaths tools = new ToolPaths();
    private List<String> nucleiTemplates = List.of();
    private List<String> nucleiSeverities = List.of();

    private LoginConfig login;                              // nullable

    // ---------- getters ----------
    public String getTarget() { return target; }
    public AuditProfile getProfile() { return profile; }
    public int getMaxPages() { return maxPages; }
    public Duration getTimeout() { return timeout; }
    public Duration getToolTimeout() { return toolTimeout; }
    public int getConcurrency() { return concurrency; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public Path getOutputDir() { return outputDir; }
    public ScannerToggles getScanners() { return scanners; }
    public ToolPaths getTools() { return tools; }
    public List<String> getNucleiTemplates() { return nucleiTemplates; }
    public List<String> getNucleiSeverities() { return nucleiSeverities; }
    public LoginConfig getLogin() { return login; }

    // ---------- 프로필 반영 스위치 ----------
    public boolean securityHeadersEnabled() {
        return orDefault(scanners.getSecurityHeaders(), true);
    }

    public boolean jsVulnerabilitiesEnabled() {
        return orDefault(scanners.getJsVulnerabilities(), true);
    }

    public boolean lighthouseEnabled() {
        return orDefault(scanners.getLighthouse(), profile == AuditProfile.PERFORMANCE);
    }

    // sslscan/nuclei는 프로필과 무관하게 명시적으로 켤 때만
    public boolean sslScanEnabled() {
        return orDefault(scanners.getSslScan(), false);
    }

    public boolean nucleiEnabled() {
        return orDefault(scanners.getNuclei(), false);
    }

    /** 인증 플로우는 SECURITY 프로필 + 로그인 설정이 있을 때만 */
    public boolean authFlowEnabled() {
        return login != null && profile == AuditProfile.SECURITY;
    }

    private static boolean orDefault(Boolean v, boolean def) { return v != null ? v : def; }

    // ---------- fluent setters ----------
    public AuditConfig setTarget(String target) { this.target = target; return this; }
    public AuditConfig setProfile(AuditProfile p) { this.profile = (p != null ? p : AuditProfile.SECURITY); return this; }
    public AuditConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public AuditConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public AuditConfig setToolTimeout(Duration t) { this.toolTimeout = t; return this; }
    public AuditConfig setConcurrency(int c) { this.concurrency = Math.max(1, c); return this; }
    public AuditConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public AuditConfig setUserAgent(String ua) { if (ua != null && !ua.isBlank()) this.userAgent = ua; return this; }
    public AuditConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public AuditConfig setScanners(ScannerToggles s) { this.scanners = (s != null ? s : new ScannerToggles()); return this; }
    public AuditConfig setTools(ToolPaths t) { this.tools = (t != null ? t : new ToolPaths()); return this; }
    public AuditConfig setNucleiTemplates(List<String> v) { this.nucleiTemplates = v == null ? List.of() : List.copyOf(v); return this; }
    public AuditConfig setNucleiSeverities(List<String> v) { this.nucleiSeverities = v == null ? List.of() : List.copyOf(v); return this; }
    public AuditConfig setLogin(LoginConfig login) { this.login = login; return this; }

    public AuditConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    public AuditConfig setToolTimeoutMs(long ms) {
        this.toolTimeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        if (target == null || target.isBlank()) throw new IllegalArgumentException("target is required");
        URI seed;
        try {
            seed = URI.create(target);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("target is not a valid URL: " + target, e);
        }
        String scheme = seed.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("target must be an http(s) URL: " + target);
        }
        if (seed.getHost() == null) throw new IllegalArgumentException("target has no host: " + target);
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (toolTimeout == null || toolTimeout.isNegative() || toolTimeout.isZero())
            throw new IllegalArgumentException("toolTimeout must be > 0");
        if (outputDir == null) throw new IllegalArgumentException("outputDir is required");
    }

    // ---------- helpers ----------
    public static AuditConfig defaults() { return new AuditConfig(); }

    public URI targetUri() { return URI.create(target); }

    /** jsoup 등 int ms 필요 시 편의 메서드 */
    public int getTimeoutMsInt() {
        long ms = timeout.toMillis();
        return (ms > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) ms;
    }

    /** 설정 → 실행 대상 */
    public Target toTarget() {
        return Target.of(targetUri(), authFlowEnabled() ? login : null);
    }
}
