package com.siteauditor.core.scanner;

import com.siteauditor.core.api.IHttpFetcher;
import com.siteauditor.core.api.IScanner;
import com.siteauditor.core.http.NetworkException;
import com.siteauditor.core.http.SetCookie;
import com.siteauditor.core.model.HttpResponseData;
import com.siteauditor.core.model.ScanResult;
import com.siteauditor.core.model.Severity;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 패시브: 응답 헤더/쿠키 품질 점검.
 * finding 키는 헤더 이름, 쿠키는 "cookie:&lt;name&gt;:&lt;attr&gt;".
 */
public final class SecurityHeadersScanner implements IScanner {

    public static final String ID = "security-headers";

    static final String CSP = "Content-Security-Policy";
    static final String HSTS = "Strict-Transport-Security";
    static final String XCTO = "X-Content-Type-Options";
    static final String XFO = "X-Frame-Options";
    static final String XXP = "X-XSS-Protection";
    static final String REFERRER = "Referrer-Policy";
    static final String PERMISSIONS = "Permissions-Policy";

    /** 180일 */
    static final long MIN_HSTS_MAX_AGE = 15_552_000L;
    private static final Pattern MAX_AGE = Pattern.compile("max-age\\s*=\\s*\"?(\\d+)\"?", Pattern.CASE_INSENSITIVE);

    private final IHttpFetcher fetcher;

    public SecurityHeadersScanner(IHttpFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
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
        return evaluate(target, resp);
    }

    /** 이미 받은 응답에 대한 판정(네트워크 없음) */
    ScanResult evaluate(URI target, HttpResponseData resp) {
        ScanResult.Builder b = ScanResult.builder(ID, target).cleanOutcomeAllowed(true);
        boolean https = "https".equalsIgnoreCase(target.getScheme());

        // 1) CSP (부재 → MEDIUM, 있더라도 너무 약하면 MEDIUM)
        String csp = resp.header(CSP);
        if (isBlank(csp)) {
            b.finding(CSP, Severity.MEDIUM, "Security header missing: Content-Security-Policy.");
        } else if (isWeakCsp(csp)) {
            b.finding(CSP, Severity.MEDIUM, "Content-Security-Policy is weak/permissive: " + elide(csp, 180));
        }

        // 2) HSTS (HTTPS면 MEDIUM, HTTP면 LOW), max-age 180일 미만 LOW
        String hsts = resp.header(HSTS);
        if (isBlank(hsts)) {
            b.finding(HSTS, https ? Severity.MEDIUM : Severity.LOW, "Security header missing: Strict-Transport-Security.");
        } else {
            long maxAge = maxAge(hsts);
            if (maxAge < MIN_HSTS_MAX_AGE) {
                b.finding(HSTS, Severity.LOW, "Strict-Transport-Security max-age too short ("
                        + (maxAge < 0 ? "absent" : maxAge + "s") + ", expected >= " + MIN_HSTS_MAX_AGE + "s).");
            }
        }

        // 3) X-Content-Type-Options
        String xcto = resp.header(XCTO);
        if (isBlank(xcto)) {
            b.finding(XCTO, Severity.LOW, "Security header missing: X-Content-Type-Options.");
        } else if (!"nosniff".equalsIgnoreCase(xcto.trim())) {
            b.finding(XCTO, Severity.LOW, "X-Content-Type-Options should be 'nosniff' but is '" + elide(xcto, 60) + "'.");
        }

        // 4) X-Frame-Options (CSP frame-ancestors가 있으면 대체된 것으로 본다)
        if (isBlank(resp.header(XFO)) && !hasFrameAncestors(csp)) {
            b.finding(XFO, Severity.LOW, "Security header missing: X-Frame-Options (and no CSP frame-ancestors).");
        }

        // 5) 정보 수준
        if (isBlank(resp.header(XXP))) {
            b.finding(XXP, Severity.INFO, "Security header missing: X-XSS-Protection.");
        }
        if (isBlank(resp.header(REFERRER))) {
            b.finding(REFERRER, Severity.INFO, "Security header missing: Referrer-Policy.");
        }
        if (isBlank(resp.header(PERMISSIONS))) {
            b.finding(PERMISSIONS, Severity.INFO, "Security header missing: Permissions-Policy.");
        }

        // 6) 쿠키 플래그
        for (String raw : resp.setCookies()) {
            SetCookie c = SetCookie.parse(raw);
            if (c.getName().isEmpty()) continue;
            String prefix = "cookie:" + c.getName() + ":";
            if (https && !c.isSecure()) {
                b.finding(prefix + "Secure", Severity.LOW, "Cookie without Secure on HTTPS: " + c.getName());
            }
            if (!c.isHttpOnly()) {
                b.finding(prefix + "HttpOnly", Severity.LOW, "Cookie without HttpOnly: " + c.getName());
            }
            if (isBlank(c.sameSite())) {
                b.finding(prefix + "SameSite", Severity.LOW, "Cookie without SameSite: " + c.getName());
            }
        }
        return b.build();
    }

    /* ----------------- 헬퍼 ----------------- */

    static boolean isWeakCsp(String csp) {
        for (String directive : csp.toLowerCase(Locale.ROOT).split(";")) {
            String d = directive.trim();
            if (!(d.startsWith("default-src") || d.startsWith("script-src"))) continue;
            String[] tokens = d.split("\\s+");
            boolean hasNonceOrHash = false;
            boolean unsafeInline = false;
            for (int i = 1; i < tokens.length; i++) {
                String t = tokens[i];
                if (t.equals("*") || t.equals("data:") || t.equals("'unsafe-eval'")
                        || t.equals("http:") || t.equals("https:")) return true;
                if (t.equals("'unsafe-inline'")) unsafeInline = true;
                if (t.startsWith("'nonce-") || t.startsWith("'sha")) hasNonceOrHash = true;
            }
            // nonce/hash가 있으면 브라우저가 unsafe-inline을 무시
            if (unsafeInline && !hasNonceOrHash) return true;
        }
        return false;
    }

    static boolean hasFrameAncestors(String csp) {
        return csp != null && csp.toLowerCase(Locale.ROOT).contains("frame-ancestors");
    }

    /** max-age 초. 없으면 -1 */
    static long maxAge(String hsts) {
        Matcher m = MAX_AGE.matcher(hsts);
        if (!m.find()) return -1;
        try {
            return Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE; // 자릿수 초과 = 충분히 김
        }
    }

    private static boolean isBlank(String s) { return s == null || s.isBlank(); }

    private static String elide(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
