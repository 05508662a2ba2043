package com.siteauditor.core.auth;

import com.siteauditor.core.api.IAuthTester;
import com.siteauditor.core.http.HttpSession;
import com.siteauditor.core.http.NetworkException;
import com.siteauditor.core.http.SetCookie;
import com.siteauditor.core.model.AuditConfig;
import com.siteauditor.core.model.AuthCheckResult;
import com.siteauditor.core.model.HttpResponseData;
import com.siteauditor.core.model.LoginConfig;
import com.siteauditor.core.model.Origin;
import com.siteauditor.core.model.Target;
import com.siteauditor.core.util.StructuredLog;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 로그인 플로우 점검.
 *
 * <p>결과 이름(고정 순서): csrf-token, rate-limiting, protected-page-before-login, login,
 * session-cookie-secure, session-cookie-httponly, session-cookie-samesite,
 * protected-page-after-login, reflected-input:xss, reflected-input:sql.
 *
 * <p>각 점검은 독립적이다. 네트워크 실패는 해당 점검만 INCONCLUSIVE.
 * 무효 로그인 반복(rate-limiting)은 실제 계정이 잠기지 않도록 임시 사용자명을 쓰고, 정상 로그인 뒤에 실행한다.
 * 증거 문자열에는 설정된 사용자명/비밀번호가 남지 않는다.
 */
public class AuthTester implements IAuthTester {
    private static final Logger log = LoggerFactory.getLogger(AuthTester.class);
    private static final StructuredLog slog = StructuredLog.get(AuthTester.class);

    public static final String CSRF = "csrf-token";
    public static final String RATE_LIMITING = "rate-limiting";
    public static final String PROTECTED_BEFORE = "protected-page-before-login";
    public static final String LOGIN = "login";
    public static final String COOKIE_SECURE = "session-cookie-secure";
    public static final String COOKIE_HTTPONLY = "session-cookie-httponly";
    public static final String COOKIE_SAMESITE = "session-cookie-samesite";
    public static final String PROTECTED_AFTER = "protected-page-after-login";
    public static final String REFLECTED_PREFIX = "reflected-input:";

    /** 마커 입력(증명이 아니라 신호) */
    static final Map<String, String> PROBES = new LinkedHashMap<>();
    static {
        PROBES.put("xss", "<script>alert(1)</script>");
        PROBES.put("sql", "' OR '1'='1");
    }

    static final Pattern CSRF_NAME = Pattern.compile(
            "(?i)(csrf|xsrf|^_token$|authenticity_token|__requestverificationtoken)");
    static final Pattern SESSION_COOKIE = Pattern.compile("(?i)(sess|sid)");
    static final Pattern AUTH_COOKIE = Pattern.compile("(?i)(auth|token)");
    private static final Pattern LOCKOUT = Pattern.compile(
            "(?i)(too many (?:login |failed )?attempts|account (?:is |has been )?locked|temporarily (?:locked|blocked)|try again (?:later|in \\d+))");

    private static final SecureRandom RANDOM = new SecureRandom();

    private final Supplier<HttpSession> sessions;

    public AuthTester(AuditConfig config) {
        this(() -> new HttpSession(config.getTimeout(), config.getUserAgent()));
    }

    /** 점검마다 새 세션(쿠키 분리)을 만드는 팩토리 */
    public AuthTester(Supplier<HttpSession> sessions) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
    }

    @Override
    public List<AuthCheckResult> runAuthChecks(Target target, LoginConfig login) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(login, "login");
        Origin origin = target.getOrigin();

        try (CredentialScope creds = new CredentialScope(login)) {
            if (!origin.matches(login.getLoginUrl())) {
                return allInconclusive("login URL is outside the target origin");
            }
            URI protectedUrl = login.getProtectedUrl();
            boolean protectedUsable = protectedUrl != null && origin.matches(protectedUrl);

            AuthCheckResult csrf = step(CSRF, creds, () -> checkCsrf(login, origin));
            AuthCheckResult before = step(PROTECTED_BEFORE, creds, () -> protectedUsable
                    ? checkProtectedBefore(protectedUrl)
                    : AuthCheckResult.inconclusive(PROTECTED_BEFORE, noProtectedUrl(protectedUrl)));

            LoginAttempt attempt = attemptLogin(login, origin, creds);
            List<AuthCheckResult> cookieChecks = attempt.cookieChecks();
            AuthCheckResult after = step(PROTECTED_AFTER, creds, () -> {
                if (!protectedUsable) return AuthCheckResult.inconclusive(PROTECTED_AFTER, noProtectedUrl(protectedUrl));
                if (!attempt.succeeded) return AuthCheckResult.inconclusive(PROTECTED_AFTER, "login did not succeed");
                return checkProtectedAfter(attempt.session, protectedUrl);
            });

            List<AuthCheckResult> reflected = new ArrayList<>();
            for (var probe : PROBES.entrySet()) {
                String name = REFLECTED_PREFIX + probe.getKey();
                reflected.add(step(name, creds, () -> checkReflected(name, probe.getValue(), login, origin)));
            }

            AuthCheckResult rate = step(RATE_LIMITING, creds, () -> checkRateLimiting(login, origin));

            List<AuthCheckResult> out = new ArrayList<>();
            out.add(csrf);
            out.add(rate);
            out.add(before);
            out.add(redacted(attempt.loginResult, creds));
            for (AuthCheckResult c : cookieChecks) out.add(redacted(c, creds));
            out.add(after);
            out.addAll(reflected);
            for (AuthCheckResult r : out) {
                slog.info("auth-check", "check", r.getName(), "outcome", r.getOutcome().name());
            }
            return out;
        }
    }

    // ---------------- 개별 점검 ----------------

    private AuthCheckResult checkCsrf(LoginConfig login, Origin origin) throws NetworkException {
        HttpResponseData page = loginPage(sessions.get(), login, origin);
        if (!page.isSuccess()) {
            return AuthCheckResult.inconclusive(CSRF, "login page returned HTTP " + page.getStatusCode());
        }
        LoginForm form = LoginForm.parse(page, login);
        if (form.csrfSource != null) {
            return AuthCheckResult.pass(CSRF, "anti-CSRF token found (" + form.csrfSource + ")");
        }
        return AuthCheckResult.fail(CSRF, "no anti-CSRF token in the login form, meta tags or response headers");
    }

    private AuthCheckResult checkRateLimiting(LoginConfig login, Origin origin) throws NetworkException {
        HttpSession s = sessions.get();
        LoginForm form = LoginForm.parse(loginPage(s, login, origin), login);
        String throwaway = "sa-probe-" + randomHex(4);
        int attempts = login.getRateLimitAttempts();

        Map<String, Integer> lockoutMessages = new LinkedHashMap<>();
        for (int i = 1; i <= attempts; i++) {
            HttpResponseData r = s.postForm(form.action, form.fields(throwaway, randomHex(8)));
            if (r.getStatusCode() == 429) {
                return AuthCheckResult.pass(RATE_LIMITING, "HTTP 429 after " + i + " invalid attempt(s)");
            }
            if (r.header("Retry-After") != null) {
                return AuthCheckResult.pass(RATE_LIMITING, "Retry-After header after " + i + " invalid attempt(s)");
            }
            Matcher m = LOCKOUT.matcher(r.getBody());
            if (m.find()) lockoutMessages.merge(m.group(1).toLowerCase(Locale.ROOT), 1, Integer::sum);
        }
        for (var e : lockoutMessages.entrySet()) {
            if (e.getValue() >= 2) {
                return AuthCheckResult.pass(RATE_LIMITING, "repeated lockout message '" + e.getKey() + "'");
            }
        }
        return AuthCheckResult.fail(RATE_LIMITING,
                "no throttling signal after " + attempts + " invalid attempts (advisory)");
    }

    private AuthCheckResult checkProtectedBefore(URI protectedUrl) throws NetworkException {
        HttpResponseData r = sessions.get().get(protectedUrl);
        int sc = r.getStatusCode();
        if (sc == 401 || sc == 403) return AuthCheckResult.pass(PROTECTED_BEFORE, "HTTP " + sc + " without a session");
        if (r.isRedirect()) {
            return AuthCheckResult.pass(PROTECTED_BEFORE, "HTTP " + sc + " redirect to " + r.header("Location"));
        }
        if (r.isSuccess()) {
            if (hasPasswordInput(r.getBody())) {
                return AuthCheckResult.pass(PROTECTED_BEFORE, "login form served instead of the page");
            }
            return AuthCheckResult.fail(PROTECTED_BEFORE, "HTTP " + sc + " served without authentication");
        }
        return AuthCheckResult.inconclusive(PROTECTED_BEFORE, "unexpected HTTP " + sc);
    }

    private AuthCheckResult checkProtectedAfter(HttpSession session, URI protectedUrl) throws NetworkException {
        HttpResponseData r = session.get(protectedUrl);
        if (r.isSuccess()) {
            return AuthCheckResult.pass(PROTECTED_AFTER, "HTTP " + r.getStatusCode() + " with the authenticated session");
        }
        return AuthCheckResult.fail(PROTECTED_AFTER, "HTTP " + r.getStatusCode() + " with the authenticated session");
    }

    private AuthCheckResult checkReflected(String name, String probe, LoginConfig login, Origin origin)
            throws NetworkException {
        HttpSession s = sessions.get();
        LoginForm form = LoginForm.parse(loginPage(s, login, origin), login);
        HttpResponseData r = s.follow(s.postForm(form.action, form.fields(probe, probe)), origin);
        if (r.getBody().contains(probe)) {
            return AuthCheckResult.inconclusive(name,
                    "marker echoed unescaped in the response (HTTP " + r.getStatusCode() + "); review manually");
        }
        return AuthCheckResult.pass(name, "marker not reflected (HTTP " + r.getStatusCode() + ")");
    }

    // ---------------- 로그인 + 세션 쿠키 ----------------

    private LoginAttempt attemptLogin(LoginConfig login, Origin origin, CredentialScope creds) {
        HttpSession s = sessions.get();
        try {
            LoginForm form = LoginForm.parse(loginPage(s, login, origin), login);
            int mark = s.observedSetCookieCount();
            HttpResponseData post = s.postForm(form.action, form.fields(creds.username(), creds.password()));
            HttpResponseData fin = s.follow(post, origin);

            boolean ok;
            String how;
            String indicator = login.getSuccessIndicator();
            if (indicator != null && !indicator.isBlank()) {
                ok = fin.getBody().contains(indicator) || fin.getUrl().toString().contains(indicator);
                how = ok ? "success indicator found" : "success indicator not found";
            } else {
                ok = fin.getStatusCode() < 400 && !hasPasswordInput(fin.getBody());
                how = ok ? "no login form after submit" : "login form served again";
            }
            String evidence = "HTTP " + post.getStatusCode() + " -> " + fin.getStatusCode()
                    + " at " + fin.getUrl().getPath() + ", " + how;
            AuthCheckResult loginResult = ok
                    ? AuthCheckResult.pass(LOGIN, evidence)
                    : AuthCheckResult.fail(LOGIN, evidence);
            if (!ok) return LoginAttempt.failed(s, loginResult, "login did not succeed");

            SetCookie cookie = pickSessionCookie(s.observedSetCookiesSince(mark), s.observedSetCookies());
            return LoginAttempt.succeeded(s, loginResult, cookie, "https".equals(origin.scheme()));
        } catch (NetworkException e) {
            log.warn("login attempt failed: {}", creds.redact(e.reason()));
            return LoginAttempt.failed(s,
                    AuthCheckResult.inconclusive(LOGIN, "network error: " + e.reason()),
                    "login request failed");
        }
    }

    /**
     * 로그인 중 설정된 쿠키 우선. 이름 기준으로 sess/sid > auth/token > 나머지 첫 번째.
     * CSRF 쿠키(XSRF-TOKEN, csrftoken)는 후보가 아니다.
     */
    static SetCookie pickSessionCookie(List<String> duringLogin, List<String> all) {
        List<String> pool = duringLogin.isEmpty() ? all : duringLogin;
        SetCookie first = null;
        SetCookie authLike = null;
        for (String raw : pool) {
            SetCookie c = SetCookie.parse(raw);
            String name = c.getName();
            if (name.isEmpty() || CSRF_NAME.matcher(name).find()) continue;
            if (SESSION_COOKIE.matcher(name).find()) return c;
            if (authLike == null && AUTH_COOKIE.matcher(name).find()) authLike = c;
            if (first == null) first = c;
        }
        return authLike != null ? authLike : first;
    }

    private static final class LoginAttempt {
        final HttpSession session;
        final boolean succeeded;
        final AuthCheckResult loginResult;
        final SetCookie cookie;
        final boolean https;
        final String whyNot;

        private LoginAttempt(HttpSession session, boolean succeeded, AuthCheckResult loginResult,
                             SetCookie cookie, boolean https, String whyNot) {
            this.session = session;
            this.succeeded = succeeded;
            this.loginResult = loginResult;
            this.cookie = cookie;
            this.https = https;
            this.whyNot = whyNot;
        }

        static LoginAttempt failed(HttpSession s, AuthCheckResult r, String why) {
            return new LoginAttempt(s, false, r, null, false, why);
        }

        static LoginAttempt succeeded(HttpSession s, AuthCheckResult r, SetCookie cookie, boolean https) {
            return new LoginAttempt(s, true, r, cookie, https, null);
        }

        List<AuthCheckResult> cookieChecks() {
            if (!succeeded) {
                return List.of(AuthCheckResult.inconclusive(COOKIE_SECURE, whyNot),
                        AuthCheckResult.inconclusive(COOKIE_HTTPONLY, whyNot),
                        AuthCheckResult.inconclusive(COOKIE_SAMESITE, whyNot));
            }
            if (cookie == null) {
                String why = "no cookie was set during login";
                return List.of(AuthCheckResult.inconclusive(COOKIE_SECURE, why),
                        AuthCheckResult.inconclusive(COOKIE_HTTPONLY, why),
                        AuthCheckResult.inconclusive(COOKIE_SAMESITE, why));
            }
            String n = "cookie '" + cookie.getName() + "'";
            List<AuthCheckResult> out = new ArrayList<>();
            if (cookie.isSecure()) out.add(AuthCheckResult.pass(COOKIE_SECURE, n + " has Secure"));
            else out.add(AuthCheckResult.fail(COOKIE_SECURE, n + " lacks Secure" + (https ? "" : " (site served over http)")));

            if (cookie.isHttpOnly()) out.add(AuthCheckResult.pass(COOKIE_HTTPONLY, n + " has HttpOnly"));
            else out.add(AuthCheckResult.fail(COOKIE_HTTPONLY, n + " lacks HttpOnly"));

            String ss = cookie.sameSite();
            if (ss == null || ss.isBlank()) {
                out.add(AuthCheckResult.fail(COOKIE_SAMESITE, n + " lacks SameSite"));
            } else if (ss.equalsIgnoreCase("none")) {
                out.add(AuthCheckResult.fail(COOKIE_SAMESITE, n + " has SameSite=None"));
            } else {
                out.add(AuthCheckResult.pass(COOKIE_SAMESITE, n + " has SameSite=" + ss));
            }
            return out;
        }
    }

    // ---------------- 로그인 폼 ----------------

    /** 로그인 페이지에서 읽어낸 폼 정보 */
    static final class LoginForm {
        final URI action;
        final String usernameField;
        final String passwordField;
        final String csrfName;
        final String csrfValue;
        final String csrfSource;

        private LoginForm(URI action, String usernameField, String passwordField,
                          String csrfName, String csrfValue, String csrfSource) {
            this.action = action;
            this.usernameField = usernameField;
            this.passwordField = passwordField;
            this.csrfName = csrfName;
            this.csrfValue = csrfValue;
            this.csrfSource = csrfSource;
        }

        /** 설정된 필드 이름이 있으면 그대로, 없으면 password 입력이 있는 폼에서 추정 */
        static LoginForm parse(HttpResponseData page, LoginConfig login) {
            Document doc = Jsoup.parse(page.getBody(), page.getUrl().toString());
            Element pw = doc.selectFirst("form input[type=password]");
            Element form = pw == null ? doc.selectFirst("form") : pw.closest("form");

            String passwordField = login.getPasswordField();
            if (passwordField == null && pw != null && !pw.attr("name").isBlank()) passwordField = pw.attr("name");
            if (passwordField == null) passwordField = "password";

            String usernameField = login.getUsernameField();
            if (usernameField == null && form != null) {
                for (Element in : form.select("input[name]")) {
                    String type = in.attr("type").toLowerCase(Locale.ROOT);
                    if ((type.isEmpty() || type.equals("text") || type.equals("email"))
                            && !CSRF_NAME.matcher(in.attr("name")).find()) {
                        usernameField = in.attr("name");
                        break;
                    }
                }
            }
            if (usernameField == null) usernameField = "username";

            URI action = login.getLoginUrl();
            if (form != null && !form.attr("action").isBlank()) {
                try {
                    URI a = URI.create(form.attr("abs:action"));
                    if (Origin.of(login.getLoginUrl()).matches(a)) action = a;
                } catch (IllegalArgumentException e) {
                    log.debug("ignoring unusable form action '{}'", form.attr("action"));
                }
            }

            String csrfName = null, csrfValue = null, source = null;
            Element scope = form != null ? form : doc;
            for (Element hidden : scope.select("input[type=hidden][name]")) {
                if (CSRF_NAME.matcher(hidden.attr("name")).find()) {
                    csrfName = hidden.attr("name");
                    csrfValue = hidden.attr("value");
                    source = "hidden input '" + csrfName + "'";
                    break;
                }
            }
            if (source == null) {
                for (Element meta : doc.select("meta[name]")) {
                    String n = meta.attr("name").toLowerCase(Locale.ROOT);
                    if (n.equals("csrf-token") || n.equals("_csrf") || n.equals("xsrf-token")) {
                        source = "meta " + n;
                        break;
                    }
                }
            }
            if (source == null) {
                for (String h : List.of("X-CSRF-Token", "X-XSRF-Token")) {
                    if (page.header(h) != null) {
                        source = "header " + h;
                        break;
                    }
                }
            }
            return new LoginForm(action, usernameField, passwordField, csrfName, csrfValue, source);
        }

        Map<String, String> fields(String user, String pass) {
            Map<String, String> m = new LinkedHashMap<>();
            m.put(usernameField, user);
            m.put(passwordField, pass);
            if (csrfName != null) m.put(csrfName, csrfValue);
            return m;
        }
    }

    // ---------------- 헬퍼 ----------------

    @FunctionalInterface
    private interface Check {
        AuthCheckResult run() throws NetworkException;
    }

    private static AuthCheckResult step(String name, CredentialScope creds, Check check) {
        AuthCheckResult r;
        try {
            r = check.run();
        } catch (NetworkException e) {
            log.debug("auth check {} could not reach the target: {}", name, e.reason());
            r = AuthCheckResult.inconclusive(name, "network error: " + e.reason());
        }
        return redacted(r, creds);
    }

    private static AuthCheckResult redacted(AuthCheckResult r, CredentialScope creds) {
        return new AuthCheckResult(r.getName(), r.getOutcome(), creds.redact(r.getEvidence()));
    }

    private static HttpResponseData loginPage(HttpSession s, LoginConfig login, Origin origin) throws NetworkException {
        return s.follow(s.get(login.getLoginUrl()), origin);
    }

    static boolean hasPasswordInput(String html) {
        if (html == null || html.isEmpty()) return false;
        return Jsoup.parse(html).selectFirst("input[type=password]") != null;
    }

    private static String noProtectedUrl(URI protectedUrl) {
        return protectedUrl == null ? "no protected URL configured" : "protected URL is outside the target origin";
    }

    private static List<AuthCheckResult> allInconclusive(String why) {
        List<AuthCheckResult> out = new ArrayList<>();
        for (String n : List.of(CSRF, RATE_LIMITING, PROTECTED_BEFORE, LOGIN,
                COOKIE_SECURE, COOKIE_HTTPONLY, COOKIE_SAMESITE, PROTECTED_AFTER)) {
            out.add(AuthCheckResult.inconclusive(n, why));
        }
        for (String p : PROBES.keySet()) out.add(AuthCheckResult.inconclusive(REFLECTED_PREFIX + p, why));
        return out;
    }

    private static String randomHex(int bytes) {
        byte[] b = new byte[bytes];
        RANDOM.nextBytes(b);
        return HexFormat.of().formatHex(b);
    }
}
