package com.siteauditor.core.auth;

import com.siteauditor.core.http.HttpSession;
import com.siteauditor.core.model.AuthCheckResult;
import com.siteauditor.core.model.CheckOutcome;
import com.siteauditor.core.model.LoginConfig;
import com.siteauditor.core.model.Target;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthTesterTest {

    static final String USER = "alice.auditor";
    static final String PASS = "s3cret-Passw0rd";
    static final String CSRF_VALUE = "tok-123";

    static HttpServer s;
    static String base;

    // 시나리오별로 바꾸는 서버 동작
    static volatile String sessionCookie;
    static volatile String csrfCookie;
    static volatile boolean throttle;
    static volatile boolean echoInput;

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        base = "http://127.0.0.1:" + s.getAddress().getPort();
        s.createContext("/login", AuthTesterTest::login);
        s.createContext("/account", ex -> {
            String cookie = ex.getRequestHeaders().getFirst("Cookie");
            if (cookie != null && cookie.contains("sid=abc123")) {
                respond(ex, 200, "<h1>Your account</h1>");
            } else {
                // 사용자명이 Location에 들어가는 사이트(증거 마스킹 확인용)
                ex.getResponseHeaders().add("Location", "/login?hint=" + USER);
                respond(ex, 302, "");
            }
        });
        s.createContext("/open", ex -> respond(ex, 200, "<h1>Anyone can read this</h1>"));
        s.start();
    }

    @AfterAll
    static void down() { s.stop(0); }

    @BeforeEach
    void reset() {
        sessionCookie = "sid=abc123; Path=/; HttpOnly; SameSite=Strict";
        csrfCookie = null;
        throttle = false;
        echoInput = false;
    }

    static void login(HttpExchange ex) throws IOException {
        if ("GET".equals(ex.getRequestMethod())) {
            respond(ex, 200, loginForm(""));
            return;
        }
        Map<String, String> form = parseForm(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        if (!CSRF_VALUE.equals(form.get("csrf_token"))) {
            respond(ex, 403, "<p>bad token</p>");
            return;
        }
        if (USER.equals(form.get("username")) && PASS.equals(form.get("password"))) {
            ex.getResponseHeaders().add("Set-Cookie", "theme=dark; Path=/");
            if (csrfCookie != null) ex.getResponseHeaders().add("Set-Cookie", csrfCookie);
            ex.getResponseHeaders().add("Set-Cookie", sessionCookie);
            respond(ex, 200, "<p>Welcome back</p>");
            return;
        }
        if (throttle) {
            respond(ex, 429, "<p>Slow down</p>");
            return;
        }
        String echoed = echoInput ? "<p>Unknown user " + form.get("username") + "</p>" : "<p>Invalid login</p>";
        respond(ex, 200, loginForm(echoed));
    }

    static String loginForm(String message) {
        return "<html><body>" + message + """
                <form action="/login" method="post">
                  <input type="hidden" name="csrf_token" value="tok-123">
                  <input type="text" name="username">
                  <input type="password" name="password">
                </form></body></html>
                """;
    }

    static Map<String, String> parseForm(String body) {
        Map<String, String> m = new HashMap<>();
        for (String pair : body.split("&")) {
            int eq = pair.indexOf('=');
            if (eq < 0) continue;
            m.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return m;
    }

    static void respond(HttpExchange ex, int code, String body) throws IOException {
        byte[] b = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        ex.sendResponseHeaders(code, b.length == 0 ? -1 : b.length);
        if (b.length == 0) {
            ex.close();
            return;
        }
        try (OutputStream os = ex.getResponseBody()) { os.write(b); }
    }

    private static AuthTester tester() {
        return new AuthTester(() -> new HttpSession(Duration.ofSeconds(5), "SiteAuditor-Test"));
    }

    private static LoginConfig login(String loginUrl, String protectedPath) {
        return LoginConfig.builder()
                .loginUrl(URI.create(loginUrl))
                .username(USER)
                .password(PASS.toCharArray())
                .protectedUrl(protectedPath == null ? null : URI.create(base + protectedPath))
                .rateLimitAttempts(3)
                .build();
    }

    private static List<AuthCheckResult> run(LoginConfig login) {
        return tester().runAuthChecks(Target.of(URI.create(base + "/")), login);
    }

    private static Map<String, AuthCheckResult> byName(List<AuthCheckResult> results) {
        return results.stream().collect(Collectors.toMap(AuthCheckResult::getName, Function.identity()));
    }

    @Test
    @DisplayName("정상 로그인: 점검 순서가 고정되고 각 점검이 독립적으로 판정된다")
    void full_flow_order_and_outcomes() {
        List<AuthCheckResult> results = run(login(base + "/login", "/account"));

        assertThat(results).extracting(AuthCheckResult::getName).containsExactly(
                AuthTester.CSRF, AuthTester.RATE_LIMITING, AuthTester.PROTECTED_BEFORE, AuthTester.LOGIN,
                AuthTester.COOKIE_SECURE, AuthTester.COOKIE_HTTPONLY, AuthTester.COOKIE_SAMESITE,
                AuthTester.PROTECTED_AFTER, "reflected-input:xss", "reflected-input:sql");

        Map<String, AuthCheckResult> r = byName(results);
        assertThat(r.get(AuthTester.CSRF).getOutcome()).isEqualTo(CheckOutcome.PASS);
        assertThat(r.get(AuthTester.CSRF).getEvidence()).contains("csrf_token");
        assertThat(r.get(AuthTester.PROTECTED_BEFORE).getOutcome()).isEqualTo(CheckOutcome.PASS);
        assertThat(r.get(AuthTester.LOGIN).getOutcome()).isEqualTo(CheckOutcome.PASS);
        assertThat(r.get(AuthTester.PROTECTED_AFTER).getOutcome()).isEqualTo(CheckOutcome.PASS);

        // http 사이트라 Secure 없음은 실패, 나머지 쿠키 속성은 통과
        assertThat(r.get(AuthTester.COOKIE_SECURE).getOutcome()).isEqualTo(CheckOutcome.FAIL);
        assertThat(r.get(AuthTester.COOKIE_SECURE).getEvidence()).contains("'sid'").contains("site served over http");
        assertThat(r.get(AuthTester.COOKIE_HTTPONLY).getOutcome()).isEqualTo(CheckOutcome.PASS);
        assertThat(r.get(AuthTester.COOKIE_SAMESITE).getOutcome()).isEqualTo(CheckOutcome.PASS);
        assertThat(r.get(AuthTester.COOKIE_SAMESITE).getEvidence()).contains("SameSite=Strict");

        assertThat(r.get(AuthTester.RATE_LIMITING).getOutcome()).isEqualTo(CheckOutcome.FAIL);
        assertThat(r.get(AuthTester.RATE_LIMITING).getEvidence()).contains("advisory");
        assertThat(r.get("reflected-input:xss").getOutcome()).isEqualTo(CheckOutcome.PASS);
    }

    @Test
    @DisplayName("HttpOnly 없는 세션 쿠키: httponly만 FAIL, 다른 쿠키 점검은 영향 없음")
    void missing_httponly_fails_only_that_check() {
        sessionCookie = "sid=abc123; Path=/; Secure; SameSite=Lax";

        Map<String, AuthCheckResult> r = byName(run(login(base + "/login", null)));

        assertThat(r.get(AuthTester.LOGIN).getOutcome()).isEqualTo(CheckOutcome.PASS);
        assertThat(r.get(AuthTester.COOKIE_HTTPONLY).getOutcome()).isEqualTo(CheckOutcome.FAIL);
        assertThat(r.get(AuthTester.COOKIE_HTTPONLY).getEvidence()).isEqualTo("cookie 'sid' lacks HttpOnly");
        assertThat(r.get(AuthTester.COOKIE_SECURE).getOutcome()).isEqualTo(CheckOutcome.PASS);
        assertThat(r.get(AuthTester.COOKIE_SAMESITE).getOutcome()).isEqualTo(CheckOutcome.PASS);
        assertThat(r.get(AuthTester.PROTECTED_BEFORE).getOutcome()).isEqualTo(CheckOutcome.INCONCLUSIVE);
        assertThat(r.get(AuthTester.PROTECTED_BEFORE).getEvidence()).isEqualTo("no protected URL configured");
    }

    @Test
    @DisplayName("스크립트용 XSRF-TOKEN 쿠키를 세션 쿠키로 오인하지 않는다")
    void xsrf_cookie_is_not_taken_for_the_session() {
        csrfCookie = "XSRF-TOKEN=abc; Path=/; SameSite=Lax";
        sessionCookie = "laravel_session=xyz; Path=/; HttpOnly; SameSite=Lax";

        Map<String, AuthCheckResult> r = byName(run(login(base + "/login", null)));

        assertThat(r.get(AuthTester.COOKIE_HTTPONLY).getOutcome()).isEqualTo(CheckOutcome.PASS);
        assertThat(r.get(AuthTester.COOKIE_SAMESITE).getOutcome()).isEqualTo(CheckOutcome.PASS);
        assertThat(r.get(AuthTester.COOKIE_SECURE).getEvidence()).contains("'laravel_session'");
    }

    @Test
    void session_cookie_preference() {
        assertThat(AuthTester.pickSessionCookie(List.of(
                "XSRF-TOKEN=abc; Secure; SameSite=Lax",
                "laravel_session=xyz; Secure; HttpOnly; SameSite=Lax"), List.of()).getName())
                .isEqualTo("laravel_session");
        assertThat(AuthTester.pickSessionCookie(List.of("csrftoken=a", "theme=dark", "auth_token=b", "PHPSESSID=c"), List.of())
                .getName()).isEqualTo("PHPSESSID");
        assertThat(AuthTester.pickSessionCookie(List.of("csrftoken=a", "theme=dark", "auth_token=b"), List.of())
                .getName()).isEqualTo("auth_token");
        assertThat(AuthTester.pickSessionCookie(List.of("XSRF-TOKEN=a", "theme=dark"), List.of()).getName())
                .isEqualTo("theme");
        // 로그인 중 새 쿠키가 없으면 세션 전체에서 고른다
        assertThat(AuthTester.pickSessionCookie(List.of(), List.of("JSESSIONID=z")).getName()).isEqualTo("JSESSIONID");
        assertThat(AuthTester.pickSessionCookie(List.of("csrftoken=a"), List.of())).isNull();
    }

    @Test
    void samesite_none_and_missing_both_fail() {
        sessionCookie = "sid=abc123; Path=/; HttpOnly; SameSite=None";
        assertThat(byName(run(login(base + "/login", null))).get(AuthTester.COOKIE_SAMESITE).getOutcome())
                .isEqualTo(CheckOutcome.FAIL);

        sessionCookie = "sid=abc123; Path=/; HttpOnly";
        AuthCheckResult missing = byName(run(login(base + "/login", null))).get(AuthTester.COOKIE_SAMESITE);
        assertThat(missing.getOutcome()).isEqualTo(CheckOutcome.FAIL);
        assertThat(missing.getEvidence()).contains("lacks SameSite");
    }

    @Test
    void wrong_password_fails_login_and_cookie_checks_become_inconclusive() {
        LoginConfig wrong = LoginConfig.builder()
                .loginUrl(URI.create(base + "/login"))
                .username(USER)
                .password("not-it".toCharArray())
                .protectedUrl(URI.create(base + "/account"))
                .rateLimitAttempts(1)
                .build();

        Map<String, AuthCheckResult> r = byName(run(wrong));

        assertThat(r.get(AuthTester.LOGIN).getOutcome()).isEqualTo(CheckOutcome.FAIL);
        assertThat(r.get(AuthTester.LOGIN).getEvidence()).contains("login form served again");
        assertThat(r.get(AuthTester.COOKIE_HTTPONLY).getOutcome()).isEqualTo(CheckOutcome.INCONCLUSIVE);
        assertThat(r.get(AuthTester.PROTECTED_AFTER).getOutcome()).isEqualTo(CheckOutcome.INCONCLUSIVE);
    }

    @Test
    void http_429_counts_as_rate_limiting() {
        throttle = true;
        AuthCheckResult rate = byName(run(login(base + "/login", null))).get(AuthTester.RATE_LIMITING);
        assertThat(rate.getOutcome()).isEqualTo(CheckOutcome.PASS);
        assertThat(rate.getEvidence()).isEqualTo("HTTP 429 after 1 invalid attempt(s)");
    }

    @Test
    void echoed_marker_is_inconclusive_not_fail() {
        echoInput = true;
        Map<String, AuthCheckResult> r = byName(run(login(base + "/login", null)));
        assertThat(r.get("reflected-input:xss").getOutcome()).isEqualTo(CheckOutcome.INCONCLUSIVE);
        assertThat(r.get("reflected-input:sql").getOutcome()).isEqualTo(CheckOutcome.INCONCLUSIVE);
    }

    @Test
    void page_served_without_session_fails_protected_before() {
        Map<String, AuthCheckResult> r = byName(run(login(base + "/login", "/open")));
        assertThat(r.get(AuthTester.PROTECTED_BEFORE).getOutcome()).isEqualTo(CheckOutcome.FAIL);
        assertThat(r.get(AuthTester.PROTECTED_BEFORE).getEvidence()).isEqualTo("HTTP 200 served without authentication");
    }

    @Test
    @DisplayName("증거 문자열에 자격 증명이 남지 않는다")
    void evidence_never_carries_credentials() {
        List<AuthCheckResult> results = run(login(base + "/login", "/account"));

        assertThat(results).allSatisfy(res -> {
            assertThat(res.getEvidence()).doesNotContain(USER);
            assertThat(res.getEvidence()).doesNotContain(PASS);
        });
        // Location의 사용자명은 마스킹되어 남는다
        assertThat(byName(results).get(AuthTester.PROTECTED_BEFORE).getEvidence())
                .contains("hint=" + CredentialScope.MASK);
    }

    @Test
    void login_url_outside_origin_makes_everything_inconclusive() {
        List<AuthCheckResult> results = run(login("https://sso.other.test/login", "/account"));

        assertThat(results).hasSize(10);
        assertThat(results).allSatisfy(res -> {
            assertThat(res.getOutcome()).isEqualTo(CheckOutcome.INCONCLUSIVE);
            assertThat(res.getEvidence()).isEqualTo("login URL is outside the target origin");
        });
    }

    @Test
    void unreachable_site_is_inconclusive_not_crash() throws Exception {
        int closedPort;
        try (ServerSocket ss = new ServerSocket(0)) {
            closedPort = ss.getLocalPort();
        }
        String dead = "http://127.0.0.1:" + closedPort;
        LoginConfig cfg = LoginConfig.builder()
                .loginUrl(URI.create(dead + "/login"))
                .username(USER)
                .password(PASS.toCharArray())
                .protectedUrl(URI.create(dead + "/account"))
                .build();

        List<AuthCheckResult> results = tester().runAuthChecks(Target.of(URI.create(dead + "/")), cfg);

        assertThat(results).hasSize(10);
        assertThat(results).extracting(AuthCheckResult::getOutcome).containsOnly(CheckOutcome.INCONCLUSIVE);
        assertThat(byName(results).get(AuthTester.LOGIN).getEvidence()).startsWith("network error");
    }

    @Test
    void credential_scope_masks_and_wipes() {
        CredentialScope scope = new CredentialScope(login(base + "/login", null));
        assertThat(scope.redact("user " + USER + " pw " + PASS)).isEqualTo("user *** pw ***");
        assertThat(scope.password()).isEqualTo(PASS);

        scope.close();
        assertThat(scope.isClosed()).isTrue();
        assertThat(scope.redact(USER)).isEqualTo("***");
        assertThatThrownBy(scope::password).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("짧은 사용자명은 단어 경계에서만 가린다")
    void short_username_does_not_mangle_evidence() {
        CredentialScope scope = new CredentialScope(LoginConfig.builder()
                .loginUrl(URI.create(base + "/login"))
                .username("1")
                .password("pw-9f3k".toCharArray())
                .build());

        assertThat(scope.redact("HTTP 401 after 1 attempt")).isEqualTo("HTTP 401 after *** attempt");
        assertThat(scope.redact("/login?user=1&next=/a1")).isEqualTo("/login?user=***&next=/a1");
        assertThat(scope.redact("token pw-9f3k")).isEqualTo("token ***");
    }
}
