package com.siteauditor.core.model;

import java.net.URI;
import java.util.Arrays;

/**
 * 로그인 플로우 설정.
 * 비밀번호는 char[]로만 보관하고, toString()은 자격증명을 절대 출력하지 않는다.
 */
public final class LoginConfig {
    private final URI loginUrl;
    private final String usernameField;   // null이면 로그인 폼에서 추정
    private final String passwordField;   // null이면 type=password 입력 추정
    private final String username;
    private final char[] password;
    private final URI protectedUrl;       // nullable
    private final String successIndicator; // nullable, 로그인 후 본문/최종 URL에 기대되는 문자열
    private final int rateLimitAttempts;

    private LoginConfig(Builder b) {
        this.loginUrl = b.loginUrl;
        this.usernameField = blankToNull(b.usernameField);
        this.passwordField = blankToNull(b.passwordField);
        this.username = b.username;
        this.password = b.password == null ? new char[0] : b.password.clone();
        this.protectedUrl = b.protectedUrl;
        this.successIndicator = blankToNull(b.successIndicator);
        this.rateLimitAttempts = b.rateLimitAttempts;
    }

    public URI getLoginUrl() { return loginUrl; }
    public String getUsernameField() { return usernameField; }
    public String getPasswordField() { return passwordField; }
    public String getUsername() { return username; }
    public URI getProtectedUrl() { return protectedUrl; }
    public String getSuccessIndicator() { return successIndicator; }
    public int getRateLimitAttempts() { return rateLimitAttempts; }

    /** 호출자가 사용 후 지울 수 있도록 복사본을 준다 */
    public char[] copyPassword() { return password.clone(); }

    public static Builder builder() { return new Builder(); }

    @Override
    public String toString() {
        return "LoginConfig{loginUrl=" + loginUrl
                + ", protectedUrl=" + protectedUrl
                + ", credentials=***}";
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    public static final class Builder {
        private URI loginUrl;
        private String usernameField;
        private String passwordField;
        private String username;
        private char[] password;
        private URI protectedUrl;
        private String successIndicator;
        private int rateLimitAttempts = 5;

        public Builder loginUrl(URI loginUrl) { this.loginUrl = loginUrl; return this; }
        public Builder usernameField(String f) { this.usernameField = f; return this; }
        public Builder passwordField(String f) { this.passwordField = f; return this; }
        public Builder username(String username) { this.username = username; return this; }
        public Builder password(char[] password) {
            this.password = (password == null ? null : password.clone());
            return this;
        }
        public Builder protectedUrl(URI protectedUrl) { this.protectedUrl = protectedUrl; return this; }
        public Builder successIndicator(String s) { this.successIndicator = s; return this; }
        public Builder rateLimitAttempts(int n) { this.rateLimitAttempts = n; return this; }

        public LoginConfig build() {
            if (loginUrl == null) throw new IllegalArgumentException("loginUrl is required");
            if (username == null || username.isEmpty()) throw new IllegalArgumentException("username is required");
            if (password == null || password.length == 0) {
                throw new IllegalArgumentException("password must not be empty");
            }
            if (rateLimitAttempts < 1 || rateLimitAttempts > 20) {
                throw new IllegalArgumentException("rateLimitAttempts must be in 1..20");
            }
            LoginConfig cfg = new LoginConfig(this);
            Arrays.fill(password, '\0');
            password = null;
            return cfg;
        }
    }
}
