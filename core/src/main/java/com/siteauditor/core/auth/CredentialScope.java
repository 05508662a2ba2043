package com.siteauditor.core.auth;

import com.siteauditor.core.model.LoginConfig;

import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 인증 점검 1회 동안만 자격 증명을 들고 있는 범위.
 * close() 시 비밀번호 배열을 0으로 덮는다. 증거 문자열은 redact()를 거쳐서만 밖으로 나간다.
 */
final class CredentialScope implements AutoCloseable {
    static final String MASK = "***";

    private final String username;
    private final Pattern usernameWord;
    private final char[] password;
    private boolean closed;

    CredentialScope(LoginConfig login) {
        this.username = login.getUsername();
        this.usernameWord = wordPattern(username);
        this.password = login.copyPassword();
    }

    String username() {
        checkOpen();
        return username;
    }

    /** 폼 전송용. 호출부에서 보관하지 않는다 */
    String password() {
        checkOpen();
        return new String(password);
    }

    /**
     * 사용자명/비밀번호가 들어간 부분을 가린다.
     * 사용자명은 영숫자 경계에서만 가린다("1" 때문에 "HTTP 401"이 망가지지 않게).
     */
    String redact(String text) {
        if (text == null) return "";
        String out = text;
        if (!closed && password.length > 0) out = out.replace(new String(password), MASK);
        if (usernameWord != null) out = usernameWord.matcher(out).replaceAll(Matcher.quoteReplacement(MASK));
        return out;
    }

    private static Pattern wordPattern(String username) {
        if (username == null || username.isEmpty()) return null;
        return Pattern.compile("(?<![A-Za-z0-9])" + Pattern.quote(username) + "(?![A-Za-z0-9])");
    }

    boolean isClosed() { return closed; }

    private void checkOpen() {
        if (closed) throw new IllegalStateException("credential scope already closed");
    }

    @Override
    public void close() {
        Arrays.fill(password, '\0');
        closed = true;
    }
}
