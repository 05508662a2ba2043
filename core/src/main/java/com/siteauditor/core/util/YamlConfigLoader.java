package com.siteauditor.core.util;

import com.siteauditor.core.model.AuditConfig;
import com.siteauditor.core.model.AuditProfile;
import com.siteauditor.core.model.LoginConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * audit.yml을 읽어 AuditConfig로 변환.
 *
 * 예상 YAML 키:
 * target: "https://example.com"
 * profile: security | performance
 * maxPages: 50
 * timeoutMs: 15000
 * toolTimeoutMs: 180000
 * concurrency: 4
 * followRedirects: true
 * userAgent: "SiteAuditor/0.3"
 * output:
 *   dir: "reports"
 * scanners:
 *   securityHeaders / jsVulnerabilities / lighthouse / sslScan / nuclei: true|false
 * tools:
 *   lighthouse / sslscan / nuclei: 실행 파일 이름 또는 경로
 * nuclei:
 *   templates: [..]
 *   severities: [..]
 * auth:
 *   loginUrl, usernameField, passwordField, username,
 *   password (또는 passwordEnv: 환경변수 이름),
 *   protectedUrl, successIndicator, rateLimitAttempts
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "audit.yml";

    private YamlConfigLoader() {}

    public static AuditConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static AuditConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("audit.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** validate()는 호출하지 않는다(CLI 오버라이드 후 호출자가 검증) */
    public static AuditConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        AuditConfig cfg = AuditConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        // 1) 평면 키
        setString(map, "target", cfg::setTarget);
        setEnum(map, "profile", AuditProfile.class, cfg::setProfile);
        setInt(map, "maxPages", cfg::setMaxPages);
        setLong(map, "timeoutMs", cfg::setTimeoutMs);
        setLong(map, "toolTimeoutMs", cfg::setToolTimeoutMs);
        setInt(map, "concurrency", cfg::setConcurrency);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setString(map, "userAgent", cfg::setUserAgent);

        // 2) output.dir
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setPath(output, "dir", cfg::setOutputDir);
        }

        // 3) scanners.* (명시값만 프로필 기본값을 덮어씀)
        Map<String, Object> scanners = getMap(map, "scanners");
        if (scanners != null) {
            var s = cfg.getScanners();
            setBoolean(scanners, "securityHeaders", s::setSecurityHeaders);
            setBoolean(scanners, "jsVulnerabilities", s::setJsVulnerabilities);
            setBoolean(scanners, "lighthouse", s::setLighthouse);
            setBoolean(scanners, "sslScan", s::setSslScan);
            setBoolean(scanners, "nuclei", s::setNuclei);
        }

        // 4) tools.*
        Map<String, Object> tools = getMap(map, "tools");
        if (tools != null) {
            var t = cfg.getTools();
            setString(tools, "lighthouse", t::setLighthouse);
            setString(tools, "sslscan", t::setSslscan);
            setString(tools, "nuclei", t::setNuclei);
        }

        // 5) nuclei.*
        Map<String, Object> nuclei = getMap(map, "nuclei");
        if (nuclei != null) {
            setStringList(nuclei, "templates", cfg::setNucleiTemplates);
            setStringList(nuclei, "severities", cfg::setNucleiSeverities);
        }

        // 6) auth.*
        Map<String, Object> auth = getMap(map, "auth");
        if (auth != null) {
            cfg.setLogin(toLogin(auth));
        }
        return cfg;
    }

    private static LoginConfig toLogin(Map<String, Object> auth) {
        LoginConfig.Builder b = LoginConfig.builder();
        setUri(auth, "loginUrl", b::loginUrl);
        setString(auth, "usernameField", b::usernameField);
        setString(auth, "passwordField", b::passwordField);
        setString(auth, "username", b::username);
        setUri(auth, "protectedUrl", b::protectedUrl);
        setString(auth, "successIndicator", b::successIndicator);
        setInt(auth, "rateLimitAttempts", b::rateLimitAttempts);

        Object pw = auth.get("password");
        Object env = auth.get("passwordEnv");
        if (pw == null && env != null) {
            pw = System.getenv(String.valueOf(env));
            if (pw == null) throw new IllegalArgumentException("auth.passwordEnv not set: " + env);
        }
        if (pw != null) b.password(String.valueOf(pw).toCharArray());

        try {
            return b.build();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("auth section is incomplete: " + e.getMessage(), e);
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setUri(Map<?, ?> map, String key, Consumer<URI> setter) {
        Object v = map.get(key);
        if (v == null) return;
        try {
            setter.accept(URI.create(String.valueOf(v).trim()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid URL for '" + key + "': " + v, e);
        }
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new IllegalArgumentException("unknown " + key + ": '" + s + "' (expected one of "
                + List.of(type.getEnumConstants()).toString().toLowerCase(Locale.ROOT) + ")");
    }
}
