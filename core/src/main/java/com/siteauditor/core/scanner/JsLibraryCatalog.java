package com.siteauditor.core.scanner;

import com.siteauditor.core.model.Severity;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 스크립트 URL → (라이브러리, 버전) 식별 + 취약 버전 범위 테이블.
 * 테이블은 클래스패스의 js-vulnerabilities.yml. 라이브러리 순서가 매칭 우선순위(react-dom이 react보다 먼저).
 */
public final class JsLibraryCatalog {

    public static final String DEFAULT_RESOURCE = "/js-vulnerabilities.yml";

    /** 식별 결과 */
    public record Detection(String library, String version) {
        @Override public String toString() { return library + "@" + version; }
    }

    /** 취약 범위 1건: atLeast(포함, nullable) <= v < below(미포함) */
    public record Advisory(String id, Severity severity, String summary, String atLeast, String below) {
        public boolean affects(String version) {
            if (atLeast != null && compareVersions(version, atLeast) < 0) return false;
            return below == null || compareVersions(version, below) < 0;
        }
    }

    private record Library(String name, List<Pattern> patterns, List<Advisory> advisories) {}

    private static final String VERSION = "v?(\\d+\\.\\d+(?:\\.\\d+)?)";

    private final List<Library> libraries;

    private JsLibraryCatalog(List<Library> libraries) {
        this.libraries = List.copyOf(libraries);
    }

    public static JsLibraryCatalog loadDefault() {
        try (InputStream in = JsLibraryCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IllegalStateException("missing classpath resource " + DEFAULT_RESOURCE);
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    @SuppressWarnings("unchecked")
    public static JsLibraryCatalog load(InputStream in) {
        Object root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        if (!(root instanceof Map<?, ?> map) || !(map.get("libraries") instanceof List<?> libs)) {
            throw new IllegalArgumentException("js vulnerability table must have a 'libraries' list");
        }
        List<Library> out = new ArrayList<>();
        for (Object o : libs) {
            Map<String, Object> lib = (Map<String, Object>) o;
            String name = String.valueOf(Objects.requireNonNull(lib.get("name"), "library name"));
            List<String> aliases = new ArrayList<>();
            if (lib.get("aliases") instanceof List<?> al) for (Object a : al) aliases.add(String.valueOf(a));
            if (aliases.isEmpty()) aliases.add(name);

            List<Advisory> advisories = new ArrayList<>();
            if (lib.get("advisories") instanceof List<?> advs) {
                for (Object ao : advs) {
                    Map<String, Object> a = (Map<String, Object>) ao;
                    advisories.add(new Advisory(
                            String.valueOf(a.get("id")),
                            Severity.parse(String.valueOf(a.get("severity"))),
                            String.valueOf(a.getOrDefault("summary", "")),
                            a.get("atLeast") == null ? null : String.valueOf(a.get("atLeast")),
                            a.get("below") == null ? null : String.valueOf(a.get("below"))));
                }
            }
            out.add(new Library(name, patternsFor(aliases), advisories));
        }
        return new JsLibraryCatalog(out);
    }

    /**
     * 인식 형태:
     * - 파일명/패키지: jquery-3.4.0.min.js, jquery@3.4.0/dist/...
     * - CDN 경로: /ajax/libs/jquery/3.4.0/jquery.min.js
     * - 쿼리: jquery.min.js?ver=3.4.0
     */
    private static List<Pattern> patternsFor(List<String> aliases) {
        List<Pattern> ps = new ArrayList<>();
        for (String alias : aliases) {
            String n = Pattern.quote(alias.toLowerCase(Locale.ROOT));
            ps.add(Pattern.compile("(?:^|/)" + n + "(?:\\.js)?[-.@]" + VERSION + "(?=[./?#-]|$)"));
            ps.add(Pattern.compile("/" + n + "(?:\\.js)?/" + VERSION + "/"));
            ps.add(Pattern.compile("(?:^|/)" + n + "(?:\\.min)?\\.js\\?(?:[^#]*&)?v(?:er(?:sion)?)?=" + VERSION));
        }
        return ps;
    }

    /** 버전을 알 수 없거나 모르는 라이브러리면 empty */
    public Optional<Detection> detect(String scriptUrl) {
        if (scriptUrl == null || scriptUrl.isBlank()) return Optional.empty();
        String s = scriptUrl.toLowerCase(Locale.ROOT);
        for (Library lib : libraries) {
            for (Pattern p : lib.patterns()) {
                Matcher m = p.matcher(s);
                if (m.find()) return Optional.of(new Detection(lib.name(), m.group(1)));
            }
        }
        return Optional.empty();
    }

    public List<Advisory> advisoriesFor(Detection d) {
        for (Library lib : libraries) {
            if (lib.name().equals(d.library())) {
                return lib.advisories().stream().filter(a -> a.affects(d.version())).toList();
            }
        }
        return List.of();
    }

    public List<String> libraryNames() {
        return libraries.stream().map(Library::name).toList();
    }

    /** 점 구분 숫자 비교. 빠진 자리는 0 */
    static int compareVersions(String a, String b) {
        String[] pa = a.split("\\.");
        String[] pb = b.split("\\.");
        for (int i = 0; i < Math.max(pa.length, pb.length); i++) {
            int x = i < pa.length ? leadingInt(pa[i]) : 0;
            int y = i < pb.length ? leadingInt(pb[i]) : 0;
            if (x != y) return Integer.compare(x, y);
        }
        return 0;
    }

    private static int leadingInt(String s) {
        int end = 0;
        while (end < s.length() && Character.isDigit(s.charAt(end))) end++;
        if (end == 0) return 0;
        try {
            return Integer.parseInt(s.substring(0, end));
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
