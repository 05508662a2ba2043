package com.siteauditor.core.scanner.tool;

import com.siteauditor.core.model.Origin;
import com.siteauditor.core.model.ScanResult;
import com.siteauditor.core.model.Severity;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * sslscan 텍스트 출력 해석.
 * 레거시 프로토콜, 약한 암호군, Heartbleed, TLS 압축, 안전하지 않은 재협상을 finding으로.
 */
public final class SslScanner extends ExternalToolScanner {

    public static final String ID = "sslscan";

    private static final Map<String, Severity> LEGACY_PROTOCOLS = Map.of(
            "SSLv2", Severity.HIGH,
            "SSLv3", Severity.HIGH,
            "TLSv1.0", Severity.MEDIUM,
            "TLSv1.1", Severity.MEDIUM);
    private static final List<String> PROTOCOL_ORDER = List.of("SSLv2", "SSLv3", "TLSv1.0", "TLSv1.1");

    private static final Pattern ANSI = Pattern.compile("\u001B\\[[;\\d]*m");
    private static final Pattern PROTOCOL_LINE =
            Pattern.compile("^(SSLv2|SSLv3|TLSv1\\.[0-3])\\s+enabled\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CIPHER_LINE =
            Pattern.compile("^(?:Preferred|Accepted)\\s+(SSLv2|SSLv3|TLSv1\\.[0-3])\\s+(\\d+)\\s+bits\\s+(\\S+)");
    private static final Pattern HEARTBLEED =
            Pattern.compile("^(\\S+)\\s+vulnerable to heartbleed", Pattern.CASE_INSENSITIVE);
    private static final Pattern WEAK_CIPHER = Pattern.compile(
            "(^|[-_])(RC4|DES|3DES|DES-CBC3|NULL|EXPORT\\d*|EXP|ANON|ADH|AECDH|MD5)([-_]|$)");

    public SslScanner(String executable, ToolLocator locator, ProcessRunner runner, Duration timeout) {
        super(executable, locator, runner, timeout);
    }

    @Override public String id() { return ID; }

    @Override
    protected String notApplicable(URI target) {
        return "https".equalsIgnoreCase(target.getScheme()) ? null : "not-https";
    }

    @Override
    protected List<String> command(Path exe, URI target) {
        return List.of(exe.toString(), "--no-colour", Origin.of(target).hostPort());
    }

    @Override
    protected ScanResult parse(URI target, ProcessOutput out) throws ToolExecutionException {
        String text = ANSI.matcher(out.stdout()).replaceAll("");
        boolean recognised = false;
        Set<String> protocols = new LinkedHashSet<>();
        ScanResult.Builder b = ScanResult.builder(ID, target).cleanOutcomeAllowed(true);

        for (String raw : text.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;
            if (line.startsWith("ERROR:")) {
                throw new ToolExecutionException(line.substring("ERROR:".length()).strip());
            }
            if (line.startsWith("Testing SSL server") || line.startsWith("SSL/TLS Protocols")
                    || line.startsWith("Supported Server Cipher")) {
                recognised = true;
                continue;
            }

            Matcher pm = PROTOCOL_LINE.matcher(line);
            if (pm.find()) {
                protocols.add(canonical(pm.group(1)));
                continue;
            }

            Matcher cm = CIPHER_LINE.matcher(line);
            if (cm.find()) {
                recognised = true;
                String protocol = canonical(cm.group(1));
                String cipher = cm.group(3);
                protocols.add(protocol);
                if (isWeakCipher(cipher)) {
                    b.finding("cipher:" + cipher, Severity.MEDIUM,
                            "Weak cipher accepted: " + cipher + " (" + protocol + ", " + cm.group(2) + " bits)");
                }
                continue;
            }

            Matcher hm = HEARTBLEED.matcher(line);
            if (hm.find() && !line.toLowerCase(Locale.ROOT).contains("not vulnerable")) {
                b.finding("heartbleed", Severity.CRITICAL, "Server is vulnerable to Heartbleed (" + hm.group(1) + ")");
                continue;
            }
            if (line.startsWith("Compression enabled")) {
                b.finding("tls-compression", Severity.MEDIUM, "TLS compression enabled (CRIME)");
                continue;
            }
            if (line.startsWith("Insecure session renegotiation supported")) {
                b.finding("insecure-renegotiation", Severity.MEDIUM, "Insecure client-initiated renegotiation supported");
            }
        }

        if (!recognised) throw ToolExecutionException.unparsable(null);

        for (String p : PROTOCOL_ORDER) {
            if (protocols.contains(p)) {
                b.finding("protocol:" + p, LEGACY_PROTOCOLS.get(p), "Legacy protocol enabled: " + p);
            }
        }
        return b.rawOutput(text.strip()).build();
    }

    static boolean isWeakCipher(String cipher) {
        return WEAK_CIPHER.matcher(cipher.toUpperCase(Locale.ROOT)).find();
    }

    /** "TLSv1.0"/"tlsv1.0" 표기 통일 */
    private static String canonical(String protocol) {
        String p = protocol.toUpperCase(Locale.ROOT);
        if (p.startsWith("SSLV")) return "SSLv" + p.substring(4);
        return "TLSv" + p.substring(4);
    }
}
