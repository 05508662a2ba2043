package com.siteauditor.core.scanner.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteauditor.core.model.ScanResult;
import com.siteauditor.core.model.Severity;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * nuclei 템플릿 스캐너 래퍼. JSONL 한 줄 = finding 1건.
 * 키: "&lt;template-id&gt;@&lt;matched-at&gt;", 심각도는 도구가 준 값.
 */
public final class NucleiScanner extends ExternalToolScanner {

    public static final String ID = "nuclei";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> templates;
    private final List<String> severities;

    public NucleiScanner(String executable, ToolLocator locator, ProcessRunner runner, Duration timeout,
                         List<String> templates, List<String> severities) {
        super(executable, locator, runner, timeout);
        this.templates = List.copyOf(Objects.requireNonNull(templates, "templates"));
        this.severities = List.copyOf(Objects.requireNonNull(severities, "severities"));
    }

    @Override public String id() { return ID; }

    @Override
    protected List<String> command(Path exe, URI target) {
        List<String> cmd = new ArrayList<>(List.of(exe.toString(),
                "-u", target.toString(), "-jsonl", "-silent", "-disable-update-check"));
        for (String t : templates) {
            cmd.add("-t");
            cmd.add(t);
        }
        if (!severities.isEmpty()) {
            cmd.add("-severity");
            cmd.add(String.join(",", severities));
        }
        return cmd;
    }

    @Override
    protected ScanResult parse(URI target, ProcessOutput out) throws ToolExecutionException {
        ScanResult.Builder b = ScanResult.builder(ID, target).cleanOutcomeAllowed(true);
        int lineNo = 0;
        for (String raw : out.stdout().split("\\R")) {
            lineNo++;
            String line = raw.strip();
            if (line.isEmpty()) continue;
            JsonNode n;
            try {
                n = MAPPER.readTree(line);
            } catch (JsonProcessingException e) {
                throw ToolExecutionException.unparsable("line " + lineNo);
            }
            String templateId = n.path("template-id").asText("");
            if (!n.isObject() || templateId.isEmpty()) {
                throw ToolExecutionException.unparsable("line " + lineNo + " has no template-id");
            }
            String matchedAt = firstNonBlank(n.path("matched-at").asText(""), n.path("host").asText(""), target.toString());
            JsonNode info = n.path("info");
            Severity sev = Severity.parse(info.path("severity").asText("info"));
            String name = firstNonBlank(info.path("name").asText(""), templateId);
            String matcher = n.path("matcher-name").asText("");
            String detail = name + (matcher.isEmpty() ? "" : " [" + matcher + "]") + " at " + matchedAt;
            b.finding(templateId + "@" + matchedAt, sev, detail);
        }
        return b.build();
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) if (v != null && !v.isBlank()) return v;
        return "";
    }
}
