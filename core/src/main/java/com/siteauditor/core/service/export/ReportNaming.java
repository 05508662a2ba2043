package com.siteauditor.core.service.export;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** 리포트 저장 경로 규칙: &lt;outputDir&gt;/&lt;yyyyMMdd_HHmmss&gt;/report.{json,html} (UTC) */
public final class ReportNaming {
    private ReportNaming() {}

    public static final DateTimeFormatter DIR_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    public static final String JSON_FILE = "report.json";
    public static final String HTML_FILE = "report.html";

    /** 스테이징 디렉터리 접두어(숨김) */
    static final String STAGING_PREFIX = ".staging-";

    public static String dirName(Instant startedAt) {
        return DIR_FMT.format(startedAt);
    }

    public static Path reportDir(Path outputDir, Instant startedAt) {
        return outputDir.resolve(dirName(startedAt));
    }

    public static boolean isStaging(Path p) {
        Path name = p.getFileName();
        return name != null && name.toString().startsWith(STAGING_PREFIX);
    }
}
