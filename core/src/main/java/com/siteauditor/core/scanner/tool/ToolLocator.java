package com.siteauditor.core.scanner.tool;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/** 외부 도구 실행 파일 위치 조회. 스캔 전 가용성 판정에 쓴다. */
@FunctionalInterface
public interface ToolLocator {

    Optional<Path> locate(String executable);

    /** 현재 프로세스의 PATH 기준 */
    static ToolLocator systemPath() {
        return fromPath(System.getenv("PATH"));
    }

    /**
     * 주어진 PATH 문자열 기준.
     * 경로 구분자가 들어간 이름(설정에 적은 절대/상대 경로)은 그 파일만 확인한다.
     */
    static ToolLocator fromPath(String pathVar) {
        boolean windows = File.separatorChar == '\\';
        return executable -> {
            if (executable == null || executable.isBlank()) return Optional.empty();
            try {
                if (executable.contains("/") || executable.contains(File.separator)) {
                    Path p = Path.of(executable);
                    return Files.isRegularFile(p) && Files.isExecutable(p) ? Optional.of(p) : Optional.empty();
                }
                if (pathVar == null || pathVar.isBlank()) return Optional.empty();
                for (String dir : pathVar.split(File.pathSeparator)) {
                    if (dir.isBlank()) continue;
                    Path candidate = Path.of(dir, executable);
                    if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) return Optional.of(candidate);
                    if (windows && !executable.toLowerCase(Locale.ROOT).endsWith(".exe")) {
                        for (String ext : new String[]{".exe", ".cmd", ".bat"}) {
                            Path c = Path.of(dir, executable + ext);
                            if (Files.isRegularFile(c)) return Optional.of(c);
                        }
                    }
                }
            } catch (InvalidPathException e) {
                return Optional.empty();
            }
            return Optional.empty();
        };
    }
}
