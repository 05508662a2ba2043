package com.siteauditor.core.scanner.tool;

/** 종료된 프로세스 1회의 결과 */
public record ProcessOutput(int exitCode, String stdout, String stderr) {
    public ProcessOutput {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    /** stderr 마지막 줄(오류 사유 요약용) */
    public String lastErrorLine() {
        String[] lines = stderr.strip().split("\\R");
        return lines.length == 0 ? "" : lines[lines.length - 1].strip();
    }
}
