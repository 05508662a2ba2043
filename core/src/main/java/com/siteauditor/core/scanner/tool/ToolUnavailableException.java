package com.siteauditor.core.scanner.tool;

/** 외부 도구 실행 파일을 찾지 못함 → skipped:tool-not-installed */
public class ToolUnavailableException extends Exception {
    private final String tool;

    public ToolUnavailableException(String tool) {
        super("tool not installed: " + tool);
        this.tool = tool;
    }

    public String getTool() { return tool; }
}
