package com.siteauditor.core.scanner.tool;

/**
 * 외부 도구 실행 실패(타임아웃/비정상 종료/출력 파싱 불가).
 * 메시지가 그대로 "error:&lt;reason&gt;"의 reason이 된다.
 */
public class ToolExecutionException extends Exception {

    public ToolExecutionException(String reason) {
        super(reason);
    }

    public ToolExecutionException(String reason, Throwable cause) {
        super(reason, cause);
    }

    public static ToolExecutionException timeout(java.time.Duration timeout) {
        long secs = (timeout.toMillis() + 999) / 1000;
        return new ToolExecutionException("timeout after " + secs + "s");
    }

    public static ToolExecutionException exitCode(int code) {
        return new ToolExecutionException("exit code " + code);
    }

    public static ToolExecutionException unparsable(String why) {
        return new ToolExecutionException("unparsable-output" + (why == null || why.isBlank() ? "" : ": " + why));
    }
}
