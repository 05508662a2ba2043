package com.siteauditor.core.scanner.tool;

import java.time.Duration;
import java.util.List;

/** 외부 프로세스 실행 seam. 호출마다 새 프로세스(풀링 없음). */
@FunctionalInterface
public interface ProcessRunner {
    /**
     * @param command 실행 파일 + 인자
     * @param stdin   표준입력으로 보낼 내용(없으면 null)
     * @param timeout 상한. 넘기면 프로세스를 강제 종료하고 ToolExecutionException("timeout after Ns")
     * @throws InterruptedException 대기 중 인터럽트(프로세스는 이미 종료시킨 뒤)
     */
    ProcessOutput run(List<String> command, String stdin, Duration timeout)
            throws ToolExecutionException, InterruptedException;
}
