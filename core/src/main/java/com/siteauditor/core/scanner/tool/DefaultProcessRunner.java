package com.siteauditor.core.scanner.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * ProcessBuilder 기반 실행기.
 * stdout/stderr는 임시 파일로 리다이렉트(파이프 버퍼가 차서 멈추는 것 방지).
 */
public final class DefaultProcessRunner implements ProcessRunner {
    private static final Logger log = LoggerFactory.getLogger(DefaultProcessRunner.class);

    @Override
    public ProcessOutput run(List<String> command, String stdin, Duration timeout)
            throws ToolExecutionException, InterruptedException {
        Path out = null;
        Path err = null;
        Process p = null;
        try {
            out = Files.createTempFile("sa-tool-", ".out");
            err = Files.createTempFile("sa-tool-", ".err");
            ProcessBuilder pb = new ProcessBuilder(command)
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile());
            log.debug("exec {}", command);
            p = pb.start();

            try (OutputStream os = p.getOutputStream()) {
                if (stdin != null) os.write(stdin.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                // 도구가 stdin을 읽지 않고 먼저 끝난 경우
                log.debug("stdin closed early for {}: {}", command.get(0), e.getMessage());
            }

            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                destroy(p);
                throw ToolExecutionException.timeout(timeout);
            }
            return new ProcessOutput(p.exitValue(),
                    Files.readString(out, StandardCharsets.UTF_8),
                    Files.readString(err, StandardCharsets.UTF_8));
        } catch (InterruptedException ie) {
            if (p != null) destroy(p);
            throw ie;
        } catch (IOException e) {
            throw new ToolExecutionException("failed to run " + command.get(0) + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    private static void destroy(Process p) {
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
        try {
            p.waitFor(2, TimeUnit.SECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static void deleteQuietly(Path f) {
        if (f == null) return;
        try {
            Files.deleteIfExists(f);
        } catch (IOException e) {
            log.warn("could not delete temp file {}: {}", f, e.getMessage());
        }
    }
}
