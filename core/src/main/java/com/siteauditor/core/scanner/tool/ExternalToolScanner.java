package com.siteauditor.core.scanner.tool;

import com.siteauditor.core.api.IScanner;
import com.siteauditor.core.model.ScanResult;
import com.siteauditor.core.model.ScanStatus;
import com.siteauditor.core.scanner.ScanGranularity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 외부 도구 기반 스캐너의 공통 틀(템플릿 메서드).
 *
 * <p>하위 클래스는
 * <ul>
 *   <li>{@link #command(Path, URI)}로 고정된 인자 계약을 만들고</li>
 *   <li>{@link #parse(URI, ProcessOutput)}에서 출력 전체를 해석한다(부분 파싱 금지)</li>
 * </ul>
 * 없음 → skipped:tool-not-installed, 타임아웃/비정상 종료/파싱 실패 → error:&lt;reason&gt;.
 */
public abstract class ExternalToolScanner implements IScanner {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String executable;
    private final ToolLocator locator;
    private final ProcessRunner runner;
    private final Duration timeout;

    protected ExternalToolScanner(String executable, ToolLocator locator, ProcessRunner runner, Duration timeout) {
        this.executable = Objects.requireNonNull(executable, "executable");
        this.locator = Objects.requireNonNull(locator, "locator");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public ScanGranularity granularity() { return ScanGranularity.ORIGIN; }

    @Override
    public boolean isAvailable() {
        return locator.locate(executable).isPresent();
    }

    @Override
    public final ScanResult scan(URI target) {
        long start = System.nanoTime();
        try {
            Path exe = resolve();
            String notApplicable = notApplicable(target);
            if (notApplicable != null) return ScanResult.skipped(id(), target, notApplicable);
            List<String> cmd = command(exe, target);
            log.info("running {} against {}", id(), target);
            ProcessOutput out = runner.run(cmd, null, timeout);
            if (out.exitCode() != 0 && !acceptsExitCode(out.exitCode())) {
                log.warn("{} exited with {}: {}", id(), out.exitCode(), out.lastErrorLine());
                throw ToolExecutionException.exitCode(out.exitCode());
            }
            return parse(target, out).withDuration(elapsedMs(start));
        } catch (ToolUnavailableException e) {
            return ScanResult.skipped(id(), target, ScanStatus.TOOL_NOT_INSTALLED);
        } catch (ToolExecutionException e) {
            log.warn("{} failed on {}: {}", id(), target, e.getMessage());
            return ScanResult.error(id(), target, e.getMessage()).withDuration(elapsedMs(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ScanResult.error(id(), target, "interrupted").withDuration(elapsedMs(start));
        }
    }

    private Path resolve() throws ToolUnavailableException {
        return locator.locate(executable).orElseThrow(() -> new ToolUnavailableException(executable));
    }

    /** 실행 파일 + 인자 */
    protected abstract List<String> command(Path exe, URI target);

    /** 출력 전체를 결과로. 해석 불가면 ToolExecutionException */
    protected abstract ScanResult parse(URI target, ProcessOutput out) throws ToolExecutionException;

    /** 대상에 의미가 없는 도구면 skipped 사유(기본 null = 적용 가능) */
    protected String notApplicable(URI target) { return null; }

    /** 0이 아니어도 정상으로 볼 종료 코드 */
    protected boolean acceptsExitCode(int code) { return false; }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
