package com.siteauditor.core.service.export;

import com.siteauditor.core.model.AuditRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * 동결된 AuditRun을 &lt;outputDir&gt;/&lt;yyyyMMdd_HHmmss&gt;/ 에 기록한다.
 * 스테이징 디렉터리에 모두 쓴 뒤 한 번에 rename 하므로, 실패 시 부분 리포트가 남지 않는다.
 */
public final class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    private final Path outputDir;
    private final List<ReportExporter> exporters;

    public ReportWriter(Path outputDir) {
        this(outputDir, List.of(new JsonReportExporter(), new HtmlReportExporter()));
    }

    public ReportWriter(Path outputDir, List<ReportExporter> exporters) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.exporters = List.copyOf(exporters);
        if (this.exporters.isEmpty()) throw new IllegalArgumentException("no exporters");
    }

    public Path getOutputDir() { return outputDir; }

    /**
     * @return 최종 리포트 디렉터리
     * @throws FileAlreadyExistsException 같은 시각의 디렉터리가 이미 있을 때(재사용 금지)
     */
    public Path write(AuditRun run) throws IOException {
        Objects.requireNonNull(run, "run");
        ReportModel model = ReportModel.from(run);   // 동결 확인 포함

        Path finalDir = ReportNaming.reportDir(outputDir, run.getStartedAt());
        if (Files.exists(finalDir)) {
            throw new FileAlreadyExistsException(finalDir.toString(), null, "report directory already exists");
        }

        Files.createDirectories(outputDir);
        Path staging = Files.createTempDirectory(outputDir,
                ReportNaming.STAGING_PREFIX + ReportNaming.dirName(run.getStartedAt()) + "-");
        try {
            for (ReportExporter ex : exporters) {
                Path p = ex.export(model, staging);
                LOG.debug("[Export] {} -> {}", ex.fileName(), p);
            }
            move(staging, finalDir);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(staging, e);
            throw e;
        }
        LOG.info("[Export] report written: {}", finalDir);
        return finalDir;
    }

    private static void move(Path staging, Path finalDir) throws IOException {
        try {
            Files.move(staging, finalDir, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("[Export] atomic move not supported, falling back: {}", e.getMessage());
            Files.move(staging, finalDir);
        }
    }

    /** 스테이징 정리. 정리 실패는 원래 예외에 suppressed로 붙인다 */
    private static void deleteQuietly(Path dir, Exception primary) {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException cleanup) {
            LOG.warn("[Export] could not remove staging dir {}: {}", dir, cleanup.toString());
            primary.addSuppressed(cleanup);
        }
    }
}
