package com.siteauditor.core.service.export;

import java.io.IOException;
import java.nio.file.Path;

/** 리포트 모델을 한 가지 표현으로 내보내는 책임 (JSON/HTML) */
public interface ReportExporter {

    /** 디렉터리 안에서의 파일 이름 (예: report.json) */
    String fileName();

    /**
     * @param model 동결된 실행에서 만든 모델
     * @param dir   기록할 디렉터리(스테이징)
     * @return 생성된 파일 경로
     */
    Path export(ReportModel model, Path dir) throws IOException;
}
