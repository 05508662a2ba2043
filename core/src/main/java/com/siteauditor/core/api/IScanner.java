package com.siteauditor.core.api;

import com.siteauditor.core.model.ScanResult;
import com.siteauditor.core.scanner.ScanGranularity;

import java.net.URI;

/**
 * 스캐너 계약.
 * 오케스트레이터는 isAvailable()을 먼저 묻고, false면 scan()을 부르지 않고 skipped를 기록한다.
 * scan()은 실패를 예외가 아니라 status(error:...)로 돌려준다.
 */
public interface IScanner {

    /** 리포트에 남는 고정 식별자 (예: "security-headers") */
    String id();

    /** PER_URL: 발견된 URL마다, ORIGIN: 시드 1회 */
    ScanGranularity granularity();

    /** 실제 스캔 없이 백킹 도구/의존성 존재 여부만 확인 */
    boolean isAvailable();

    ScanResult scan(URI target);
}
