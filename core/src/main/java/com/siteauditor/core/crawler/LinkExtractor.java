package com.siteauditor.core.crawler;

import com.siteauditor.core.http.NetworkException;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/** 페이지에서 절대 URL을 추출하는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * base 페이지를 가져와 링크를 문서 순서대로 절대 URI 목록으로 반환(중복 허용).
     *
     * @throws NetworkException 연결 자체가 실패했을 때(연결 거부/DNS/타임아웃)
     * @throws IOException      페이지는 응답했지만 쓸 수 없을 때(4xx/5xx, HTML 아님)
     */
    List<URI> extract(URI base) throws IOException;
}
