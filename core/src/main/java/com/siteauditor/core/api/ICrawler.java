package com.siteauditor.core.api;

import com.siteauditor.core.http.NetworkException;
import com.siteauditor.core.model.CrawlResult;

import java.net.URI;

/** 크롤러 최소 계약: 시드에서 same-origin URL을 최대 maxPages개 발견한다. */
public interface ICrawler extends AutoCloseable {
    /**
     * @throws NetworkException 시드 자체를 가져올 수 없을 때만
     */
    CrawlResult crawl(URI seed, int maxPages) throws NetworkException;

    @Override default void close() throws Exception {}
}
