package com.siteauditor.core.api;

import com.siteauditor.core.http.NetworkException;
import com.siteauditor.core.model.HttpResponseData;

import java.net.URI;

/** HTTP GET 최소 계약: URL을 받아 응답 모델을 돌려준다. 연결 실패는 NetworkException. */
public interface IHttpFetcher extends AutoCloseable {
    HttpResponseData fetch(URI url) throws NetworkException;

    @Override default void close() throws Exception {}
}
