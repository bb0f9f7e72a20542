package com.pagelens.core.api;

import com.pagelens.core.model.FetchOutcome;

/** 페치 최소 계약: URL을 받아 원본 응답 또는 실패 분류를 돌려준다. 예외는 던지지 않는다. */
public interface IPageFetcher extends AutoCloseable {
    FetchOutcome fetch(String url);
    @Override default void close() throws Exception {}
}
