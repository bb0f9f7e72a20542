package com.pagelens.core.model;

/** 페치 실패 분류. 코어로는 전파되지 않고 리포트/CLI에서만 사용. */
public enum FetchFailure {
    TIMEOUT,
    TLS_ERROR,
    CONNECTION_ERROR,
    UNKNOWN
}
