package com.pagelens.core.model;

import java.util.Objects;
import java.util.Optional;

/** 페치 결과: 응답 또는 실패 분류 중 하나 */
public final class FetchOutcome {
    private final RawResponse response;
    private final FetchFailure failure;
    private final String detail;

    private FetchOutcome(RawResponse response, FetchFailure failure, String detail) {
        this.response = response;
        this.failure = failure;
        this.detail = detail;
    }

    public static FetchOutcome success(RawResponse response) {
        return new FetchOutcome(Objects.requireNonNull(response, "response"), null, null);
    }

    public static FetchOutcome failure(FetchFailure failure, String detail) {
        return new FetchOutcome(null, Objects.requireNonNull(failure, "failure"), detail);
    }

    public boolean isSuccess() { return response != null; }
    public Optional<RawResponse> getResponse() { return Optional.ofNullable(response); }
    public FetchFailure getFailure() { return failure; }
    public String getDetail() { return detail; }
}
