package com.pagelens.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** 한 페이지 분석 결과 묶음 (필드 결과는 분석 순서대로) */
public final class PageReport {
    private final String url;
    private final int statusCode;
    private final String contentType;     // nullable
    private final long responseTimeMs;
    private final String charset;
    private final DecodeStage decodeStage;
    private final List<FieldResult> results;

    private PageReport(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
        this.charset = b.charset;
        this.decodeStage = b.decodeStage;
        this.results = List.copyOf(b.results);
    }

    public String getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public String getCharset() { return charset; }
    public DecodeStage getDecodeStage() { return decodeStage; }
    public List<FieldResult> getResults() { return results; }

    public boolean isDecodeDegraded() {
        return decodeStage != DecodeStage.DECLARED && decodeStage != DecodeStage.DETECTED;
    }

    public Optional<FieldResult> result(FieldType field) {
        for (FieldResult r : results) {
            if (r.getField() == field) return Optional.of(r);
        }
        return Optional.empty();
    }

    /** 초기 콘텐츠 점검 통과 여부. 실패면 이후 점검 결과 신뢰도가 낮음. */
    public boolean isContentVisible() {
        return result(FieldType.CONTENT_VISIBILITY).map(FieldResult::isVerdict).orElse(false);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private int statusCode;
        private String contentType;
        private long responseTimeMs;
        private String charset;
        private DecodeStage decodeStage;
        private final List<FieldResult> results = new ArrayList<>();

        public Builder url(String url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        /** 상태코드, Content-Type, 응답시간을 원본 응답에서 복사 */
        public Builder response(RawResponse raw) {
            this.statusCode = raw.getStatusCode();
            this.contentType = raw.getContentType();
            this.responseTimeMs = raw.getResponseTimeMs();
            return this;
        }
        public Builder decoded(DecodedText decoded) {
            this.charset = decoded.getCharset();
            this.decodeStage = decoded.getStage();
            return this;
        }
        public Builder add(FieldResult r) { if (r != null) results.add(r); return this; }

        public PageReport build() {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(decodeStage, "decodeStage");
            return new PageReport(this);
        }
    }
}
