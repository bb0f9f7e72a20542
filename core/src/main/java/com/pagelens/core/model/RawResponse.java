package com.pagelens.core.model;

import java.util.Objects;

/** 페치 결과 원본(바이트 기준). 디코딩은 EncodingResolver가 담당. */
public final class RawResponse {
    private static final byte[] EMPTY = new byte[0];

    private final String sourceUrl;
    private final byte[] bytes;
    private final String declaredEncoding;   // nullable: Content-Type charset
    private final int statusCode;
    private final String contentType;
    private final long responseTimeMs;

    private RawResponse(Builder b) {
        this.sourceUrl = b.sourceUrl;
        this.bytes = (b.bytes == null) ? EMPTY : b.bytes.clone();
        this.declaredEncoding = blankToNull(b.declaredEncoding);
        this.statusCode = b.statusCode;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
    }

    public String getSourceUrl() { return sourceUrl; }
    /** 방어적 복사본 */
    public byte[] getBytes() { return bytes.clone(); }
    public int length() { return bytes.length; }
    public String getDeclaredEncoding() { return declaredEncoding; }
    public boolean hasDeclaredEncoding() { return declaredEncoding != null; }
    public int getStatusCode() { return statusCode; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String sourceUrl;
        private byte[] bytes;
        private String declaredEncoding;
        private int statusCode = 200;
        private String contentType;
        private long responseTimeMs;

        public Builder sourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; return this; }
        public Builder bytes(byte[] bytes) { this.bytes = bytes; return this; }
        public Builder declaredEncoding(String declaredEncoding) { this.declaredEncoding = declaredEncoding; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }

        public RawResponse build() {
            Objects.requireNonNull(sourceUrl, "sourceUrl");
            return new RawResponse(this);
        }
    }
}
