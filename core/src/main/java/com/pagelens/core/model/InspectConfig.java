package com.pagelens.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 페이지 점검 설정 (pagelens.yml 매핑 대상). 순수 설정 보관용.
 * 컴포넌트에는 불변 복사본(List.copyOf)만 넘긴다.
 */
public final class InspectConfig {

    /** YAML `encoding:` 섹션 */
    public static final class EncodingCfg {
        /** URL에 포함되면 중국어 사이트로 간주하는 조각 (".cn" 포함) */
        private List<String> cjkSiteHints = List.of(".cn", "sina", "baidu", "sohu", "163", "qq", "zhihu");
        /** 통계적 감지에 쓰는 앞부분 바이트 수 */
        private int detectionSampleBytes = 1024;
        /** 감지 신뢰도 하한(0~1, 초과해야 채택) */
        private double minConfidence = 0.8;
        private List<String> cjkCandidates = List.of("gbk", "gb2312", "gb18030", "utf-8", "iso-8859-1");
        private List<String> defaultCandidates = List.of("utf-8", "gbk", "gb2312", "iso-8859-1");

        public List<String> getCjkSiteHints() { return cjkSiteHints; }
        public EncodingCfg setCjkSiteHints(List<String> v) { if (v != null && !v.isEmpty()) this.cjkSiteHints = List.copyOf(v); return this; }

        public int getDetectionSampleBytes() { return detectionSampleBytes; }
        public EncodingCfg setDetectionSampleBytes(int v) { this.detectionSampleBytes = v; return this; }

        public double getMinConfidence() { return minConfidence; }
        public EncodingCfg setMinConfidence(double v) { this.minConfidence = v; return this; }

        public List<String> getCjkCandidates() { return cjkCandidates; }
        public EncodingCfg setCjkCandidates(List<String> v) { if (v != null && !v.isEmpty()) this.cjkCandidates = List.copyOf(v); return this; }

        public List<String> getDefaultCandidates() { return defaultCandidates; }
        public EncodingCfg setDefaultCandidates(List<String> v) { if (v != null && !v.isEmpty()) this.defaultCandidates = List.copyOf(v); return this; }
    }

    /** YAML `visibility:` 섹션 */
    public static final class VisibilityCfg {
        private List<String> noiseTags = List.of(
                "script", "style", "noscript", "iframe",
                "nav", "header", "footer", "aside",
                "form", "button", "input");
        private List<String> noiseSelectors = List.of(
                "nav", ".navigation", ".navbar", ".menu",
                "#nav", "#navigation", "#menu",
                ".header", ".footer", ".sidebar");

        public List<String> getNoiseTags() { return noiseTags; }
        public VisibilityCfg setNoiseTags(List<String> v) { if (v != null) this.noiseTags = List.copyOf(v); return this; }

        public List<String> getNoiseSelectors() { return noiseSelectors; }
        public VisibilityCfg setNoiseSelectors(List<String> v) { if (v != null) this.noiseSelectors = List.copyOf(v); return this; }
    }

    /** YAML `heading:` 섹션 */
    public static final class HeadingCfg {
        private List<String> stopWords = List.of("的", "和", "与", "及", "或", "在", "是", "有", "了", "吗", "呢", "吧", "啊");

        public List<String> getStopWords() { return stopWords; }
        public HeadingCfg setStopWords(List<String> v) { if (v != null) this.stopWords = List.copyOf(v); return this; }
    }

    // ---------- 기본 필드 ----------
    private Duration timeout = Duration.ofSeconds(10);
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private String acceptLanguage = "zh-CN,zh;q=0.9,en;q=0.8";
    private boolean followRedirects = true;
    /** 국내에서 접근이 막힐 수 있는 사이트 (CLI 확인 프롬프트용) */
    private List<String> blockedSites = List.of(
            "bbc.com", "wikipedia.org", "twitter.com", "facebook.com", "google.com", "youtube.com");

    private final EncodingCfg encoding = new EncodingCfg();
    private final VisibilityCfg visibility = new VisibilityCfg();
    private final HeadingCfg heading = new HeadingCfg();

    // ---------- getters ----------
    public Duration getTimeout() { return timeout; }
    public long getTimeoutSeconds() { return timeout.toSeconds(); }
    public String getUserAgent() { return userAgent; }
    public String getAcceptLanguage() { return acceptLanguage; }
    public boolean isFollowRedirects() { return followRedirects; }
    public List<String> getBlockedSites() { return blockedSites; }

    public EncodingCfg encoding() { return encoding; }
    public VisibilityCfg visibility() { return visibility; }
    public HeadingCfg heading() { return heading; }

    // ---------- fluent setters ----------
    /** 0 이하 값은 1초로 올림 */
    public InspectConfig setTimeoutSeconds(long seconds) {
        this.timeout = Duration.ofSeconds(Math.max(1, seconds));
        return this;
    }

    public InspectConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public InspectConfig setAcceptLanguage(String acceptLanguage) { this.acceptLanguage = acceptLanguage; return this; }
    public InspectConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public InspectConfig setBlockedSites(List<String> sites) {
        if (sites != null) this.blockedSites = List.copyOf(sites);
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("userAgent must not be blank");
        Objects.requireNonNull(blockedSites, "blockedSites");

        if (encoding.getDetectionSampleBytes() < 1)
            throw new IllegalArgumentException("encoding.detectionSampleBytes must be >= 1");
        if (encoding.getMinConfidence() < 0.0 || encoding.getMinConfidence() > 1.0)
            throw new IllegalArgumentException("encoding.minConfidence must be within [0,1]");
        if (encoding.getCjkCandidates().isEmpty() || encoding.getDefaultCandidates().isEmpty())
            throw new IllegalArgumentException("encoding candidates must not be empty");

        for (String t : visibility.getNoiseTags()) {
            if (t == null || t.isBlank())
                throw new IllegalArgumentException("visibility.noiseTags entries must not be blank");
        }
        for (String css : visibility.getNoiseSelectors()) {
            if (css == null || css.isBlank())
                throw new IllegalArgumentException("visibility.noiseSelectors entries must not be blank");
        }
        for (String w : heading.getStopWords()) {
            if (w == null || w.codePointCount(0, w.length()) != 1)
                throw new IllegalArgumentException("heading.stopWords entries must be single characters: " + w);
        }
    }

    public static InspectConfig defaults() { return new InspectConfig(); }
}
