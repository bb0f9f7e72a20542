package com.pagelens.core.analyzer;

import com.pagelens.core.model.FieldResult;
import com.pagelens.core.model.Status;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TitleAnalyzerTest {

    private final TitleAnalyzer analyzer = new TitleAnalyzer();

    @Test
    void missing_title_fails() {
        FieldResult r = analyzer.analyze(Docs.head("<meta charset='utf-8'>"));
        assertThat(r.getStatus()).isEqualTo(Status.FAIL);
        assertThat(r.isVerdict()).isFalse();
        assertThat(r.hasFinding("No <title>")).isTrue();
    }

    @Test
    void short_latin_title_fails() {
        FieldResult r = analyzer.analyze(Docs.head("<title>Short</title>"));
        assertThat(r.getStatus()).isEqualTo(Status.FAIL);
        assertThat(r.metric("length")).isEqualTo(5);
        assertThat(r.metric("language")).isEqualTo("LATIN");
        assertThat(r.isVerdict()).isFalse();
    }

    @Test
    void thirty_chinese_characters_pass() {
        String title = "搜索引擎优化".repeat(5);
        FieldResult r = analyzer.analyze(Docs.head("<title>" + title + "</title>"));

        assertThat(r.getStatus()).isEqualTo(Status.PASS);
        assertThat(r.metric("length")).isEqualTo(30);
        assertThat(r.metric("language")).isEqualTo("CJK");
        assertThat(r.metric("cjkRatio")).isEqualTo(1.0);
        assertThat(r.metric("recommended")).isEqualTo("30-50");
        assertThat(r.isVerdict()).isTrue();
    }

    @Test
    void chinese_bands_differ_from_latin_bands() {
        // 20자: CJK 기준 WARN(15~29), Latin 기준이었다면 FAIL
        FieldResult cjk = analyzer.analyze(Docs.head("<title>" + "网页标题".repeat(5) + "</title>"));
        assertThat(cjk.getStatus()).isEqualTo(Status.WARN);

        FieldResult latin = analyzer.analyze(Docs.head("<title>" + "a".repeat(20) + "</title>"));
        assertThat(latin.getStatus()).isEqualTo(Status.FAIL);
    }

    @Test
    void latin_title_in_recommended_range_passes() {
        String title = "PageLens - SEO heuristics for server-rendered pages";
        FieldResult r = analyzer.analyze(Docs.head("<title>" + title + "</title>"));
        assertThat(r.metric("length")).isEqualTo(title.length());
        assertThat(r.getStatus()).isEqualTo(Status.PASS);
        assertThat(r.isVerdict()).isTrue();
    }

    @Test
    void too_long_title_warns_and_verdict_follows_30_to_70() {
        FieldResult r = analyzer.analyze(Docs.head("<title>" + "x".repeat(68) + "</title>"));
        assertThat(r.getStatus()).isEqualTo(Status.WARN);
        assertThat(r.isVerdict()).isTrue();

        FieldResult over = analyzer.analyze(Docs.head("<title>" + "x".repeat(71) + "</title>"));
        assertThat(over.isVerdict()).isFalse();
    }

    @Test
    void title_is_trimmed() {
        assertThat(TitleAnalyzer.extractTitle(Docs.head("<title>  Hello  </title>"))).contains("Hello");
    }
}
