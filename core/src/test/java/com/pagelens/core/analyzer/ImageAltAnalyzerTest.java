package com.pagelens.core.analyzer;

import com.pagelens.core.model.FieldResult;
import com.pagelens.core.model.Status;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ImageAltAnalyzerTest {

    private final ImageAltAnalyzer analyzer = new ImageAltAnalyzer();

    private static String images(int withAlt, int withoutAlt) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < withAlt; i++) sb.append("<img src=\"/ok").append(i).append(".png\" alt=\"pic\">");
        for (int i = 0; i < withoutAlt; i++) sb.append("<img src=\"/missing").append(i).append(".png\">");
        return sb.toString();
    }

    @Test
    void no_images_is_informational_and_passes_verdict() {
        FieldResult r = analyzer.analyze(Docs.body("<p>text</p>"));
        assertThat(r.getStatus()).isEqualTo(Status.INFO);
        assertThat(r.isVerdict()).isTrue();
        assertThat(r.metric("total")).isEqualTo(0);
    }

    @Test
    void all_alts_present_passes() {
        FieldResult r = analyzer.analyze(Docs.body(images(3, 0)));
        assertThat(r.getStatus()).isEqualTo(Status.PASS);
        assertThat(r.metric("severity")).isEqualTo("none");
        assertThat(r.isVerdict()).isTrue();
    }

    @Test
    void one_in_ten_is_minor() {
        FieldResult r = analyzer.analyze(Docs.body(images(9, 1)));
        assertThat(r.getStatus()).isEqualTo(Status.WARN);
        assertThat(r.metric("severity")).isEqualTo("minor");
        assertThat(r.metric("missingPercent")).isEqualTo(10.0);
        assertThat(r.isVerdict()).isFalse();
    }

    @Test
    void exactly_twenty_percent_is_moderate() {
        FieldResult r = analyzer.analyze(Docs.body(images(4, 1)));
        assertThat(r.getStatus()).isEqualTo(Status.WARN);
        assertThat(r.metric("severity")).isEqualTo("moderate");
    }

    @Test
    void half_or_more_missing_fails() {
        FieldResult r = analyzer.analyze(Docs.body(images(1, 2)));
        assertThat(r.getStatus()).isEqualTo(Status.FAIL);
        assertThat(r.metric("severity")).isEqualTo("severe");
        assertThat(r.metric("missingPercent")).isEqualTo(66.7);
    }

    @Test
    void empty_alt_counts_as_missing_and_examples_are_capped() {
        String html = "<img alt=\"\" src=\"/a.png\"><img>" + images(0, 6);
        FieldResult r = analyzer.analyze(Docs.body(html));

        assertThat(r.metric("missing")).isEqualTo(8);
        assertThat(r.hasFinding("src='/a.png'")).isTrue();
        assertThat(r.hasFinding("(no src)")).isTrue();
        assertThat(r.getFindings().stream().filter(f -> f.getMessage().contains("without alt")).count())
                .isEqualTo(5);
    }

    @Test
    void long_src_is_truncated() {
        String src = "/" + "p".repeat(80) + ".png";
        FieldResult r = analyzer.analyze(Docs.body("<img src=\"" + src + "\">"));
        assertThat(r.hasFinding("src='" + src.substring(0, 50) + "'")).isTrue();
    }
}
