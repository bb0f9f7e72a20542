package com.pagelens.core.analyzer;

import com.pagelens.core.api.PageDocument;
import com.pagelens.core.api.PageElement;
import com.pagelens.core.model.FieldResult;
import com.pagelens.core.model.InspectConfig;
import com.pagelens.core.model.Status;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.*;

class ContentVisibilityAssessorTest {

    private final ContentVisibilityAssessor assessor = ContentVisibilityAssessor.defaults();

    private static final String PARAGRAPH =
            "Server rendered pages put their main text directly into the initial HTML response body.";

    @Test
    void navigation_and_scripts_only_fail() {
        PageDocument doc = Docs.body("""
                <nav class="navbar"><a href="/">Home</a><a href="/news">News</a></nav>
                <script>window.__APP__ = {"data": "lots of inline state that is not visible"}</script>
                <div id="app"></div>
                """);
        FieldResult r = assessor.assess(doc);

        assertThat(r.getStatus()).isEqualTo(Status.FAIL);
        assertThat(r.isVerdict()).isFalse();
        assertThat((Integer) r.metric("charLength")).isLessThan(100);
    }

    @Test
    void article_with_paragraphs_passes() {
        PageDocument doc = Docs.body("<article><p>" + PARAGRAPH + "</p><p>" + PARAGRAPH + "</p></article>");
        FieldResult r = assessor.assess(doc);

        assertThat(r.getStatus()).isEqualTo(Status.PASS);
        assertThat(r.isVerdict()).isTrue();
        assertThat(r.metric("meaningfulParagraphs")).isEqualTo(2);
        assertThat(r.metric("hasContentStructure")).isEqualTo(true);
    }

    @Test
    void little_text_in_one_paragraph_warns_as_hybrid() {
        PageDocument doc = Docs.body("<div><p>" + PARAGRAPH + " " + PARAGRAPH + "</p></div>");
        FieldResult r = assessor.assess(doc);

        assertThat((Integer) r.metric("charLength")).isBetween(100, 299);
        assertThat(r.getStatus()).isEqualTo(Status.WARN);
        assertThat(r.isVerdict()).isFalse();
        assertThat(r.hasFinding("hybrid")).isTrue();
    }

    @Test
    void enough_text_without_structure_needs_further_check() {
        String text = "word ".repeat(80);
        FieldResult r = assessor.assess(Docs.body("<div>" + text + "</div>"));

        assertThat((Integer) r.metric("charLength")).isGreaterThanOrEqualTo(300);
        assertThat(r.hasFinding("Needs further check")).isTrue();
        assertThat(r.getStatus()).isEqualTo(Status.PASS);
        assertThat(r.isVerdict()).isTrue();
    }

    @Test
    void content_class_counts_as_structure() {
        String text = "word ".repeat(80);
        FieldResult r = assessor.assess(Docs.body("<div class=\"Post-Body\">" + text + "</div>"));
        assertThat(r.metric("hasContentStructure")).isEqualTo(true);
        assertThat(r.hasFinding("server-rendered")).isTrue();
    }

    @Test
    void noise_selectors_are_excluded_from_the_count() {
        String filler = "menu entry ".repeat(40);
        FieldResult r = assessor.assess(Docs.body("<div class=\"sidebar\">" + filler + "</div><p>tiny</p>"));
        assertThat((Integer) r.metric("charLength")).isLessThan(100);
    }

    @Test
    void assessment_does_not_mutate_the_document() {
        PageDocument doc = Docs.body("<nav>links</nav><script>var a;</script><p>" + PARAGRAPH + "</p>");
        String before = doc.body().orElseThrow().text();

        assessor.assess(doc);

        assertThat(doc.all("nav")).hasSize(1);
        assertThat(doc.all("script")).hasSize(1);
        assertThat(doc.body().orElseThrow().text()).isEqualTo(before);
    }

    @Test
    void body_matching_a_noise_selector_counts_as_empty() {
        PageDocument doc = Docs.html("<html><head></head><body class=\"header\"><p>" + PARAGRAPH + "</p></body></html>");
        FieldResult r = assessor.assess(doc);

        assertThat(r.metric("charLength")).isEqualTo(0);
        assertThat(r.getStatus()).isEqualTo(Status.FAIL);
        assertThat(doc.body().orElseThrow().text()).isEqualTo(PARAGRAPH);
    }

    @Test
    void custom_noise_configuration_is_honoured() {
        InspectConfig.VisibilityCfg cfg = new InspectConfig.VisibilityCfg()
                .setNoiseTags(List.of())
                .setNoiseSelectors(List.of());
        ContentVisibilityAssessor keepAll = new ContentVisibilityAssessor(cfg);

        String nav = "<nav>" + "navigation ".repeat(20) + "</nav>";
        assertThat((Integer) keepAll.assess(Docs.body(nav)).metric("charLength")).isGreaterThan(100);
        assertThat((Integer) assessor.assess(Docs.body(nav)).metric("charLength")).isZero();
    }

    @Test
    void document_without_body_fails() {
        FieldResult r = assessor.assess(new NoBodyDocument());
        assertThat(r.getStatus()).isEqualTo(Status.FAIL);
        assertThat(r.isVerdict()).isFalse();
        assertThat(r.metric("charLength")).isEqualTo(0);
        assertThat(r.hasFinding("No <body>")).isTrue();
    }

    /** frameset 문서처럼 body가 없는 경우 */
    static final class NoBodyDocument implements PageDocument {
        @Override public Optional<PageElement> first(String tag) { return Optional.empty(); }
        @Override public List<PageElement> all(String tag) { return List.of(); }
        @Override public List<PageElement> select(String cssQuery) { return List.of(); }
        @Override public List<PageElement> withAttribute(String tag, String attr, Predicate<String> valueTest) { return List.of(); }
        @Override public Optional<PageElement> body() { return Optional.empty(); }
    }
}
