package com.pagelens.core.analyzer;

import com.pagelens.core.api.PageDocument;
import com.pagelens.core.api.PageElement;
import com.pagelens.core.model.FieldResult;
import com.pagelens.core.model.FieldType;
import com.pagelens.core.model.InspectConfig;
import com.pagelens.core.model.Status;
import com.pagelens.core.model.VisibleTextStats;
import com.pagelens.core.text.TextMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * 초기 HTML 콘텐츠 가시성(반 CSR 위험) 점검.
 * - body의 독립 복사본에서 스크립트/내비/폼 등 노이즈를 제거한 뒤 남은 텍스트를 잰다.
 * - 의미 있는 단락/콘텐츠 구조 신호는 원본 body 기준.
 * - 호출자의 문서는 절대 변경하지 않는다.
 */
public final class ContentVisibilityAssessor {

    private static final Logger LOG = LoggerFactory.getLogger(ContentVisibilityAssessor.class);

    static final int MIN_TEXT = 100;
    static final int HYBRID_TEXT = 300;
    static final int BORDERLINE_TEXT = 200;
    static final int MEANINGFUL_PARAGRAPH = 50;
    static final int MIN_PARAGRAPHS = 2;

    private static final List<String> CONTENT_TAGS = List.of("article", "main");
    private static final List<String> CONTENT_CLASS_TOKENS = List.of("content", "post", "article", "main", "entry");

    private final List<String> noiseTags;
    private final List<String> noiseSelectors;

    public ContentVisibilityAssessor(InspectConfig.VisibilityCfg cfg) {
        Objects.requireNonNull(cfg, "cfg");
        this.noiseTags = List.copyOf(cfg.getNoiseTags());
        this.noiseSelectors = List.copyOf(cfg.getNoiseSelectors());
    }

    public static ContentVisibilityAssessor defaults() {
        return new ContentVisibilityAssessor(new InspectConfig.VisibilityCfg());
    }

    public FieldResult assess(PageDocument doc) {
        FieldResult.Builder r = FieldResult.builder(FieldType.CONTENT_VISIBILITY);

        Optional<PageElement> maybeBody = doc.body();
        if (maybeBody.isEmpty()) {
            return r.status(Status.FAIL).verdict(false)
                    .metric("charLength", 0)
                    .metric("wordCount", 0)
                    .fail("No <body> element found.")
                    .build();
        }
        PageElement body = maybeBody.get();

        VisibleTextStats stats = measure(body);
        int paragraphs = countMeaningfulParagraphs(body);
        boolean structure = hasContentStructure(body);
        LOG.debug("Visible text: chars={}, words={}, paragraphs={}, structure={}",
                stats.charLength(), stats.wordCount(), paragraphs, structure);

        r.metric("charLength", stats.charLength())
         .metric("wordCount", stats.wordCount())
         .metric("meaningfulParagraphs", paragraphs)
         .metric("hasContentStructure", structure);

        int chars = stats.charLength();
        if (chars < MIN_TEXT) {
            return r.status(Status.FAIL).verdict(false)
                    .fail("Very little text in the initial HTML: high render-dependency risk.")
                    .info("The page very likely depends on client-side JavaScript rendering (CSR); crawlers may miss most content.")
                    .info("Put the core content directly into the initial HTML.")
                    .build();
        }
        if (chars < HYBRID_TEXT && paragraphs < MIN_PARAGRAPHS) {
            return r.status(Status.WARN).verdict(false)
                    .warn("Initial HTML content may be insufficient: possible hybrid rendering.")
                    .info("Core content may be loaded by JavaScript; keep at least part of it in the initial HTML.")
                    .build();
        }
        if (structure || paragraphs >= MIN_PARAGRAPHS) {
            return r.status(Status.PASS).verdict(true)
                    .pass("Initial HTML contains substantive content: content likely server-rendered.")
                    .build();
        }
        boolean acceptable = chars >= BORDERLINE_TEXT;
        return r.status(acceptable ? Status.PASS : Status.WARN).verdict(acceptable)
                .warn("Needs further check: initial content is present, but more may be loaded by JavaScript.")
                .info("For important pages, keep the core content directly in the HTML.")
                .build();
    }

    /** 노이즈 제거 후 가시 텍스트 통계. body는 복사본에서만 변경. */
    public VisibleTextStats measure(PageElement body) {
        PageElement work = body.isolatedCopy();
        for (String tag : noiseTags) {
            for (PageElement e : work.all(tag)) e.detach();
        }
        for (String css : noiseSelectors) {
            for (PageElement e : work.select(css)) e.detach();
        }
        String text = work.text();
        return new VisibleTextStats(TextMetrics.length(text), TextMetrics.wordCount(text));
    }

    static int countMeaningfulParagraphs(PageElement body) {
        int n = 0;
        for (PageElement p : body.all("p")) {
            if (TextMetrics.length(p.text().trim()) > MEANINGFUL_PARAGRAPH) n++;
        }
        return n;
    }

    static boolean hasContentStructure(PageElement body) {
        for (String tag : CONTENT_TAGS) {
            if (!body.all(tag).isEmpty()) return true;
        }
        for (PageElement e : body.select("[class]")) {
            String cls = e.attr("class").orElse("").toLowerCase(Locale.ROOT);
            for (String token : CONTENT_CLASS_TOKENS) {
                if (cls.contains(token)) return true;
            }
        }
        return false;
    }
}
