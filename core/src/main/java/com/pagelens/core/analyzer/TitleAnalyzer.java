package com.pagelens.core.analyzer;

import com.pagelens.core.api.PageDocument;
import com.pagelens.core.api.PageElement;
import com.pagelens.core.model.FieldResult;
import com.pagelens.core.model.FieldType;
import com.pagelens.core.model.LanguageProfile;
import com.pagelens.core.model.Status;
import com.pagelens.core.text.LanguageProfiler;
import com.pagelens.core.text.TextMetrics;

import java.util.Optional;

/** &lt;title&gt; 존재/길이 점검. 중국어 우세 여부에 따라 기준이 달라진다. */
public final class TitleAnalyzer {

    /** 언어별 길이 밴드: FAIL 미만, WARN 미만, WARN 초과 */
    private static final Bands CJK   = new Bands(15, 30, 70, 20, "30-50");
    private static final Bands LATIN = new Bands(30, 50, 65, 30, "50-60");

    static final int VERDICT_MIN = 30;
    static final int VERDICT_MAX = 70;

    /** 트림된 제목 텍스트. title 요소가 없으면 empty. */
    public static Optional<String> extractTitle(PageDocument doc) {
        return doc.first("title").map(PageElement::text).map(String::trim);
    }

    public FieldResult analyze(PageDocument doc) {
        FieldResult.Builder r = FieldResult.builder(FieldType.TITLE);

        Optional<String> maybeTitle = extractTitle(doc);
        if (maybeTitle.isEmpty()) {
            return r.status(Status.FAIL).verdict(false)
                    .fail("No <title> element found.")
                    .info("Search engines cannot determine the page topic; this seriously hurts ranking.")
                    .build();
        }

        String title = maybeTitle.get();
        int length = TextMetrics.length(title);
        LanguageProfile lang = LanguageProfiler.profile(title, LanguageProfiler.TITLE_THRESHOLD);
        Bands b = lang.isCjk() ? CJK : LATIN;

        r.metric("title", title)
         .metric("length", length)
         .metric("language", lang.dominant().name())
         .metric("cjkRatio", round2(lang.ratio()))
         .metric("recommended", b.recommended);

        Status status;
        if (length < b.failBelow) {
            status = Status.FAIL;
            r.fail("Too short (" + length + " chars) - recommend at least " + b.minAdvice + " characters.");
        } else if (length < b.warnBelow) {
            status = Status.WARN;
            r.warn("Slightly short (" + length + " chars) - recommend " + b.recommended + " characters.");
        } else if (length > b.warnAbove) {
            status = Status.WARN;
            r.warn("Too long (" + length + " chars) - recommend at most " + b.warnAbove + " characters.");
        } else {
            status = Status.PASS;
            r.pass("Length is appropriate for a " + (lang.isCjk() ? "CJK" : "Latin") + " page.");
        }
        r.info("Make sure the title carries the core keywords and invites clicks.");

        return r.status(status)
                .verdict(length >= VERDICT_MIN && length <= VERDICT_MAX)
                .build();
    }

    static double round2(double v) { return Math.round(v * 100.0) / 100.0; }

    private static final class Bands {
        final int failBelow;
        final int warnBelow;
        final int warnAbove;
        final int minAdvice;       // 안내 문구용 최소 길이
        final String recommended;

        Bands(int failBelow, int warnBelow, int warnAbove, int minAdvice, String recommended) {
            this.failBelow = failBelow;
            this.warnBelow = warnBelow;
            this.warnAbove = warnAbove;
            this.minAdvice = minAdvice;
            this.recommended = recommended;
        }
    }
}
