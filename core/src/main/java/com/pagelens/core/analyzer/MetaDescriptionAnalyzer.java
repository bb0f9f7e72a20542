package com.pagelens.core.analyzer;

import com.pagelens.core.api.PageDocument;
import com.pagelens.core.api.PageElement;
import com.pagelens.core.model.FieldResult;
import com.pagelens.core.model.FieldType;
import com.pagelens.core.model.LanguageProfile;
import com.pagelens.core.model.Status;
import com.pagelens.core.text.LanguageProfiler;
import com.pagelens.core.text.TextMetrics;

import java.util.List;

/**
 * &lt;meta name="description"&gt; 점검.
 * verdict 범위(CJK 100~200, Latin 140~180)는 WARN/FAIL 밴드보다 좁다: 경계 길이도 표시하기 위함.
 */
public final class MetaDescriptionAnalyzer {

    private static final int PREVIEW_CHARS = 100;

    public FieldResult analyze(PageDocument doc) {
        FieldResult.Builder r = FieldResult.builder(FieldType.META_DESCRIPTION);

        List<PageElement> metas = doc.withAttribute("meta", "name",
                v -> v.trim().equalsIgnoreCase("description"));
        if (metas.isEmpty()) {
            return r.status(Status.FAIL).verdict(false)
                    .fail("No meta description tag found.")
                    .info("Search engines will pick a snippet from the page; the result listing cannot be controlled.")
                    .build();
        }

        String content = metas.get(0).attr("content").orElse("").trim();
        if (content.isEmpty()) {
            return r.status(Status.WARN).verdict(false)
                    .metric("length", 0)
                    .warn("Meta description content is empty.")
                    .info("Add a meaningful description that invites users to click.")
                    .build();
        }

        int length = TextMetrics.length(content);
        LanguageProfile lang = LanguageProfiler.profile(content, LanguageProfiler.DESCRIPTION_THRESHOLD);
        boolean cjk = lang.isCjk();

        String preview = TextMetrics.truncate(content, PREVIEW_CHARS) + (length > PREVIEW_CHARS ? "..." : "");
        r.metric("content", preview)
         .metric("length", length)
         .metric("language", lang.dominant().name())
         .metric("cjkRatio", TitleAnalyzer.round2(lang.ratio()))
         .metric("recommended", cjk ? "120-160" : "150-160");

        Status status;
        if (cjk) {
            if (length < 50) {
                status = Status.FAIL;
                r.fail("Too short (" + length + " chars) - recommend at least 80 characters.");
            } else if (length < 100) {
                status = Status.WARN;
                r.warn("Slightly short (" + length + " chars) - recommend 120-160 characters.");
            } else if (length > 200) {
                status = Status.WARN;
                r.warn("Too long (" + length + " chars) - recommend at most 200 characters.");
            } else {
                status = Status.PASS;
                r.pass("Length is appropriate for a CJK page.");
            }
        } else {
            if (length < 120) {
                status = Status.FAIL;
                r.fail("Too short (" + length + " chars) - recommend at least 120 characters.");
            } else if (length < 140) {
                status = Status.WARN;
                r.warn("Slightly short (" + length + " chars) - recommend 150-160 characters.");
            } else if (length > 180) {
                status = Status.WARN;
                r.warn("Too long (" + length + " chars) - recommend at most 180 characters.");
            } else {
                status = Status.PASS;
                r.pass("Length is appropriate for a Latin page.");
            }
        }
        r.info("The description should contain keywords, invite clicks and not repeat the title.");

        boolean verdict = cjk ? (length >= 100 && length <= 200) : (length >= 140 && length <= 180);
        return r.status(status).verdict(verdict).build();
    }
}
