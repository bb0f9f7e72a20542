package com.pagelens.core.analyzer;

import com.pagelens.core.api.PageDocument;
import com.pagelens.core.api.PageElement;
import com.pagelens.core.model.FieldResult;
import com.pagelens.core.model.FieldType;
import com.pagelens.core.model.Status;
import com.pagelens.core.util.UrlNormalizer;

import java.util.List;
import java.util.Locale;

/** &lt;link rel="canonical"&gt; 점검: 존재, href, 자기참조 여부 */
public final class CanonicalAnalyzer {

    public FieldResult analyze(PageDocument doc, String currentUrl) {
        FieldResult.Builder r = FieldResult.builder(FieldType.CANONICAL);

        List<PageElement> links = doc.withAttribute("link", "rel", CanonicalAnalyzer::isCanonicalRel);
        if (links.isEmpty()) {
            return r.status(Status.WARN).verdict(false)
                    .warn("No canonical link found; this may cause duplicate-content dilution.")
                    .info("Add a canonical link pointing to the authoritative URL of every page.")
                    .build();
        }

        String href = links.get(0).attr("href").orElse("").trim();
        if (href.isEmpty()) {
            return r.status(Status.FAIL).verdict(false)
                    .fail("Canonical link has an empty href.")
                    .build();
        }

        String canonical = UrlNormalizer.normalize(href);
        String current = UrlNormalizer.normalize(currentUrl);
        r.metric("href", href)
         .metric("normalizedCanonical", canonical)
         .metric("normalizedCurrent", current);

        if (canonical.equals(current)) {
            return r.status(Status.PASS).verdict(true)
                    .pass("Canonical is self-referencing (correct).")
                    .build();
        }
        return r.status(Status.WARN).verdict(false)
                .warn("Canonical points elsewhere; this page may not be the canonical version.")
                .info("Important pages should point to themselves as the canonical version.")
                .build();
    }

    /** rel은 공백 구분 토큰 목록 */
    static boolean isCanonicalRel(String rel) {
        if (rel == null) return false;
        for (String token : rel.trim().split("\\s+")) {
            if (token.toLowerCase(Locale.ROOT).equals("canonical")) return true;
        }
        return false;
    }
}
