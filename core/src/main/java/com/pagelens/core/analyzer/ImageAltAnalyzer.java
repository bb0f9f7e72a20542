package com.pagelens.core.analyzer;

import com.pagelens.core.api.PageDocument;
import com.pagelens.core.api.PageElement;
import com.pagelens.core.model.FieldResult;
import com.pagelens.core.model.FieldType;
import com.pagelens.core.model.Status;
import com.pagelens.core.text.TextMetrics;

import java.util.ArrayList;
import java.util.List;

/** &lt;img&gt; alt 누락 비율 점검. 이미지가 없으면 결함이 아니라 INFO. */
public final class ImageAltAnalyzer {

    static final int MAX_EXAMPLES = 5;
    static final int SRC_PREVIEW = 50;
    static final double MINOR_BELOW = 20.0;
    static final double MODERATE_BELOW = 50.0;

    public FieldResult analyze(PageDocument doc) {
        FieldResult.Builder r = FieldResult.builder(FieldType.IMAGE_ALT);

        List<PageElement> images = doc.all("img");
        int total = images.size();
        r.metric("total", total);

        if (total == 0) {
            return r.status(Status.INFO).verdict(true)
                    .metric("missing", 0)
                    .info("No images on the page.")
                    .info("Relevant images can improve user experience.")
                    .build();
        }

        List<PageElement> missing = new ArrayList<>();
        for (PageElement img : images) {
            // 빈 문자열 alt도 누락으로 본다
            if (img.attr("alt").orElse("").isEmpty()) missing.add(img);
        }
        int missingCount = missing.size();
        double percent = missingCount * 100.0 / total;

        r.metric("missing", missingCount)
         .metric("missingPercent", Math.round(percent * 10.0) / 10.0);

        Status status;
        String severity;
        if (missingCount == 0) {
            status = Status.PASS;
            severity = "none";
            r.pass("All images have alt text; this helps search engines and accessibility.");
        } else if (percent < MINOR_BELOW) {
            status = Status.WARN;
            severity = "minor";
            r.warn("A few images are missing alt text.");
        } else if (percent < MODERATE_BELOW) {
            status = Status.WARN;
            severity = "moderate";
            r.warn("Many images are missing alt text; search engines cannot understand their content.");
            r.info("Prioritise alt text for images that carry core content.");
        } else {
            status = Status.FAIL;
            severity = "severe";
            r.fail("More than half of the images are missing alt text.");
            r.info("Image meaning is lost for crawlers and screen-reader users, and image-search traffic is missed.");
        }
        r.metric("severity", severity);

        int shown = Math.min(MAX_EXAMPLES, missingCount);
        for (int i = 0; i < shown; i++) {
            String src = missing.get(i).attr("src").orElse("(no src)");
            r.info("Image " + (i + 1) + " without alt: src='" + TextMetrics.truncate(src, SRC_PREVIEW) + "'");
        }

        return r.status(status).verdict(missingCount == 0).build();
    }
}
