package com.pagelens.core.analyzer;

import com.pagelens.core.api.PageDocument;
import com.pagelens.core.api.PageElement;
import com.pagelens.core.model.FieldResult;
import com.pagelens.core.model.FieldType;
import com.pagelens.core.model.InspectConfig;
import com.pagelens.core.model.Status;
import com.pagelens.core.text.TextMetrics;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * H1 점검: 개수, 각 H1 길이, 첫 H1과 title의 관련성.
 * 판정은 "H1이 정확히 하나"만으로 결정되고, 관련성은 참고용 finding이다.
 */
public final class HeadingAnalyzer {

    static final int SHORT_H1 = 10;
    static final int LONG_H1 = 100;
    static final int MIN_PHRASE = 2;

    /** title과 첫 H1의 관계 */
    public enum Relation { IDENTICAL, CONTAINS, RELATED, WEAK, SKIPPED }

    private final Set<Integer> stopChars;

    public HeadingAnalyzer(InspectConfig.HeadingCfg cfg) {
        Objects.requireNonNull(cfg, "cfg");
        Set<Integer> s = new HashSet<>();
        for (String w : cfg.getStopWords()) w.codePoints().forEach(s::add);
        this.stopChars = Set.copyOf(s);
    }

    public static HeadingAnalyzer defaults() {
        return new HeadingAnalyzer(new InspectConfig.HeadingCfg());
    }

    /** @param pageTitle TitleAnalyzer가 추출한 제목 (없으면 빈 문자열/null) */
    public FieldResult analyze(PageDocument doc, String pageTitle) {
        FieldResult.Builder r = FieldResult.builder(FieldType.H1);
        String title = (pageTitle == null) ? "" : pageTitle.trim();

        List<PageElement> h1s = doc.all("h1");
        int count = h1s.size();
        r.metric("count", count);

        if (count == 0) {
            return r.status(Status.FAIL).verdict(false)
                    .fail("No H1 element found.")
                    .info("Search engines have a harder time determining the page's core topic.")
                    .info("Use exactly one H1 per page; it should roughly match the page title.")
                    .build();
        }

        List<String> texts = new ArrayList<>(count);
        int i = 1;
        for (PageElement h1 : h1s) {
            String text = h1.text().trim();
            texts.add(text);
            int len = TextMetrics.length(text);
            String label = "H1-" + i++ + " \"" + text + "\" (" + len + " chars)";
            if (len == 0) {
                r.fail(label + ": empty.");
            } else if (len < SHORT_H1) {
                r.warn(label + ": possibly too short.");
            } else if (len > LONG_H1) {
                r.warn(label + ": possibly too long.");
            } else {
                r.pass(label + ": length OK.");
            }
        }

        if (count > 1) {
            r.warn("Found " + count + " H1 elements; expect exactly one main heading per page.");
        }

        String primary = texts.get(0);
        r.metric("primary", primary);
        Relation rel = relate(primary, title, r);
        r.metric("relation", rel.name());

        return r.status(count == 1 ? Status.PASS : Status.WARN)
                .verdict(count == 1)
                .build();
    }

    /** title과 첫 H1 관계 판정 + finding 기록 */
    Relation relate(String h1, String title, FieldResult.Builder r) {
        if (title.isEmpty()) return Relation.SKIPPED;

        if (h1.equals(title)) {
            r.warn("H1 and title are identical: acceptable, but consider a variation to cover more keywords.");
            return Relation.IDENTICAL;
        }
        if (title.contains(h1) || h1.contains(title)) {
            r.pass("H1 and title are in a containment relation.");
            return Relation.CONTAINS;
        }

        String[] shared = sharedPhrase(keyPhrases(h1), keyPhrases(title));
        if (shared != null) {
            r.pass("H1 and title are close in meaning (shared '" + shared[0] + "'/'" + shared[1] + "').");
            return Relation.RELATED;
        }
        r.warn("Weak relation between H1 and title; the H1 should roughly match the title's meaning.");
        return Relation.WEAK;
    }

    /**
     * 문자 단위 후보 구문: 불용 문자를 뺀 시퀀스에서 앞 3개, 그리고(5개 이상이면) 3~5번째.
     * 형태소 분석 없이 의도적으로 단순하게 유지.
     */
    List<String> keyPhrases(String text) {
        int[] chars = text.codePoints().filter(cp -> !stopChars.contains(cp)).toArray();
        List<String> phrases = new ArrayList<>(2);
        if (chars.length > 2) {
            phrases.add(new String(chars, 0, Math.min(3, chars.length)));
        }
        if (chars.length > 4) {
            phrases.add(new String(chars, 2, Math.min(5, chars.length) - 2));
        }
        return phrases;
    }

    /** 한쪽 구문이 다른 쪽 구문에 포함되면 [h1Phrase, titlePhrase], 없으면 null */
    static String[] sharedPhrase(List<String> h1Phrases, List<String> titlePhrases) {
        for (String a : h1Phrases) {
            for (String b : titlePhrases) {
                if (TextMetrics.length(a) < MIN_PHRASE || TextMetrics.length(b) < MIN_PHRASE) continue;
                if (b.contains(a) || a.contains(b)) return new String[]{a, b};
            }
        }
        return null;
    }
}
