package com.pagelens.core.text;

import com.pagelens.core.model.LanguageProfile;
import com.pagelens.core.model.LanguageProfile.Dominant;

/**
 * CJK(한자) 비율로 텍스트의 지배 언어를 판정.
 * 짧은 제목은 1/2, 구두점/영문이 섞이기 쉬운 설명문은 1/3 기준을 쓴다.
 */
public final class LanguageProfiler {
    private LanguageProfiler() {}

    public static final double TITLE_THRESHOLD = 1.0 / 2.0;
    public static final double DESCRIPTION_THRESHOLD = 1.0 / 3.0;

    private static final int CJK_FIRST = 0x4E00;
    private static final int CJK_LAST  = 0x9FFF;

    /** cjkCount > length * threshold 이면 CJK. 빈 문자열은 ratio 0, LATIN. */
    public static LanguageProfile profile(String text, double threshold) {
        if (text == null || text.isEmpty()) {
            return new LanguageProfile(Dominant.LATIN, 0.0, 0, 0);
        }
        int length = TextMetrics.length(text);
        int cjk = countCjk(text);
        double ratio = (double) cjk / length;
        Dominant d = (cjk > length * threshold) ? Dominant.CJK : Dominant.LATIN;
        return new LanguageProfile(d, ratio, cjk, length);
    }

    public static int countCjk(String text) {
        if (text == null) return 0;
        return (int) text.codePoints().filter(LanguageProfiler::isCjk).count();
    }

    public static boolean isCjk(int codePoint) {
        return codePoint >= CJK_FIRST && codePoint <= CJK_LAST;
    }
}
