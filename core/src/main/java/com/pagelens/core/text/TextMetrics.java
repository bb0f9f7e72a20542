package com.pagelens.core.text;

/** 길이/잘라내기 공용 헬퍼 (코드 포인트 기준) */
public final class TextMetrics {
    private TextMetrics() {}

    public static int length(String s) {
        return (s == null) ? 0 : s.codePointCount(0, s.length());
    }

    /** 앞에서 max 코드 포인트까지 */
    public static String truncate(String s, int max) {
        if (s == null) return "";
        if (length(s) <= max) return s;
        return s.substring(0, s.offsetByCodePoints(0, max));
    }

    /** 공백 기준 단어 수 */
    public static int wordCount(String s) {
        if (s == null || s.isBlank()) return 0;
        return s.trim().split("\\s+").length;
    }
}
