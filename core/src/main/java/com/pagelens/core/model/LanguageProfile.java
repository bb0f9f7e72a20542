package com.pagelens.core.model;

/** 텍스트 구간의 지배 언어 판정 결과 */
public record LanguageProfile(Dominant dominant, double ratio, int cjkCount, int length) {

    public enum Dominant { CJK, LATIN }

    public boolean isCjk() { return dominant == Dominant.CJK; }
}
