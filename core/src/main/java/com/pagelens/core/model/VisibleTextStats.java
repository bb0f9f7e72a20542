package com.pagelens.core.model;

/** 노이즈 제거 후 본문 텍스트 통계 */
public record VisibleTextStats(int charLength, int wordCount) {}
