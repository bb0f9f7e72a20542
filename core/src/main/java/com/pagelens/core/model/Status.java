package com.pagelens.core.model;

/** 필드 진단 판정 */
public enum Status {
    PASS,
    WARN,
    FAIL,
    INFO;

    /** 콘솔 렌더링용 아이콘 */
    public String icon() {
        switch (this) {
            case PASS: return "✅";
            case WARN: return "⚠️";
            case FAIL: return "❌";
            default:   return "ℹ️";
        }
    }
}
