package com.pagelens.core.model;

/** 점검 대상 필드 (리포트 출력 순서와 동일) */
public enum FieldType {
    CONTENT_VISIBILITY("Initial content visibility"),
    TITLE("Page title"),
    META_DESCRIPTION("Meta description"),
    H1("H1 heading"),
    IMAGE_ALT("Image alt text"),
    CANONICAL("Canonical link");

    private final String label;

    FieldType(String label) { this.label = label; }

    public String label() { return label; }
}
