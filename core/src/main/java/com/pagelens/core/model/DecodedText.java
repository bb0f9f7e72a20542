package com.pagelens.core.model;

import java.util.Objects;

/** 디코딩된 문서 텍스트 + 어떤 charset/단계로 얻었는지 */
public final class DecodedText {
    private final String text;
    private final String charset;
    private final DecodeStage stage;

    public DecodedText(String text, String charset, DecodeStage stage) {
        this.text = (text == null) ? "" : text;
        this.charset = Objects.requireNonNull(charset, "charset");
        this.stage = Objects.requireNonNull(stage, "stage");
    }

    public String getText() { return text; }
    public String getCharset() { return charset; }
    public DecodeStage getStage() { return stage; }

    /** 선언/감지 결과를 그대로 쓰지 못하고 대체 경로로 내려갔는지 */
    public boolean isDegraded() {
        return stage != DecodeStage.DECLARED && stage != DecodeStage.DETECTED;
    }

    @Override
    public String toString() {
        return "DecodedText{charset=" + charset + ", stage=" + stage + ", length=" + text.length() + "}";
    }
}
