package com.pagelens.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 단일 필드 분석 결과.
 * status는 WARN/FAIL 밴드, verdict는 필드별 "합격" 판정(밴드보다 엄격할 수 있음).
 */
public final class FieldResult {
    private final FieldType field;
    private final Status status;
    private final boolean verdict;
    private final Map<String, Object> metrics;   // 삽입 순서 유지
    private final List<Finding> findings;

    private FieldResult(Builder b) {
        this.field = b.field;
        this.status = b.status;
        this.verdict = b.verdict;
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(b.metrics));
        this.findings = List.copyOf(b.findings);
    }

    public FieldType getField() { return field; }
    public Status getStatus() { return status; }
    public boolean isVerdict() { return verdict; }
    public Map<String, Object> getMetrics() { return metrics; }
    public List<Finding> getFindings() { return findings; }

    /** 메트릭 조회 편의. 없으면 null. */
    public Object metric(String key) { return metrics.get(key); }

    /** 메시지 일부로 finding 존재 여부 확인 */
    public boolean hasFinding(String fragment) {
        if (fragment == null) return false;
        for (Finding f : findings) {
            if (f.getMessage().contains(fragment)) return true;
        }
        return false;
    }

    public static Builder builder(FieldType field) { return new Builder().field(field); }

    public static final class Builder {
        private FieldType field;
        private Status status;
        private boolean verdict;
        private final Map<String, Object> metrics = new LinkedHashMap<>();
        private final List<Finding> findings = new ArrayList<>();

        public Builder field(FieldType field) { this.field = field; return this; }
        public Builder status(Status status) { this.status = status; return this; }
        public Builder verdict(boolean verdict) { this.verdict = verdict; return this; }

        /** null 값은 기록하지 않음 */
        public Builder metric(String key, Object value) {
            if (key != null && value != null) metrics.put(key, value);
            return this;
        }

        public Builder finding(Finding f) {
            if (f != null) findings.add(f);
            return this;
        }

        public Builder pass(String msg) { return finding(Finding.pass(msg)); }
        public Builder warn(String msg) { return finding(Finding.warn(msg)); }
        public Builder fail(String msg) { return finding(Finding.fail(msg)); }
        public Builder info(String msg) { return finding(Finding.info(msg)); }

        public FieldResult build() {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(status, "status");
            return new FieldResult(this);
        }
    }
}
