package com.pagelens.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FieldResultTest {

    @Test
    void builder_keeps_metric_order_and_skips_nulls() {
        FieldResult r = FieldResult.builder(FieldType.TITLE)
                .status(Status.WARN)
                .metric("title", "Hello")
                .metric("length", 5)
                .metric("ignored", null)
                .warn("Slightly short")
                .info("hint")
                .build();

        assertThat(r.getMetrics().keySet()).containsExactly("title", "length");
        assertThat(r.metric("length")).isEqualTo(5);
        assertThat(r.getFindings()).extracting(Finding::getLevel).containsExactly(Status.WARN, Status.INFO);
        assertThat(r.hasFinding("short")).isTrue();
        assertThat(r.isVerdict()).isFalse();
    }

    @Test
    void status_is_required() {
        assertThatThrownBy(() -> FieldResult.builder(FieldType.H1).build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void results_are_immutable() {
        FieldResult r = FieldResult.builder(FieldType.H1).status(Status.PASS).pass("ok").build();
        assertThatThrownBy(() -> r.getMetrics().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> r.getFindings().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
