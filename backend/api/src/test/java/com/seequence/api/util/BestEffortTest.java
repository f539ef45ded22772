package com.seequence.api.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BestEffortTest {

    @Test
    void attemptKeepsValueWhenSupplierSucceeds() {
        BestEffort<String> result = BestEffort.attempt("title", () -> "Water Cycle");

        assertThat(result.isPresent()).isTrue();
        assertThat(result.isFailed()).isFalse();
        assertThat(result.orElse("fallback")).isEqualTo("Water Cycle");
    }

    @Test
    void attemptRecordsFailureInsteadOfThrowing() {
        BestEffort<String> result = BestEffort.attempt("title", () -> {
            throw new IllegalStateException("model down");
        });

        assertThat(result.isPresent()).isFalse();
        assertThat(result.isFailed()).isTrue();
        assertThat(result.failureReason()).contains("IllegalStateException").contains("model down");
        assertThat(result.orElse(null)).isNull();
    }

    @Test
    void nullResultIsEmptyNotFailed() {
        BestEffort<String> result = BestEffort.attempt("summary", () -> null);

        assertThat(result.isPresent()).isFalse();
        assertThat(result.isFailed()).isFalse();
        assertThat(result.toOptional()).isEmpty();
    }

    @Test
    void mapPreservesFailureReason() {
        BestEffort<Integer> mapped = BestEffort.<String>failed("timeout").map(String::length);

        assertThat(mapped.isFailed()).isTrue();
        assertThat(mapped.failureReason()).isEqualTo("timeout");
        assertThat(BestEffort.of("abc").map(String::length).orElse(0)).isEqualTo(3);
    }
}
