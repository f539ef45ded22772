package com.seequence.api.util;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 실패해도 파이프라인을 멈추지 않는 부가 계산 결과 (전체 요약, 제목, 핵심 사실)
 * 값 또는 실패 사유 중 하나를 가진다. 호출자는 orElse 로 꺼내 쓴다.
 */
@Slf4j
public final class BestEffort<T> {

    private static final BestEffort<?> EMPTY = new BestEffort<>(null, null);

    private final T value;
    private final String failureReason;

    private BestEffort(T value, String failureReason) {
        this.value = value;
        this.failureReason = failureReason;
    }

    public static <T> BestEffort<T> of(T value) {
        return new BestEffort<>(Objects.requireNonNull(value), null);
    }

    @SuppressWarnings("unchecked")
    public static <T> BestEffort<T> empty() {
        return (BestEffort<T>) EMPTY;
    }

    public static <T> BestEffort<T> failed(String reason) {
        return new BestEffort<>(null, reason == null ? "unknown" : reason);
    }

    /**
     * supplier 실행. 예외와 null 결과는 실패/빈 값으로 바꾼다.
     * @param label 로그용 이름
     */
    public static <T> BestEffort<T> attempt(String label, Supplier<T> supplier) {
        try {
            T result = supplier.get();
            return result == null ? empty() : of(result);
        } catch (RuntimeException e) {
            log.warn("[BEST-EFFORT] {} failed, continuing without it: {}", label, e.getMessage());
            return failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public boolean isPresent() {
        return value != null;
    }

    public boolean isFailed() {
        return failureReason != null;
    }

    public String failureReason() {
        return failureReason;
    }

    public T orElse(T other) {
        return value != null ? value : other;
    }

    public <R> BestEffort<R> map(Function<? super T, ? extends R> mapper) {
        if (value == null) {
            return failureReason == null ? empty() : failed(failureReason);
        }
        R mapped = mapper.apply(value);
        return mapped == null ? empty() : of(mapped);
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        if (value != null) {
            return "BestEffort[" + value + "]";
        }
        return failureReason != null ? "BestEffort.failed[" + failureReason + "]" : "BestEffort.empty";
    }
}
