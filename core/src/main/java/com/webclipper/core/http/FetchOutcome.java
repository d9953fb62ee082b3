package com.webclipper.core.http;

import java.util.List;
import java.util.Objects;

/**
 * 전략 세트 전체를 돈 결과.
 * attemptedStrategyNames 는 실제로 시도한 순서 그대로(성공한 전략 포함).
 */
public final class FetchOutcome<T> {
    private final T value;
    private final String error;
    private final List<String> attemptedStrategyNames;

    private FetchOutcome(T value, String error, List<String> attempted) {
        this.value = value;
        this.error = error;
        this.attemptedStrategyNames = List.copyOf(attempted);
    }

    public static <T> FetchOutcome<T> ok(T value, List<String> attempted) {
        return new FetchOutcome<>(Objects.requireNonNull(value, "value"), null, attempted);
    }

    public static <T> FetchOutcome<T> failed(String error, List<String> attempted) {
        return new FetchOutcome<>(null, error == null ? "unknown error" : error, attempted);
    }

    public boolean isOk() { return value != null; }
    public T getValue() { return value; }
    public String getError() { return error; }
    public List<String> getAttemptedStrategyNames() { return attemptedStrategyNames; }

    /** 성공한(마지막) 전략 이름. 시도가 없으면 null */
    public String lastStrategyName() {
        return attemptedStrategyNames.isEmpty() ? null : attemptedStrategyNames.get(attemptedStrategyNames.size() - 1);
    }
}
