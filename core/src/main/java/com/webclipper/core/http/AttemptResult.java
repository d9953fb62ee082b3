package com.webclipper.core.http;

import java.util.Objects;

/** 전략 1회 시도의 결과(성공 값 또는 실패 사유). 예외 대신 값으로 흐른다. */
public final class AttemptResult<T> {
    private final T value;
    private final String error;

    private AttemptResult(T value, String error) {
        this.value = value;
        this.error = error;
    }

    public static <T> AttemptResult<T> ok(T value) {
        return new AttemptResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> AttemptResult<T> failed(String error) {
        return new AttemptResult<>(null, (error == null || error.isBlank()) ? "unknown error" : error);
    }

    public boolean isOk() { return value != null; }
    public T getValue() { return value; }
    public String getError() { return error; }

    @Override public String toString() {
        return isOk() ? "AttemptResult{ok}" : "AttemptResult{failed=" + error + "}";
    }
}
