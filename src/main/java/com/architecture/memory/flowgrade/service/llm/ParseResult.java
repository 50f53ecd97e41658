package com.architecture.memory.flowgrade.service.llm;

import java.util.Objects;

/**
 * Outcome of decoding model output: either a value or the reason it could not be decoded.
 */
public final class ParseResult<T> {

    private final T value;
    private final String failureReason;

    private ParseResult(T value, String failureReason) {
        this.value = value;
        this.failureReason = failureReason;
    }

    public static <T> ParseResult<T> ok(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ParseResult<T> failure(String reason) {
        return new ParseResult<>(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isOk() {
        return value != null;
    }

    public T getValue() {
        if (value == null) {
            throw new IllegalStateException("No value, parse failed: " + failureReason);
        }
        return value;
    }

    public String getFailureReason() {
        return failureReason;
    }
}
