package com.example.pageviews;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or the {@link PageviewException} that prevented it. Streams of results keep
 * failures in place so consumers can count, log or stop on them individually.
 */
@ToString
@EqualsAndHashCode
public final class Result<T> {

    /** Step that may fail with a line-level exception. */
    @FunctionalInterface
    public interface Step<T, R> {
        R apply(T value) throws PageviewException;
    }

    private final T value;
    private final PageviewException error;

    private Result(T value, PageviewException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Result<T> failed(PageviewException error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    /** Runs {@code step}, capturing a thrown {@link PageviewException} as a failed result. */
    public static <T, R> Result<R> of(T input, Step<T, R> step) {
        try {
            return ok(step.apply(input));
        } catch (PageviewException e) {
            return failed(e);
        }
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isFailed() {
        return error != null;
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public T get() {
        if (error != null) {
            throw new IllegalStateException("No value present: " + error.getMessage(), error);
        }
        return value;
    }

    public T getOrThrow() throws PageviewException {
        if (error != null) {
            throw error;
        }
        return value;
    }

    public PageviewException getError() {
        return error;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> fn) {
        return isOk() ? ok(fn.apply(value)) : failed(error);
    }

    public <R> Result<R> flatMap(Step<? super T, ? extends R> step) {
        if (isFailed()) {
            return failed(error);
        }
        try {
            return ok(step.apply(value));
        } catch (PageviewException e) {
            return failed(e);
        }
    }
}
