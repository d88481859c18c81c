package com.ecoWasteEngine.model;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a best-effort step: either a value or the captured failure.
 * Callers branch on {@link #isSuccess()} instead of catching.
 */
public final class StepResult<T> {

    private final T value;
    private final RuntimeException error;

    private StepResult(T value, RuntimeException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> StepResult<T> ok(T value) {
        return new StepResult<>(value, null);
    }

    public static <T> StepResult<T> failed(RuntimeException error) {
        if (error == null) {
            throw new IllegalArgumentException("A failed step needs an error");
        }
        return new StepResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("Step failed", error);
        }
        return value;
    }

    public Optional<RuntimeException> getError() {
        return Optional.ofNullable(error);
    }

    /** A mapper that throws turns the result into a failure. */
    public <R> StepResult<R> map(Function<T, R> mapper) {
        if (!isSuccess()) {
            return failed(error);
        }
        try {
            return ok(mapper.apply(value));
        } catch (RuntimeException e) {
            return failed(e);
        }
    }

    @Override
    public String toString() {
        return isSuccess() ? "StepResult[ok=" + value + "]" : "StepResult[failed=" + error + "]";
    }
}
