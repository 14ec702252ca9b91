package com.lucidata.model;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tagged result of a pipeline stage.
 *
 * <p>Lets callers see whether a built-in default was substituted instead of inferring it from logs.
 *
 * @param <T> value type
 */
@ToString
public final class Outcome<T> {

    /**
     * How the stage finished.
     */
    public enum Status {
        SUCCEEDED,
        FALLBACK_APPLIED,
        FAILED
    }

    @Getter
    private final Status status;
    private final T value;
    @Getter
    private final String error;
    @Getter
    private final List<String> warnings;

    private Outcome(Status status, T value, String error, List<String> warnings) {
        this.status = status;
        this.value = value;
        this.error = error;
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /**
     * Create a successful outcome.
     *
     * @param value produced value
     * @param <T> value type
     * @return outcome
     */
    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(Status.SUCCEEDED, Objects.requireNonNull(value, "value"), null, List.of());
    }

    /**
     * Create an outcome whose value is a built-in default.
     *
     * @param value substituted value
     * @param warnings why the default was used
     * @param <T> value type
     * @return outcome
     */
    public static <T> Outcome<T> fallback(T value, List<String> warnings) {
        return new Outcome<>(Status.FALLBACK_APPLIED, Objects.requireNonNull(value, "value"), null, warnings);
    }

    /**
     * Create a failed outcome with no value.
     *
     * @param error error message
     * @param <T> value type
     * @return outcome
     */
    public static <T> Outcome<T> failed(String error) {
        return new Outcome<>(Status.FAILED, null, error, List.of());
    }

    /**
     * Chain a later stage onto this one. The result carries the later stage's value, the warnings
     * of both stages, and reports a fallback if either stage applied one.
     *
     * @param next outcome of the later stage
     * @param <R> value type of the later stage
     * @return combined outcome
     */
    public <R> Outcome<R> followedBy(Outcome<R> next) {
        if (status == Status.FAILED) {
            return failed(error);
        }
        if (next.status == Status.FAILED) {
            return failed(next.error);
        }
        List<String> merged = new ArrayList<>(warnings);
        merged.addAll(next.warnings);
        Status resolved = status == Status.FALLBACK_APPLIED || next.status == Status.FALLBACK_APPLIED
                ? Status.FALLBACK_APPLIED
                : Status.SUCCEEDED;
        return new Outcome<>(resolved, next.value, null, merged);
    }

    /**
     * Get the value.
     *
     * @return value
     * @throws IllegalStateException if the outcome failed
     */
    public T getValue() {
        if (status == Status.FAILED) {
            throw new IllegalStateException("Outcome failed: " + error);
        }
        return value;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean isFallbackApplied() {
        return status == Status.FALLBACK_APPLIED;
    }
}
