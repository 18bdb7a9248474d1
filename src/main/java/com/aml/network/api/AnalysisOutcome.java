package com.aml.network.api;

/**
 * Value of a standalone analysis together with the store failure that cut it short, if any.
 *
 * @param value the (possibly empty) result
 * @param error store failure message, or null
 * @param <T>   result type
 */
public record AnalysisOutcome<T>(T value, String error) {

    public static <T> AnalysisOutcome<T> success(T value) {
        return new AnalysisOutcome<>(value, null);
    }

    public static <T> AnalysisOutcome<T> failure(T fallback, String error) {
        return new AnalysisOutcome<>(fallback, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
