package com.example.contentops.flowguard.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Soft-failure envelope returned by every public monitor operation. A failed outcome carries a
 * {@link FailureReason} and a plain message instead of an exception.
 */
public record Outcome<T>(boolean success, T value, FailureReason reason, String error) {

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(true, value, null, null);
    }

    public static <T> Outcome<T> failure(FailureReason reason, String error) {
        return new Outcome<>(false, null, Objects.requireNonNull(reason, "reason"), error);
    }

    public Optional<T> toOptional() {
        return success ? Optional.ofNullable(value) : Optional.empty();
    }

    /** Re-types a failed outcome so it can be passed up through a different operation. */
    public <R> Outcome<R> castFailure() {
        if (success) {
            throw new IllegalStateException("outcome is successful");
        }
        return new Outcome<>(false, null, reason, error);
    }
}
