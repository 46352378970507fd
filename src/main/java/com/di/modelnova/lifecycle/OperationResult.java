package com.di.modelnova.lifecycle;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;
import java.util.function.Function;

/**
 * Value-or-failure returned by lifecycle components instead of throwing across component boundaries.
 *
 * @param <T> payload type on success
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OperationResult<T> {

    private final boolean success;
    private final T value;
    private final FailureKind failureKind;
    private final String message;

    public static <T> OperationResult<T> ok(T value) {
        return new OperationResult<>(true, value, null, null);
    }

    public static <T> OperationResult<T> failure(FailureKind kind, String message) {
        return new OperationResult<>(false, null, kind, message);
    }

    public static <T> OperationResult<T> notFound(String message) {
        return failure(FailureKind.NOT_FOUND, message);
    }

    public static <T> OperationResult<T> invariant(String message) {
        return failure(FailureKind.INVARIANT_VIOLATION, message);
    }

    @JsonIgnore
    public boolean isFailure() {
        return !success;
    }

    /** Re-types a failure so it can be returned from a method with a different payload. */
    public <U> OperationResult<U> asFailure() {
        if (success) {
            throw new IllegalStateException("Not a failure");
        }
        return new OperationResult<>(false, null, failureKind, message);
    }

    public <U> OperationResult<U> map(Function<T, U> mapper) {
        return success ? ok(mapper.apply(value)) : asFailure();
    }

    public Optional<T> toOptional() {
        return success ? Optional.ofNullable(value) : Optional.empty();
    }

    /** Value on success, otherwise an {@link IllegalStateException} carrying the failure message. */
    public T orElseThrow() {
        if (!success) {
            throw new IllegalStateException(failureKind + ": " + message);
        }
        return value;
    }

    @Override
    public String toString() {
        return success ? "OperationResult[ok " + value + "]" : "OperationResult[" + failureKind + " " + message + "]";
    }
}
