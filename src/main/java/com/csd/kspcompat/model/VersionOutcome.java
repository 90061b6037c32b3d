package com.csd.kspcompat.model;

import com.csd.kspcompat.exception.BadKspVersionException;
import com.csd.kspcompat.exception.KspVersionIncomparableException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * Result of a parse, compare or targets call made through the {@code try*} methods of the
 * version service. Holds either the value or the error that would otherwise have been thrown.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VersionOutcome<T> {

    T value;
    VersionErrorKind errorKind;
    RuntimeException error;

    public static <T> VersionOutcome<T> success(T value) {
        return new VersionOutcome<>(value, null, null);
    }

    public static <T> VersionOutcome<T> malformed(BadKspVersionException error) {
        return new VersionOutcome<>(null, VersionErrorKind.MALFORMED_INPUT, Objects.requireNonNull(error));
    }

    public static <T> VersionOutcome<T> incomparable(KspVersionIncomparableException error) {
        return new VersionOutcome<>(null, VersionErrorKind.INCOMPARABLE_OPERANDS, Objects.requireNonNull(error));
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isFailure() {
        return errorKind != null;
    }

    public String getMessage() {
        return error == null ? null : error.getMessage();
    }

    /**
     * Returns the value, or rethrows the original error for a failed outcome.
     */
    public T getOrThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }
}
