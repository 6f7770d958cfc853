package com.schemacraft.generator.pipeline;

import java.util.NoSuchElementException;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Outcome of a stage that may fail on bad input: exactly one of a value or a {@link StageError}.
 *
 * @param <T> the stage's output type
 */
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class StageResult<T> {

    private final T value;
    private final StageError error;

    public static <T> StageResult<T> success(T value) {
        if (value == null) {
            throw new IllegalArgumentException("A successful stage result needs a value");
        }
        return new StageResult<>(value, null);
    }

    public static <T> StageResult<T> failure(StageError error) {
        if (error == null) {
            throw new IllegalArgumentException("A failed stage result needs an error");
        }
        return new StageResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new NoSuchElementException("Stage failed: " + error.describe());
        }
        return value;
    }

    public Optional<StageError> getError() {
        return Optional.ofNullable(error);
    }
}
