package com.schemacraft.generator.pipeline;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A terminal, caller-facing stage failure.
 */
@Value
@Builder
public class StageError {

    @NonNull
    StageErrorKind kind;

    @NonNull
    String message;

    /**
     * Underlying parser message or similar detail, when there is one.
     */
    String detail;

    public static StageError of(StageErrorKind kind, String message) {
        return StageError.builder().kind(kind).message(message).build();
    }

    public static StageError of(StageErrorKind kind, String message, String detail) {
        return StageError.builder().kind(kind).message(message).detail(detail).build();
    }

    public String describe() {
        return detail == null ? kind + ": " + message : kind + ": " + message + " (" + detail + ")";
    }
}
