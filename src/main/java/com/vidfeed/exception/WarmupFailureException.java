package com.vidfeed.exception;

import com.vidfeed.model.FailureKind;
import lombok.Getter;

/**
 * A warm-up that did not produce a playable handle.
 * The category is a finer-grained label used in logs and status messages.
 */
@Getter
public class WarmupFailureException extends RuntimeException {

    private final FailureKind kind;
    private final String category;

    public WarmupFailureException(FailureKind kind, String category, String message) {
        this(kind, category, message, null);
    }

    public WarmupFailureException(FailureKind kind, String category, String message, Throwable cause) {
        super(message + " [" + category + "]", cause);
        this.kind = kind;
        this.category = category;
    }

    public static WarmupFailureException sourceUnavailable(String category, String message, Throwable cause) {
        return new WarmupFailureException(FailureKind.SOURCE_UNAVAILABLE, category, message, cause);
    }

    public static WarmupFailureException capacityExhausted(String category, String message, Throwable cause) {
        return new WarmupFailureException(FailureKind.CAPACITY_EXHAUSTED, category, message, cause);
    }

    public static WarmupFailureException decodeFailure(String category, String message, Throwable cause) {
        return new WarmupFailureException(FailureKind.DECODE_FAILURE, category, message, cause);
    }
}
