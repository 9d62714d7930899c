package com.vidfeed.queue;

import com.vidfeed.backend.DecoderHandle;
import com.vidfeed.exception.WarmupFailureException;
import com.vidfeed.model.VideoIdentifier;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of one warm-up attempt, tagged with the generation of the acquisition that started it.
 * Exactly one of {@code handle} and {@code failure} is set.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WarmupOutcome {
    VideoIdentifier identifier;
    long generation;
    DecoderHandle handle;
    WarmupFailureException failure;

    public static WarmupOutcome ready(VideoIdentifier identifier, long generation, DecoderHandle handle) {
        return new WarmupOutcome(identifier, generation, handle, null);
    }

    public static WarmupOutcome failed(VideoIdentifier identifier, long generation, WarmupFailureException failure) {
        return new WarmupOutcome(identifier, generation, null, failure);
    }

    public boolean isSuccess() {
        return handle != null;
    }
}
