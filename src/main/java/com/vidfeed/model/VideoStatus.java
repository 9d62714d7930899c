package com.vidfeed.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time snapshot of one identifier's resource state.
 */
@Value
@Builder
public class VideoStatus {
    VideoIdentifier identifier;
    ResourceState state;
    FailureKind failureKind;   // Only set when state is FAILED
    String failureMessage;
    int failureCount;          // Consecutive failed warm-ups
    Instant nextRetryAt;       // null when no automatic retry is pending
    Instant updatedAt;

    public static VideoStatus unregistered(VideoIdentifier identifier, Instant now) {
        return VideoStatus.builder()
                .identifier(identifier)
                .state(ResourceState.UNREGISTERED)
                .updatedAt(now)
                .build();
    }
}
