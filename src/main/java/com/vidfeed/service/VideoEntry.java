package com.vidfeed.service;

import com.vidfeed.model.FailureKind;
import com.vidfeed.model.PlaybackCommand;
import com.vidfeed.model.ResourceState;
import com.vidfeed.model.VideoDescriptor;
import com.vidfeed.model.VideoStatus;
import lombok.Data;

import java.time.Instant;
import java.util.concurrent.Future;

/**
 * Mutable per-video bookkeeping, only touched while holding the manager's lock.
 */
@Data
class VideoEntry {
    private final VideoDescriptor descriptor;
    private final int feedIndex;
    private ResourceState state = ResourceState.UNREGISTERED;
    private FailureKind failureKind;
    private String failureMessage;
    private int failureCount;
    private Instant nextRetryAt;
    private PlaybackCommand pendingCommand;
    private Future<?> retryTask;
    private Instant updatedAt;

    void clearFailure() {
        failureKind = null;
        failureMessage = null;
        failureCount = 0;
        nextRetryAt = null;
        cancelRetry();
    }

    void cancelRetry() {
        if (retryTask != null) {
            retryTask.cancel(false);
            retryTask = null;
        }
    }

    VideoStatus toStatus() {
        boolean failed = state == ResourceState.FAILED;
        return VideoStatus.builder()
                .identifier(descriptor.getIdentifier())
                .state(state)
                .failureKind(failed ? failureKind : null)
                .failureMessage(failed ? failureMessage : null)
                .failureCount(failureCount)
                .nextRetryAt(failed ? nextRetryAt : null)
                .updatedAt(updatedAt)
                .build();
    }
}
