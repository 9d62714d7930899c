package com.vidfeed.model;

import lombok.Builder;
import lombok.Value;

/**
 * Diagnostics snapshot of the resource manager.
 */
@Value
@Builder
public class ResourceManagerStats {
    int totalVideos;
    int registeredVideos;
    int preparingVideos;
    int readyVideos;
    int playingVideos;
    int failedVideos;
    int activeSlots;
    int capacity;
    int viewportIndex;
    long preloadCount;
    long preloadSuccessCount;
    long preloadFailureCount;
    long evictionCount;
    long cancelledCount;
    long memoryPressureCount;
    int estimatedMemoryMb;
    boolean shutdown;

    public double getSlotUtilization() {
        return capacity > 0 ? (activeSlots * 100.0) / capacity : 0.0;
    }
}
