package com.vidfeed.model;

/**
 * Lifecycle of a single video's decoder resource.
 */
public enum ResourceState {
    UNREGISTERED,
    REGISTERED,
    PREPARING,
    READY,
    PLAYING,
    PAUSED,
    FAILED;

    /**
     * Whether this state implies a slot with a live decoder handle.
     */
    public boolean holdsHandle() {
        return this == READY || this == PLAYING || this == PAUSED;
    }

    /**
     * Whether this state implies a bound slot (with or without a handle yet).
     */
    public boolean holdsSlot() {
        return this == PREPARING || holdsHandle();
    }
}
