package com.vidfeed.service;

import com.vidfeed.backend.DecoderHandle;
import com.vidfeed.exception.StaleControllerException;
import com.vidfeed.model.VideoIdentifier;

/**
 * Borrowed view of a ready slot's decoder. The manager revokes the lease when it releases
 * the slot, after which {@link #getHandle()} refuses to hand out the closed decoder.
 * Fetch a fresh lease after every viewport change.
 */
public class ControllerLease {

    private final VideoIdentifier identifier;
    private final long generation;
    private final DecoderHandle handle;
    private volatile boolean revoked;

    ControllerLease(VideoIdentifier identifier, long generation, DecoderHandle handle) {
        this.identifier = identifier;
        this.generation = generation;
        this.handle = handle;
    }

    public DecoderHandle getHandle() {
        if (revoked) {
            throw new StaleControllerException(identifier);
        }
        return handle;
    }

    public boolean isValid() {
        return !revoked;
    }

    public VideoIdentifier getIdentifier() {
        return identifier;
    }

    public long getGeneration() {
        return generation;
    }

    void revoke() {
        revoked = true;
    }
}
