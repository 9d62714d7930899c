package com.vidfeed.backend;

import java.util.concurrent.CompletableFuture;

/**
 * Network/decoder collaborator that turns a source URI into a playable handle.
 */
public interface DecoderBackend {

    /**
     * Starts warming up the requested video without blocking the caller.
     * <p>
     * The returned future completes with a handle, or exceptionally with the cause of the
     * failure. If the request is cancelled before a handle is handed over, the backend
     * closes whatever it created.
     */
    CompletableFuture<DecoderHandle> prepare(WarmupRequest request);
}
