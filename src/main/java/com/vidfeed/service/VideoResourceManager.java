package com.vidfeed.service;

import com.vidfeed.model.ResourceManagerStats;
import com.vidfeed.model.ResourceState;
import com.vidfeed.model.VideoDescriptor;
import com.vidfeed.model.VideoIdentifier;
import com.vidfeed.model.VideoStatus;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Single source of truth for which feed videos hold a decoder and what state each one is in.
 * <p>
 * Commands never block on I/O: warm-ups run asynchronously and report back through state
 * change notifications. Queries return point-in-time snapshots and may be called from any thread.
 */
public interface VideoResourceManager {

    /**
     * Adds a video to the feed. Registering a known identifier again changes nothing.
     *
     * @throws IllegalArgumentException if the descriptor is malformed
     */
    void register(VideoDescriptor descriptor);

    /**
     * Asks for the video to be warmed up. Returns immediately; if no slot can be freed the
     * request is dropped until capacity frees up. Warm-up failures surface as FAILED state,
     * never as exceptions.
     */
    void requestPreload(VideoIdentifier identifier);

    /**
     * Moves the viewport, releases idle decoders that fell out of the window and warms up
     * the new window in priority order.
     */
    void setViewportIndex(int index);

    void play(VideoIdentifier identifier);

    void pause(VideoIdentifier identifier);

    /**
     * Pauses every playing video. Does not preload or evict anything.
     */
    void pauseAll();

    ResourceState getState(VideoIdentifier identifier);

    VideoStatus getStatus(VideoIdentifier identifier);

    /**
     * Lease on the video's decoder, or empty when no live decoder exists.
     */
    Optional<ControllerLease> getController(VideoIdentifier identifier);

    boolean canLoadMore();

    /**
     * Fetches the next feed page and registers it.
     *
     * @return number of newly registered videos
     */
    CompletableFuture<Integer> loadMore();

    Subscription subscribe(StateChangeListener listener);

    /**
     * Releases one video's decoder regardless of its position.
     */
    void release(VideoIdentifier identifier);

    /**
     * Stops and releases every decoder, e.g. before the camera takes over the codecs.
     */
    void releaseAll();

    /**
     * Clears the failure history of a FAILED video and tries it again.
     */
    void retry(VideoIdentifier identifier);

    /**
     * Releases every idle decoder outside the near radius of the viewport.
     *
     * @return number of decoders released
     */
    int handleMemoryPressure();

    List<VideoDescriptor> videos();

    List<VideoIdentifier> readyVideos();

    /**
     * Identifiers of the current preload window, highest priority first.
     */
    List<VideoIdentifier> currentWindow();

    ResourceManagerStats getStats();

    void shutdown();
}
