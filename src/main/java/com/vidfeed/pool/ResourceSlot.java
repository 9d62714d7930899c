package com.vidfeed.pool;

import com.vidfeed.backend.DecoderHandle;
import com.vidfeed.backend.WarmupRequest;
import com.vidfeed.model.VideoIdentifier;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * One unit of decoder capacity. Bound to at most one video at a time and owned by the
 * {@link SlotPool}; binding and release only happen through the pool.
 */
@Slf4j
public class ResourceSlot {

    private final int index;

    private VideoIdentifier owner;
    private long generation;
    private SlotState state = SlotState.EMPTY;
    private DecoderHandle handle;
    private Instant lastTouched = Instant.EPOCH;

    private WarmupRequest warmupRequest;
    private CompletableFuture<DecoderHandle> warmup;
    private Future<?> warmupTimeout;

    ResourceSlot(int index) {
        this.index = index;
    }

    void bind(VideoIdentifier identifier, long newGeneration, Instant now) {
        if (owner != null) {
            throw new IllegalStateException("Slot " + index + " already bound to " + owner);
        }
        this.owner = identifier;
        this.generation = newGeneration;
        this.state = SlotState.PREPARING;
        this.lastTouched = now;
    }

    /**
     * Records the in-flight warm-up so that a release can cancel it.
     */
    public void beginWarmup(WarmupRequest request, CompletableFuture<DecoderHandle> future, Future<?> timeout) {
        requireState(SlotState.PREPARING, "begin warm-up");
        this.warmupRequest = request;
        this.warmup = future;
        this.warmupTimeout = timeout;
    }

    public void completeWarmup(DecoderHandle decoderHandle, Instant now) {
        requireState(SlotState.PREPARING, "complete warm-up");
        this.handle = decoderHandle;
        this.state = SlotState.READY;
        this.lastTouched = now;
        clearWarmup(false);
    }

    public void play(Instant now) {
        requireHandle("play");
        handle.play();
        state = SlotState.PLAYING;
        lastTouched = now;
    }

    public void pause(Instant now) {
        requireHandle("pause");
        handle.pause();
        state = SlotState.PAUSED;
        lastTouched = now;
    }

    public void touch(Instant now) {
        lastTouched = now;
    }

    /**
     * Cancels any in-flight warm-up and closes the handle. The handle is closed even when
     * cancelling or pausing fails.
     */
    void release() {
        DecoderHandle toClose = handle;
        try {
            clearWarmup(true);
            if (toClose != null && toClose.isPlaying()) {
                toClose.pause();
            }
        } finally {
            if (toClose != null) {
                try {
                    toClose.close();
                } catch (RuntimeException e) {
                    log.warn("Error closing decoder for video {} in slot {}", owner, index, e);
                }
            }
            owner = null;
            handle = null;
            state = SlotState.EMPTY;
        }
    }

    private void clearWarmup(boolean cancel) {
        if (cancel) {
            if (warmupRequest != null) {
                warmupRequest.cancel();
            }
            if (warmup != null) {
                warmup.cancel(true);
            }
        }
        if (warmupTimeout != null) {
            warmupTimeout.cancel(false);
        }
        warmupRequest = null;
        warmup = null;
        warmupTimeout = null;
    }

    private void requireState(SlotState expected, String action) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + action + " in slot " + index + " while " + state);
        }
    }

    private void requireHandle(String action) {
        if (handle == null) {
            throw new IllegalStateException("Cannot " + action + " video " + owner + ": slot " + index + " has no decoder");
        }
    }

    public int getIndex() {
        return index;
    }

    public VideoIdentifier getOwner() {
        return owner;
    }

    public long getGeneration() {
        return generation;
    }

    public SlotState getState() {
        return state;
    }

    public Instant getLastTouched() {
        return lastTouched;
    }

    public boolean isEmpty() {
        return owner == null;
    }

    public boolean isPlaying() {
        return state == SlotState.PLAYING;
    }

    public boolean isPreparing() {
        return state == SlotState.PREPARING;
    }

    @Override
    public String toString() {
        return "Slot[" + index + ", " + (owner == null ? "empty" : owner.shortId() + " " + state + " gen=" + generation) + "]";
    }
}
