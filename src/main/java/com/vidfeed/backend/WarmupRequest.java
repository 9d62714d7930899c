package com.vidfeed.backend;

import com.vidfeed.model.VideoDescriptor;
import com.vidfeed.model.VideoIdentifier;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One warm-up attempt. The generation identifies the slot acquisition that issued it;
 * backends poll {@link #isCancelled()} between I/O steps and stop early once it flips.
 * Blocking I/O registers an abort hook through {@link #onCancel(Runnable)}.
 */
@Getter
@Slf4j
public class WarmupRequest {

    private final VideoDescriptor descriptor;
    private final long generation;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    @Getter(AccessLevel.NONE)
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();

    public WarmupRequest(VideoDescriptor descriptor, long generation) {
        this.descriptor = descriptor;
        this.generation = generation;
    }

    public VideoIdentifier getIdentifier() {
        return descriptor.getIdentifier();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Runs {@code hook} when the request is cancelled, or right away if it already is.
     */
    public void onCancel(Runnable hook) {
        cancelHooks.add(hook);
        if (cancelled.get() && cancelHooks.remove(hook)) {
            runHook(hook);
        }
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable hook : cancelHooks) {
            if (cancelHooks.remove(hook)) {
                runHook(hook);
            }
        }
    }

    private void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("Cancel hook of {} failed: {}", this, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "WarmupRequest[" + descriptor.getIdentifier().shortId() + ", gen=" + generation + "]";
    }
}
