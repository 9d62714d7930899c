package com.vidfeed.service;

import com.vidfeed.backend.DecoderBackend;
import com.vidfeed.backend.DecoderHandle;
import com.vidfeed.backend.FeedSource;
import com.vidfeed.backend.WarmupRequest;
import com.vidfeed.config.VideoManagerProperties;
import com.vidfeed.exception.VideoManagerException;
import com.vidfeed.exception.WarmupFailureException;
import com.vidfeed.model.FailureKind;
import com.vidfeed.model.PlaybackCommand;
import com.vidfeed.model.ResourceManagerStats;
import com.vidfeed.model.ResourceState;
import com.vidfeed.model.StateChangeEvent;
import com.vidfeed.model.VideoDescriptor;
import com.vidfeed.model.VideoIdentifier;
import com.vidfeed.model.VideoStatus;
import com.vidfeed.pool.EvictionPolicy;
import com.vidfeed.pool.LowestPriorityEvictionPolicy;
import com.vidfeed.pool.ResourceSlot;
import com.vidfeed.pool.SlotPool;
import com.vidfeed.pool.SlotState;
import com.vidfeed.queue.CompletionChannel;
import com.vidfeed.queue.WarmupOutcome;
import com.vidfeed.scheduler.BackoffPolicy;
import com.vidfeed.scheduler.PriorityOrder;
import com.vidfeed.scheduler.PriorityScheduler;
import com.vidfeed.scheduler.ScrollDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Resource manager backed by a fixed-capacity {@link SlotPool}.
 * <p>
 * Every command runs as one scheduling pass under a single monitor. Warm-up outcomes arrive
 * on backend threads, go through the {@link CompletionChannel} and are applied at the end of
 * the running pass, or in a pass of their own. Each pass that changed any state publishes
 * exactly one {@link StateChangeEvent}.
 */
@Slf4j
public class PooledVideoResourceManager implements VideoResourceManager {

    private final Object lock = new Object();

    private final SlotPool pool;
    private final PriorityScheduler scheduler;
    private final EvictionPolicy evictionPolicy;
    private final BackoffPolicy backoffPolicy;
    private final DecoderBackend backend;
    private final FeedSource feedSource;
    private final TaskScheduler taskScheduler;
    private final Executor notificationExecutor;
    private final Clock clock;
    private final Duration warmupTimeout;
    private final int memoryPerSlotMb;

    private final DescriptorValidator validator = new DescriptorValidator();
    private final ErrorClassifier errorClassifier = new ErrorClassifier();
    private final CompletionChannel completions = new CompletionChannel();

    // Guarded by lock
    private final Map<VideoIdentifier, VideoEntry> entries = new HashMap<>();
    private final Map<VideoIdentifier, ResourceState> pendingChanges = new LinkedHashMap<>();
    private PriorityOrder currentOrder = PriorityOrder.empty();
    private ScrollDirection direction = ScrollDirection.FORWARD;
    private long generationCounter;
    private long eventSequence;
    private int passDepth;
    private Future<?> refillTask;

    // Lock-free snapshots for readers
    private final List<VideoDescriptor> feed = new CopyOnWriteArrayList<>();
    private final ConcurrentMap<VideoIdentifier, VideoStatus> statuses = new ConcurrentHashMap<>();
    private final ConcurrentMap<VideoIdentifier, ControllerLease> leases = new ConcurrentHashMap<>();
    private final List<StateChangeListener> listeners = new CopyOnWriteArrayList<>();
    private volatile int viewportIndex = -1;
    private volatile boolean shutdown;

    private final AtomicLong preloadCount = new AtomicLong();
    private final AtomicLong preloadSuccessCount = new AtomicLong();
    private final AtomicLong preloadFailureCount = new AtomicLong();
    private final AtomicLong evictionCount = new AtomicLong();
    private final AtomicLong cancelledCount = new AtomicLong();
    private final AtomicLong memoryPressureCount = new AtomicLong();

    public PooledVideoResourceManager(VideoManagerProperties properties,
                                      DecoderBackend backend,
                                      FeedSource feedSource,
                                      TaskScheduler taskScheduler,
                                      Executor notificationExecutor,
                                      Clock clock) {
        this(properties, new LowestPriorityEvictionPolicy(), backend, feedSource, taskScheduler, notificationExecutor, clock);
    }

    public PooledVideoResourceManager(VideoManagerProperties properties,
                                      EvictionPolicy evictionPolicy,
                                      DecoderBackend backend,
                                      FeedSource feedSource,
                                      TaskScheduler taskScheduler,
                                      Executor notificationExecutor,
                                      Clock clock) {
        properties.validate();
        this.pool = new SlotPool(properties.getCapacity());
        this.scheduler = new PriorityScheduler(properties.getNearRadius(), properties.getFarRadius(),
                properties.isDirectionAware());
        this.backoffPolicy = new BackoffPolicy(properties.getBackoffBase(), properties.getBackoffFactor(),
                properties.getMaxBackoff(), properties.getMaxRetries());
        this.evictionPolicy = evictionPolicy;
        this.backend = backend;
        this.feedSource = feedSource;
        this.taskScheduler = taskScheduler;
        this.notificationExecutor = notificationExecutor;
        this.clock = clock;
        this.warmupTimeout = properties.getWarmupTimeout();
        this.memoryPerSlotMb = properties.getMemoryPerSlotMb();
        log.info("Video resource manager started: capacity={}, window=±{} (near ±{}), maxRetries={}",
                properties.getCapacity(), properties.getFarRadius(), properties.getNearRadius(),
                properties.getMaxRetries());
    }

    // ---------------------------------------------------------------- commands

    @Override
    public void register(VideoDescriptor descriptor) {
        ensureActive();
        validator.validate(descriptor);
        runPass(() -> registerInternal(descriptor));
    }

    @Override
    public void requestPreload(VideoIdentifier identifier) {
        ensureActive();
        runPass(() -> preloadInternal(identifier));
    }

    @Override
    public void setViewportIndex(int index) {
        ensureActive();
        if (index < 0) {
            throw new IllegalArgumentException("Viewport index cannot be negative: " + index);
        }
        runPass(() -> {
            if (viewportIndex >= 0) {
                direction = ScrollDirection.of(viewportIndex, index, direction);
            }
            viewportIndex = index;
            recomputeOrder();
            log.debug("Viewport moved to {} ({}), window {}", index, direction, currentOrder);

            for (ResourceSlot slot : pool.occupied()) {
                if (!currentOrder.contains(slot.getOwner()) && !slot.isPlaying()) {
                    evict(slot.getOwner(), "outside window of index " + index);
                }
            }
            for (VideoIdentifier identifier : currentOrder.asList()) {
                preloadInternal(identifier);
            }
        });
    }

    @Override
    public void play(VideoIdentifier identifier) {
        ensureActive();
        runPass(() -> {
            VideoEntry entry = entries.get(identifier);
            if (entry == null) {
                log.warn("Play requested for unknown video {}", identifier);
                return;
            }
            if (entry.getState().holdsHandle()) {
                playInternal(entry);
            } else {
                entry.setPendingCommand(PlaybackCommand.PLAY);
                log.debug("Video {} not ready ({}), will play when ready", identifier.shortId(), entry.getState());
                preloadInternal(identifier);
            }
        });
    }

    @Override
    public void pause(VideoIdentifier identifier) {
        ensureActive();
        runPass(() -> {
            VideoEntry entry = entries.get(identifier);
            if (entry == null) {
                log.warn("Pause requested for unknown video {}", identifier);
                return;
            }
            if (entry.getState() == ResourceState.PLAYING) {
                pauseInternal(entry);
                releaseIfOutsideWindow(entry);
            } else if (entry.getState().holdsHandle()) {
                entry.setPendingCommand(null);
            } else {
                entry.setPendingCommand(PlaybackCommand.PAUSE);
            }
        });
    }

    @Override
    public void pauseAll() {
        ensureActive();
        runPass(() -> {
            int paused = 0;
            for (VideoEntry entry : entries.values()) {
                if (entry.getState() == ResourceState.PLAYING) {
                    pauseInternal(entry);
                    paused++;
                }
                if (entry.getPendingCommand() == PlaybackCommand.PLAY) {
                    entry.setPendingCommand(null);
                }
            }
            if (paused > 0) {
                log.debug("Paused {} videos", paused);
            }
        });
    }

    @Override
    public void release(VideoIdentifier identifier) {
        ensureActive();
        runPass(() -> {
            if (evict(identifier, "released by caller")) {
                fillFreeSlots(Set.of(identifier));
            }
        });
    }

    @Override
    public void releaseAll() {
        ensureActive();
        runPass(this::releaseEverything);
    }

    @Override
    public void retry(VideoIdentifier identifier) {
        ensureActive();
        runPass(() -> {
            VideoEntry entry = entries.get(identifier);
            if (entry == null || entry.getState() != ResourceState.FAILED) {
                log.debug("Retry ignored for video {}: not failed", identifier);
                return;
            }
            log.info("Manual retry for video {} after {} failures", identifier.shortId(), entry.getFailureCount());
            entry.clearFailure();
            preloadInternal(identifier);
        });
    }

    @Override
    public int handleMemoryPressure() {
        ensureActive();
        int[] released = {0};
        runPass(() -> {
            memoryPressureCount.incrementAndGet();
            int current = viewportIndex;
            for (ResourceSlot slot : pool.occupied()) {
                if (slot.isPlaying()) {
                    continue;
                }
                int index = entries.get(slot.getOwner()).getFeedIndex();
                if (current < 0 || !scheduler.isNear(current, index)) {
                    evict(slot.getOwner(), "memory pressure");
                    released[0]++;
                }
            }
            log.info("Memory pressure handled: released {} decoders, {} still active", released[0], pool.occupiedCount());
        });
        return released[0];
    }

    @Override
    public CompletableFuture<Integer> loadMore() {
        ensureActive();
        if (!feedSource.canLoadMore()) {
            return CompletableFuture.completedFuture(0);
        }
        return feedSource.loadMore().thenApply(page -> {
            int added = 0;
            for (VideoDescriptor descriptor : page) {
                if (shutdown) {
                    log.info("Manager shut down while loading a feed page, kept {} of {} videos", added, page.size());
                    return added;
                }
                try {
                    int before = feed.size();
                    register(descriptor);
                    if (feed.size() > before) {
                        added++;
                    }
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping invalid video from feed page: {}", e.getMessage());
                } catch (VideoManagerException e) {
                    log.info("Stopped loading feed page after {} videos: {}", added, e.getMessage());
                    return added;
                }
            }
            log.info("Loaded feed page: {} new of {} videos, total {}", added, page.size(), feed.size());
            return added;
        });
    }

    @Override
    public Subscription subscribe(StateChangeListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        runPass(this::releaseEverything);
        shutdown = true;
        listeners.clear();
        log.info("Video resource manager shut down");
    }

    // ---------------------------------------------------------------- queries

    @Override
    public ResourceState getState(VideoIdentifier identifier) {
        VideoStatus status = statuses.get(identifier);
        return status == null ? ResourceState.UNREGISTERED : status.getState();
    }

    @Override
    public VideoStatus getStatus(VideoIdentifier identifier) {
        VideoStatus status = statuses.get(identifier);
        return status == null ? VideoStatus.unregistered(identifier, clock.instant()) : status;
    }

    @Override
    public Optional<ControllerLease> getController(VideoIdentifier identifier) {
        return Optional.ofNullable(leases.get(identifier));
    }

    @Override
    public boolean canLoadMore() {
        return !shutdown && feedSource.canLoadMore();
    }

    @Override
    public List<VideoDescriptor> videos() {
        return List.copyOf(feed);
    }

    @Override
    public List<VideoIdentifier> readyVideos() {
        return feed.stream()
                .map(VideoDescriptor::getIdentifier)
                .filter(id -> getState(id).holdsHandle())
                .collect(Collectors.toList());
    }

    @Override
    public List<VideoIdentifier> currentWindow() {
        synchronized (lock) {
            return currentOrder.asList();
        }
    }

    @Override
    public ResourceManagerStats getStats() {
        synchronized (lock) {
            Map<ResourceState, Long> byState = entries.values().stream()
                    .collect(Collectors.groupingBy(VideoEntry::getState, Collectors.counting()));
            return ResourceManagerStats.builder()
                    .totalVideos(feed.size())
                    .registeredVideos(count(byState, ResourceState.REGISTERED) + count(byState, ResourceState.UNREGISTERED))
                    .preparingVideos(count(byState, ResourceState.PREPARING))
                    .readyVideos(count(byState, ResourceState.READY) + count(byState, ResourceState.PAUSED))
                    .playingVideos(count(byState, ResourceState.PLAYING))
                    .failedVideos(count(byState, ResourceState.FAILED))
                    .activeSlots(pool.occupiedCount())
                    .capacity(pool.capacity())
                    .viewportIndex(viewportIndex)
                    .preloadCount(preloadCount.get())
                    .preloadSuccessCount(preloadSuccessCount.get())
                    .preloadFailureCount(preloadFailureCount.get())
                    .evictionCount(evictionCount.get())
                    .cancelledCount(cancelledCount.get())
                    .memoryPressureCount(memoryPressureCount.get())
                    .estimatedMemoryMb(pool.occupiedCount() * memoryPerSlotMb)
                    .shutdown(shutdown)
                    .build();
        }
    }

    // ---------------------------------------------------------------- pass machinery

    /**
     * Runs one scheduling pass. Nested calls (listeners, synchronous backend callbacks) join
     * the outer pass; outcomes are drained and the coalesced event published when the
     * outermost pass finishes.
     */
    private void runPass(Runnable body) {
        synchronized (lock) {
            passDepth++;
            try {
                body.run();
            } finally {
                try {
                    if (passDepth == 1) {
                        completions.drain(this::applyOutcome);
                    }
                } finally {
                    passDepth--;
                    if (passDepth == 0) {
                        publishChanges();
                    }
                }
            }
        }
    }

    private void publishChanges() {
        if (pendingChanges.isEmpty()) {
            return;
        }
        StateChangeEvent event = new StateChangeEvent(++eventSequence,
                Collections.unmodifiableMap(new LinkedHashMap<>(pendingChanges)), clock.instant());
        pendingChanges.clear();
        for (StateChangeListener listener : listeners) {
            notificationExecutor.execute(() -> deliver(listener, event));
        }
    }

    private void deliver(StateChangeListener listener, StateChangeEvent event) {
        try {
            listener.onStateChanged(event);
        } catch (RuntimeException e) {
            log.error("State change listener failed on event #{}", event.getSequence(), e);
        }
    }

    private void setState(VideoEntry entry, ResourceState newState) {
        if (entry.getState() == newState) {
            return;
        }
        VideoIdentifier identifier = entry.getDescriptor().getIdentifier();
        entry.setState(newState);
        entry.setUpdatedAt(clock.instant());
        statuses.put(identifier, entry.toStatus());
        pendingChanges.remove(identifier);
        pendingChanges.put(identifier, newState);
    }

    // ---------------------------------------------------------------- internals (hold lock)

    private void registerInternal(VideoDescriptor descriptor) {
        VideoIdentifier identifier = descriptor.getIdentifier();
        if (entries.containsKey(identifier)) {
            log.debug("Duplicate video registration ignored: {}", identifier);
            return;
        }
        VideoEntry entry = new VideoEntry(descriptor, feed.size());
        entries.put(identifier, entry);
        feed.add(descriptor);
        setState(entry, ResourceState.REGISTERED);
        if (viewportIndex >= 0) {
            recomputeOrder();
        }
    }

    private void recomputeOrder() {
        List<Integer> indices = scheduler.candidates(viewportIndex, feed.size(), direction);
        List<VideoIdentifier> ordered = new ArrayList<>(indices.size());
        for (int index : indices) {
            ordered.add(feed.get(index).getIdentifier());
        }
        currentOrder = new PriorityOrder(ordered);
    }

    /**
     * Moves the video toward READY if a slot is free or can be reclaimed.
     *
     * @return whether the video holds a slot afterwards
     */
    private boolean preloadInternal(VideoIdentifier identifier) {
        VideoEntry entry = entries.get(identifier);
        if (entry == null) {
            log.warn("Preload requested for unknown video {}", identifier);
            return false;
        }
        Instant now = clock.instant();
        if (entry.getState().holdsSlot()) {
            pool.slotFor(identifier).ifPresent(slot -> slot.touch(now));
            return true;
        }
        if (entry.getState() == ResourceState.FAILED) {
            if (!backoffPolicy.canRetry(entry.getFailureCount())) {
                log.debug("Skipping preload for video {}: retries exhausted", identifier.shortId());
                return false;
            }
            if (entry.getNextRetryAt() != null && now.isBefore(entry.getNextRetryAt())) {
                log.debug("Skipping preload for video {}: backing off until {}", identifier.shortId(), entry.getNextRetryAt());
                return false;
            }
        }

        if (!pool.hasFreeSlot()) {
            Optional<ResourceSlot> victim = evictionPolicy.selectVictim(pool.occupied(), currentOrder, identifier);
            if (victim.isEmpty()) {
                log.debug("Preload of video {} deferred: {}", identifier.shortId(), FailureKind.CAPACITY_EXHAUSTED);
                return false;
            }
            evict(victim.get().getOwner(), "making room for " + identifier.shortId());
        }

        ResourceSlot slot = pool.acquire(identifier, ++generationCounter, now)
                .orElseThrow(() -> new IllegalStateException("No free slot after eviction for video " + identifier));
        startWarmup(slot, entry, now);
        return true;
    }

    private void startWarmup(ResourceSlot slot, VideoEntry entry, Instant now) {
        entry.cancelRetry();
        entry.setNextRetryAt(null);
        setState(entry, ResourceState.PREPARING);
        preloadCount.incrementAndGet();

        WarmupRequest request = new WarmupRequest(entry.getDescriptor(), slot.getGeneration());
        log.info("Starting warm-up for video {} in slot {} (gen={}) from {}", request.getIdentifier().shortId(),
                slot.getIndex(), slot.getGeneration(), entry.getDescriptor().getSourceUri());

        CompletableFuture<DecoderHandle> future;
        try {
            future = backend.prepare(request);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            future = CompletableFuture.failedFuture(
                    WarmupFailureException.decodeFailure("UNKNOWN", "Decoder backend returned no warm-up", null));
        }
        Future<?> timeout = taskScheduler.schedule(() -> onWarmupTimeout(request), now.plus(warmupTimeout));
        slot.beginWarmup(request, future, timeout);
        future.whenComplete((handle, error) -> onWarmupFinished(request, handle, error));
    }

    private void onWarmupFinished(WarmupRequest request, DecoderHandle handle, Throwable error) {
        WarmupOutcome outcome;
        if (error != null) {
            outcome = WarmupOutcome.failed(request.getIdentifier(), request.getGeneration(), errorClassifier.classify(error));
        } else if (handle == null) {
            outcome = WarmupOutcome.failed(request.getIdentifier(), request.getGeneration(),
                    WarmupFailureException.decodeFailure("UNKNOWN", "Decoder backend produced no handle", null));
        } else {
            outcome = WarmupOutcome.ready(request.getIdentifier(), request.getGeneration(), handle);
        }
        completions.publish(outcome);
        runPass(() -> { });
    }

    private void onWarmupTimeout(WarmupRequest request) {
        completions.publish(WarmupOutcome.failed(request.getIdentifier(), request.getGeneration(),
                WarmupFailureException.sourceUnavailable("TIMEOUT",
                        "Warm-up exceeded " + warmupTimeout.toMillis() + "ms", null)));
        runPass(() -> { });
    }

    private void applyOutcome(WarmupOutcome outcome) {
        VideoIdentifier identifier = outcome.getIdentifier();
        ResourceSlot slot = pool.slotFor(identifier).orElse(null);
        if (slot == null || slot.getGeneration() != outcome.getGeneration() || !slot.isPreparing()) {
            discardStale(outcome);
            return;
        }
        VideoEntry entry = entries.get(identifier);
        if (outcome.isSuccess()) {
            onWarmupReady(slot, entry, outcome.getHandle());
        } else if (outcome.getFailure().getKind() == FailureKind.CANCELLED) {
            cancelledCount.incrementAndGet();
            log.debug("Warm-up of video {} cancelled by backend", identifier.shortId());
            evict(identifier, "warm-up cancelled");
        } else if (outcome.getFailure().getKind() == FailureKind.CAPACITY_EXHAUSTED) {
            deferWarmup(entry, outcome.getFailure());
        } else {
            onWarmupFailed(entry, outcome.getFailure());
        }
    }

    /**
     * The backend could not take the warm-up. The slot is handed back without counting a
     * failure and free slots are offered to the window again once a refill is due.
     */
    private void deferWarmup(VideoEntry entry, WarmupFailureException reason) {
        VideoIdentifier identifier = entry.getDescriptor().getIdentifier();
        pool.release(identifier);
        revokeLease(identifier);
        setState(entry, ResourceState.REGISTERED);
        log.debug("Preload of video {} deferred: {}", identifier.shortId(), reason.getMessage());
        scheduleRefill();
    }

    private void scheduleRefill() {
        if (refillTask != null && !refillTask.isDone()) {
            return;
        }
        Instant refillAt = clock.instant().plus(backoffPolicy.delayAfter(1));
        refillTask = taskScheduler.schedule(() -> runPass(this::refillDue), refillAt);
    }

    private void refillDue() {
        refillTask = null;
        if (shutdown) {
            return;
        }
        fillFreeSlots(Set.of());
    }

    private void discardStale(WarmupOutcome outcome) {
        if (outcome.getHandle() != null) {
            try {
                outcome.getHandle().close();
            } catch (RuntimeException e) {
                log.warn("Error closing stale decoder for video {}", outcome.getIdentifier(), e);
            }
        }
        if (outcome.getFailure() != null && outcome.getFailure().getKind() == FailureKind.CANCELLED) {
            cancelledCount.incrementAndGet();
        }
        log.debug("Discarded stale warm-up outcome for video {} (gen={})",
                outcome.getIdentifier().shortId(), outcome.getGeneration());
    }

    private void onWarmupReady(ResourceSlot slot, VideoEntry entry, DecoderHandle handle) {
        VideoIdentifier identifier = entry.getDescriptor().getIdentifier();
        Instant now = clock.instant();
        slot.completeWarmup(handle, now);
        leases.put(identifier, new ControllerLease(identifier, slot.getGeneration(), handle));
        entry.clearFailure();
        setState(entry, ResourceState.READY);
        preloadSuccessCount.incrementAndGet();
        log.info("Video {} is READY in slot {}", identifier.shortId(), slot.getIndex());

        PlaybackCommand pending = entry.getPendingCommand();
        entry.setPendingCommand(null);
        if (pending == PlaybackCommand.PLAY) {
            playInternal(entry);
        }
    }

    private void onWarmupFailed(VideoEntry entry, WarmupFailureException failure) {
        VideoIdentifier identifier = entry.getDescriptor().getIdentifier();
        Instant now = clock.instant();
        pool.release(identifier);
        revokeLease(identifier);
        preloadFailureCount.incrementAndGet();

        int failures = entry.getFailureCount() + 1;
        entry.setFailureCount(failures);
        entry.setFailureKind(failure.getKind());
        entry.setFailureMessage(failure.getMessage());

        if (backoffPolicy.canRetry(failures)) {
            Instant retryAt = now.plus(backoffPolicy.delayAfter(failures));
            entry.setNextRetryAt(retryAt);
            entry.setRetryTask(taskScheduler.schedule(() -> runPass(() -> retryDue(identifier, failures)), retryAt));
            log.warn("Warm-up failed for video {} ({}): {}. Retry {}/{} at {}", identifier.shortId(),
                    failure.getKind(), failure.getMessage(), failures, backoffPolicy.getMaxRetries(), retryAt);
        } else {
            entry.setNextRetryAt(null);
            log.warn("Video {} marked as failed after {} attempts: {}", identifier.shortId(), failures, failure.getMessage());
        }
        setState(entry, ResourceState.FAILED);
        fillFreeSlots(Set.of(identifier));
    }

    /**
     * Automatic retry once the backoff elapsed. Only videos still in the window are retried;
     * the others wait until the viewport brings them back.
     */
    private void retryDue(VideoIdentifier identifier, int expectedFailures) {
        if (shutdown) {
            return;
        }
        VideoEntry entry = entries.get(identifier);
        if (entry == null || entry.getState() != ResourceState.FAILED || entry.getFailureCount() != expectedFailures) {
            return;
        }
        entry.setRetryTask(null);
        if (!currentOrder.contains(identifier)) {
            log.debug("Retry of video {} skipped: outside window", identifier.shortId());
            return;
        }
        log.info("Retrying warm-up for video {} (attempt {})", identifier.shortId(), expectedFailures + 1);
        preloadInternal(identifier);
    }

    /**
     * Hands free slots to the highest-priority window videos that still lack one.
     */
    private void fillFreeSlots(Set<VideoIdentifier> skip) {
        for (VideoIdentifier identifier : currentOrder.asList()) {
            if (!pool.hasFreeSlot()) {
                return;
            }
            if (skip.contains(identifier) || entries.get(identifier).getState().holdsSlot()) {
                continue;
            }
            preloadInternal(identifier);
        }
    }

    private void playInternal(VideoEntry entry) {
        VideoIdentifier identifier = entry.getDescriptor().getIdentifier();
        entry.setPendingCommand(null);
        if (entry.getState() == ResourceState.PLAYING) {
            return;
        }
        for (VideoEntry other : entries.values()) {
            if (other != entry && other.getState() == ResourceState.PLAYING) {
                pauseInternal(other);
                releaseIfOutsideWindow(other);
            }
        }
        ResourceSlot slot = pool.slotFor(identifier)
                .orElseThrow(() -> new IllegalStateException("Video " + identifier + " is " + entry.getState() + " without a slot"));
        try {
            slot.play(clock.instant());
            setState(entry, ResourceState.PLAYING);
            log.debug("Playing video {}", identifier.shortId());
        } catch (RuntimeException e) {
            log.error("Error starting playback of video {}", identifier, e);
            onWarmupFailed(entry, errorClassifier.classify(e));
        }
    }

    private void pauseInternal(VideoEntry entry) {
        VideoIdentifier identifier = entry.getDescriptor().getIdentifier();
        ResourceSlot slot = pool.slotFor(identifier)
                .orElseThrow(() -> new IllegalStateException("Video " + identifier + " is playing without a slot"));
        try {
            slot.pause(clock.instant());
            setState(entry, ResourceState.PAUSED);
            log.debug("Paused video {}", identifier.shortId());
        } catch (RuntimeException e) {
            log.error("Error pausing video {}", identifier, e);
            onWarmupFailed(entry, errorClassifier.classify(e));
        }
    }

    /**
     * A video kept past the window only because it was playing gives its slot back once paused.
     */
    private void releaseIfOutsideWindow(VideoEntry entry) {
        VideoIdentifier identifier = entry.getDescriptor().getIdentifier();
        if (entry.getState() == ResourceState.PAUSED && !currentOrder.contains(identifier)
                && evict(identifier, "paused outside window")) {
            fillFreeSlots(Set.of(identifier));
        }
    }

    /**
     * Releases the video's slot, if any, and returns it to UNREGISTERED with its descriptor kept.
     */
    private boolean evict(VideoIdentifier identifier, String reason) {
        Optional<SlotState> previous = pool.release(identifier);
        if (previous.isEmpty()) {
            return false;
        }
        revokeLease(identifier);
        evictionCount.incrementAndGet();
        VideoEntry entry = entries.get(identifier);
        entry.setPendingCommand(null);
        setState(entry, ResourceState.UNREGISTERED);
        log.info("Evicted video {} (was {}): {}", identifier.shortId(), previous.get(), reason);
        return true;
    }

    private void releaseEverything() {
        for (VideoIdentifier identifier : pool.boundIdentifiers()) {
            evict(identifier, "releasing all decoders");
        }
        for (VideoEntry entry : entries.values()) {
            entry.cancelRetry();
            entry.setPendingCommand(null);
        }
        if (refillTask != null) {
            refillTask.cancel(false);
            refillTask = null;
        }
        log.info("Released all decoders");
    }

    private void revokeLease(VideoIdentifier identifier) {
        ControllerLease lease = leases.remove(identifier);
        if (lease != null) {
            lease.revoke();
        }
    }

    private void ensureActive() {
        if (shutdown) {
            throw new VideoManagerException("VideoManager has been shut down");
        }
    }

    private static int count(Map<ResourceState, Long> byState, ResourceState state) {
        return byState.getOrDefault(state, 0L).intValue();
    }
}
