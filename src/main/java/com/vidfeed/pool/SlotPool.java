package com.vidfeed.pool;

import com.vidfeed.model.VideoIdentifier;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed-capacity set of resource slots. The pool is the only place where a slot gets bound
 * to or released from a video, which keeps "one slot per video" and "never more slots than
 * capacity" true at all times.
 * <p>
 * Not thread-safe; callers serialize access.
 */
@Slf4j
public class SlotPool {

    private final List<ResourceSlot> slots;
    private final Map<VideoIdentifier, ResourceSlot> bindings = new HashMap<>();

    public SlotPool(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Pool capacity must be at least 1, got " + capacity);
        }
        this.slots = new ArrayList<>(capacity);
        for (int i = 0; i < capacity; i++) {
            slots.add(new ResourceSlot(i));
        }
        log.info("Slot pool initialized with {} decoder slots", capacity);
    }

    /**
     * Binds a free slot to the video, or returns empty when the pool is full.
     */
    public Optional<ResourceSlot> acquire(VideoIdentifier identifier, long generation, Instant now) {
        if (bindings.containsKey(identifier)) {
            throw new IllegalStateException("Video " + identifier + " already holds " + bindings.get(identifier));
        }
        for (ResourceSlot slot : slots) {
            if (slot.isEmpty()) {
                slot.bind(identifier, generation, now);
                bindings.put(identifier, slot);
                log.debug("Bound {} to video {}", slot, identifier.shortId());
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }

    /**
     * Releases the video's slot, cancelling its warm-up and closing its decoder.
     *
     * @return the state the slot was in, or empty if the video held no slot
     */
    public Optional<SlotState> release(VideoIdentifier identifier) {
        ResourceSlot slot = bindings.remove(identifier);
        if (slot == null) {
            return Optional.empty();
        }
        SlotState previous = slot.getState();
        slot.release();
        log.debug("Released slot {} from video {} (was {})", slot.getIndex(), identifier.shortId(), previous);
        return Optional.of(previous);
    }

    public Optional<ResourceSlot> slotFor(VideoIdentifier identifier) {
        return Optional.ofNullable(bindings.get(identifier));
    }

    /**
     * Snapshot of the bound slots.
     */
    public List<ResourceSlot> occupied() {
        return new ArrayList<>(bindings.values());
    }

    public List<VideoIdentifier> boundIdentifiers() {
        return new ArrayList<>(bindings.keySet());
    }

    public boolean hasFreeSlot() {
        return bindings.size() < slots.size();
    }

    public int occupiedCount() {
        return bindings.size();
    }

    public int capacity() {
        return slots.size();
    }
}
