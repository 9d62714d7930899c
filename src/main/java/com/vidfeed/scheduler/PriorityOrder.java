package com.vidfeed.scheduler;

import com.vidfeed.model.VideoIdentifier;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of identifiers that should hold a slot, highest priority first.
 * Identifiers outside the window rank below every identifier inside it.
 */
public final class PriorityOrder {

    public static final int OUTSIDE_WINDOW = Integer.MAX_VALUE;

    private static final PriorityOrder EMPTY = new PriorityOrder(List.of());

    private final List<VideoIdentifier> ordered;
    private final Map<VideoIdentifier, Integer> ranks;

    public PriorityOrder(List<VideoIdentifier> ordered) {
        this.ordered = List.copyOf(ordered);
        this.ranks = new HashMap<>();
        for (int i = 0; i < this.ordered.size(); i++) {
            ranks.putIfAbsent(this.ordered.get(i), i);
        }
    }

    public static PriorityOrder empty() {
        return EMPTY;
    }

    /**
     * 0 for the current video, larger for lower priority, {@link #OUTSIDE_WINDOW} when not in the window.
     */
    public int rankOf(VideoIdentifier identifier) {
        return ranks.getOrDefault(identifier, OUTSIDE_WINDOW);
    }

    public boolean contains(VideoIdentifier identifier) {
        return ranks.containsKey(identifier);
    }

    public List<VideoIdentifier> asList() {
        return Collections.unmodifiableList(ordered);
    }

    public int size() {
        return ordered.size();
    }

    @Override
    public String toString() {
        return "PriorityOrder" + ordered;
    }
}
