package com.vidfeed.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes which feed positions deserve a decoder around the viewport.
 * <p>
 * The current position comes first, then positions alternate forward and backward by
 * increasing distance up to the far radius. On equal distance the scroll direction wins,
 * or forward when direction awareness is off.
 */
@Slf4j
public class PriorityScheduler {

    private final int nearRadius;
    private final int farRadius;
    private final boolean directionAware;

    public PriorityScheduler(int nearRadius, int farRadius, boolean directionAware) {
        if (nearRadius < 0 || farRadius < nearRadius) {
            throw new IllegalArgumentException("Radii must satisfy 0 <= near <= far, got near=" + nearRadius + ", far=" + farRadius);
        }
        this.nearRadius = nearRadius;
        this.farRadius = farRadius;
        this.directionAware = directionAware;
    }

    /**
     * Feed positions to hold, highest priority first, clipped to {@code [0, feedSize)}.
     */
    public List<Integer> candidates(int currentIndex, int feedSize, ScrollDirection direction) {
        List<Integer> order = new ArrayList<>(2 * farRadius + 1);
        if (feedSize <= 0) {
            return order;
        }

        boolean backwardFirst = directionAware && direction == ScrollDirection.BACKWARD;
        addIfValid(order, currentIndex, feedSize);
        for (int distance = 1; distance <= farRadius; distance++) {
            int ahead = currentIndex + distance;
            int behind = currentIndex - distance;
            if (backwardFirst) {
                addIfValid(order, behind, feedSize);
                addIfValid(order, ahead, feedSize);
            } else {
                addIfValid(order, ahead, feedSize);
                addIfValid(order, behind, feedSize);
            }
        }

        log.debug("Priority order around index {} ({}): {}", currentIndex, direction, order);
        return order;
    }

    /**
     * Whether a position is close enough to the viewport to survive memory pressure.
     */
    public boolean isNear(int currentIndex, int index) {
        return Math.abs(index - currentIndex) <= nearRadius;
    }

    private static void addIfValid(List<Integer> order, int index, int feedSize) {
        if (index >= 0 && index < feedSize) {
            order.add(index);
        }
    }
}
