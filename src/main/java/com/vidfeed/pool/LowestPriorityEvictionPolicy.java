package com.vidfeed.pool;

import com.vidfeed.model.VideoIdentifier;
import com.vidfeed.scheduler.PriorityOrder;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Evicts the lowest-priority slot, least recently touched first among equals.
 * <p>
 * A slot qualifies when it is not playing and its video is either outside the window or
 * ranked strictly below the requester. Slots inside the window that outrank the requester,
 * and the playing slot, are never taken.
 */
public class LowestPriorityEvictionPolicy implements EvictionPolicy {

    @Override
    public Optional<ResourceSlot> selectVictim(Collection<ResourceSlot> occupied, PriorityOrder order,
                                               VideoIdentifier requester) {
        int requesterRank = order.rankOf(requester);

        Comparator<ResourceSlot> lowestPriorityFirst = Comparator
                .comparingInt((ResourceSlot slot) -> order.rankOf(slot.getOwner())).reversed()
                .thenComparing(ResourceSlot::getLastTouched);

        return occupied.stream()
                .filter(slot -> !slot.isPlaying())
                .filter(slot -> !slot.getOwner().equals(requester))
                .filter(slot -> {
                    int rank = order.rankOf(slot.getOwner());
                    return rank == PriorityOrder.OUTSIDE_WINDOW || rank > requesterRank;
                })
                .min(lowestPriorityFirst);
    }
}
