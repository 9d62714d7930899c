package com.vidfeed.pool;

import com.vidfeed.model.VideoIdentifier;
import com.vidfeed.scheduler.PriorityOrder;

import java.util.Collection;
import java.util.Optional;

/**
 * Chooses which bound slot to reclaim when the pool is full and another video needs a decoder.
 */
public interface EvictionPolicy {

    /**
     * @param occupied  currently bound slots
     * @param order     the latest priority order
     * @param requester video asking for a slot
     * @return the slot to release, or empty to defer the request
     */
    Optional<ResourceSlot> selectVictim(Collection<ResourceSlot> occupied, PriorityOrder order, VideoIdentifier requester);
}
