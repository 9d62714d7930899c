package com.vidfeed.model;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Coalesced notification for one scheduling pass. {@code changes} holds the final
 * state of every identifier that transitioned during the pass, in transition order.
 */
@Value
public class StateChangeEvent {
    long sequence;
    Map<VideoIdentifier, ResourceState> changes;
    Instant timestamp;
}
