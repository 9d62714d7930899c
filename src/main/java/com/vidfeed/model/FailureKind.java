package com.vidfeed.model;

public enum FailureKind {
    SOURCE_UNAVAILABLE, // Network or URI failure
    DECODE_FAILURE,     // Codec rejected the content
    CANCELLED,          // Superseded by eviction, never surfaced
    CAPACITY_EXHAUSTED  // Preload deferred, never surfaced
}
