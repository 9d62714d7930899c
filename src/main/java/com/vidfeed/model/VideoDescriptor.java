package com.vidfeed.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.net.URI;
import java.time.Duration;

/**
 * Immutable description of a feed video as supplied by the feed source.
 * Many descriptors exist without any decoder resource behind them.
 */
@Value
@Builder
public class VideoDescriptor {
    @NonNull VideoIdentifier identifier;
    @NonNull URI sourceUri;
    @NonNull @Builder.Default Duration declaredDuration = Duration.ZERO;
    long arrivalOrder; // Order in which the feed delivered this video
}
