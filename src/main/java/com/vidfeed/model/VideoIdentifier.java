package com.vidfeed.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Opaque, content-addressed key of a feed video (typically the event id).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VideoIdentifier {

    String value;

    public static VideoIdentifier of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Video identifier cannot be null or blank");
        }
        return new VideoIdentifier(value);
    }

    /**
     * First eight characters, for log lines.
     */
    public String shortId() {
        return value.length() > 8 ? value.substring(0, 8) : value;
    }

    @Override
    public String toString() {
        return value;
    }
}
