package com.vidfeed.exception;

import com.vidfeed.model.VideoIdentifier;
import lombok.Getter;

/**
 * Raised when the resource manager is used incorrectly, e.g. after shutdown.
 */
@Getter
public class VideoManagerException extends RuntimeException {

    private final VideoIdentifier identifier;

    public VideoManagerException(String message) {
        this(message, null);
    }

    public VideoManagerException(String message, VideoIdentifier identifier) {
        super(identifier == null ? message : message + " (videoId: " + identifier + ")");
        this.identifier = identifier;
    }
}
