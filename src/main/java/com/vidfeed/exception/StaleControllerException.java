package com.vidfeed.exception;

import com.vidfeed.model.VideoIdentifier;

/**
 * Thrown when a controller lease is used after its slot was released.
 */
public class StaleControllerException extends IllegalStateException {

    public StaleControllerException(VideoIdentifier identifier) {
        super("Controller for video " + identifier + " was released; fetch it again from the manager");
    }
}
