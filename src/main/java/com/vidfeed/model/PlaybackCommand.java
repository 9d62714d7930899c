package com.vidfeed.model;

/**
 * Command remembered for an identifier that was not ready when it was issued.
 * At most one is kept per identifier; a newer command replaces an older one.
 */
public enum PlaybackCommand {
    PLAY,
    PAUSE
}
