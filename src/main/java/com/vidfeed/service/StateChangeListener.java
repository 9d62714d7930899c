package com.vidfeed.service;

import com.vidfeed.model.StateChangeEvent;

/**
 * Receives one coalesced event per scheduling pass that changed any video's state.
 * Events arrive in the order the transitions happened.
 */
@FunctionalInterface
public interface StateChangeListener {

    void onStateChanged(StateChangeEvent event);
}
