package com.vidfeed.pool;

public enum SlotState {
    EMPTY,
    PREPARING,
    READY,
    PLAYING,
    PAUSED
}
