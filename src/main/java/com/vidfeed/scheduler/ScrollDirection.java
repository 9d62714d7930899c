package com.vidfeed.scheduler;

public enum ScrollDirection {
    FORWARD,
    BACKWARD;

    /**
     * Direction of a viewport move; staying in place keeps the previous direction.
     */
    public static ScrollDirection of(int previousIndex, int newIndex, ScrollDirection previous) {
        if (newIndex > previousIndex) {
            return FORWARD;
        }
        if (newIndex < previousIndex) {
            return BACKWARD;
        }
        return previous;
    }
}
