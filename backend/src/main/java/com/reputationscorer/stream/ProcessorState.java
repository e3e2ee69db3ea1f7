package com.reputationscorer.stream;

/**
 * Lifecycle of {@link ActivityStreamProcessor}:
 * STARTING → RUNNING ↔ RECONNECTING → STOPPING → STOPPED.
 */
public enum ProcessorState {
    STARTING,
    RUNNING,
    RECONNECTING,
    STOPPING,
    STOPPED
}
