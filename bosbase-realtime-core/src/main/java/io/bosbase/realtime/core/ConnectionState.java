package io.bosbase.realtime.core;

/**
 * Lifecycle states of a realtime connection.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    READY
}
