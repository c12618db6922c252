package com.naturalsql.model;

/**
 * Snapshot of a connection manager's state.
 *
 * @param connected  whether a connection is live
 * @param descriptor the live descriptor, or {@code null}
 * @param handle     the live handle, or {@code null}
 */
public record ConnectionStatus(boolean connected, ConnectionDescriptor descriptor, ConnectionHandle handle) {

    public static ConnectionStatus disconnected() {
        return new ConnectionStatus(false, null, null);
    }
}
