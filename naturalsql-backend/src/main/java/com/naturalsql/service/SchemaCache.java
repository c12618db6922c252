package com.naturalsql.service;

import com.naturalsql.exception.ConnectionInactiveException;
import com.naturalsql.model.ConnectionStatus;
import com.naturalsql.model.SchemaSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoizes schema snapshots per connection identity. Snapshots are built lazily on first use and replaced
 * wholesale after {@link #invalidate(String)}.
 */
@Slf4j
public class SchemaCache {

    private final ConnectionManager connectionManager;
    private final Map<String, SchemaSnapshot> snapshots = new ConcurrentHashMap<>();

    public SchemaCache(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    /**
     * Snapshot of the live connection, introspecting on first access.
     *
     * @param connectionId identity of the live connection
     * @return snapshot
     * @throws ConnectionInactiveException when {@code connectionId} is not the live connection
     */
    public SchemaSnapshot getSnapshot(String connectionId) {
        ConnectionStatus status = connectionManager.status();
        if (!status.connected() || !status.handle().connectionId().equals(connectionId)) {
            throw new ConnectionInactiveException("Connection " + abbreviate(connectionId) + " is not active");
        }
        return snapshots.computeIfAbsent(connectionId, id -> {
            log.debug("Schema cache miss (connection_id={})", abbreviate(id));
            return connectionManager.introspect();
        });
    }

    public void invalidate(String connectionId) {
        if (connectionId != null && snapshots.remove(connectionId) != null) {
            log.debug("Schema cache invalidated (connection_id={})", abbreviate(connectionId));
        }
    }

    public void invalidateAll() {
        snapshots.clear();
    }

    static String abbreviate(String connectionId) {
        if (connectionId == null) {
            return "null";
        }
        return connectionId.length() > 12 ? connectionId.substring(0, 12) : connectionId;
    }
}
