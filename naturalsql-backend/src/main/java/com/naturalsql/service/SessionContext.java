package com.naturalsql.service;

import com.naturalsql.config.PipelineSettings;
import com.naturalsql.model.SessionInfo;
import com.naturalsql.util.CancellationToken;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Everything one session owns: its connection, schema and query caches, and history.
 */
@Slf4j
@Getter
public class SessionContext implements AutoCloseable {

    private final SessionInfo info;
    private final ConnectionManager connectionManager;
    private final SchemaCache schemaCache;
    private final QueryCache queryCache;
    private final HistoryStore historyStore;
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicReference<CancellationToken> currentRequest = new AtomicReference<>(new CancellationToken());

    public SessionContext(SessionInfo info, PipelineSettings settings) {
        this.info = info;
        this.connectionManager = new ConnectionManager(info.getSessionId(), settings);
        this.schemaCache = new SchemaCache(connectionManager);
        this.queryCache = new QueryCache(settings);
        this.historyStore = new HistoryStore(settings.historyEnabled(), settings.historyMaxEntries());
    }

    public String getSessionId() {
        return info.getSessionId();
    }

    /**
     * Start tracking a new request, replacing the previous one's token.
     *
     * @return token of the new request
     */
    public CancellationToken beginRequest() {
        CancellationToken token = new CancellationToken();
        currentRequest.set(token);
        return token;
    }

    /**
     * Cancel the current request: abort its model call and its running statement.
     *
     * @return true if something was running
     */
    public boolean cancel() {
        boolean modelCall = currentRequest.get().cancel();
        boolean statement = connectionManager.cancel();
        return modelCall || statement;
    }

    @Override
    public void close() {
        cancel();
        connectionManager.disconnect();
        schemaCache.invalidateAll();
        queryCache.invalidateAll();
        historyStore.clear();
        log.info("Session closed (session_id={})", getSessionId());
    }
}
