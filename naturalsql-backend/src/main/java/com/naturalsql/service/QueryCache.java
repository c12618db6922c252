package com.naturalsql.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.naturalsql.config.PipelineSettings;
import com.naturalsql.model.QueryResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * TTL cache of successful SELECT results for one session.
 *
 * <p>Failures are never stored: a compute that throws leaves no entry behind. A result is stored only if no
 * invalidation of its connection happened while it was being computed.
 */
@Slf4j
public class QueryCache {

    private final boolean enabled;
    private final Cache<CacheKey, QueryResult> cache;
    private final Object storeLock = new Object();
    private final Map<String, Long> generations = new HashMap<>();
    private long epoch;

    public QueryCache(PipelineSettings settings) {
        this.enabled = settings.cacheEnabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, settings.cacheMaxEntries()))
                .expireAfterWrite(Duration.ofSeconds(Math.max(1, settings.cacheTtlSeconds())))
                .build();
    }

    /**
     * Return the cached result for {@code key}, or compute and store it.
     *
     * @param key cache key
     * @param compute full compile-validate-execute pipeline
     * @return result; flagged {@code fromCache} when served from the cache
     */
    public QueryResult getOrCompute(CacheKey key, Supplier<QueryResult> compute) {
        if (!enabled) {
            return compute.get();
        }
        QueryResult cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("Query cache hit (connection_id={})", SchemaCache.abbreviate(key.connectionId()));
            return cached.asCached();
        }
        long stamp = stamp(key.connectionId());
        QueryResult result = compute.get();
        synchronized (storeLock) {
            if (stamp(key.connectionId()) == stamp) {
                cache.put(key, result);
            } else {
                log.debug("Query cache store skipped, connection invalidated meanwhile (connection_id={})",
                        SchemaCache.abbreviate(key.connectionId()));
            }
        }
        return result;
    }

    private long stamp(String connectionId) {
        synchronized (storeLock) {
            return epoch + generations.getOrDefault(connectionId, 0L);
        }
    }

    public Optional<QueryResult> lookup(CacheKey key) {
        if (!enabled) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(key)).map(QueryResult::asCached);
    }

    /**
     * Drop every cached result of a connection.
     *
     * @param connectionId connection identity
     */
    public void invalidate(String connectionId) {
        if (connectionId == null) {
            return;
        }
        boolean removed;
        synchronized (storeLock) {
            generations.merge(connectionId, 1L, Long::sum);
            removed = cache.asMap().keySet().removeIf(k -> connectionId.equals(k.connectionId()));
        }
        if (removed) {
            log.debug("Query cache invalidated (connection_id={})", SchemaCache.abbreviate(connectionId));
        }
    }

    public void invalidateAll() {
        synchronized (storeLock) {
            epoch++;
            cache.invalidateAll();
        }
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public boolean isEnabled() {
        return enabled;
    }
}
