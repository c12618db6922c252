package com.naturalsql.service;

import com.naturalsql.config.PipelineSettings;
import com.naturalsql.model.QueryResult;
import com.naturalsql.model.StatementKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryCacheTest {

    private final QueryCache cache = new QueryCache(PipelineSettings.defaults());
    private final AtomicInteger computations = new AtomicInteger();

    @Test
    void secondLookupIsServedFromCache() {
        CacheKey key = CacheKey.of("conn-1", "How many orders?");

        QueryResult first = cache.getOrCompute(key, this::compute);
        QueryResult second = cache.getOrCompute(key, this::compute);

        assertThat(first.isFromCache()).isFalse();
        assertThat(second.isFromCache()).isTrue();
        assertThat(second.getRows()).isEqualTo(first.getRows());
        assertThat(computations).hasValue(1);
    }

    @Test
    void keyNormalizesWhitespaceAndCase() {
        assertThat(CacheKey.of("conn-1", "  How many\n  ORDERS? "))
                .isEqualTo(CacheKey.of("conn-1", "how many orders?"));
        assertThat(CacheKey.of("conn-2", "how many orders?"))
                .isNotEqualTo(CacheKey.of("conn-1", "how many orders?"));
    }

    @Test
    void failuresAreNotCached() {
        CacheKey key = CacheKey.of("conn-1", "broken");

        assertThatThrownBy(() -> cache.getOrCompute(key, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(cache.lookup(key)).isEmpty();
        assertThat(cache.getOrCompute(key, this::compute).isFromCache()).isFalse();
    }

    @Test
    void invalidatesOnlyOneConnection() {
        cache.getOrCompute(CacheKey.of("conn-1", "a"), this::compute);
        cache.getOrCompute(CacheKey.of("conn-2", "a"), this::compute);

        cache.invalidate("conn-1");

        assertThat(cache.lookup(CacheKey.of("conn-1", "a"))).isEmpty();
        assertThat(cache.lookup(CacheKey.of("conn-2", "a")))
                .hasValueSatisfying(r -> assertThat(r.isFromCache()).isTrue());
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void resultComputedAcrossAnInvalidationIsNotStored() {
        CacheKey key = CacheKey.of("conn-1", "how many orders?");

        QueryResult stale = cache.getOrCompute(key, () -> {
            QueryResult result = compute();
            cache.invalidate("conn-1");
            return result;
        });

        assertThat(stale.isFromCache()).isFalse();
        assertThat(cache.lookup(key)).isEmpty();
        assertThat(cache.getOrCompute(key, this::compute).isFromCache()).isFalse();
        assertThat(cache.getOrCompute(key, this::compute).isFromCache()).isTrue();
        assertThat(computations).hasValue(2);
    }

    @Test
    void invalidationOfAnotherConnectionDoesNotBlockStore() {
        CacheKey key = CacheKey.of("conn-1", "a");

        cache.getOrCompute(key, () -> {
            cache.invalidate("conn-2");
            return compute();
        });

        assertThat(cache.lookup(key)).isPresent();
    }

    @Test
    void disabledCacheAlwaysComputes() {
        QueryCache disabled = new QueryCache(PipelineSettings.defaults().withCacheEnabled(false));
        CacheKey key = CacheKey.of("conn-1", "a");

        disabled.getOrCompute(key, this::compute);
        QueryResult second = disabled.getOrCompute(key, this::compute);

        assertThat(second.isFromCache()).isFalse();
        assertThat(computations).hasValue(2);
        assertThat(disabled.lookup(key)).isEmpty();
    }

    private QueryResult compute() {
        computations.incrementAndGet();
        return QueryResult.builder()
                .sql("SELECT COUNT(*) AS n FROM orders")
                .kind(StatementKind.SELECT)
                .columns(List.of("n"))
                .rows(List.of(Map.<String, Object>of("n", 3)))
                .rowCount(1)
                .build();
    }
}
