package com.naturalsql.config;

import org.springframework.core.env.Environment;

/**
 * Tunables of the request pipeline.
 *
 * @param cacheEnabled        whether SELECT results are cached
 * @param cacheTtlSeconds     time-to-live of cached results
 * @param cacheMaxEntries     size bound of each session's query cache
 * @param historyEnabled      whether outcomes are recorded
 * @param historyMaxEntries   entries kept per session
 * @param maxRows             row ceiling for SELECT results
 * @param executionTimeoutMs  statement timeout
 * @param busyPolicy          behavior when the connection is busy
 * @param promptTokenBudget   schema budget of a prompt, in estimated tokens
 * @param promptHistoryTail   history entries included in a prompt
 * @param connectionTimeoutMs connect timeout
 */
public record PipelineSettings(
        boolean cacheEnabled,
        int cacheTtlSeconds,
        int cacheMaxEntries,
        boolean historyEnabled,
        int historyMaxEntries,
        int maxRows,
        int executionTimeoutMs,
        BusyPolicy busyPolicy,
        int promptTokenBudget,
        int promptHistoryTail,
        int connectionTimeoutMs
) {

    public static PipelineSettings defaults() {
        return new PipelineSettings(true, 300, 500, true, 1000, 1000, 30000, BusyPolicy.WAIT, 2000, 3, 5000);
    }

    public static PipelineSettings fromEnvironment(Environment environment) {
        PipelineSettings d = defaults();
        return new PipelineSettings(
                ConfigValues.getBoolean(environment, "naturalsql.cache.enabled", "CACHE_ENABLED", d.cacheEnabled()),
                ConfigValues.getInt(environment, "naturalsql.cache.ttl-seconds", "CACHE_TTL", d.cacheTtlSeconds()),
                ConfigValues.getInt(environment, "naturalsql.cache.max-entries", "CACHE_MAX_ENTRIES", d.cacheMaxEntries()),
                ConfigValues.getBoolean(environment, "naturalsql.history.enabled", "HISTORY_ENABLED", d.historyEnabled()),
                ConfigValues.getInt(environment, "naturalsql.history.max-entries", "MAX_HISTORY_ITEMS", d.historyMaxEntries()),
                ConfigValues.getInt(environment, "naturalsql.execution.max-rows", "MAX_QUERY_RESULTS", d.maxRows()),
                ConfigValues.getInt(environment, "naturalsql.execution.timeout-ms", "QUERY_TIMEOUT_MS", d.executionTimeoutMs()),
                BusyPolicy.fromName(ConfigValues.getTrimmed(environment, "naturalsql.execution.busy-policy", "BUSY_POLICY")),
                ConfigValues.getInt(environment, "naturalsql.prompt.token-budget", "PROMPT_TOKEN_BUDGET", d.promptTokenBudget()),
                ConfigValues.getInt(environment, "naturalsql.prompt.history-tail", "PROMPT_HISTORY_TAIL", d.promptHistoryTail()),
                ConfigValues.getInt(environment, "naturalsql.connection.timeout-ms", "DB_CONNECT_TIMEOUT_MS", d.connectionTimeoutMs())
        );
    }

    public PipelineSettings withCacheEnabled(boolean enabled) {
        return new PipelineSettings(enabled, cacheTtlSeconds, cacheMaxEntries, historyEnabled, historyMaxEntries,
                maxRows, executionTimeoutMs, busyPolicy, promptTokenBudget, promptHistoryTail, connectionTimeoutMs);
    }

    public PipelineSettings withMaxRows(int rows) {
        return new PipelineSettings(cacheEnabled, cacheTtlSeconds, cacheMaxEntries, historyEnabled, historyMaxEntries,
                rows, executionTimeoutMs, busyPolicy, promptTokenBudget, promptHistoryTail, connectionTimeoutMs);
    }

    public PipelineSettings withBusyPolicy(BusyPolicy policy) {
        return new PipelineSettings(cacheEnabled, cacheTtlSeconds, cacheMaxEntries, historyEnabled, historyMaxEntries,
                maxRows, executionTimeoutMs, policy, promptTokenBudget, promptHistoryTail, connectionTimeoutMs);
    }
}
