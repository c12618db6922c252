package com.naturalsql.service;

import com.naturalsql.compiler.PromptBuilder;
import com.naturalsql.model.ColumnInfo;
import com.naturalsql.model.HistoryEntry;
import com.naturalsql.model.KeyRole;
import com.naturalsql.model.SchemaSnapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Proposes natural-language requests a user may want to ask next.
 *
 * <p>Follow-ups come from the table of the most recent successful request. Table suggestions come from the
 * tables that best match the current request, or the first tables by name when there is none.
 */
@Component
public class QuerySuggester {

    static final int MAX_SUGGESTIONS = 10;
    static final int SUGGESTED_TABLES = 3;

    private final PromptBuilder promptBuilder;

    public QuerySuggester(PromptBuilder promptBuilder) {
        this.promptBuilder = promptBuilder;
    }

    /**
     * Build suggestions.
     *
     * @param snapshot schema of the live connection, or {@code null} when not connected
     * @param recentSuccessful successful history entries, most recent first
     * @param currentRequest what the user is typing, may be {@code null}
     * @return distinct suggestions, at most {@value #MAX_SUGGESTIONS}
     */
    public List<String> suggest(SchemaSnapshot snapshot, List<HistoryEntry> recentSuccessful, String currentRequest) {
        Set<String> out = new LinkedHashSet<>();

        for (HistoryEntry entry : recentSuccessful) {
            if (entry.getTables().isEmpty()) {
                continue;
            }
            String table = entry.getTables().get(0);
            List<ColumnInfo> columns = snapshot == null ? List.of() : snapshot.columns(table).orElse(List.of());
            out.add("How many records are in " + table + "?");
            dateColumn(columns).ifPresent(c -> out.add("Show me the most recent entries in " + table + " by " + c));
            categoryColumn(columns).ifPresent(c -> out.add("What are the different " + c + " values in " + table + "?"));
            break;
        }

        if (snapshot != null) {
            List<String> ranked = promptBuilder.rankTables(currentRequest, snapshot);
            for (String table : ranked.subList(0, Math.min(SUGGESTED_TABLES, ranked.size()))) {
                out.add("Show me the structure of the " + table + " table");
                out.add("How many records are in " + table + "?");
                out.add("What are the most recent entries in " + table + "?");
            }
        }

        List<String> list = new ArrayList<>(out);
        return list.size() > MAX_SUGGESTIONS ? List.copyOf(list.subList(0, MAX_SUGGESTIONS)) : list;
    }

    static Optional<String> dateColumn(List<ColumnInfo> columns) {
        for (ColumnInfo c : columns) {
            String type = lower(c.type());
            String name = lower(c.name());
            if (type.contains("date") || type.contains("time") || name.endsWith("_at") || name.endsWith("_date")) {
                return Optional.of(c.name());
            }
        }
        return Optional.empty();
    }

    static Optional<String> categoryColumn(List<ColumnInfo> columns) {
        for (ColumnInfo c : columns) {
            String type = lower(c.type());
            String name = lower(c.name());
            boolean text = type.contains("char") || type.contains("text") || type.contains("enum");
            if (text && c.keyRole() == KeyRole.NONE && !name.endsWith("_at") && !name.endsWith("_date")) {
                return Optional.of(c.name());
            }
        }
        return Optional.empty();
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
