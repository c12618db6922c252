package com.naturalsql.compiler;

import com.naturalsql.config.PipelineSettings;
import com.naturalsql.model.ColumnInfo;
import com.naturalsql.model.EngineKind;
import com.naturalsql.model.HistoryEntry;
import com.naturalsql.model.KeyRole;
import com.naturalsql.model.SchemaSnapshot;
import com.naturalsql.model.StatementKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds model prompts from a request, the relevant part of the schema and recent history.
 *
 * <p>Output is deterministic for identical inputs.
 */
@Component
public class PromptBuilder {

    static final int TABLE_HIT_WEIGHT = 3;
    static final int COLUMN_HIT_WEIGHT = 1;
    static final int CHARS_PER_TOKEN = 4;

    private final int tokenBudget;

    public PromptBuilder(PipelineSettings settings) {
        this.tokenBudget = settings.promptTokenBudget();
    }

    /**
     * Build the prompt for a request.
     *
     * @param requestText natural-language request
     * @param snapshot schema of the live connection
     * @param historyTail most recent history entries, oldest first
     * @param expectedKind kind the caller asked for, or {@code null} for a query
     * @param engine engine the statement will run on
     * @return prompt
     */
    public Prompt build(String requestText, SchemaSnapshot snapshot, List<HistoryEntry> historyTail,
                        StatementKind expectedKind, EngineKind engine) {
        String system = buildSystemPrompt(engine, expectedKind);

        StringBuilder sb = new StringBuilder();
        sb.append("Request:\n").append(requestText == null ? "" : requestText.trim()).append("\n\n");
        sb.append("Schema:\n");
        for (String line : selectTables(requestText, snapshot)) {
            sb.append(line).append("\n");
        }

        if (historyTail != null && !historyTail.isEmpty()) {
            sb.append("\nRecent requests (oldest first):\n");
            sb.append(formatHistory(historyTail));
        }
        return new Prompt(system, sb.toString(), requestText, expectedKind, 1);
    }

    private String buildSystemPrompt(EngineKind engine, StatementKind expectedKind) {
        String kindRule = expectedKind == null
                ? "The statement must be a SELECT query. "
                : "The statement must be a single " + expectedKind.name() + " statement. ";
        return "You are a SQL compiler. Output ONLY valid JSON and nothing else. "
                + "Do not use markdown fences. Do not add explanations. "
                + "Output schema: {\"statements\": [{\"sql\": \"<SQL statement>\", \"params\": [<value>, ...]}]}. "
                + "Return exactly one statement WITHOUT a trailing semicolon. "
                + kindRule
                + "Use a ? placeholder for every value taken from the request and list the values in params, in placeholder order. "
                + "UPDATE and DELETE statements must have a WHERE clause that filters on a column. "
                + "Use only the tables and columns listed in the schema. "
                + "Target database dialect: " + engine.getDialect() + ".";
    }

    /**
     * Render the tables to include, most relevant first, within the token budget.
     *
     * @param requestText request
     * @param snapshot schema
     * @return one rendered line per table
     */
    List<String> selectTables(String requestText, SchemaSnapshot snapshot) {
        List<String> ordered = rankTables(requestText, snapshot);
        List<String> lines = new ArrayList<>();
        int usedChars = 0;
        int budgetChars = tokenBudget * CHARS_PER_TOKEN;
        for (String table : ordered) {
            String line = renderTable(table, snapshot.getTables().get(table));
            if (!lines.isEmpty() && usedChars + line.length() > budgetChars) {
                break;
            }
            lines.add(line);
            usedChars += line.length() + 1;
        }
        return lines;
    }

    /**
     * Tables ordered by relevance. Falls back to all tables by name when nothing matches.
     *
     * @param requestText request
     * @param snapshot schema
     * @return table names
     */
    public List<String> rankTables(String requestText, SchemaSnapshot snapshot) {
        Set<String> requestTokens = tokens(requestText);
        List<ScoredTable> scored = new ArrayList<>();
        for (Map.Entry<String, List<ColumnInfo>> e : snapshot.getTables().entrySet()) {
            int score = score(e.getKey(), e.getValue(), requestTokens);
            scored.add(new ScoredTable(e.getKey(), score));
        }

        List<String> matched = scored.stream()
                .filter(s -> s.score() > 0)
                .sorted(Comparator.comparingInt(ScoredTable::score).reversed().thenComparing(ScoredTable::name))
                .map(ScoredTable::name)
                .toList();
        if (!matched.isEmpty()) {
            return matched;
        }
        return scored.stream().map(ScoredTable::name).sorted().toList();
    }

    private static int score(String table, List<ColumnInfo> columns, Set<String> requestTokens) {
        int score = 0;
        for (String t : tokens(table)) {
            if (requestTokens.contains(t)) {
                score += TABLE_HIT_WEIGHT;
            }
        }
        for (ColumnInfo c : columns) {
            for (String t : tokens(c.name())) {
                if (requestTokens.contains(t)) {
                    score += COLUMN_HIT_WEIGHT;
                }
            }
        }
        return score;
    }

    private static String renderTable(String table, List<ColumnInfo> columns) {
        StringBuilder sb = new StringBuilder("- ").append(table).append("(");
        for (int i = 0; i < columns.size(); i++) {
            ColumnInfo c = columns.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(c.name()).append(" ").append(c.type());
            if (c.keyRole() == KeyRole.PRIMARY) {
                sb.append(" PK");
            } else if (c.keyRole() == KeyRole.FOREIGN) {
                sb.append(" FK");
            }
            if (!c.nullable()) {
                sb.append(" NOT NULL");
            }
        }
        return sb.append(")").toString();
    }

    private static String formatHistory(List<HistoryEntry> entries) {
        StringBuilder sb = new StringBuilder();
        int idx = 1;
        for (HistoryEntry entry : entries) {
            if (entry == null) {
                continue;
            }
            sb.append("[").append(idx).append("] Request: ").append(entry.getRequestText()).append("\n");
            if (entry.getSql() != null) {
                sb.append("    SQL: ").append(entry.getSql()).append("\n");
            }
            if (entry.getParams() != null && !entry.getParams().isEmpty()) {
                sb.append("    Params: ").append(entry.getParams()).append("\n");
            }
            if (!entry.isSuccess() && entry.getErrorMessage() != null) {
                sb.append("    ERROR: ").append(entry.getErrorMessage()).append("\n");
            }
            idx++;
        }
        return sb.toString();
    }

    /**
     * Lower-cased word tokens with a trailing plural removed.
     *
     * @param text input
     * @return distinct tokens in order of appearance
     */
    public static Set<String> tokens(String text) {
        Set<String> out = new LinkedHashSet<>();
        if (text == null) {
            return out;
        }
        for (String raw : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (!raw.isEmpty()) {
                out.add(singular(raw));
            }
        }
        return out;
    }

    static String singular(String word) {
        if (word.length() <= 3) {
            return word;
        }
        if (word.endsWith("ies")) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.endsWith("sses") || word.endsWith("xes") || word.endsWith("ches") || word.endsWith("shes")
                || word.endsWith("uses")) {
            return word.substring(0, word.length() - 2);
        }
        if (word.endsWith("s") && !word.endsWith("ss") && !word.endsWith("us")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    private record ScoredTable(String name, int score) {
    }
}
