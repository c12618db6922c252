package com.naturalsql.compiler;

import com.naturalsql.model.StatementKind;
import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.util.TablesNamesFinder;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classifies parsed statements and extracts the tables they reference.
 */
@Slf4j
public final class StatementInspector {

    private StatementInspector() {
    }

    /**
     * Classify a statement by its leading keyword, cross-checked against the parsed statement type.
     *
     * <p>A leading {@code WITH} counts as SELECT only when the parsed statement is a query. Any disagreement
     * between keyword and parsed type yields {@link StatementKind#OTHER}, and so does a query that selects
     * {@code INTO} a table or file.
     *
     * @param sql statement text
     * @param statement parsed statement
     * @return statement kind
     */
    public static StatementKind classify(String sql, Statement statement) {
        String keyword = SqlTokenizer.leadingKeyword(sql);
        StatementKind byKeyword = switch (keyword) {
            case "SELECT", "WITH" -> StatementKind.SELECT;
            case "INSERT" -> StatementKind.INSERT;
            case "UPDATE" -> StatementKind.UPDATE;
            case "DELETE" -> StatementKind.DELETE;
            default -> StatementKind.OTHER;
        };
        StatementKind byType = kindOf(statement);
        if (byKeyword != byType) {
            return StatementKind.OTHER;
        }
        return byKeyword == StatementKind.SELECT && selectsInto(sql) ? StatementKind.OTHER : byKeyword;
    }

    /**
     * Whether a query writes its rows somewhere: {@code SELECT ... INTO table}, or MySQL's
     * {@code INTO OUTFILE} and {@code INTO DUMPFILE}.
     *
     * @param sql statement text
     * @return true if an {@code INTO} keyword appears outside literals and quoted identifiers
     */
    public static boolean selectsInto(String sql) {
        for (SqlTokenizer.Token token : SqlTokenizer.tokenize(sql)) {
            if (token.isWord("INTO")) {
                return true;
            }
        }
        return false;
    }

    private static StatementKind kindOf(Statement statement) {
        if (statement instanceof Select) {
            return StatementKind.SELECT;
        }
        if (statement instanceof Insert) {
            return StatementKind.INSERT;
        }
        if (statement instanceof Update) {
            return StatementKind.UPDATE;
        }
        if (statement instanceof Delete) {
            return StatementKind.DELETE;
        }
        return StatementKind.OTHER;
    }

    /**
     * Tables referenced anywhere in the statement, unquoted and without schema prefix, sorted by name.
     *
     * @param statement parsed statement
     * @return table names
     */
    public static List<String> tables(Statement statement) {
        Set<String> raw;
        try {
            raw = new TablesNamesFinder().getTables(statement);
        } catch (UnsupportedOperationException e) {
            log.debug("Table extraction not supported for {}: {}", statement.getClass().getSimpleName(), e.getMessage());
            return List.of();
        }
        Set<String> names = new TreeSet<>();
        for (String name : raw) {
            String n = normalizeTableName(name);
            if (!n.isEmpty()) {
                names.add(n);
            }
        }
        return new ArrayList<>(names);
    }

    static String normalizeTableName(String raw) {
        if (raw == null) {
            return "";
        }
        String n = raw.trim();
        int dot = lastDotOutsideQuotes(n);
        if (dot != -1) {
            n = n.substring(dot + 1);
        }
        return stripQuotes(n);
    }

    private static int lastDotOutsideQuotes(String s) {
        boolean quoted = false;
        int last = -1;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"' || c == '`') {
                quoted = !quoted;
            } else if (c == '[') {
                quoted = true;
            } else if (c == ']') {
                quoted = false;
            } else if (c == '.' && !quoted) {
                last = i;
            }
        }
        return last;
    }

    private static String stripQuotes(String s) {
        if (s.length() >= 2) {
            char first = s.charAt(0);
            char last = s.charAt(s.length() - 1);
            if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
                return s.substring(1, s.length() - 1);
            }
        }
        return s;
    }
}
