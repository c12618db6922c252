package com.naturalsql.validation;

import com.naturalsql.compiler.SqlTokenizer;
import com.naturalsql.compiler.StatementInspector;
import com.naturalsql.compiler.SqlTokenizer.Token;
import com.naturalsql.model.CandidateStatement;
import com.naturalsql.model.RejectionReason;
import com.naturalsql.model.SchemaSnapshot;
import com.naturalsql.model.StatementKind;
import com.naturalsql.model.Verdict;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.update.Update;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a candidate statement may run. Rules are applied in order and the first failure wins:
 *
 * <ol>
 *   <li>the statement kind is SELECT, INSERT, UPDATE or DELETE, and the expected one when given, and it calls
 *   no administrative function</li>
 *   <li>UPDATE and DELETE carry a WHERE clause that references a column</li>
 *   <li>every referenced table exists in the schema snapshot</li>
 *   <li>no literal copied from the request text appears in the statement</li>
 * </ol>
 *
 * <p>Stateless; rejections are final and never sent back to the model.
 */
@Component
public class SafetyValidator {

    private static final Pattern REQUEST_NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Set<String> LIMIT_KEYWORDS = Set.of("LIMIT", "OFFSET", "TOP", "FIRST", "NEXT");
    private static final Set<String> NON_COLUMN_NAMES = Set.of(
            "true", "false", "null", "current_date", "current_time", "current_timestamp");
    private static final Set<String> ADMIN_FUNCTIONS = Set.of(
            // postgres
            "pg_terminate_backend", "pg_cancel_backend", "pg_sleep", "pg_sleep_for", "pg_sleep_until",
            "pg_reload_conf", "pg_rotate_logfile", "pg_read_file", "pg_read_binary_file", "pg_ls_dir",
            "pg_stat_file", "lo_import", "lo_export", "dblink", "dblink_exec", "set_config",
            // mysql
            "load_file", "sleep", "benchmark", "get_lock", "release_all_locks",
            // sqlite
            "load_extension", "readfile", "writefile");

    public Verdict validate(CandidateStatement candidate, SchemaSnapshot snapshot) {
        return validate(candidate, snapshot, null);
    }

    /**
     * Validate a candidate against the snapshot.
     *
     * @param candidate compiled statement
     * @param snapshot schema of the live connection
     * @param expectedKind required kind, or {@code null} to accept any permitted kind
     * @return verdict
     */
    public Verdict validate(CandidateStatement candidate, SchemaSnapshot snapshot, StatementKind expectedKind) {
        StatementKind kind = candidate.kind();
        if (candidate.statement() instanceof Select && StatementInspector.selectsInto(candidate.sql())) {
            return Verdict.reject(RejectionReason.DISALLOWED_STATEMENT_KIND,
                    "SELECT ... INTO writes to a table or file and is not allowed");
        }
        if (!StatementKind.PERMITTED.contains(kind)) {
            return Verdict.reject(RejectionReason.DISALLOWED_STATEMENT_KIND,
                    "Statement kind " + kind + " is not allowed; only SELECT, INSERT, UPDATE and DELETE may run");
        }
        if (expectedKind != null && kind != expectedKind) {
            return Verdict.reject(RejectionReason.DISALLOWED_STATEMENT_KIND,
                    "Expected a " + expectedKind + " statement but got " + kind);
        }

        String function = findAdminFunction(candidate.sql());
        if (function != null) {
            return Verdict.reject(RejectionReason.DISALLOWED_STATEMENT_KIND,
                    "Administrative function " + function + " is not allowed");
        }

        if (kind == StatementKind.UPDATE || kind == StatementKind.DELETE) {
            Expression where = whereOf(candidate.statement());
            if (where == null || !referencesColumn(where)) {
                return Verdict.reject(RejectionReason.MISSING_FILTER_PREDICATE,
                        kind + " requires a WHERE clause that filters on a column");
            }
        }

        for (String table : candidate.tables()) {
            if (!snapshot.containsTable(table)) {
                return Verdict.reject(RejectionReason.UNKNOWN_TABLE, "Unknown table: " + table);
            }
        }

        String literal = findRequestLiteral(candidate.sql(), candidate.requestText());
        if (literal != null) {
            return Verdict.reject(RejectionReason.UNPARAMETERIZED_LITERAL,
                    "Value " + literal + " from the request must be passed as a parameter, not inlined");
        }
        return Verdict.accept();
    }

    private static Expression whereOf(Statement statement) {
        if (statement instanceof Update update) {
            return update.getWhere();
        }
        if (statement instanceof Delete delete) {
            return delete.getWhere();
        }
        return null;
    }

    static boolean referencesColumn(Expression expression) {
        ColumnFinder finder = new ColumnFinder();
        expression.accept(finder);
        return finder.found;
    }

    /**
     * First call to a denied function, matched on the name right before an opening parenthesis. Schema
     * prefixes and identifier quotes do not hide the name.
     *
     * @param sql statement text
     * @return lower-cased function name, or {@code null}
     */
    static String findAdminFunction(String sql) {
        List<Token> tokens = SqlTokenizer.tokenize(sql);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            Token name = tokens.get(i);
            Token next = tokens.get(i + 1);
            boolean identifier = name.type() == SqlTokenizer.Type.WORD
                    || name.type() == SqlTokenizer.Type.QUOTED_IDENTIFIER;
            if (identifier && next.type() == SqlTokenizer.Type.SYMBOL && "(".equals(next.text())) {
                String lower = name.text().toLowerCase(Locale.ROOT);
                if (ADMIN_FUNCTIONS.contains(lower)) {
                    return lower;
                }
            }
        }
        return null;
    }

    /**
     * Find a string or numeric literal whose value also appears in the request text. LIMIT and OFFSET counts
     * are exempt.
     *
     * @param sql statement text
     * @param requestText request text
     * @return offending literal as written, or {@code null}
     */
    static String findRequestLiteral(String sql, String requestText) {
        if (requestText == null || requestText.isBlank()) {
            return null;
        }
        String request = requestText.toLowerCase(Locale.ROOT);
        List<BigDecimal> requestNumbers = numbersIn(request);

        boolean inLimitClause = false;
        for (Token token : SqlTokenizer.tokenize(sql)) {
            switch (token.type()) {
                case WORD -> inLimitClause = LIMIT_KEYWORDS.contains(token.text().toUpperCase(Locale.ROOT));
                case STRING -> {
                    inLimitClause = false;
                    String value = token.text().trim().toLowerCase(Locale.ROOT);
                    if (isWordLike(value) && containsWord(request, value)) {
                        return "'" + token.text() + "'";
                    }
                }
                case NUMBER -> {
                    if (!inLimitClause && containsNumber(requestNumbers, token.text())) {
                        return token.text();
                    }
                }
                case SYMBOL -> {
                    if (!",".equals(token.text())) {
                        inLimitClause = false;
                    }
                }
                default -> inLimitClause = false;
            }
        }
        return null;
    }

    private static boolean isWordLike(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isLetterOrDigit(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether {@code value} occurs in {@code text} as whole words, so {@code 'm'} does not match "male".
     */
    static boolean containsWord(String text, String value) {
        int from = 0;
        while (true) {
            int at = text.indexOf(value, from);
            if (at == -1) {
                return false;
            }
            int end = at + value.length();
            boolean startsClean = at == 0 || !isWordChar(text.charAt(at - 1)) || !isWordChar(value.charAt(0));
            boolean endsClean = end == text.length() || !isWordChar(text.charAt(end))
                    || !isWordChar(value.charAt(value.length() - 1));
            if (startsClean && endsClean) {
                return true;
            }
            from = at + 1;
        }
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static List<BigDecimal> numbersIn(String text) {
        List<BigDecimal> out = new ArrayList<>();
        Matcher m = REQUEST_NUMBER.matcher(text);
        while (m.find()) {
            out.add(new BigDecimal(m.group()));
        }
        return out;
    }

    private static boolean containsNumber(List<BigDecimal> numbers, String literal) {
        BigDecimal value;
        try {
            value = new BigDecimal(literal);
        } catch (NumberFormatException e) {
            return false;
        }
        for (BigDecimal n : numbers) {
            if (n.compareTo(value) == 0) {
                return true;
            }
        }
        return false;
    }

    private static final class ColumnFinder extends ExpressionVisitorAdapter {
        private boolean found;

        @Override
        public void visit(Column column) {
            String name = column.getColumnName();
            if (name != null && !NON_COLUMN_NAMES.contains(name.toLowerCase(Locale.ROOT))) {
                found = true;
            }
        }
    }
}
