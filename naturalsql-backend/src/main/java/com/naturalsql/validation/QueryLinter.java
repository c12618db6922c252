package com.naturalsql.validation;

import com.naturalsql.compiler.SqlTokenizer;
import com.naturalsql.compiler.SqlTokenizer.Token;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory checks on SELECT statements. Warnings never block execution.
 */
@Component
public class QueryLinter {

    static final String SELECT_STAR = "SELECT * returns every column; list only the columns you need";
    static final String LEADING_WILDCARD = "LIKE pattern starts with a wildcard and cannot use an index";
    static final String CROSS_JOIN = "CROSS JOIN produces a cartesian product";
    static final String IN_SUBQUERY = "IN (SELECT ...) may be slow; consider EXISTS or a JOIN";

    public List<String> lint(String sql) {
        List<Token> tokens = SqlTokenizer.tokenize(sql);
        List<String> warnings = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            Token prev = i > 0 ? tokens.get(i - 1) : null;
            Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;

            if (t.type() == SqlTokenizer.Type.SYMBOL && "*".equals(t.text()) && prev != null
                    && (prev.isWord("SELECT") || prev.isWord("DISTINCT")
                    || (prev.type() == SqlTokenizer.Type.SYMBOL && (",".equals(prev.text()) || ".".equals(prev.text()))))) {
                addOnce(warnings, SELECT_STAR);
            } else if ((t.isWord("LIKE") || t.isWord("ILIKE")) && next != null && next.type() == SqlTokenizer.Type.STRING
                    && (next.text().startsWith("%") || next.text().startsWith("_"))) {
                addOnce(warnings, LEADING_WILDCARD);
            } else if (t.isWord("CROSS") && next != null && next.isWord("JOIN")) {
                addOnce(warnings, CROSS_JOIN);
            } else if (t.isWord("IN") && next != null && "(".equals(next.text())
                    && i + 2 < tokens.size() && tokens.get(i + 2).isWord("SELECT")) {
                addOnce(warnings, IN_SUBQUERY);
            }
        }
        return warnings;
    }

    private static void addOnce(List<String> warnings, String warning) {
        if (!warnings.contains(warning)) {
            warnings.add(warning);
        }
    }
}
