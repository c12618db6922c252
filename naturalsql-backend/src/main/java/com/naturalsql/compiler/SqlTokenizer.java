package com.naturalsql.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Minimal SQL lexer. It recognizes enough structure to tell literals, identifiers and placeholders apart; it
 * does not validate syntax.
 */
public final class SqlTokenizer {

    /**
     * Token categories.
     */
    public enum Type {
        WORD,
        NUMBER,
        STRING,
        QUOTED_IDENTIFIER,
        PLACEHOLDER,
        SYMBOL
    }

    /**
     * One token. For {@link Type#STRING} the text is the unescaped literal value.
     *
     * @param type token type
     * @param text token text
     */
    public record Token(Type type, String text) {
        public boolean isWord(String word) {
            return type == Type.WORD && text.equalsIgnoreCase(word);
        }
    }

    private SqlTokenizer() {
    }

    /**
     * Split SQL into tokens, dropping whitespace and comments.
     *
     * @param sql sql text
     * @return tokens in source order
     */
    public static List<Token> tokenize(String sql) {
        List<Token> out = new ArrayList<>();
        if (sql == null) {
            return out;
        }
        int n = sql.length();
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                while (i < n && sql.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end == -1 ? n : end + 2;
            } else if (c == '\'') {
                StringBuilder sb = new StringBuilder();
                i++;
                while (i < n) {
                    char ch = sql.charAt(i);
                    if (ch == '\'') {
                        if (i + 1 < n && sql.charAt(i + 1) == '\'') {
                            sb.append('\'');
                            i += 2;
                            continue;
                        }
                        i++;
                        break;
                    }
                    sb.append(ch);
                    i++;
                }
                out.add(new Token(Type.STRING, sb.toString()));
            } else if (c == '"' || c == '`' || c == '[') {
                char close = c == '[' ? ']' : c;
                int end = sql.indexOf(close, i + 1);
                int stop = end == -1 ? n : end;
                out.add(new Token(Type.QUOTED_IDENTIFIER, sql.substring(i + 1, stop)));
                i = end == -1 ? n : end + 1;
            } else if (c == '?') {
                out.add(new Token(Type.PLACEHOLDER, "?"));
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(sql.charAt(i + 1)))) {
                int start = i;
                while (i < n && (Character.isDigit(sql.charAt(i)) || sql.charAt(i) == '.')) {
                    i++;
                }
                if (i < n && (sql.charAt(i) == 'e' || sql.charAt(i) == 'E')
                        && i + 1 < n && (Character.isDigit(sql.charAt(i + 1)) || sql.charAt(i + 1) == '-' || sql.charAt(i + 1) == '+')) {
                    i += 2;
                    while (i < n && Character.isDigit(sql.charAt(i))) {
                        i++;
                    }
                }
                out.add(new Token(Type.NUMBER, sql.substring(start, i)));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '_' || sql.charAt(i) == '$')) {
                    i++;
                }
                out.add(new Token(Type.WORD, sql.substring(start, i)));
            } else {
                out.add(new Token(Type.SYMBOL, String.valueOf(c)));
                i++;
            }
        }
        return out;
    }

    /**
     * Number of {@code ?} placeholders outside literals and comments.
     *
     * @param sql sql text
     * @return placeholder count
     */
    public static int countPlaceholders(String sql) {
        int count = 0;
        for (Token t : tokenize(sql)) {
            if (t.type() == Type.PLACEHOLDER) {
                count++;
            }
        }
        return count;
    }

    /**
     * First keyword of the statement, upper-cased, skipping leading parentheses.
     *
     * @param sql sql text
     * @return keyword, or empty string
     */
    public static String leadingKeyword(String sql) {
        for (Token t : tokenize(sql)) {
            if (t.type() == Type.WORD) {
                return t.text().toUpperCase(Locale.ROOT);
            }
            if (!(t.type() == Type.SYMBOL && "(".equals(t.text()))) {
                return "";
            }
        }
        return "";
    }
}
