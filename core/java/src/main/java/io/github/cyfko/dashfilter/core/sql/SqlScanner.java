package io.github.cyfko.dashfilter.core.sql;

import io.github.cyfko.dashfilter.core.exception.MalformedQueryException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Single-pass lexical scan of a SQL query.
 * <p>
 * Produces the bare words of the query with their parenthesis depth, skipping string literals,
 * quoted identifiers and comments. This is not a parser: it knows nothing about grammar, only
 * where words are and how deeply they are nested, which is enough to find clause boundaries.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class SqlScanner {

    private SqlScanner() {
    }

    /**
     * One bare word of the query.
     *
     * @param text        the word in upper case
     * @param start       offset of the first character
     * @param end         offset after the last character
     * @param depth       parenthesis depth, 0 for the outer statement
     * @param previousEnd offset after the last significant character before the word
     * @param qualified   whether the word follows a dot ({@code t.limit})
     */
    record Word(String text, int start, int end, int depth, int previousEnd, boolean qualified) {

        boolean isKeyword(String keyword) {
            return !qualified && text.equals(keyword);
        }

        boolean isTopLevel() {
            return depth == 0 && !qualified;
        }
    }

    /**
     * Scan outcome.
     *
     * @param sql            the scanned query
     * @param words          every bare word, in order
     * @param contentEnd     offset after the last significant character of the first statement
     * @param terminator     offset of the depth-0 {@code ;}, or -1
     * @param extraStatement whether something significant follows the terminator
     */
    record Layout(String sql, List<Word> words, int contentEnd, int terminator, boolean extraStatement) {

        List<Word> topLevel() {
            List<Word> top = new ArrayList<>();
            for (Word word : words) {
                if (word.isTopLevel()) {
                    top.add(word);
                }
            }
            return top;
        }
    }

    /**
     * Scans a query.
     *
     * @param sql query text
     * @return the layout
     * @throws MalformedQueryException on unbalanced parentheses or an unterminated literal or comment
     */
    static Layout scan(String sql) {
        List<Word> words = new ArrayList<>();
        int n = sql.length();
        int depth = 0;
        int lastSignificantEnd = 0;
        char lastSignificant = 0;
        int terminator = -1;
        boolean extraStatement = false;

        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int eol = sql.indexOf('\n', i + 2);
                i = eol < 0 ? n : eol + 1;
                continue;
            }
            if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                if (close < 0) {
                    throw new MalformedQueryException("Unterminated block comment", i);
                }
                i = close + 2;
                continue;
            }
            if (terminator >= 0) {
                if (c != ';') {
                    extraStatement = true;
                    break;
                }
                i++;
                continue;
            }

            if (c == '\'' || c == '"' || c == '`') {
                i = skipQuoted(sql, i, c);
            } else if (c == '(') {
                depth++;
                i++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new MalformedQueryException("Unbalanced parenthesis", i);
                }
                i++;
            } else if (c == ';') {
                if (depth != 0) {
                    throw new MalformedQueryException("Statement terminator inside parentheses", i);
                }
                terminator = i;
                i++;
                continue;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && isWordPart(sql.charAt(i))) {
                    i++;
                }
                words.add(new Word(sql.substring(start, i).toUpperCase(Locale.ROOT), start, i, depth,
                        lastSignificantEnd, lastSignificant == '.'));
            } else if (Character.isDigit(c)) {
                while (i < n && (isWordPart(sql.charAt(i)) || sql.charAt(i) == '.')) {
                    i++;
                }
            } else {
                i++;
            }
            lastSignificantEnd = i;
            lastSignificant = sql.charAt(i - 1);
        }

        if (depth != 0) {
            throw new MalformedQueryException("Unbalanced parentheses: " + depth + " unclosed '(' at end of query");
        }
        return new Layout(sql, Collections.unmodifiableList(words), lastSignificantEnd, terminator, extraStatement);
    }

    private static int skipQuoted(String sql, int open, char quote) {
        int i = open + 1;
        int n = sql.length();
        while (i < n) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < n && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        throw new MalformedQueryException(quote == '\'' ? "Unterminated string literal" : "Unterminated quoted identifier", open);
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
