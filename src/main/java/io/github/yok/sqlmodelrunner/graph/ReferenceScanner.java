package io.github.yok.sqlmodelrunner.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Locates reference tokens ({@code {name}}) in a model body.
 *
 * <p>
 * This is a plain character scan. Nothing in the body is evaluated. A token is an opening brace
 * immediately followed by an identifier ({@code [A-Za-z_][A-Za-z0-9_]*}) and a closing brace.
 * </p>
 *
 * <p>
 * Braces inside the following regions are not tokens:
 * </p>
 * <ul>
 * <li>line comments ({@code -- ...} up to the end of the line)</li>
 * <li>block comments ({@code /* ... *}{@code /})</li>
 * <li>single- or double-quoted literals (a doubled quote is an escaped quote)</li>
 * </ul>
 *
 * <p>
 * {@link io.github.yok.sqlmodelrunner.resolve.ReferenceResolver} substitutes exactly the tokens
 * returned here, so discovery and substitution always agree.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ReferenceScanner {

    /**
     * One token occurrence.
     */
    @Getter
    @ToString
    @RequiredArgsConstructor
    public static final class Token {
        // Referenced name without braces
        private final String name;
        // Offset of '{'
        private final int start;
        // Offset just after '}'
        private final int end;
    }

    private ReferenceScanner() {
        throw new AssertionError("ReferenceScanner must not be instantiated.");
    }

    /**
     * Returns every token in {@code body}, in order of appearance.
     *
     * @param body model body
     * @return tokens; empty if none
     */
    public static List<Token> scan(String body) {
        List<Token> tokens = new ArrayList<>();
        int len = body.length();
        int i = 0;
        while (i < len) {
            char c = body.charAt(i);
            if (c == '-' && i + 1 < len && body.charAt(i + 1) == '-') {
                int eol = body.indexOf('\n', i);
                i = eol < 0 ? len : eol + 1;
            } else if (c == '/' && i + 1 < len && body.charAt(i + 1) == '*') {
                int close = body.indexOf("*/", i + 2);
                i = close < 0 ? len : close + 2;
            } else if (c == '\'' || c == '"') {
                i = skipQuoted(body, i, c);
            } else if (c == '{') {
                int end = matchToken(body, i);
                if (end > 0) {
                    tokens.add(new Token(body.substring(i + 1, end - 1), i, end));
                    i = end;
                } else {
                    i++;
                }
            } else {
                i++;
            }
        }
        return tokens;
    }

    /**
     * Returns the distinct referenced names in order of first appearance.
     *
     * @param body model body
     * @return referenced names
     */
    public static Set<String> referencedNames(String body) {
        Set<String> names = new LinkedHashSet<>();
        for (Token token : scan(body)) {
            names.add(token.getName());
        }
        return names;
    }

    /**
     * Returns the offset just after the closing quote of the literal starting at {@code start}.
     * An unterminated literal runs to the end of the body.
     */
    private static int skipQuoted(String body, int start, char quote) {
        int i = start + 1;
        while (i < body.length()) {
            if (body.charAt(i) == quote) {
                if (i + 1 < body.length() && body.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return body.length();
    }

    /**
     * Returns the offset just after '}' when a token starts at {@code open}, otherwise -1.
     */
    private static int matchToken(String body, int open) {
        int i = open + 1;
        if (i >= body.length() || !isIdentifierStart(body.charAt(i))) {
            return -1;
        }
        i++;
        while (i < body.length() && isIdentifierPart(body.charAt(i))) {
            i++;
        }
        if (i < body.length() && body.charAt(i) == '}') {
            return i + 1;
        }
        return -1;
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
