package io.github.goodees.factstore.core.compose;

/*-
 * #%L
 * factstore
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.function.IntFunction;

/**
 * Rewriting of positional placeholders ({@code $1}, {@code $2}, ...) in SQL text.
 *
 * <p>Rewriting is done in a single pass over the statement and every placeholder is matched as a whole token,
 * i. e. {@code $1} is never matched as a prefix of {@code $10}, and the replacement text is never scanned again.
 * Text within quoted literals ({@code '...'}), quoted identifiers ({@code "..."}), dollar quoted strings
 * ({@code $$...$$} as well as {@code $tag$...$tag$}) and comments is copied verbatim.
 */
public final class Placeholders {
    private Placeholders() {

    }

    /**
     * Shift every placeholder by given offset.
     * @param sql the statement
     * @param offset number to add to every placeholder index
     * @return statement with {@code $k} replaced by {@code $(k+offset)}
     */
    public static String renumber(String sql, int offset) {
        if (offset == 0) {
            return sql;
        }
        return rewrite(sql, index -> "$" + (index + offset));
    }

    /**
     * Replace every placeholder with text provided by {@code replacement}. The function is invoked for placeholders
     * in order of their appearance.
     * @param sql the statement
     * @param replacement function from placeholder index to its replacement
     * @return rewritten statement
     */
    public static String rewrite(String sql, IntFunction<String> replacement) {
        int length = sql.length();
        StringBuilder result = new StringBuilder(length + 16);
        int i = 0;
        while (i < length) {
            char c = sql.charAt(i);
            int end;
            if (c == '\'' || c == '"') {
                end = skipQuoted(sql, i, c);
            } else if (startsWith(sql, i, "--")) {
                end = skipUntil(sql, i + 2, "\n", 1);
            } else if (startsWith(sql, i, "/*")) {
                end = skipUntil(sql, i + 2, "*/", 2);
            } else if (c == '$' && dollarTag(sql, i) != null) {
                String tag = dollarTag(sql, i);
                end = skipUntil(sql, i + tag.length(), tag, tag.length());
            } else if (c == '$' && i + 1 < length && isDigit(sql.charAt(i + 1)) && !followsIdentifier(sql, i)) {
                end = i + 1;
                while (end < length && isDigit(sql.charAt(end))) {
                    end++;
                }
                result.append(replacement.apply(parseIndex(sql.substring(i + 1, end))));
                i = end;
                continue;
            } else {
                end = i + 1;
            }
            result.append(sql, i, end);
            i = end;
        }
        return result.toString();
    }

    private static int parseIndex(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Placeholder $" + digits + " is out of range", e);
        }
    }

    /**
     * Opening delimiter of a dollar quoted string at given position, {@code $$} or {@code $tag$}.
     * @return the delimiter, or null if there is none
     */
    private static String dollarTag(String sql, int position) {
        if (followsIdentifier(sql, position)) {
            return null;
        }
        int i = position + 1;
        if (i < sql.length() && (Character.isLetter(sql.charAt(i)) || sql.charAt(i) == '_')) {
            while (i < sql.length() && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '_')) {
                i++;
            }
        }
        return i < sql.length() && sql.charAt(i) == '$' ? sql.substring(position, i + 1) : null;
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                // doubled quote is an escaped quote
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                } else {
                    return i + 1;
                }
            } else {
                i++;
            }
        }
        return sql.length();
    }

    private static int skipUntil(String sql, int from, String terminator, int terminatorLength) {
        int found = sql.indexOf(terminator, from);
        return found < 0 ? sql.length() : found + terminatorLength;
    }

    private static boolean startsWith(String sql, int position, String prefix) {
        return sql.startsWith(prefix, position);
    }

    private static boolean followsIdentifier(String sql, int position) {
        if (position == 0) {
            return false;
        }
        char previous = sql.charAt(position - 1);
        return Character.isLetterOrDigit(previous) || previous == '_' || previous == '$';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
