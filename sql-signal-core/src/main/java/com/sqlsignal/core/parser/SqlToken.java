package com.sqlsignal.core.parser;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Lexical token of masked T-SQL text.
 *
 * @param type token type
 * @param text token text (string literals are already masked to {@code ''})
 */
public record SqlToken(
    Type type,
    String text
) {
    public enum Type {
        WORD,
        QUOTED_IDENTIFIER,
        VARIABLE,
        SYSTEM_VARIABLE,
        NUMBER,
        STRING,
        LPAREN,
        RPAREN,
        SEMI,
        COLON,
        DOT,
        COMMA,
        OPERATOR
    }

    public SqlToken {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Upper-cased text, used for keyword comparison.
     *
     * @return upper-case token text
     */
    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    public boolean isWord() {
        return type == Type.WORD;
    }

    /**
     * Returns whether this token is the given keyword (case-insensitive).
     *
     * @param keyword upper-case keyword
     * @return true if this is a word token equal to the keyword
     */
    public boolean is(String keyword) {
        return type == Type.WORD && text.equalsIgnoreCase(keyword);
    }

    public boolean isAnyOf(Set<String> keywords) {
        return type == Type.WORD && keywords.contains(upper());
    }

    /**
     * Returns whether this token can be one part of an object name.
     *
     * @return true for plain words and bracketed/quoted identifiers
     */
    public boolean isNamePart() {
        return type == Type.WORD || type == Type.QUOTED_IDENTIFIER;
    }

    /**
     * Name text with surrounding brackets or double quotes removed.
     *
     * @return unquoted identifier text
     */
    public String unquoted() {
        if (type != Type.QUOTED_IDENTIFIER) {
            return text;
        }
        boolean bracketed = text.charAt(0) == '[';
        char close = bracketed ? ']' : '"';
        int end = text.length() > 1 && text.charAt(text.length() - 1) == close ? text.length() - 1 : text.length();
        String inner = text.substring(1, end);
        return bracketed ? inner.replace("]]", "]") : inner.replace("\"\"", "\"");
    }
}
