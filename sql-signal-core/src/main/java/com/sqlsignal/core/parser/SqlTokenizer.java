package com.sqlsignal.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based tokenizer for masked T-SQL.
 *
 * <p>Used by the fallback scanner over a whole unit and by the grammar path over the text span of
 * each recognized statement, so both paths classify statements from the same token shapes.
 */
public final class SqlTokenizer {

    private static final Pattern TOKEN_PATTERN = Pattern.compile(
        "(?<string>[Nn]?'(?:[^']++|'')*+'?)"
            + "|(?<quoted>\\[(?:[^\\]]++|\\]\\])*+\\]?|\"(?:[^\"]++|\"\")*+\"?)"
            + "|(?<sysvar>@@[\\w$#]+)"
            + "|(?<variable>@[\\w@$#]*)"
            + "|(?<number>0[xX][0-9a-fA-F]*|\\d+(?:\\.\\d*)?(?:[eE][+-]?\\d+)?|\\.\\d+)"
            + "|(?<word>[A-Za-z_#][\\w@$#]*)"
            + "|(?<symbol>\\S)"
    );

    private SqlTokenizer() {
        // Utility class
    }

    /**
     * Tokenizes masked SQL text.
     *
     * @param masked masked SQL text
     * @return tokens in source order, never null
     */
    public static List<SqlToken> tokenize(String masked) {
        List<SqlToken> tokens = new ArrayList<>();
        if (masked == null || masked.isEmpty()) {
            return tokens;
        }

        Matcher matcher = TOKEN_PATTERN.matcher(masked);
        while (matcher.find()) {
            tokens.add(new SqlToken(typeOf(matcher), matcher.group()));
        }
        return tokens;
    }

    private static SqlToken.Type typeOf(Matcher matcher) {
        if (matcher.group("string") != null) {
            return SqlToken.Type.STRING;
        }
        if (matcher.group("quoted") != null) {
            return SqlToken.Type.QUOTED_IDENTIFIER;
        }
        if (matcher.group("sysvar") != null) {
            return SqlToken.Type.SYSTEM_VARIABLE;
        }
        if (matcher.group("variable") != null) {
            return SqlToken.Type.VARIABLE;
        }
        if (matcher.group("number") != null) {
            return SqlToken.Type.NUMBER;
        }
        if (matcher.group("word") != null) {
            return SqlToken.Type.WORD;
        }
        return switch (matcher.group("symbol")) {
            case "(" -> SqlToken.Type.LPAREN;
            case ")" -> SqlToken.Type.RPAREN;
            case ";" -> SqlToken.Type.SEMI;
            case ":" -> SqlToken.Type.COLON;
            case "." -> SqlToken.Type.DOT;
            case "," -> SqlToken.Type.COMMA;
            default -> SqlToken.Type.OPERATOR;
        };
    }
}
