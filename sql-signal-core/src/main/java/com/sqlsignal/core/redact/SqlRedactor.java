package com.sqlsignal.core.redact;

import com.sqlsignal.core.model.Digest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redaction boundary for raw SQL text.
 *
 * <p>Two operations are offered:
 * <ul>
 *   <li>{@link #digest(String)} derives a {@link Digest} (length + first 8 hex chars of SHA-256)</li>
 *   <li>{@link #mask(String)} blanks comments and replaces string literals with {@code ''}</li>
 * </ul>
 *
 * <p>Masking keeps token boundaries and line structure (newlines inside block comments survive), so
 * line/column positions reported by the parser still refer to the original text. Bracketed and
 * double-quoted identifiers pass through untouched so that a quote inside {@code [it's]} does not
 * start a literal.
 */
public final class SqlRedactor {

    private static final Pattern LITERAL_PATTERN = Pattern.compile(
        "(?<block>/\\*(?:[^*]++|\\*(?!/))*+(?:\\*/)?)"
            + "|(?<line>--[^\\r\\n]*+)"
            + "|(?<ident>\\[(?:[^\\]]++|\\]\\])*+\\]?|\"(?:[^\"]++|\"\")*+\"?)"
            + "|(?<string>(?<![\\w@#$])[Nn]'(?:[^']++|'')*+'?|'(?:[^']++|'')*+'?)"
    );

    private static final String STRING_PLACEHOLDER = "''";

    private SqlRedactor() {
        // Utility class
    }

    /**
     * Computes the digest of a raw text.
     *
     * @param raw raw SQL text
     * @return length and short hash
     */
    public static Digest digest(String raw) {
        String text = raw == null ? "" : raw;
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha.digest(text.getBytes(StandardCharsets.UTF_8));
            return new Digest(text.length(), HexFormat.of().formatHex(hash).substring(0, 8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Produces a comment- and string-masked copy of a raw text.
     *
     * @param raw raw SQL text
     * @return masked text, safe for pattern matching and parsing
     */
    public static String mask(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }

        Matcher matcher = LITERAL_PATTERN.matcher(raw);
        StringBuilder masked = new StringBuilder(raw.length());
        int last = 0;

        while (matcher.find()) {
            masked.append(raw, last, matcher.start());
            if (matcher.group("block") != null) {
                masked.append(blankPreservingNewlines(matcher.group("block")));
            } else if (matcher.group("line") != null) {
                masked.append(' ');
            } else if (matcher.group("ident") != null) {
                masked.append(matcher.group("ident"));
            } else {
                masked.append(STRING_PLACEHOLDER);
            }
            last = matcher.end();
        }
        masked.append(raw, last, raw.length());
        return masked.toString();
    }

    private static String blankPreservingNewlines(String comment) {
        StringBuilder sb = new StringBuilder(" ");
        comment.chars()
            .filter(c -> c == '\n')
            .forEach(c -> sb.append('\n'));
        return sb.toString();
    }
}
