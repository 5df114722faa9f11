package com.sqlsignal.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Dotted object name read from a token run, e.g. {@code [dbo].[Users]} or {@code db..Orders}.
 *
 * @param parts unquoted name parts
 * @param end index of the first token after the name
 */
record QualifiedName(
    List<String> parts,
    int end
) {
    QualifiedName {
        parts = List.copyOf(parts);
    }

    /**
     * Reads a qualified name starting at {@code start}.
     *
     * @param tokens statement tokens
     * @param start index of the first name part
     * @return the name, or empty if no name part starts at {@code start}
     */
    static Optional<QualifiedName> readAt(List<SqlToken> tokens, int start) {
        if (start < 0 || start >= tokens.size() || !tokens.get(start).isNamePart()) {
            return Optional.empty();
        }

        List<String> parts = new ArrayList<>();
        parts.add(tokens.get(start).unquoted());
        int i = start + 1;

        while (i < tokens.size() && tokens.get(i).type() == SqlToken.Type.DOT) {
            int j = i;
            while (j < tokens.size() && tokens.get(j).type() == SqlToken.Type.DOT) {
                j++;
            }
            if (j >= tokens.size() || !tokens.get(j).isNamePart()) {
                break;
            }
            parts.add(tokens.get(j).unquoted());
            i = j + 1;
        }
        return Optional.of(new QualifiedName(parts, i));
    }

    String canonical() {
        return written().toUpperCase(Locale.ROOT);
    }

    String written() {
        return String.join(".", parts);
    }

    String first() {
        return parts.get(0);
    }

    String last() {
        return parts.get(parts.size() - 1);
    }

    boolean isSinglePart() {
        return parts.size() == 1;
    }
}
