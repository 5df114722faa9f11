package com.sqlsignal.core.model;

import java.util.Objects;

/**
 * Length and short hash of a raw SQL text.
 *
 * <p>The only representation of source text allowed past the redaction boundary, in responses as
 * well as in log lines.
 *
 * @param length character count of the raw text
 * @param hash8 first 8 hex characters of the SHA-256 of the raw text
 */
public record Digest(
    int length,
    String hash8
) {
    public Digest {
        Objects.requireNonNull(hash8, "hash8 must not be null");
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative");
        }
    }

    @Override
    public String toString() {
        return "len=" + length + ", hash8=" + hash8;
    }
}
