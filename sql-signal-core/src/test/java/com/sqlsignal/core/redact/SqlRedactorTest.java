package com.sqlsignal.core.redact;

import com.sqlsignal.core.model.Digest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SqlRedactor}.
 */
class SqlRedactorTest {

    @Test
    void digest_sameText_returnsSameHash() {
        Digest first = SqlRedactor.digest("SELECT 1");
        Digest second = SqlRedactor.digest("SELECT 1");

        assertThat(first).isEqualTo(second);
        assertThat(first.length()).isEqualTo(8);
        assertThat(first.hash8()).hasSize(8).matches("[0-9a-f]{8}");
    }

    @Test
    void digest_differentText_returnsDifferentHash() {
        assertThat(SqlRedactor.digest("SELECT 1").hash8())
            .isNotEqualTo(SqlRedactor.digest("SELECT 2").hash8());
    }

    @Test
    void digest_null_treatedAsEmpty() {
        Digest digest = SqlRedactor.digest(null);

        assertThat(digest.length()).isZero();
        // SHA-256 of the empty string
        assertThat(digest.hash8()).isEqualTo("e3b0c442");
    }

    @Test
    void digest_toString_containsOnlyLengthAndHash() {
        Digest digest = SqlRedactor.digest("SELECT 'secret'");

        assertThat(digest.toString()).isEqualTo("len=15, hash8=" + digest.hash8());
    }

    @Test
    void mask_stringLiterals_replacedWithEmptyLiteral() {
        String masked = SqlRedactor.mask("SELECT 'top secret', N'unicode secret' FROM t");

        assertThat(masked).isEqualTo("SELECT '', '' FROM t");
    }

    @Test
    void mask_escapedQuoteInsideLiteral_maskedAsOneLiteral() {
        assertThat(SqlRedactor.mask("PRINT 'it''s here'")).isEqualTo("PRINT ''");
    }

    @Test
    void mask_comments_removedButLinesKept() {
        // Given
        String raw = "SELECT 1 -- hidden note\n/* block\ncomment */SELECT 2";

        // When
        String masked = SqlRedactor.mask(raw);

        // Then
        assertThat(masked).doesNotContain("hidden", "block", "comment");
        assertThat(masked.split("\n", -1)).hasSize(3);
        assertThat(masked).contains("SELECT 1", "SELECT 2");
    }

    @Test
    void mask_bracketedIdentifierWithQuote_leftIntact() {
        String masked = SqlRedactor.mask("SELECT [it's] FROM [dbo].[Users] WHERE name = 'bob'");

        assertThat(masked).isEqualTo("SELECT [it's] FROM [dbo].[Users] WHERE name = ''");
    }

    @Test
    void mask_unterminatedLiteral_maskedToEnd() {
        assertThat(SqlRedactor.mask("SELECT 'never closed")).isEqualTo("SELECT ''");
    }

    @Test
    void mask_nullOrEmpty_returnsEmpty() {
        assertThat(SqlRedactor.mask(null)).isEmpty();
        assertThat(SqlRedactor.mask("")).isEmpty();
    }
}
