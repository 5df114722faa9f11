package com.sqlsignal.core.terms;

import com.sqlsignal.core.model.TruncationNotice;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QueryTermsTest {

    @Test
    void of_mixedCaseAndWhitespace_canonicalized() {
        QueryTerms terms = QueryTerms.of(List.of("BEGIN  TRAN", "Try/Catch", "begin tran", " RETURN "), 30);

        assertThat(terms.asList()).containsExactly("begin tran", "return", "try/catch");
        assertThat(terms.truncation()).isEmpty();
    }

    @Test
    void iterator_calledTwice_restartsFromFirstTerm() {
        QueryTerms terms = QueryTerms.of(List.of("b", "a", "c"), 30);

        List<String> first = new ArrayList<>();
        terms.forEach(first::add);
        List<String> second = new ArrayList<>();
        terms.forEach(second::add);

        assertThat(first).containsExactly("a", "b", "c");
        assertThat(second).isEqualTo(first);
    }

    @Test
    void of_overLimit_cappedWithNotice() {
        QueryTerms terms = QueryTerms.of(List.of("d", "c", "b", "a"), 2);

        assertThat(terms.asList()).containsExactly("a", "b");
        assertThat(terms.size()).isEqualTo(2);
        assertThat(terms.truncation())
            .contains(new TruncationNotice(TruncationNotice.MAX_ITEMS_EXCEEDED, "query_terms", 2, 4));
    }

    @Test
    void empty_hasNoTerms() {
        assertThat(QueryTerms.empty().isEmpty()).isTrue();
        assertThat(QueryTerms.empty().iterator().hasNext()).isFalse();
    }
}
