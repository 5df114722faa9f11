package com.sqlsignal.core.terms;

import com.sqlsignal.core.determinism.Canonical;
import com.sqlsignal.core.determinism.Capped;
import com.sqlsignal.core.determinism.DeterministicList;
import com.sqlsignal.core.flow.ControlFlow;
import com.sqlsignal.core.model.TruncationNotice;
import com.sqlsignal.core.signal.MigrationImpact;
import com.sqlsignal.core.signal.MigrationImpacts;
import com.sqlsignal.core.signal.SignalBundle;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Retrieval terms for a lexical document index.
 *
 * <p>Finite and restartable: every {@link #iterator()} call starts over at the first term. Terms are
 * lower-case with collapsed whitespace, sorted and unique.
 */
public final class QueryTerms implements Iterable<String> {

    private static final QueryTerms EMPTY = new QueryTerms(new Capped<>(List.of(), 0, 0));

    private final Capped<String> terms;

    private QueryTerms(Capped<String> terms) {
        this.terms = terms;
    }

    public static QueryTerms empty() {
        return EMPTY;
    }

    /**
     * Canonicalizes arbitrary strings into terms.
     *
     * @param values raw terms
     * @param limit maximum number of terms
     * @return query terms
     */
    public static QueryTerms of(Collection<String> values, int limit) {
        return new QueryTerms(DeterministicList.strings(values, Canonical.term(), limit));
    }

    /**
     * Collects terms from impact ids and categories and from every signal list of one analysis.
     *
     * @param bundle extracted signals
     * @param impacts migration impacts
     * @param controlFlow control flow result
     * @param limit maximum number of terms
     * @return query terms
     */
    public static QueryTerms from(SignalBundle bundle, MigrationImpacts impacts, ControlFlow controlFlow, int limit) {
        List<String> values = new ArrayList<>();
        for (MigrationImpact impact : impacts.items()) {
            values.add(impact.id());
            values.add(impact.category());
        }
        values.addAll(bundle.transactions().signals());
        values.addAll(bundle.dataChanges().signals());
        values.addAll(bundle.errorHandling().signals());
        values.addAll(controlFlow.signals());
        return of(values, limit);
    }

    @Override
    public Iterator<String> iterator() {
        return terms.items().iterator();
    }

    public List<String> asList() {
        return terms.items();
    }

    public int size() {
        return terms.size();
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    public Optional<TruncationNotice> truncation() {
        return terms.notice("query_terms");
    }

    @Override
    public String toString() {
        return terms.items().toString();
    }
}
