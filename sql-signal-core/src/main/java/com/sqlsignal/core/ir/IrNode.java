package com.sqlsignal.core.ir;

import java.util.List;
import java.util.Objects;

/**
 * One statement of the intermediate representation.
 *
 * <p>{@code keyword} is a canonical keyword fragment ({@code INSERT}, {@code SELECT INTO},
 * {@code BEGIN TRAN}, {@code XACT_ABORT}, ...). {@code target} holds the statement's subject when it
 * has one: the DML target table, the EXEC callee, a GOTO label, a RETURN literal or a SET option
 * value. Neither ever carries literal text; string literals are masked before classification.
 *
 * @param position zero-based source-order index within the unit
 * @param kind statement kind
 * @param depth nesting depth (0 = top level of the unit or routine body)
 * @param keyword canonical keyword fragment
 * @param target statement subject, or null
 * @param references names and markers found inside the statement's own tokens
 */
public record IrNode(
    int position,
    StatementKind kind,
    int depth,
    String keyword,
    String target,
    List<Reference> references
) {
    public IrNode {
        Objects.requireNonNull(kind, "kind must not be null");
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative");
        }
        if (depth < 0) {
            depth = 0;
        }
        if (keyword == null) {
            keyword = kind.name();
        }
        references = references == null ? List.of() : List.copyOf(references);
    }

    public boolean hasTarget() {
        return target != null && !target.isEmpty();
    }

    public boolean isKeyword(String value) {
        return keyword.equals(value);
    }
}
