package com.sqlsignal.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Documents produced by one command, in output order.
 *
 * @param documents documents to render
 */
public record RenderedOutput(
    List<RenderedDocument> documents
) {
    public RenderedOutput {
        Objects.requireNonNull(documents, "documents must not be null");
        documents = List.copyOf(documents);
    }

    public static RenderedOutput of(RenderedDocument document) {
        return new RenderedOutput(List.of(document));
    }
}
