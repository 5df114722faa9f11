package com.sqlsignal.core.renderer;

import java.util.Objects;

/**
 * One document to be rendered.
 *
 * @param relativePath relative path for the document (e.g. {@code dbo.usp_load-control-flow.md})
 * @param content document content
 * @param contentType MIME type ({@code application/json}, {@code text/markdown})
 */
public record RenderedDocument(
    String relativePath,
    String content,
    String contentType
) {
    public static final String JSON = "application/json";
    public static final String MARKDOWN = "text/markdown";

    public RenderedDocument {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
