package com.sqlsignal.core.renderer;

/**
 * Writes rendered documents to a destination.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; register them in
 * {@code META-INF/services/com.sqlsignal.core.renderer.OutputRenderer}.
 */
public interface OutputRenderer {

    /**
     * Returns unique lowercase identifier ({@code console}, {@code filesystem}).
     *
     * @return renderer id
     */
    String getId();

    /**
     * Renders the documents.
     *
     * @param output documents to render
     * @param context destination and settings
     * @throws IllegalStateException if the destination is missing or cannot be written
     */
    void render(RenderedOutput output, RenderContext context);
}
