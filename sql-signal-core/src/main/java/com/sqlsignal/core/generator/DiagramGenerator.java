package com.sqlsignal.core.generator;

import java.util.Set;

/**
 * Turns analysis graphs into diagram source text.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; register them in
 * {@code META-INF/services/com.sqlsignal.core.generator.DiagramGenerator}.
 *
 * @see DiagramModel
 * @see DiagramType
 */
public interface DiagramGenerator {

    /**
     * Returns unique lowercase identifier, matched against the CLI {@code --format} option.
     *
     * @return generator id
     */
    String getId();

    String getDisplayName();

    /**
     * @return file extension without leading dot
     */
    String getFileExtension();

    Set<DiagramType> getSupportedDiagramTypes();

    /**
     * Generates a diagram. A model without data for the requested type yields a placeholder diagram.
     *
     * @param model graphs to draw
     * @param type diagram type
     * @return generated diagram
     * @throws IllegalArgumentException if the type is not supported
     */
    GeneratedDiagram generate(DiagramModel model, DiagramType type);
}
