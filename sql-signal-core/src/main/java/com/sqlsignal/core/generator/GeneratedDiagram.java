package com.sqlsignal.core.generator;

import java.util.Objects;

/**
 * Represents a generated diagram.
 *
 * @param name diagram name, usable as a file name stem
 * @param type diagram type
 * @param content diagram source
 * @param fileExtension file extension for this content
 */
public record GeneratedDiagram(
    String name,
    DiagramType type,
    String content,
    String fileExtension
) {
    public GeneratedDiagram {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }
}
