package com.sqlsignal.core.renderer.impl;

import com.sqlsignal.core.renderer.OutputRenderer;
import com.sqlsignal.core.renderer.RenderContext;
import com.sqlsignal.core.renderer.RenderedDocument;
import com.sqlsignal.core.renderer.RenderedOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that writes documents below the context's output directory, overwriting existing files.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(RenderedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory();
        if (outputDir == null) {
            throw new IllegalStateException("Output directory is required for the filesystem renderer");
        }
        logger.info("Rendering {} documents to filesystem at: {}", output.documents().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }
        for (RenderedDocument document : output.documents()) {
            writeDocument(outputDir, document);
        }
    }

    private void writeDocument(Path outputDir, RenderedDocument document) {
        Path targetPath = outputDir.resolve(document.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir.normalize())) {
            throw new IllegalStateException("Document path escapes output directory: " + document.relativePath());
        }

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, document.content(), StandardCharsets.UTF_8);
            logger.info("Wrote file: {} ({} bytes)", document.relativePath(), document.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + document.relativePath(), e);
        }
    }
}
