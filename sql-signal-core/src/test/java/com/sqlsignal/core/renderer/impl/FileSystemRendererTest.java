package com.sqlsignal.core.renderer.impl;

import com.sqlsignal.core.renderer.OutputRenderer;
import com.sqlsignal.core.renderer.RenderContext;
import com.sqlsignal.core.renderer.RenderedDocument;
import com.sqlsignal.core.renderer.RenderedOutput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private final FileSystemRenderer renderer = new FileSystemRenderer();

    @Test
    void render_documents_writtenBelowOutputDirectory() throws IOException {
        // Given
        Path outputDir = tempDir.resolve("out");
        RenderedOutput output = new RenderedOutput(List.of(
            new RenderedDocument("dbo.a.json", "{}\n", RenderedDocument.JSON),
            new RenderedDocument("diagrams/dbo.a-control-flow.md", "# A\n", RenderedDocument.MARKDOWN)));

        // When
        renderer.render(output, RenderContext.directory(outputDir));

        // Then
        assertThat(Files.readString(outputDir.resolve("dbo.a.json"))).isEqualTo("{}\n");
        assertThat(Files.readString(outputDir.resolve("diagrams/dbo.a-control-flow.md"))).isEqualTo("# A\n");
    }

    @Test
    void render_existingFile_overwritten() throws IOException {
        Files.writeString(tempDir.resolve("a.json"), "old");

        renderer.render(RenderedOutput.of(new RenderedDocument("a.json", "new", RenderedDocument.JSON)),
            RenderContext.directory(tempDir));

        assertThat(Files.readString(tempDir.resolve("a.json"))).isEqualTo("new");
    }

    @Test
    void render_withoutOutputDirectory_throws() {
        RenderedOutput output = RenderedOutput.of(new RenderedDocument("a.json", "{}", RenderedDocument.JSON));

        assertThatThrownBy(() -> renderer.render(output, RenderContext.console()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Output directory is required");
    }

    @Test
    void render_pathOutsideOutputDirectory_throws() {
        RenderedOutput output = RenderedOutput.of(new RenderedDocument("../escape.json", "{}", RenderedDocument.JSON));

        assertThatThrownBy(() -> renderer.render(output, RenderContext.directory(tempDir.resolve("out"))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("escapes output directory");
        assertThat(tempDir.resolve("escape.json")).doesNotExist();
    }

    @Test
    void serviceLoader_discoversBothRenderers() {
        assertThat(ServiceLoader.load(OutputRenderer.class))
            .extracting(OutputRenderer::getId)
            .containsExactlyInAnyOrder("console", "filesystem");
    }
}
