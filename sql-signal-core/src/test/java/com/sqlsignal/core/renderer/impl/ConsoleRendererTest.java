package com.sqlsignal.core.renderer.impl;

import com.sqlsignal.core.renderer.RenderContext;
import com.sqlsignal.core.renderer.RenderedDocument;
import com.sqlsignal.core.renderer.RenderedOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ConsoleRenderer renderer;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    private String console() {
        return outputStream.toString(StandardCharsets.UTF_8);
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_singleDocument_printsContentVerbatim() {
        // Given
        String content = "{\n  \"name\" : \"x\"\n}\n";
        RenderedOutput output = RenderedOutput.of(new RenderedDocument("x.json", content, RenderedDocument.JSON));

        // When
        renderer.render(output, RenderContext.console());

        // Then
        assertThat(console()).isEqualTo(content);
    }

    @Test
    void render_multipleDocuments_printsHeaders() {
        RenderedOutput output = new RenderedOutput(List.of(
            new RenderedDocument("a.json", "{}\n", RenderedDocument.JSON),
            new RenderedDocument("a-control-flow.md", "# A", RenderedDocument.MARKDOWN)));

        renderer.render(output, RenderContext.console());

        assertThat(console()).isEqualTo("--- a.json ---\n{}\n--- a-control-flow.md ---\n# A\n");
    }

    @Test
    void render_headersDisabled_printsContentOnly() {
        RenderedOutput output = new RenderedOutput(List.of(
            new RenderedDocument("a.json", "{}\n", RenderedDocument.JSON),
            new RenderedDocument("b.json", "[]\n", RenderedDocument.JSON)));

        renderer.render(output, new RenderContext(null, Map.of("console.showHeaders", "false")));

        assertThat(console()).isEqualTo("{}\n[]\n");
    }

    @Test
    void render_customSeparator_used() {
        RenderedOutput output = new RenderedOutput(List.of(
            new RenderedDocument("a.json", "{}\n", RenderedDocument.JSON),
            new RenderedDocument("b.json", "[]\n", RenderedDocument.JSON)));

        renderer.render(output, new RenderContext(null, Map.of("console.separator", "==")));

        assertThat(console()).contains("== a.json ==");
    }
}
