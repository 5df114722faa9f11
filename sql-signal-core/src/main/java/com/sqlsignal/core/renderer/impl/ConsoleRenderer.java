package com.sqlsignal.core.renderer.impl;

import com.sqlsignal.core.renderer.OutputRenderer;
import com.sqlsignal.core.renderer.RenderContext;
import com.sqlsignal.core.renderer.RenderedDocument;
import com.sqlsignal.core.renderer.RenderedOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Renderer that prints documents to standard output.
 *
 * <p>A single document is printed verbatim so that JSON output can be piped into other tools. With
 * several documents each one is preceded by a header line unless headers are disabled.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.showHeaders} - Show document headers ("true"/"false", default: "true")</li>
 *   <li>{@code console.separator} - Separator between documents (default: "---")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String DEFAULT_SEPARATOR = "---";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(RenderedOutput output, RenderContext context) {
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"))
            && output.documents().size() > 1;
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);
        logger.debug("Rendering {} documents to console (headers: {})", output.documents().size(), showHeaders);

        for (int i = 0; i < output.documents().size(); i++) {
            RenderedDocument document = output.documents().get(i);
            if (showHeaders) {
                out.println(separator + " " + document.relativePath() + " " + separator);
            }
            out.print(document.content());
            if (!document.content().endsWith("\n")) {
                out.println();
            }
        }
        out.flush();
    }
}
