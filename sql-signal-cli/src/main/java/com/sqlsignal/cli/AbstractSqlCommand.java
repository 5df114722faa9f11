package com.sqlsignal.cli;

import com.sqlsignal.core.analysis.SqlAnalyzer;
import com.sqlsignal.core.config.AnalyzerConfig;
import com.sqlsignal.core.config.AnalyzerSettings;
import com.sqlsignal.core.config.ConfigLoader;
import com.sqlsignal.core.generator.DiagramGenerator;
import com.sqlsignal.core.generator.DiagramModel;
import com.sqlsignal.core.generator.DiagramType;
import com.sqlsignal.core.generator.GeneratedDiagram;
import com.sqlsignal.core.renderer.OutputRenderer;
import com.sqlsignal.core.renderer.RenderContext;
import com.sqlsignal.core.renderer.RenderedDocument;
import com.sqlsignal.core.renderer.RenderedOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Options and plumbing shared by the analysis commands: configuration loading, output format
 * selection and rendering through the discovered {@link OutputRenderer}s.
 *
 * <p>When output goes to the console only the document itself is printed, so JSON can be piped.
 * With {@code --output} the documents are written to files and progress lines are printed instead.
 */
public abstract class AbstractSqlCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractSqlCommand.class);

    static final String CONSOLE_RENDERER = "console";
    static final String FILESYSTEM_RENDERER = "filesystem";

    /**
     * Output formats.
     */
    public enum Format {
        JSON,
        MERMAID
    }

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: ${DEFAULT-VALUE})"
    )
    Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    Format format = Format.JSON;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (default: print to console)"
    )
    Path outputDir;

    /**
     * Name used in progress and failure messages.
     *
     * @return command display name
     */
    protected abstract String commandName();

    /**
     * Produces the documents of this command.
     *
     * @param analyzer analyzer built from the loaded configuration
     * @return documents to render
     * @throws Exception if the input cannot be read or analyzed
     */
    protected abstract RenderedOutput execute(SqlAnalyzer analyzer) throws Exception;

    @Override
    public Integer call() {
        try {
            AnalyzerConfig config = loadConfiguration();
            RenderedOutput output = execute(new SqlAnalyzer(config));
            render(output);
            if (outputDir != null) {
                System.out.println("✓ Wrote " + output.documents().size() + " documents to: " + outputDir.toAbsolutePath());
            }
            return 0;
        } catch (Exception e) {
            log.error("{} failed", commandName(), e);
            System.err.println("✗ " + capitalize(commandName()) + " failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Loads the configuration file for this invocation and installs it as the process-wide settings
     * if none are installed yet.
     */
    AnalyzerConfig loadConfiguration() {
        log.debug("Loading configuration from: {}", configPath.toAbsolutePath());
        AnalyzerConfig config = ConfigLoader.load(configPath);
        AnalyzerSettings.initialize(config);
        return config;
    }

    /**
     * Renders a diagram with the first discovered generator that supports the type.
     *
     * @param model diagram input
     * @param type diagram type
     * @return Markdown document
     */
    RenderedDocument diagram(DiagramModel model, DiagramType type) {
        DiagramGenerator generator = discoverGenerator(type);
        GeneratedDiagram diagram = generator.generate(model, type);
        log.debug("Generated {} diagram with {}", type, generator.getId());
        return new RenderedDocument(diagram.name() + "." + diagram.fileExtension(), diagram.content(),
            RenderedDocument.MARKDOWN);
    }

    private DiagramGenerator discoverGenerator(DiagramType type) {
        for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
            if (generator.getSupportedDiagramTypes().contains(type)) {
                return generator;
            }
        }
        throw new IllegalStateException("No diagram generator available for " + type);
    }

    private void render(RenderedOutput output) {
        String rendererId = outputDir != null ? FILESYSTEM_RENDERER : CONSOLE_RENDERER;
        RenderContext context = outputDir != null ? RenderContext.directory(outputDir) : RenderContext.console();
        discoverRenderer(rendererId).render(output, context);
    }

    OutputRenderer discoverRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalStateException("No output renderer registered with id: " + id);
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
