package com.sqlsignal.cli;

import com.sqlsignal.core.analysis.AnalysisReport;
import com.sqlsignal.core.analysis.SqlAnalyzer;
import com.sqlsignal.core.generator.DiagramModel;
import com.sqlsignal.core.generator.DiagramType;
import com.sqlsignal.core.model.SourceUnit;
import com.sqlsignal.core.renderer.JsonReportFormatter;
import com.sqlsignal.core.renderer.RenderedOutput;
import com.sqlsignal.core.util.SqlSourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Analyzes one SQL object: signals, control flow, migration impacts and query terms.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * sqlsignal analyze sql/usp_PlaceOrder.sql
 * sqlsignal analyze sql/usp_PlaceOrder.sql --format mermaid -o build/reports
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze a single SQL object",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand extends AbstractSqlCommand {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Parameters(index = "0", description = "SQL file containing one object")
    Path file;

    @Override
    protected String commandName() {
        return "analysis";
    }

    @Override
    protected RenderedOutput execute(SqlAnalyzer analyzer) throws IOException {
        SourceUnit unit = SqlSourceLoader.loadFile(file);
        log.info("Analyzing {} from {}", unit.name(), file);
        AnalysisReport report = analyzer.analyze(unit);

        return switch (format) {
            case JSON -> RenderedOutput.of(JsonReportFormatter.document(unit.name(), report));
            case MERMAID -> RenderedOutput.of(
                diagram(DiagramModel.ofControlFlow(unit.name(), report.controlFlow().graph()), DiagramType.CONTROL_FLOW));
        };
    }
}
