package com.sqlsignal.cli;

import com.sqlsignal.core.analysis.SqlAnalyzer;
import com.sqlsignal.core.callgraph.CallGraph;
import com.sqlsignal.core.callgraph.CallGraphOptions;
import com.sqlsignal.core.generator.DiagramModel;
import com.sqlsignal.core.generator.DiagramType;
import com.sqlsignal.core.model.SourceUnit;
import com.sqlsignal.core.renderer.JsonReportFormatter;
import com.sqlsignal.core.renderer.RenderedOutput;
import com.sqlsignal.core.util.SqlSourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds the call graph of a batch of SQL files.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * sqlsignal call-graph sql/
 * sqlsignal call-graph sql/ --schema-sensitive --max-nodes 100 --format mermaid
 * }</pre>
 */
@Command(
    name = "call-graph",
    description = "Build the call graph of a batch of SQL objects",
    mixinStandardHelpOptions = true
)
public class CallGraphCommand extends AbstractSqlCommand {

    private static final Logger log = LoggerFactory.getLogger(CallGraphCommand.class);

    static final String GRAPH_NAME = "call-graph";

    @Parameters(arity = "1..*", description = "SQL files or directories")
    List<Path> paths;

    @Option(names = "--case-sensitive", description = "Match object names case-sensitively")
    boolean caseSensitive;

    @Option(names = "--schema-sensitive", description = "Only resolve schema-qualified calls")
    boolean schemaSensitive;

    @Option(names = "--no-functions", description = "Exclude functions and function calls")
    boolean noFunctions;

    @Option(names = "--no-procedures", description = "Exclude procedures and EXEC calls")
    boolean noProcedures;

    @Option(names = "--include-dynamic-exec", description = "Keep sp_executesql calls as edges")
    boolean includeDynamicExec;

    @Option(names = "--max-nodes", description = "Node cap (default: configured)")
    Integer maxNodes;

    @Option(names = "--max-edges", description = "Edge cap (default: configured)")
    Integer maxEdges;

    @Option(names = "--strict", description = "Fail instead of truncating an oversized batch")
    boolean strict;

    @Override
    protected String commandName() {
        return "call graph";
    }

    @Override
    protected RenderedOutput execute(SqlAnalyzer analyzer) throws IOException {
        List<SourceUnit> units = SqlSourceLoader.load(paths);
        log.info("Loaded {} objects from {} paths", units.size(), paths.size());

        CallGraphOptions options = new CallGraphOptions(!caseSensitive, schemaSensitive, !noFunctions,
            !noProcedures, !includeDynamicExec, maxNodes, maxEdges);
        CallGraph graph = strict ? analyzer.callGraphStrict(units, options) : analyzer.callGraph(units, options);

        return switch (format) {
            case JSON -> RenderedOutput.of(JsonReportFormatter.document(GRAPH_NAME, graph));
            case MERMAID -> RenderedOutput.of(diagram(DiagramModel.ofCallGraph("batch", graph), DiagramType.CALL_GRAPH));
        };
    }
}
