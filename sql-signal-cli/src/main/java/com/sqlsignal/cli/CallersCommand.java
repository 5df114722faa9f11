package com.sqlsignal.cli;

import com.sqlsignal.core.analysis.SqlAnalyzer;
import com.sqlsignal.core.callgraph.CallersOptions;
import com.sqlsignal.core.callgraph.CallersResult;
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
 * Lists the objects of a batch that call a target procedure or function.
 *
 * <p>Only JSON output is supported.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * sqlsignal callers dbo.usp_Audit sql/
 * sqlsignal callers "dbo.fn_Tax()" sql/ --type function
 * }</pre>
 */
@Command(
    name = "callers",
    description = "Find the callers of a procedure or function",
    mixinStandardHelpOptions = true
)
public class CallersCommand extends AbstractSqlCommand {

    private static final Logger log = LoggerFactory.getLogger(CallersCommand.class);

    @Parameters(index = "0", description = "Target object, optionally schema-qualified")
    String target;

    @Parameters(index = "1..*", arity = "1..*", description = "SQL files or directories")
    List<Path> paths;

    @Option(names = {"-t", "--type"}, description = "Target type: procedure or function (default: inferred)")
    String targetType;

    @Option(names = "--case-sensitive", description = "Match names case-sensitively")
    boolean caseSensitive;

    @Option(names = "--schema-sensitive", description = "Require matching schemas when the target is qualified")
    boolean schemaSensitive;

    @Option(names = "--include-self", description = "Report the target calling itself")
    boolean includeSelf;

    @Option(names = "--strict", description = "Fail instead of truncating an oversized batch")
    boolean strict;

    @Override
    protected String commandName() {
        return "callers lookup";
    }

    @Override
    protected RenderedOutput execute(SqlAnalyzer analyzer) throws IOException {
        if (format != Format.JSON) {
            throw new IllegalArgumentException("Unsupported format for callers: " + format);
        }
        List<SourceUnit> units = SqlSourceLoader.load(paths);
        log.info("Loaded {} objects from {} paths", units.size(), paths.size());

        CallersOptions options = new CallersOptions(!caseSensitive, schemaSensitive, includeSelf);
        CallersResult result = strict
            ? analyzer.callersStrict(target, targetType, units, options)
            : analyzer.callers(target, targetType, units, options);
        return RenderedOutput.of(JsonReportFormatter.document("callers", result));
    }
}
