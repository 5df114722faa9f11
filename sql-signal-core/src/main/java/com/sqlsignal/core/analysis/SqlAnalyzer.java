package com.sqlsignal.core.analysis;

import com.sqlsignal.core.callgraph.CallGraph;
import com.sqlsignal.core.callgraph.CallGraphBuilder;
import com.sqlsignal.core.callgraph.CallGraphOptions;
import com.sqlsignal.core.callgraph.CallersFinder;
import com.sqlsignal.core.callgraph.CallersOptions;
import com.sqlsignal.core.callgraph.CallersResult;
import com.sqlsignal.core.config.AnalyzerConfig;
import com.sqlsignal.core.flow.ControlFlow;
import com.sqlsignal.core.flow.ControlFlowGrapher;
import com.sqlsignal.core.ir.ParseOutcome;
import com.sqlsignal.core.model.Digest;
import com.sqlsignal.core.model.SourceUnit;
import com.sqlsignal.core.model.TruncationNotice;
import com.sqlsignal.core.parser.SourceParser;
import com.sqlsignal.core.redact.SqlRedactor;
import com.sqlsignal.core.signal.MigrationImpactDetector;
import com.sqlsignal.core.signal.MigrationImpacts;
import com.sqlsignal.core.signal.SignalBundle;
import com.sqlsignal.core.signal.SignalExtractor;
import com.sqlsignal.core.terms.QueryTerms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the engine: single-unit analysis, batch call graphs and callers lookups.
 *
 * <p>Stateless apart from its immutable configuration, so one instance may serve concurrent requests.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * SqlAnalyzer analyzer = new SqlAnalyzer(AnalyzerSettings.current());
 * AnalysisReport report = analyzer.analyze(SourceUnit.of("dbo.usp_demo", "procedure", sql));
 * report.controlFlow().summary().cyclomaticComplexity();
 * }</pre>
 */
public class SqlAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SqlAnalyzer.class);

    private final AnalyzerConfig config;
    private final SourceParser parser;
    private final SignalExtractor extractor;
    private final ControlFlowGrapher grapher;
    private final MigrationImpactDetector impactDetector;
    private final CallGraphBuilder callGraphBuilder;
    private final CallersFinder callersFinder;

    public SqlAnalyzer(AnalyzerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.parser = new SourceParser();
        this.extractor = new SignalExtractor(config);
        this.grapher = new ControlFlowGrapher(config);
        this.impactDetector = new MigrationImpactDetector();
        this.callGraphBuilder = new CallGraphBuilder(config, parser, extractor);
        this.callersFinder = new CallersFinder(config, parser, extractor);
    }

    /**
     * Analyzes one unit. Never fails on unparseable input: the fallback IR is analyzed instead and
     * {@code parse_error} is reported.
     *
     * @param unit source unit
     * @return analysis report
     */
    public AnalysisReport analyze(SourceUnit unit) {
        Objects.requireNonNull(unit, "unit must not be null");
        Digest digest = SqlRedactor.digest(unit.rawText());
        log.info("Analyzing {} ({})", unit.name(), digest);

        ParseOutcome outcome = parser.parse(unit);
        SignalBundle signals = extractor.extract(outcome.ir());
        ControlFlow controlFlow = grapher.graph(outcome.ir());
        MigrationImpacts impacts = impactDetector.detect(outcome.ir(), signals);
        QueryTerms terms = QueryTerms.from(signals, impacts, controlFlow, config.lists().queryTerms());

        List<String> errors = new ArrayList<>();
        if (outcome.isDegraded()) {
            errors.add(outcome.reason());
        }
        errors.addAll(controlFlow.errors());

        List<TruncationNotice> truncations = new ArrayList<>(signals.truncations());
        truncations.addAll(controlFlow.truncations());
        terms.truncation().ifPresent(truncations::add);

        log.debug("Analysis of {} ({}) complete: parser={}, errors={}, truncations={}",
            unit.name(), digest, outcome.ir().path().label(), errors.size(), truncations.size());

        return new AnalysisReport(
            unit.name(),
            unit.type(),
            digest,
            outcome.ir().path().label(),
            signals.references(),
            signals.transactions(),
            signals.dataChanges(),
            signals.errorHandling(),
            controlFlow,
            impacts,
            terms.asList(),
            errors,
            truncations
        );
    }

    public CallGraph callGraph(List<SourceUnit> units, CallGraphOptions options) {
        return callGraphBuilder.build(units, options);
    }

    public CallGraph callGraphStrict(List<SourceUnit> units, CallGraphOptions options) {
        return callGraphBuilder.buildStrict(units, options);
    }

    public CallersResult callers(String target, String targetType, List<SourceUnit> units, CallersOptions options) {
        return callersFinder.find(target, targetType, units, options);
    }

    public CallersResult callersStrict(String target, String targetType, List<SourceUnit> units, CallersOptions options) {
        return callersFinder.findStrict(target, targetType, units, options);
    }

    public AnalyzerConfig config() {
        return config;
    }
}
