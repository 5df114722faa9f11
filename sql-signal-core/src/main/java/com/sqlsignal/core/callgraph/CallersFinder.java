package com.sqlsignal.core.callgraph;

import com.sqlsignal.core.config.AnalyzerConfig;
import com.sqlsignal.core.determinism.DeterministicList;
import com.sqlsignal.core.ir.ParseOutcome;
import com.sqlsignal.core.model.SourceUnit;
import com.sqlsignal.core.parser.SourceParser;
import com.sqlsignal.core.redact.SqlRedactor;
import com.sqlsignal.core.signal.CallSite;
import com.sqlsignal.core.signal.SignalExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Finds the objects of a batch that call one target.
 */
public class CallersFinder {

    private static final Logger log = LoggerFactory.getLogger(CallersFinder.class);

    public static final String PROCEDURE = "procedure";
    public static final String FUNCTION = "function";
    public static final String PARSE_DEGRADED = "parse_degraded";

    private static final Comparator<Rank> RANK_ORDER = Comparator
        .comparingInt(Rank::callCount).reversed()
        .thenComparing(Rank::lowerName)
        .thenComparing(Rank::name)
        .thenComparingInt(Rank::position);

    private final AnalyzerConfig config;
    private final SourceParser parser;
    private final SignalExtractor extractor;

    public CallersFinder(AnalyzerConfig config) {
        this(config, new SourceParser(), new SignalExtractor(config));
    }

    public CallersFinder(AnalyzerConfig config, SourceParser parser, SignalExtractor extractor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
    }

    /**
     * Infers the target type when none is given: a target containing {@code (} is a function.
     *
     * @param target target name
     * @param targetType explicit type, may be null or blank
     * @return lower-case target type
     */
    public static String inferTargetType(String target, String targetType) {
        if (targetType != null && !targetType.isBlank()) {
            return targetType.toLowerCase(Locale.ROOT);
        }
        return target.contains("(") ? FUNCTION : PROCEDURE;
    }

    /**
     * Looks up callers, reporting oversized batches as error strings.
     *
     * @param target target name, optionally schema-qualified
     * @param targetType {@code procedure} or {@code function}; inferred when null
     * @param units candidate callers in input order
     * @param options matching options
     * @return callers result
     */
    public CallersResult find(String target, String targetType, List<SourceUnit> units, CallersOptions options) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(units, "units must not be null");
        Objects.requireNonNull(options, "options must not be null");

        String type = inferTargetType(target, targetType);
        String bareTarget = ObjectNames.withoutArguments(target);
        String normalizedTarget = ObjectNames.normalize(bareTarget, true);
        String comparisonTarget = ObjectNames.normalize(bareTarget, options.caseInsensitive());
        String targetSchema = ObjectNames.schema(bareTarget, options.caseInsensitive());
        String targetName = ObjectNames.baseName(bareTarget, options.caseInsensitive());

        long totalLength = units.stream().mapToLong(SourceUnit::length).sum();
        log.info("Finding callers of {}: {} objects, {} characters", normalizedTarget, units.size(), totalLength);

        List<String> errors = new ArrayList<>();
        List<SourceUnit> processed = applyLimits(units, totalLength, errors);

        List<Rank> ranked = new ArrayList<>();
        for (int position = 0; position < processed.size(); position++) {
            SourceUnit unit = processed.get(position);
            if (!options.includeSelf()
                && ObjectNames.normalize(unit.name(), options.caseInsensitive()).equals(comparisonTarget)) {
                continue;
            }
            log.debug("Scanning {} ({})", unit.name(), SqlRedactor.digest(unit.rawText()));

            ParseOutcome outcome = parser.parse(unit);
            if (outcome.isDegraded()) {
                errors.add(PARSE_DEGRADED + ": object=" + unit.name());
            }

            List<String> kinds = new ArrayList<>();
            List<String> signals = new ArrayList<>();
            for (CallSite call : extractor.extract(outcome.ir()).callSites()) {
                if (call.isFunctionCall() != FUNCTION.equals(type)) {
                    continue;
                }
                if (matches(call.name(), targetSchema, targetName, options)) {
                    kinds.add(call.kind());
                    signals.add(call.signal());
                }
            }
            if (kinds.isEmpty()) {
                continue;
            }
            Caller caller = new Caller(unit.name(), unit.type(), kinds.size(),
                DeterministicList.strings(kinds, DeterministicList.UNLIMITED).items(),
                DeterministicList.strings(signals, config.lists().callSignals()).items());
            ranked.add(new Rank(caller, position));
        }

        List<Caller> callers = DeterministicList.of(ranked, rank -> rank, DeterministicList.UNLIMITED).items()
            .stream()
            .map(Rank::caller)
            .toList();
        int totalCalls = callers.stream().mapToInt(Caller::callCount).sum();
        return new CallersResult(
            new CallersResult.Target(target, type, normalizedTarget),
            new CallersResult.Summary(totalCalls > 0, callers.size(), totalCalls),
            callers,
            errors
        );
    }

    /**
     * Looks up callers, rejecting a batch over the object or character ceiling.
     *
     * @throws BatchLimitExceededException if the batch exceeds a ceiling
     */
    public CallersResult findStrict(String target, String targetType, List<SourceUnit> units, CallersOptions options) {
        CallGraphBuilder.requireWithinObjectLimit(units, config.batch().maxObjects());
        long totalLength = units.stream().mapToLong(SourceUnit::length).sum();
        if (totalLength > config.batch().maxTotalSqlLength()) {
            throw new BatchLimitExceededException("sql_limit_exceeded", config.batch().maxTotalSqlLength(), totalLength);
        }
        return find(target, targetType, units, options);
    }

    private List<SourceUnit> applyLimits(List<SourceUnit> units, long totalLength, List<String> errors) {
        int maxObjects = config.batch().maxObjects();
        int maxTotalLength = config.batch().maxTotalSqlLength();

        List<SourceUnit> withinCount = units.size() > maxObjects ? units.subList(0, maxObjects) : units;
        if (withinCount.size() < units.size()) {
            errors.add("object_limit_exceeded: max=" + maxObjects + " provided=" + units.size()
                + " processed=" + withinCount.size());
        }
        if (totalLength > maxTotalLength) {
            errors.add("sql_limit_exceeded: max_total_len=" + maxTotalLength + " provided=" + totalLength);
        }

        List<SourceUnit> trimmed = new ArrayList<>();
        long running = 0;
        for (SourceUnit unit : withinCount) {
            if (running + unit.length() > maxTotalLength) {
                break;
            }
            trimmed.add(unit);
            running += unit.length();
        }
        if (trimmed.size() < withinCount.size() && totalLength <= maxTotalLength) {
            errors.add("sql_limit_exceeded: truncated_objects due to per-request SQL length cap");
        }
        if (!errors.isEmpty()) {
            log.warn("Callers batch limited: {}", errors);
        }
        return trimmed;
    }

    private static boolean matches(String candidate, String targetSchema, String targetName, CallersOptions options) {
        String schema = ObjectNames.schema(candidate, options.caseInsensitive());
        String name = ObjectNames.baseName(candidate, options.caseInsensitive());
        if (options.schemaSensitive() && targetSchema != null) {
            return targetSchema.equals(schema) && targetName.equals(name);
        }
        return targetName.equals(name);
    }

    /**
     * Sort key: call count descending, then name.
     */
    // Same-named units in one batch stay distinct callers, ordered by input position
    private record Rank(Caller caller, int position) implements Comparable<Rank> {
        int callCount() {
            return caller.callCount();
        }

        String lowerName() {
            return caller.name().toLowerCase(Locale.ROOT);
        }

        String name() {
            return caller.name();
        }

        @Override
        public int compareTo(Rank other) {
            return RANK_ORDER.compare(this, other);
        }
    }
}
