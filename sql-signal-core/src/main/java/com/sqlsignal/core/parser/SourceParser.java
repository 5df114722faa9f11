package com.sqlsignal.core.parser;

import com.sqlsignal.core.ir.ParseOutcome;
import com.sqlsignal.core.ir.SourceIr;
import com.sqlsignal.core.model.Digest;
import com.sqlsignal.core.model.SourceUnit;
import com.sqlsignal.core.redact.SqlRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one unit's text into an IR, degrading to the fallback scanner when the grammar fails.
 *
 * <p>Parsing tiers:
 * <ol>
 *   <li><b>Grammar:</b> {@link GrammarIrProducer}, precise boundaries and nesting</li>
 *   <li><b>Fallback:</b> {@link FallbackIrScanner}, same node vocabulary, coarser nesting</li>
 * </ol>
 *
 * <p>A grammar failure is never propagated: it yields {@link ParseOutcome#degraded(SourceIr, String)}
 * with a {@code parse_error} reason. Only the masked text reaches either producer, and log lines carry
 * the unit's {@link Digest} instead of text.
 */
public class SourceParser {

    public static final String PARSE_ERROR = "parse_error";

    private static final Logger log = LoggerFactory.getLogger(SourceParser.class);

    private final IrProducer primary;
    private final IrProducer fallback;

    public SourceParser() {
        this(new GrammarIrProducer(), new FallbackIrScanner());
    }

    public SourceParser(IrProducer primary, IrProducer fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    /**
     * Parses one unit.
     *
     * @param unit source unit
     * @return tagged parse outcome, never null
     */
    public ParseOutcome parse(SourceUnit unit) {
        Digest digest = SqlRedactor.digest(unit.rawText());
        String masked = SqlRedactor.mask(unit.rawText());
        return parseMasked(unit.name(), digest, masked);
    }

    /**
     * Parses already-masked text.
     *
     * @param name unit name, for logging
     * @param digest digest of the raw text, for logging
     * @param masked masked text
     * @return tagged parse outcome, never null
     */
    public ParseOutcome parseMasked(String name, Digest digest, String masked) {
        try {
            SourceIr ir = primary.produce(masked);
            log.debug("Parsed {} ({}) via {}: {} statements", name, digest, primary.path().label(), ir.size());
            return ParseOutcome.ok(ir);
        } catch (GrammarParseException e) {
            String reason = PARSE_ERROR + ": " + e.getMessage();
            log.warn("Grammar parse failed for {} ({}) at {}. Using fallback scanner.", name, digest, e.getMessage());
            return ParseOutcome.degraded(fallback.produce(masked), reason);
        } catch (RuntimeException e) {
            String reason = PARSE_ERROR + ": " + e.getClass().getSimpleName();
            log.warn("Grammar parser aborted for {} ({}): {}. Using fallback scanner.", name, digest, e.getClass().getSimpleName());
            log.debug("Grammar parser failure detail", e);
            return ParseOutcome.degraded(fallback.produce(masked), reason);
        }
    }
}
