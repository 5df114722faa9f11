package com.sqlsignal.core.parser;

import com.sqlsignal.core.ir.ParserPath;
import com.sqlsignal.core.ir.SourceIr;

/**
 * Capability of turning masked T-SQL text into an IR.
 *
 * <p>Two interchangeable producers exist: {@link GrammarIrProducer} (full grammar, may throw
 * {@link GrammarParseException}) and {@link FallbackIrScanner} (pattern-based, never throws).
 * {@link SourceParser} chains them.
 */
public interface IrProducer {

    /**
     * Returns which path this producer represents.
     *
     * @return parser path tag
     */
    ParserPath path();

    /**
     * Produces the IR of one unit.
     *
     * @param maskedText comment/string-masked SQL text
     * @return IR in source order
     */
    SourceIr produce(String maskedText);
}
