package com.sqlsignal.core.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * ANTLR error listener that turns the first syntax error into a {@link GrammarParseException}.
 *
 * <p>The ANTLR message is dropped on purpose: it quotes offending token text.
 */
final class StrictErrorListener extends BaseErrorListener {

    static final StrictErrorListener INSTANCE = new StrictErrorListener();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        throw new GrammarParseException(line, charPositionInLine, e);
    }
}
