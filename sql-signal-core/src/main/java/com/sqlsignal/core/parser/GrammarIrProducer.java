package com.sqlsignal.core.parser;

import com.sqlsignal.core.ir.ParserPath;
import com.sqlsignal.core.ir.SourceIr;
import com.sqlsignal.parser.TSqlLexer;
import com.sqlsignal.parser.TSqlParser;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Primary IR producer backed by the ANTLR {@code TSql} grammar.
 *
 * <p>Parses in two stages: a fast SLL pass that bails on the first conflict, then a full LL pass
 * whose first syntax error raises {@link GrammarParseException}.
 */
public class GrammarIrProducer implements IrProducer {

    private static final Logger log = LoggerFactory.getLogger(GrammarIrProducer.class);

    @Override
    public ParserPath path() {
        return ParserPath.GRAMMAR;
    }

    @Override
    public SourceIr produce(String maskedText) {
        CharStream input = CharStreams.fromString(maskedText == null ? "" : maskedText);
        TSqlParser.ScriptContext script;

        try {
            TSqlParser parser = newParser(input);
            parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
            parser.setErrorHandler(new BailErrorStrategy());
            script = parser.script();
        } catch (ParseCancellationException e) {
            log.debug("SLL prediction failed, retrying with full LL");
            input.seek(0);
            TSqlParser parser = newParser(input);
            parser.addErrorListener(StrictErrorListener.INSTANCE);
            parser.setErrorHandler(new DefaultErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            script = parser.script();
        }

        IrBuildingVisitor visitor = new IrBuildingVisitor(input);
        visitor.visitScript(script);
        return new SourceIr(visitor.nodes(), ParserPath.GRAMMAR);
    }

    private TSqlParser newParser(CharStream input) {
        TSqlLexer lexer = new TSqlLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(StrictErrorListener.INSTANCE);

        TSqlParser parser = new TSqlParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        return parser;
    }
}
