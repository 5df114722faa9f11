package com.sqlsignal.core.parser;

import com.sqlsignal.core.ir.IrNode;
import com.sqlsignal.parser.TSqlBaseVisitor;
import com.sqlsignal.parser.TSqlParser;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a {@code TSql} parse tree and emits IR nodes in source order.
 *
 * <p>Depth rules: the body of an IF, ELSE, WHILE, TRY or CATCH is one level deeper than its head;
 * a BEGIN...END block that is directly such a body adds no further level, a free-standing block
 * adds one.
 */
class IrBuildingVisitor extends TSqlBaseVisitor<Void> {

    private final CharStream input;
    private final List<IrNode> nodes = new ArrayList<>();
    private int depth;

    IrBuildingVisitor(CharStream input) {
        this.input = input;
    }

    List<IrNode> nodes() {
        return nodes;
    }

    @Override
    public Void visitScript(TSqlParser.ScriptContext ctx) {
        ctx.statement().forEach(this::visitStatement);
        return null;
    }

    @Override
    public Void visitStatement(TSqlParser.StatementContext ctx) {
        if (ctx.routineDefinition() != null) {
            return visitRoutineDefinition(ctx.routineDefinition());
        }
        if (ctx.tryCatchBlock() != null) {
            return visitTryCatchBlock(ctx.tryCatchBlock());
        }
        if (ctx.block() != null) {
            return visitBlock(ctx.block());
        }
        if (ctx.ifStatement() != null) {
            return visitIfStatement(ctx.ifStatement());
        }
        if (ctx.whileStatement() != null) {
            return visitWhileStatement(ctx.whileStatement());
        }
        if (ctx.transactionStatement() != null) {
            emit(ctx.transactionStatement().getStart(), ctx.transactionStatement().getStop());
        } else if (ctx.labelStatement() != null) {
            emit(ctx.labelStatement().getStart(), ctx.labelStatement().getStop());
        } else if (ctx.leafStatement() != null) {
            emit(ctx.leafStatement().getStart(), ctx.leafStatement().getStop());
        }
        return null;
    }

    @Override
    public Void visitRoutineDefinition(TSqlParser.RoutineDefinitionContext ctx) {
        Token headerStop = ctx.routineHeaderItem().isEmpty()
            ? ctx.routineKind().getStop()
            : ctx.routineHeaderItem(ctx.routineHeaderItem().size() - 1).getStop();
        emit(ctx.getStart(), headerStop);
        ctx.statement().forEach(this::visitStatement);
        return null;
    }

    @Override
    public Void visitBlock(TSqlParser.BlockContext ctx) {
        depth++;
        ctx.statement().forEach(this::visitStatement);
        depth--;
        return null;
    }

    @Override
    public Void visitTryCatchBlock(TSqlParser.TryCatchBlockContext ctx) {
        int tryEnd = ctx.END(0).getSymbol().getTokenIndex();

        emit(ctx.BEGIN(0).getSymbol(), ctx.TRY(0).getSymbol());
        depth++;
        ctx.statement().stream()
            .filter(statement -> statement.getStart().getTokenIndex() < tryEnd)
            .forEach(this::visitStatement);
        depth--;

        emit(ctx.BEGIN(1).getSymbol(), ctx.CATCH(0).getSymbol());
        depth++;
        ctx.statement().stream()
            .filter(statement -> statement.getStart().getTokenIndex() > tryEnd)
            .forEach(this::visitStatement);
        depth--;
        return null;
    }

    @Override
    public Void visitIfStatement(TSqlParser.IfStatementContext ctx) {
        emit(ctx.IF().getSymbol(), ctx.condition().getStop());
        visitBody(ctx.statement(0));

        TerminalNode elseKeyword = ctx.ELSE();
        if (elseKeyword != null) {
            emit(elseKeyword.getSymbol(), elseKeyword.getSymbol());
            visitBody(ctx.statement(1));
        }
        return null;
    }

    @Override
    public Void visitWhileStatement(TSqlParser.WhileStatementContext ctx) {
        emit(ctx.WHILE().getSymbol(), ctx.condition().getStop());
        visitBody(ctx.statement());
        return null;
    }

    private void visitBody(TSqlParser.StatementContext body) {
        depth++;
        if (body.block() != null) {
            body.block().statement().forEach(this::visitStatement);
        } else {
            visitStatement(body);
        }
        depth--;
    }

    private void emit(Token start, Token stop) {
        String text = input.getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
        nodes.add(StatementClassifier.classify(SqlTokenizer.tokenize(text), nodes.size(), depth));
    }
}
