package com.sqlsignal.core.parser;

import com.sqlsignal.core.ir.IrNode;
import com.sqlsignal.core.ir.ParserPath;
import com.sqlsignal.core.ir.SourceIr;
import com.sqlsignal.core.ir.StatementKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Pattern-based IR producer used when the grammar rejects a unit.
 *
 * <p>Tokenizes the masked text and splits it into statements at statement-starting keywords,
 * outside parentheses and CASE...END. Nesting is approximated by counting unmatched BEGIN/END
 * before each statement, plus one level for the single statement following an IF, WHILE or ELSE
 * head. Never throws; unrecognizable runs become {@code OTHER} nodes.
 */
public class FallbackIrScanner implements IrProducer {

    private static final Set<String> STATEMENT_STARTERS = Set.of(
        "SELECT", "INSERT", "UPDATE", "DELETE", "MERGE", "TRUNCATE", "SET", "DECLARE", "IF", "WHILE",
        "RETURN", "GOTO", "BREAK", "CONTINUE", "COMMIT", "ROLLBACK", "SAVE", "EXEC", "EXECUTE", "THROW",
        "RAISERROR", "PRINT", "OPEN", "FETCH", "CLOSE", "DEALLOCATE", "USE", "WAITFOR", "DBCC", "GRANT",
        "REVOKE", "DENY", "CREATE", "ALTER", "DROP", "WITH", "BEGIN"
    );

    private static final Set<String> SET_OPERATORS = Set.of("UNION", "ALL", "EXCEPT", "INTERSECT");

    private static final Set<String> EXECUTE_WORDS = Set.of("EXEC", "EXECUTE");

    @Override
    public ParserPath path() {
        return ParserPath.FALLBACK;
    }

    @Override
    public SourceIr produce(String maskedText) {
        return new Scan(SqlTokenizer.tokenize(maskedText)).run();
    }

    /**
     * Single-use scanning state over one unit's tokens.
     */
    private static final class Scan {

        private final List<SqlToken> tokens;
        private final List<IrNode> nodes = new ArrayList<>();
        private final List<SqlToken> segment = new ArrayList<>();

        private int blockDepth;
        private int segmentDepth;
        private boolean pendingBody;
        private boolean inRoutineHeader;
        private int parenDepth;
        private int caseDepth;

        Scan(List<SqlToken> tokens) {
            this.tokens = tokens;
        }

        SourceIr run() {
            for (int i = 0; i < tokens.size(); i++) {
                i = step(i);
            }
            flush();
            return new SourceIr(nodes, ParserPath.FALLBACK);
        }

        /**
         * Consumes the token at {@code i} and returns the index of the last token consumed.
         */
        private int step(int i) {
            SqlToken token = tokens.get(i);

            if (token.type() == SqlToken.Type.LPAREN) {
                parenDepth++;
                append(token);
                return i;
            }
            if (token.type() == SqlToken.Type.RPAREN) {
                parenDepth = Math.max(0, parenDepth - 1);
                append(token);
                return i;
            }
            if (parenDepth > 0) {
                append(token);
                return i;
            }
            if (inRoutineHeader) {
                if (token.is("AS") && !followsExecute()) {
                    flush();
                    inRoutineHeader = false;
                } else {
                    append(token);
                }
                return i;
            }
            if (token.type() == SqlToken.Type.SEMI) {
                caseDepth = 0;
                flush();
                return i;
            }
            if (!token.isWord()) {
                append(token);
                return i;
            }
            return stepWord(i, token.upper());
        }

        private int stepWord(int i, String word) {
            if (word.equals("CASE")) {
                caseDepth++;
                append(tokens.get(i));
                return i;
            }
            if (caseDepth > 0) {
                if (word.equals("END")) {
                    caseDepth--;
                }
                append(tokens.get(i));
                return i;
            }
            if (word.equals("GO")) {
                flush();
                return i;
            }
            if (word.equals("BEGIN") && !isTransactionWord(i + 1)) {
                return beginBlock(i);
            }
            if (word.equals("END")) {
                flush();
                blockDepth = Math.max(0, blockDepth - 1);
                return nextIs(i, "TRY") || nextIs(i, "CATCH") ? i + 1 : i;
            }
            if (word.equals("ELSE")) {
                flush();
                nodes.add(new IrNode(nodes.size(), StatementKind.ELSE, blockDepth, "ELSE", null, List.of()));
                pendingBody = true;
                return i;
            }
            if (isLabel(i)) {
                flush();
                nodes.add(StatementClassifier.classify(List.of(tokens.get(i), tokens.get(i + 1)), nodes.size(), currentDepth()));
                pendingBody = false;
                return i + 1;
            }
            if (STATEMENT_STARTERS.contains(word) && !isContinuation(i, word)) {
                flush();
                if ((word.equals("CREATE") || word.equals("ALTER")) && StatementClassifier.isRoutineHeader(tokens, i)) {
                    inRoutineHeader = true;
                }
            }
            append(tokens.get(i));
            return i;
        }

        private int beginBlock(int i) {
            flush();
            if (nextIs(i, "TRY") || nextIs(i, "CATCH")) {
                nodes.add(StatementClassifier.classify(List.of(tokens.get(i), tokens.get(i + 1)), nodes.size(), currentDepth()));
                pendingBody = false;
                blockDepth++;
                return i + 1;
            }
            blockDepth++;
            pendingBody = false;
            return i;
        }

        private int currentDepth() {
            return blockDepth + (pendingBody ? 1 : 0);
        }

        private boolean isContinuation(int i, String word) {
            if (segment.isEmpty()) {
                return false;
            }
            String head = segment.get(0).upper();
            SqlToken previous = tokens.get(i - 1);

            if (head.equals("MERGE")) {
                return true;
            }
            if (previous.is("OR") || previous.is("ON") || previous.is("FOR") || previous.isAnyOf(SET_OPERATORS)) {
                return true;
            }
            return switch (word) {
                case "SELECT" -> (head.equals("INSERT") && !segmentContains("VALUES") && !segmentContains("SELECT"))
                    || (head.equals("WITH") && !segmentContainsMainVerb())
                    || (head.equals("DECLARE") && previous.is("FOR"));
                case "EXEC", "EXECUTE" -> head.equals("INSERT") && !segmentContains("VALUES") && !segmentContains("SELECT")
                    || previous.is("WITH");
                case "SET" -> head.equals("UPDATE") && !segmentContains("SET");
                case "INSERT", "UPDATE", "DELETE", "MERGE" -> head.equals("WITH") && !segmentContainsMainVerb();
                case "WITH" -> !startsCommonTableExpression(i);
                case "IF" -> head.equals("DROP") && nextIs(i, "EXISTS");
                case "DROP" -> head.equals("ALTER") || head.equals("CREATE");
                case "BEGIN" -> false;
                default -> false;
            };
        }

        private boolean startsCommonTableExpression(int i) {
            if (i + 2 >= tokens.size() || !tokens.get(i + 1).isNamePart()) {
                return false;
            }
            SqlToken afterName = tokens.get(i + 2);
            return afterName.is("AS") || afterName.type() == SqlToken.Type.LPAREN;
        }

        private boolean isLabel(int i) {
            return i + 1 < tokens.size()
                && tokens.get(i + 1).type() == SqlToken.Type.COLON
                && (i + 2 >= tokens.size() || tokens.get(i + 2).type() != SqlToken.Type.COLON);
        }

        private boolean isTransactionWord(int i) {
            return i < tokens.size() && (tokens.get(i).is("TRAN") || tokens.get(i).is("TRANSACTION") || tokens.get(i).is("DISTRIBUTED"));
        }

        private boolean nextIs(int i, String keyword) {
            return i + 1 < tokens.size() && tokens.get(i + 1).is(keyword);
        }

        private boolean segmentContains(String keyword) {
            int depth = 0;
            for (SqlToken token : segment) {
                if (token.type() == SqlToken.Type.LPAREN) {
                    depth++;
                } else if (token.type() == SqlToken.Type.RPAREN) {
                    depth = Math.max(0, depth - 1);
                } else if (depth == 0 && token.is(keyword)) {
                    return true;
                }
            }
            return false;
        }

        private boolean segmentContainsMainVerb() {
            return StatementClassifier.MAIN_VERBS.stream().anyMatch(this::segmentContains);
        }

        private void append(SqlToken token) {
            if (segment.isEmpty()) {
                segmentDepth = currentDepth();
                pendingBody = false;
            }
            segment.add(token);
        }

        // WITH EXECUTE AS <principal> inside a routine header
        private boolean followsExecute() {
            return !segment.isEmpty() && segment.get(segment.size() - 1).isAnyOf(EXECUTE_WORDS);
        }

        private void flush() {
            if (segment.isEmpty()) {
                return;
            }
            IrNode node = StatementClassifier.classify(List.copyOf(segment), nodes.size(), segmentDepth);
            nodes.add(node);
            segment.clear();
            pendingBody = node.kind() == StatementKind.BRANCH || node.kind() == StatementKind.LOOP;
        }
    }
}
