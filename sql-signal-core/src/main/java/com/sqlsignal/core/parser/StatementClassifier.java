package com.sqlsignal.core.parser;

import com.sqlsignal.core.ir.IrNode;
import com.sqlsignal.core.ir.Reference;
import com.sqlsignal.core.ir.ReferenceKind;
import com.sqlsignal.core.ir.StatementKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the tokens of one statement into an {@link IrNode}.
 *
 * <p>Both parser paths delegate here: the grammar path decides statement boundaries and nesting
 * from the parse tree, the fallback scanner approximates them, and this class assigns kind,
 * keyword, target and references from the statement's leading tokens.
 */
public final class StatementClassifier {

    static final Set<String> MAIN_VERBS = Set.of("SELECT", "INSERT", "UPDATE", "DELETE", "MERGE");

    private static final Set<String> ROUTINE_KINDS = Set.of("PROCEDURE", "PROC", "FUNCTION", "TRIGGER", "VIEW");

    private static final Set<String> ISOLATION_LEVELS = Set.of(
        "READ UNCOMMITTED", "READ COMMITTED", "REPEATABLE READ", "SNAPSHOT", "SERIALIZABLE"
    );

    private static final Map<String, String> DML_KEYWORDS = Map.of(
        "INSERT", "INSERT",
        "UPDATE", "UPDATE",
        "DELETE", "DELETE",
        "MERGE", "MERGE",
        "TRUNCATE", "TRUNCATE"
    );

    public static final String SELECT_INTO = "SELECT INTO";

    private StatementClassifier() {
        // Utility class
    }

    /**
     * Classifies one statement.
     *
     * @param tokens the statement's own tokens (for compound statements only the head, e.g. {@code IF <condition>})
     * @param position source-order index
     * @param depth nesting depth
     * @return IR node
     */
    public static IrNode classify(List<SqlToken> tokens, int position, int depth) {
        if (tokens.isEmpty()) {
            return new IrNode(position, StatementKind.OTHER, depth, "OTHER", null, List.of());
        }

        SqlToken first = tokens.get(0);
        if (first.isWord() && tokens.size() == 2 && tokens.get(1).type() == SqlToken.Type.COLON) {
            return new IrNode(position, StatementKind.LABEL, depth, "LABEL", first.upper(), List.of());
        }
        if (!first.isWord()) {
            return node(tokens, position, depth, StatementKind.OTHER, "OTHER", null);
        }

        String lead = first.upper();
        return switch (lead) {
            case "IF" -> node(tokens, position, depth, StatementKind.BRANCH, "IF", null);
            case "ELSE" -> new IrNode(position, StatementKind.ELSE, depth, "ELSE", null, List.of());
            case "WHILE" -> node(tokens, position, depth, StatementKind.LOOP, "WHILE", null);
            case "BEGIN" -> classifyBegin(tokens, position, depth);
            case "COMMIT" -> node(tokens, position, depth, StatementKind.TRANSACTION, "COMMIT", null);
            case "ROLLBACK" -> node(tokens, position, depth, StatementKind.TRANSACTION, "ROLLBACK", null);
            case "SAVE" -> node(tokens, position, depth, StatementKind.TRANSACTION, "SAVE TRAN", null);
            case "RETURN" -> node(tokens, position, depth, StatementKind.RETURN, "RETURN", returnValue(tokens));
            case "GOTO" -> new IrNode(position, StatementKind.GOTO, depth, "GOTO",
                tokens.size() > 1 ? tokens.get(1).upper() : null, List.of());
            case "BREAK" -> new IrNode(position, StatementKind.BREAK, depth, "BREAK", null, List.of());
            case "CONTINUE" -> new IrNode(position, StatementKind.CONTINUE, depth, "CONTINUE", null, List.of());
            case "EXEC", "EXECUTE" -> classifyExec(tokens, position, depth, lead);
            case "INSERT", "UPDATE", "DELETE", "MERGE", "TRUNCATE" ->
                node(tokens, position, depth, StatementKind.DML, DML_KEYWORDS.get(lead), dmlTarget(tokens, 0, lead));
            case "SELECT" -> classifySelect(tokens, 0, position, depth);
            case "WITH" -> classifyWith(tokens, position, depth);
            case "SET" -> classifySet(tokens, position, depth);
            case "DECLARE" -> node(tokens, position, depth, StatementKind.DECLARE, "DECLARE", null);
            case "THROW" -> node(tokens, position, depth, StatementKind.THROW, "THROW", null);
            case "RAISERROR" -> node(tokens, position, depth, StatementKind.RAISERROR, "RAISERROR", null);
            case "PRINT" -> node(tokens, position, depth, StatementKind.PRINT, "PRINT", null);
            case "OPEN", "FETCH", "CLOSE", "DEALLOCATE" -> node(tokens, position, depth, StatementKind.CURSOR, lead, null);
            case "CREATE", "ALTER" -> classifyCreate(tokens, position, depth, lead);
            case "DROP" -> new IrNode(position, StatementKind.DDL, depth, ddlKeyword(tokens, 1, lead), ddlTarget(tokens, 2), List.of());
            default -> node(tokens, position, depth, StatementKind.OTHER, lead, null);
        };
    }

    /**
     * Returns whether the tokens open a routine header ({@code CREATE [OR ALTER] PROCEDURE ...}).
     *
     * @param tokens tokens starting at a CREATE or ALTER keyword
     * @param start index of the CREATE/ALTER keyword
     * @return true for procedure, function, trigger and view definitions
     */
    public static boolean isRoutineHeader(List<SqlToken> tokens, int start) {
        int i = routineKindIndex(tokens, start);
        return i < tokens.size() && tokens.get(i).isAnyOf(ROUTINE_KINDS);
    }

    private static int routineKindIndex(List<SqlToken> tokens, int start) {
        int i = start + 1;
        if (tokens.get(start).is("CREATE") && i + 1 < tokens.size() && tokens.get(i).is("OR") && tokens.get(i + 1).is("ALTER")) {
            i += 2;
        }
        return i;
    }

    private static IrNode node(List<SqlToken> tokens, int position, int depth, StatementKind kind, String keyword, String target) {
        return new IrNode(position, kind, depth, keyword, target, ReferenceScanner.scan(tokens, kind));
    }

    private static IrNode classifyBegin(List<SqlToken> tokens, int position, int depth) {
        String second = tokens.size() > 1 ? tokens.get(1).upper() : "";
        return switch (second) {
            case "TRY" -> new IrNode(position, StatementKind.TRY, depth, "BEGIN TRY", null, List.of());
            case "CATCH" -> new IrNode(position, StatementKind.CATCH, depth, "BEGIN CATCH", null, List.of());
            case "TRAN", "TRANSACTION", "DISTRIBUTED" -> node(tokens, position, depth, StatementKind.TRANSACTION, "BEGIN TRAN", null);
            default -> new IrNode(position, StatementKind.OTHER, depth, "BEGIN", null, List.of());
        };
    }

    private static IrNode classifyExec(List<SqlToken> tokens, int position, int depth, String lead) {
        List<Reference> call = ReferenceScanner.callAt(tokens, 0);
        String target = call.stream()
            .filter(reference -> reference.kind() == ReferenceKind.CALL)
            .map(Reference::name)
            .findFirst()
            .orElse(null);
        return node(tokens, position, depth, StatementKind.CALL, lead, target);
    }

    private static IrNode classifySelect(List<SqlToken> tokens, int start, int position, int depth) {
        int into = topLevelInto(tokens, start);
        if (into < 0) {
            return node(tokens, position, depth, StatementKind.QUERY, "SELECT", null);
        }
        return node(tokens, position, depth, StatementKind.DML, SELECT_INTO, nameOrVariable(tokens, into + 1));
    }

    private static IrNode classifyWith(List<SqlToken> tokens, int position, int depth) {
        int depthCounter = 0;
        for (int i = 1; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            if (token.type() == SqlToken.Type.LPAREN) {
                depthCounter++;
            } else if (token.type() == SqlToken.Type.RPAREN) {
                depthCounter = Math.max(0, depthCounter - 1);
            } else if (depthCounter == 0 && token.isAnyOf(MAIN_VERBS)) {
                String verb = token.upper();
                if (verb.equals("SELECT")) {
                    int into = topLevelInto(tokens, i);
                    return into < 0
                        ? node(tokens, position, depth, StatementKind.QUERY, "SELECT", null)
                        : node(tokens, position, depth, StatementKind.DML, SELECT_INTO, nameOrVariable(tokens, into + 1));
                }
                return node(tokens, position, depth, StatementKind.DML, verb, dmlTarget(tokens, i, verb));
            }
        }
        return node(tokens, position, depth, StatementKind.QUERY, "WITH", null);
    }

    private static IrNode classifySet(List<SqlToken> tokens, int position, int depth) {
        if (tokens.size() > 1 && tokens.get(1).is("XACT_ABORT")) {
            String value = tokens.size() > 2 ? tokens.get(2).upper() : null;
            return node(tokens, position, depth, StatementKind.SET_OPTION, "XACT_ABORT", value);
        }
        if (tokens.size() > 4 && tokens.get(1).is("TRANSACTION") && tokens.get(2).is("ISOLATION") && tokens.get(3).is("LEVEL")) {
            String level = tokens.get(4).upper();
            if (tokens.size() > 5 && ISOLATION_LEVELS.contains(level + " " + tokens.get(5).upper())) {
                level = level + " " + tokens.get(5).upper();
            }
            return node(tokens, position, depth, StatementKind.SET_OPTION, "ISOLATION LEVEL",
                ISOLATION_LEVELS.contains(level) ? level : null);
        }
        if (tokens.size() > 2 && tokens.get(1).isWord()) {
            return node(tokens, position, depth, StatementKind.SET_OPTION, tokens.get(1).upper(), tokens.get(2).upper());
        }
        return node(tokens, position, depth, StatementKind.SET_OPTION, "SET", null);
    }

    private static IrNode classifyCreate(List<SqlToken> tokens, int position, int depth, String lead) {
        int kindIndex = routineKindIndex(tokens, 0);
        if (kindIndex < tokens.size() && tokens.get(kindIndex).isAnyOf(ROUTINE_KINDS)) {
            String routineKind = tokens.get(kindIndex).upper().equals("PROC") ? "PROCEDURE" : tokens.get(kindIndex).upper();
            String name = QualifiedName.readAt(tokens, kindIndex + 1).map(QualifiedName::written).orElse(null);
            return new IrNode(position, StatementKind.ROUTINE, depth, routineKind, name, outputParameters(tokens, kindIndex + 1));
        }
        List<Reference> references = new ArrayList<>();
        for (SqlToken token : tokens) {
            if (token.isWord() && token.text().startsWith("#")) {
                references.add(Reference.marker(Reference.MARKER_TEMP_TABLE, token.upper()));
            }
        }
        return new IrNode(position, StatementKind.DDL, depth, ddlKeyword(tokens, 1, lead), ddlTarget(tokens, 2), references);
    }

    /**
     * Finds parameters declared with OUTPUT/OUT in a routine header.
     */
    private static List<Reference> outputParameters(List<SqlToken> tokens, int start) {
        List<Reference> parameters = new ArrayList<>();
        String current = null;
        int depth = 0;

        for (int i = start; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            switch (token.type()) {
                case LPAREN -> depth++;
                case RPAREN -> depth = Math.max(0, depth - 1);
                case COMMA -> {
                    if (depth <= 1) {
                        current = null;
                    }
                }
                case VARIABLE -> {
                    SqlToken previous = tokens.get(i - 1);
                    boolean declaration = previous.type() != SqlToken.Type.OPERATOR;
                    if (declaration && current == null) {
                        current = token.text();
                    }
                }
                case WORD -> {
                    if ((token.is("OUTPUT") || token.is("OUT")) && current != null) {
                        parameters.add(Reference.of(ReferenceKind.OUTPUT_PARAMETER, current));
                        current = null;
                    }
                }
                default -> {
                    // Types, defaults and punctuation
                }
            }
        }
        return parameters;
    }

    private static String dmlTarget(List<SqlToken> tokens, int verbIndex, String verb) {
        int i = verbIndex + 1;
        if (i < tokens.size() && tokens.get(i).is("TOP")) {
            i = ReferenceScanner.skipParenthesized(tokens, i + 1);
        }
        switch (verb) {
            case "INSERT", "MERGE" -> {
                if (i < tokens.size() && tokens.get(i).is("INTO")) {
                    i++;
                }
            }
            case "DELETE" -> {
                if (i < tokens.size() && tokens.get(i).is("FROM")) {
                    i++;
                }
            }
            case "TRUNCATE" -> {
                if (i < tokens.size() && tokens.get(i).is("TABLE")) {
                    i++;
                }
            }
            default -> {
                // UPDATE names its target directly
            }
        }

        String target = nameOrVariable(tokens, i);
        if (target != null && !target.startsWith("@") && (verb.equals("UPDATE") || verb.equals("DELETE"))) {
            Map<String, String> aliases = ReferenceScanner.aliases(tokens);
            target = aliases.getOrDefault(target, target);
        }
        return target;
    }

    /**
     * Reads a canonical table name at {@code index}, or the upper-cased variable name for table variables.
     */
    private static String nameOrVariable(List<SqlToken> tokens, int index) {
        if (index >= tokens.size()) {
            return null;
        }
        SqlToken token = tokens.get(index);
        if (token.type() == SqlToken.Type.VARIABLE) {
            return token.upper();
        }
        Optional<QualifiedName> name = QualifiedName.readAt(tokens, index);
        return name
            .filter(value -> !ReferenceScanner.RESERVED.contains(value.first().toUpperCase(Locale.ROOT)))
            .map(QualifiedName::canonical)
            .orElse(null);
    }

    private static int topLevelInto(List<SqlToken> tokens, int selectIndex) {
        int depth = 0;
        for (int i = selectIndex + 1; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            if (token.type() == SqlToken.Type.LPAREN) {
                depth++;
            } else if (token.type() == SqlToken.Type.RPAREN) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && (token.is("FROM") || token.is("UNION") || token.is("WHERE"))) {
                return -1;
            } else if (depth == 0 && token.is("INTO")) {
                return i;
            }
        }
        return -1;
    }

    private static String returnValue(List<SqlToken> tokens) {
        int i = 1;
        while (i < tokens.size() && tokens.get(i).type() == SqlToken.Type.LPAREN) {
            i++;
        }
        String sign = "";
        if (i < tokens.size() && tokens.get(i).type() == SqlToken.Type.OPERATOR
            && (tokens.get(i).text().equals("-") || tokens.get(i).text().equals("+"))) {
            sign = tokens.get(i).text().equals("-") ? "-" : "";
            i++;
        }
        if (i < tokens.size() && tokens.get(i).type() == SqlToken.Type.NUMBER && tokens.get(i).text().chars().allMatch(Character::isDigit)) {
            try {
                return Integer.toString(Integer.parseInt(sign + tokens.get(i).text()));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String ddlKeyword(List<SqlToken> tokens, int objectIndex, String lead) {
        if (objectIndex < tokens.size() && tokens.get(objectIndex).isWord()) {
            return lead + " " + tokens.get(objectIndex).upper();
        }
        return lead;
    }

    private static String ddlTarget(List<SqlToken> tokens, int index) {
        int i = index;
        if (i + 1 < tokens.size() && tokens.get(i).is("IF") && tokens.get(i + 1).is("EXISTS")) {
            i += 2;
        }
        return QualifiedName.readAt(tokens, i).map(QualifiedName::canonical).orElse(null);
    }
}
