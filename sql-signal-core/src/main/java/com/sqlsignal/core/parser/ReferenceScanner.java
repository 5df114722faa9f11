package com.sqlsignal.core.parser;

import com.sqlsignal.core.ir.Reference;
import com.sqlsignal.core.ir.ReferenceKind;
import com.sqlsignal.core.ir.StatementKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collects table, function, call and marker references from one statement's tokens.
 *
 * <p>References are recorded in token order, duplicates included; ordering and deduplication are
 * applied later by the signal extractor.
 */
final class ReferenceScanner {

    private static final Set<String> TABLE_PRECEDERS = Set.of("FROM", "JOIN", "INTO", "UPDATE", "MERGE", "USING", "DELETE");

    static final Set<String> RESERVED = Set.of(
        "ALL", "AND", "AS", "BEGIN", "BY", "CASE", "CROSS", "DELETE", "DISTINCT", "ELSE", "END", "EXEC", "EXECUTE",
        "EXISTS", "FROM", "FULL", "GROUP", "HAVING", "IF", "IN", "INNER", "INSERT", "INTO", "IS", "JOIN", "LEFT",
        "MERGE", "NOT", "NULL", "ON", "OR", "ORDER", "OUTER", "OUTPUT", "RIGHT", "SELECT", "SET", "TABLE", "THEN",
        "TOP", "UNION", "UPDATE", "USING", "VALUES", "WHEN", "WHERE", "WITH", "APPLY", "OPTION", "FOR", "WHILE",
        "RETURN", "DECLARE", "MATCHED", "TARGET", "SOURCE", "STATISTICS"
    );

    private static final Set<String> NON_FUNCTIONS = Set.of(
        "AND", "OR", "NOT", "IN", "EXISTS", "AS", "ON", "IF", "WHILE", "RETURN", "RETURNS", "VALUES", "SELECT",
        "FROM", "JOIN", "WHERE", "UPDATE", "INTO", "DELETE", "INSERT", "CASE", "WHEN", "THEN", "ELSE", "END",
        "OVER", "TABLE", "TOP", "KEY", "UNIQUE", "CHECK", "DEFAULT", "REFERENCES", "OPTION", "WITH", "USING",
        "INCLUDE", "CLUSTERED", "NONCLUSTERED", "EXEC", "EXECUTE", "RAISERROR", "PRINT", "THROW", "OUTPUT",
        "PARTITION", "BY", "HAVING", "UNION", "ALL", "EXCEPT", "INTERSECT", "SET", "DECLARE", "PROC", "PROCEDURE",
        "FUNCTION", "TRIGGER", "VIEW", "IDENTITY", "MERGE", "SOURCE", "TARGET", "ROWS", "RANGE", "BETWEEN", "LIKE",
        "IS", "CURSOR", "FOR", "OF", "APPLY", "PIVOT", "UNPIVOT",
        "VARCHAR", "NVARCHAR", "CHAR", "NCHAR", "DECIMAL", "NUMERIC", "VARBINARY", "BINARY", "FLOAT",
        "DATETIME2", "DATETIMEOFFSET", "TIME"
    );

    private static final Set<String> NAME_DEFINERS = Set.of("INTO", "TABLE", "PROCEDURE", "PROC", "FUNCTION", "TRIGGER", "VIEW", "WITH", "REFERENCES", "INDEX");

    private static final Set<String> DML_KINDS_WITH_OUTPUT = Set.of("INSERT", "UPDATE", "DELETE", "MERGE");

    private ReferenceScanner() {
        // Utility class
    }

    /**
     * Scans a statement's tokens.
     *
     * @param tokens statement tokens
     * @param kind statement kind the tokens were classified as
     * @return references in token order
     */
    static List<Reference> scan(List<SqlToken> tokens, StatementKind kind) {
        List<Reference> references = new ArrayList<>();
        Map<String, String> aliases = aliases(tokens);
        boolean outputClauseAllowed = kind == StatementKind.DML || kind == StatementKind.QUERY;

        for (int i = 0; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            SqlToken previous = i > 0 ? tokens.get(i - 1) : null;

            switch (token.type()) {
                case SYSTEM_VARIABLE -> references.add(Reference.of(ReferenceKind.SYSTEM_VARIABLE, token.upper()));
                case VARIABLE -> {
                    if (kind == StatementKind.DECLARE && isTableVariableDeclaration(tokens, i)) {
                        references.add(Reference.marker(Reference.MARKER_TABLE_VARIABLE));
                    }
                }
                case WORD -> scanWord(tokens, i, previous, aliases, outputClauseAllowed, kind, references);
                case QUOTED_IDENTIFIER -> {
                    if (previous == null || previous.type() != SqlToken.Type.DOT) {
                        functionAt(tokens, i).ifPresent(references::add);
                    }
                }
                default -> {
                    // Literals and punctuation carry no references
                }
            }
        }
        return references;
    }

    private static void scanWord(List<SqlToken> tokens, int i, SqlToken previous, Map<String, String> aliases,
                                 boolean outputClauseAllowed, StatementKind kind, List<Reference> references) {
        SqlToken token = tokens.get(i);
        String upper = token.upper();

        if (token.text().startsWith("#")) {
            references.add(Reference.marker(Reference.MARKER_TEMP_TABLE, upper));
        }

        boolean tablePosition = TABLE_PRECEDERS.contains(upper)
            || (upper.equals("TABLE") && previous != null && previous.is("TRUNCATE"));
        if (kind != StatementKind.DDL && tablePosition) {
            tableAfter(tokens, i, upper, aliases).ifPresent(references::add);
        }

        if ((upper.equals("INSERTED") || upper.equals("DELETED"))
            && (previous == null || previous.type() != SqlToken.Type.DOT)) {
            references.add(Reference.marker(upper));
        }

        if (upper.equals("OUTPUT") && outputClauseAllowed && isStatementLead(tokens, DML_KINDS_WITH_OUTPUT)) {
            references.add(Reference.marker(Reference.MARKER_OUTPUT));
        }

        if (upper.equals("CURSOR") && kind == StatementKind.DECLARE) {
            references.add(Reference.marker(Reference.MARKER_CURSOR));
        }

        if (upper.equals("EXEC") || upper.equals("EXECUTE")) {
            // EXECUTE AS <principal> switches context and calls nothing
            boolean impersonation = i + 1 < tokens.size() && tokens.get(i + 1).is("AS");
            if (!impersonation && (previous == null || !previous.is("WITH"))) {
                references.addAll(callAt(tokens, i));
            }
            return;
        }

        if (previous == null || previous.type() != SqlToken.Type.DOT) {
            functionAt(tokens, i).ifPresent(references::add);
        }
    }

    /**
     * Reads the callee of an EXEC/EXECUTE at {@code index}.
     *
     * @param tokens statement tokens
     * @param index index of the EXEC/EXECUTE keyword
     * @return a call reference, plus a dynamic SQL marker (detail {@code EXEC(}, {@code EXEC @VAR} or
     *     {@code sp_executesql}) where the target is not a static name
     */
    static List<Reference> callAt(List<SqlToken> tokens, int index) {
        String kindKeyword = tokens.get(index).upper();
        int i = index + 1;

        // EXEC @rc = dbo.proc
        if (i + 1 < tokens.size() && tokens.get(i).type() == SqlToken.Type.VARIABLE
            && tokens.get(i + 1).type() == SqlToken.Type.OPERATOR && tokens.get(i + 1).text().equals("=")) {
            i += 2;
        }
        if (i >= tokens.size() || tokens.get(i).type() == SqlToken.Type.LPAREN) {
            return List.of(Reference.marker(Reference.MARKER_DYNAMIC_SQL, kindKeyword + "("));
        }
        if (tokens.get(i).type() == SqlToken.Type.VARIABLE) {
            return List.of(Reference.marker(Reference.MARKER_DYNAMIC_SQL, kindKeyword + " @VAR"));
        }

        Optional<QualifiedName> callee = QualifiedName.readAt(tokens, i);
        if (callee.isEmpty()) {
            return List.of();
        }

        Reference call = new Reference(ReferenceKind.CALL, callee.get().written(), kindKeyword);
        if (callee.get().last().toLowerCase(Locale.ROOT).endsWith("sp_executesql")) {
            return List.of(call, Reference.marker(Reference.MARKER_DYNAMIC_SQL, "sp_executesql"));
        }
        return List.of(call);
    }

    private static Optional<Reference> tableAfter(List<SqlToken> tokens, int index, String preceder, Map<String, String> aliases) {
        int i = index + 1;
        if (i < tokens.size() && tokens.get(i).is("TOP")) {
            i = skipParenthesized(tokens, i + 1);
        }
        if (preceder.equals("MERGE") && i < tokens.size() && tokens.get(i).is("INTO")) {
            return Optional.empty();
        }
        if (preceder.equals("DELETE") && i < tokens.size() && tokens.get(i).is("FROM")) {
            return Optional.empty();
        }

        Optional<QualifiedName> name = QualifiedName.readAt(tokens, i);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        QualifiedName table = name.get();
        String first = table.first().toUpperCase(Locale.ROOT);
        boolean followedByParen = table.end() < tokens.size() && tokens.get(table.end()).type() == SqlToken.Type.LPAREN;

        if (RESERVED.contains(first) || first.startsWith("#") || first.equals("INSERTED") || first.equals("DELETED")) {
            return Optional.empty();
        }
        // FROM dbo.fn(...) is a table-valued function; INTO dbo.t (cols) is still a table
        if (followedByParen && !preceder.equals("INTO")) {
            return Optional.empty();
        }

        String canonical = table.canonical();
        if ((preceder.equals("UPDATE") || preceder.equals("DELETE")) && table.isSinglePart()) {
            canonical = aliases.getOrDefault(canonical, canonical);
        }
        return Optional.of(Reference.of(ReferenceKind.TABLE, canonical));
    }

    private static Optional<Reference> functionAt(List<SqlToken> tokens, int index) {
        Optional<QualifiedName> name = QualifiedName.readAt(tokens, index);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        QualifiedName function = name.get();
        if (function.end() >= tokens.size() || tokens.get(function.end()).type() != SqlToken.Type.LPAREN) {
            return Optional.empty();
        }
        if (NON_FUNCTIONS.contains(function.last().toUpperCase(Locale.ROOT))) {
            return Optional.empty();
        }
        if (index > 0 && tokens.get(index - 1).isAnyOf(NAME_DEFINERS)) {
            return Optional.empty();
        }
        if (index > 0 && tokens.get(index - 1).type() == SqlToken.Type.COMMA && isInCteList(tokens, index)) {
            return Optional.empty();
        }
        return Optional.of(Reference.of(ReferenceKind.FUNCTION, function.written()));
    }

    /**
     * Maps FROM/JOIN aliases to canonical table names, e.g. {@code FROM dbo.Users u} maps {@code U}.
     */
    static Map<String, String> aliases(List<SqlToken> tokens) {
        Map<String, String> aliases = new HashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            if (!tokens.get(i).is("FROM") && !tokens.get(i).is("JOIN")) {
                continue;
            }
            Optional<QualifiedName> name = QualifiedName.readAt(tokens, i + 1);
            if (name.isEmpty() || RESERVED.contains(name.get().first().toUpperCase(Locale.ROOT))) {
                continue;
            }
            int j = name.get().end();
            if (j < tokens.size() && tokens.get(j).is("AS")) {
                j++;
            }
            if (j < tokens.size() && tokens.get(j).isWord() && !RESERVED.contains(tokens.get(j).upper())
                && !isJoinModifier(tokens.get(j))) {
                aliases.putIfAbsent(tokens.get(j).upper(), name.get().canonical());
            }
        }
        return aliases;
    }

    private static boolean isJoinModifier(SqlToken token) {
        return token.isAnyOf(Set.of("LEFT", "RIGHT", "INNER", "OUTER", "FULL", "CROSS", "GROUP", "ORDER", "WHERE", "ON"));
    }

    private static boolean isTableVariableDeclaration(List<SqlToken> tokens, int index) {
        int i = index + 1;
        if (i < tokens.size() && tokens.get(i).is("AS")) {
            i++;
        }
        return i < tokens.size() && tokens.get(i).is("TABLE");
    }

    private static boolean isStatementLead(List<SqlToken> tokens, Set<String> leads) {
        for (SqlToken token : tokens) {
            if (token.isAnyOf(leads)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns whether {@code index} sits in the CTE definitions of a WITH statement, before its main verb.
     */
    private static boolean isInCteList(List<SqlToken> tokens, int index) {
        if (tokens.isEmpty() || !tokens.get(0).is("WITH")) {
            return false;
        }
        int depth = 0;
        for (int i = 1; i < index; i++) {
            SqlToken token = tokens.get(i);
            if (token.type() == SqlToken.Type.LPAREN) {
                depth++;
            } else if (token.type() == SqlToken.Type.RPAREN) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.isAnyOf(StatementClassifier.MAIN_VERBS)) {
                return false;
            }
        }
        return depth == 0;
    }

    static int skipParenthesized(List<SqlToken> tokens, int start) {
        if (start >= tokens.size() || tokens.get(start).type() != SqlToken.Type.LPAREN) {
            // TOP 10 without parentheses
            return start < tokens.size() && tokens.get(start).type() == SqlToken.Type.NUMBER ? start + 1 : start;
        }
        int depth = 0;
        for (int i = start; i < tokens.size(); i++) {
            if (tokens.get(i).type() == SqlToken.Type.LPAREN) {
                depth++;
            } else if (tokens.get(i).type() == SqlToken.Type.RPAREN && --depth == 0) {
                return i + 1;
            }
        }
        return tokens.size();
    }
}
