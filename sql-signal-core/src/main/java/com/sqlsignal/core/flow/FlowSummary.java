package com.sqlsignal.core.flow;

/**
 * Control-flow metrics, always computed from the complete IR.
 *
 * @param hasBranching IF present
 * @param hasLoops WHILE present
 * @param hasTryCatch TRY/CATCH present
 * @param hasGoto GOTO present
 * @param hasReturn RETURN present
 * @param branchCount IF statements
 * @param loopCount WHILE statements
 * @param returnCount RETURN statements
 * @param gotoCount GOTO statements
 * @param maxNestingDepth deepest IR nesting level
 * @param cyclomaticComplexity {@code 1 + branchCount + loopCount}
 */
public record FlowSummary(
    boolean hasBranching,
    boolean hasLoops,
    boolean hasTryCatch,
    boolean hasGoto,
    boolean hasReturn,
    int branchCount,
    int loopCount,
    int returnCount,
    int gotoCount,
    int maxNestingDepth,
    int cyclomaticComplexity
) {
}
