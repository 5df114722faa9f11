package com.sqlsignal.core.signal;

import java.util.List;

/**
 * Error-handling constructs of one unit.
 *
 * @param hasTryCatch true when a TRY/CATCH block is present
 * @param tryCount BEGIN TRY blocks
 * @param catchCount BEGIN CATCH blocks
 * @param usesThrow THROW present
 * @param throwCount THROW statements
 * @param usesRaiserror RAISERROR present
 * @param raiserrorCount RAISERROR statements
 * @param usesAtAtError {@code @@ERROR} referenced
 * @param atAtErrorCount {@code @@ERROR} references
 * @param usesErrorFunctions sorted ERROR_* function names (capped)
 * @param usesPrint PRINT present
 * @param printCount PRINT statements
 * @param usesReturn RETURN present
 * @param returnCount RETURN statements
 * @param returnValues sorted integer RETURN literals (capped)
 * @param usesOutputErrorParams OUTPUT parameters carrying error state declared
 * @param outputErrorParams sorted OUTPUT error parameter names (capped)
 * @param signals sorted aggregate signals (capped)
 * @param notes observations about error propagation
 */
public record ErrorHandlingSignals(
    boolean hasTryCatch,
    int tryCount,
    int catchCount,
    boolean usesThrow,
    int throwCount,
    boolean usesRaiserror,
    int raiserrorCount,
    boolean usesAtAtError,
    int atAtErrorCount,
    List<String> usesErrorFunctions,
    boolean usesPrint,
    int printCount,
    boolean usesReturn,
    int returnCount,
    List<Integer> returnValues,
    boolean usesOutputErrorParams,
    List<String> outputErrorParams,
    List<String> signals,
    List<String> notes
) {
    public ErrorHandlingSignals {
        usesErrorFunctions = usesErrorFunctions == null ? List.of() : List.copyOf(usesErrorFunctions);
        returnValues = returnValues == null ? List.of() : List.copyOf(returnValues);
        outputErrorParams = outputErrorParams == null ? List.of() : List.copyOf(outputErrorParams);
        signals = signals == null ? List.of() : List.copyOf(signals);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
