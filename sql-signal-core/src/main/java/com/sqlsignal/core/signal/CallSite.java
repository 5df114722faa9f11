package com.sqlsignal.core.signal;

import java.util.Objects;

/**
 * One call made by a unit, in source order.
 *
 * @param kind {@code exec}, {@code execute} or {@code function_call}
 * @param name callee name as written, quoting removed
 */
public record CallSite(
    String kind,
    String name
) {
    public static final String EXEC = "exec";
    public static final String EXECUTE = "execute";
    public static final String FUNCTION_CALL = "function_call";

    public CallSite {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Upper-case signal of this call kind: {@code EXEC}, {@code EXECUTE} or {@code FUNCTION}.
     *
     * @return signal label
     */
    public String signal() {
        return switch (kind) {
            case EXEC -> "EXEC";
            case EXECUTE -> "EXECUTE";
            default -> "FUNCTION";
        };
    }

    public boolean isFunctionCall() {
        return FUNCTION_CALL.equals(kind);
    }
}
