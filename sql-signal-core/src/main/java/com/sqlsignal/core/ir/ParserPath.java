package com.sqlsignal.core.ir;

/**
 * Which producer built an IR.
 */
public enum ParserPath {
    GRAMMAR("grammar"),
    FALLBACK("fallback");

    private final String label;

    ParserPath(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
