package com.sqlsignal.core.callgraph;

/**
 * Thrown by strict batch entry points when a batch exceeds the object or character ceiling.
 */
public class BatchLimitExceededException extends RuntimeException {

    private final String limit;
    private final long max;
    private final long provided;

    public BatchLimitExceededException(String limit, long max, long provided) {
        super(limit + ": max=" + max + " provided=" + provided);
        this.limit = limit;
        this.max = max;
        this.provided = provided;
    }

    public String getLimit() {
        return limit;
    }

    public long getMax() {
        return max;
    }

    public long getProvided() {
        return provided;
    }
}
