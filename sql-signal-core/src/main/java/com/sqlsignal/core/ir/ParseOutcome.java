package com.sqlsignal.core.ir;

import java.util.Objects;

/**
 * Tagged result of turning one unit's text into an IR.
 *
 * <p>{@link Status#OK} carries the grammar IR. {@link Status#DEGRADED} carries the fallback IR plus
 * the reason the grammar path was abandoned ({@code parse_error: line L:C ...}). A degraded IR is
 * always returned in preference to no result.
 *
 * @param status outcome tag
 * @param ir produced IR, never null
 * @param reason degradation reason; null when status is OK
 */
public record ParseOutcome(
    Status status,
    SourceIr ir,
    String reason
) {
    public enum Status {
        OK,
        DEGRADED
    }

    public ParseOutcome {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(ir, "ir must not be null");
        if (status == Status.DEGRADED) {
            Objects.requireNonNull(reason, "reason must not be null for a degraded outcome");
        }
    }

    public static ParseOutcome ok(SourceIr ir) {
        return new ParseOutcome(Status.OK, ir, null);
    }

    public static ParseOutcome degraded(SourceIr ir, String reason) {
        return new ParseOutcome(Status.DEGRADED, ir, reason);
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }
}
