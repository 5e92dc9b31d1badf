package com.conveyal.proximity.pipeline;

import com.conveyal.proximity.aggregate.ScopeResult;
import com.conveyal.proximity.util.ExceptionUtils;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * What happened to one scope: whether it completed, and if not, at which stage it stopped and why. Produced by the
 * worker that analyzed the scope and never modified afterward.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"scopeId", "region", "status", "stage", "errorType", "message"})
public class ScopeOutcome {

    public enum Status {
        /** Result available and included in rollups. */
        COMPLETED,
        /** Boundary does not overlap the population grid. Zero coverage, excluded from rollups. */
        SKIPPED_NO_OVERLAP,
        /** No roads or facilities were found in the scope, which usually means missing input. */
        NEEDS_REVIEW,
        /** Unreadable or inconsistent input, or an unexpected error. */
        FAILED
    }

    public final String scopeId;

    public final String region;

    public final Status status;

    /** Stage at which the scope stopped. Null when it completed. */
    public final Stage stage;

    public final String errorType;

    public final String message;

    /** Present when completed, and as an all-zero result when skipped for lack of overlap. Null otherwise. */
    @JsonIgnore
    public final ScopeResult result;

    private ScopeOutcome (String scopeId, String region, Status status, Stage stage, Throwable cause,
                          ScopeResult result) {
        this.scopeId = scopeId;
        this.region = region;
        this.status = status;
        this.stage = stage;
        this.errorType = cause == null ? null : cause.getClass().getSimpleName();
        this.message = cause == null ? null : ExceptionUtils.shortCauseString(cause);
        this.result = result;
    }

    public static ScopeOutcome completed (ScopeResult result) {
        return new ScopeOutcome(result.id, result.region, Status.COMPLETED, null, null, result);
    }

    /** The scope lies outside the population grid: it has no population to cover, so its coverage is zero. */
    public static ScopeOutcome noOverlap (ScopeResult zeroResult, Throwable cause) {
        return new ScopeOutcome(zeroResult.id, zeroResult.region, Status.SKIPPED_NO_OVERLAP, Stage.LOAD, cause,
                zeroResult);
    }

    public static ScopeOutcome stopped (String scopeId, String region, Status status, Stage stage, Throwable cause) {
        return new ScopeOutcome(scopeId, region, status, stage, cause, null);
    }

    @JsonIgnore
    public boolean isCompleted () {
        return status == Status.COMPLETED;
    }

    /** One line reason for excluding the scope from rollups. */
    public String exclusionReason () {
        return String.format("%s at %s: %s", status, stage, message);
    }

}
