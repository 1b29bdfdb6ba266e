package com.parkthrive.crmops.campaign;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of driving one record through the engine.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransitionOutcome {

    Kind kind;
    String recordId;
    String childId;
    String message;
    boolean childOk;
    boolean parentOk;

    public enum Kind {
        SUCCEEDED,
        /** No child has a transition; not a failure */
        INELIGIBLE,
        FAILED,
        /** Child written, parent write failed */
        PARTIAL_FAILURE,
        /** Moved to the error stage with a note */
        ROUTED_TO_ERROR
    }

    public static TransitionOutcome succeeded(String recordId, String childId) {
        return new TransitionOutcome(Kind.SUCCEEDED, recordId, childId, null, true, true);
    }

    public static TransitionOutcome ineligible(String recordId, String reason) {
        return new TransitionOutcome(Kind.INELIGIBLE, recordId, null, reason, false, false);
    }

    public static TransitionOutcome failed(String recordId, String childId, String message) {
        return new TransitionOutcome(Kind.FAILED, recordId, childId, message, false, false);
    }

    public static TransitionOutcome partialFailure(String recordId, String childId, String message) {
        return new TransitionOutcome(Kind.PARTIAL_FAILURE, recordId, childId, message, true, false);
    }

    public static TransitionOutcome routedToError(String recordId, String message) {
        return new TransitionOutcome(Kind.ROUTED_TO_ERROR, recordId, null, message, false, false);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCEEDED;
    }

    /**
     * Counted as a failure in run statistics.
     */
    public boolean isFailure() {
        return kind == Kind.FAILED || kind == Kind.PARTIAL_FAILURE || kind == Kind.ROUTED_TO_ERROR;
    }

    public String statusLine() {
        switch (kind) {
            case SUCCEEDED:
                return "Success";
            case INELIGIBLE:
                return "Skipped - " + message;
            case PARTIAL_FAILURE:
                return "Error - " + message + " (opportunity updated, lead not)";
            default:
                return "Error - " + message;
        }
    }
}
