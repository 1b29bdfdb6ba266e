package com.parkthrive.crmops.campaign;

/**
 * Receives records where one write took effect and a later write of the same step did not.
 * {@code pendingWrite} names what still has to be written by hand.
 */
public interface ReconciliationHook {

    void onPartialFailure(TransitionOutcome outcome, String pendingWrite);
}
