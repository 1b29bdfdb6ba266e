package com.parkthrive.crmops.run;

import com.parkthrive.crmops.campaign.ErrorStageRouter;
import com.parkthrive.crmops.campaign.TransitionOutcome;
import com.parkthrive.crmops.config.RetryProperties;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.http.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Drives records one at a time, in the order given, through a {@link RecordProcessor}.
 * A failing record never stops the run: unexpected exceptions are logged, optionally
 * routed to the error stage, and counted as failed.
 */
@Slf4j
public class RunOrchestrator {

    private final ErrorStageRouter errorRouter;
    private final RetryProperties retryProperties;
    private final Sleeper sleeper;

    public RunOrchestrator(ErrorStageRouter errorRouter, RetryProperties retryProperties, Sleeper sleeper) {
        this.errorRouter = errorRouter;
        this.retryProperties = retryProperties;
        this.sleeper = sleeper;
    }

    public CampaignRunStats run(String runName, List<CrmRecord> records, RecordProcessor processor,
                                boolean routeFailuresToErrorStage) {
        CampaignRunStats stats = new CampaignRunStats(runName);
        int total = records.size();

        log.info("==================== PROCESSING {} LEADS ({}) ====================", total, runName);

        for (int i = 0; i < total; i++) {
            CrmRecord record = records.get(i);
            if (i > 0) {
                sleeper.pause(retryProperties.recordDelay());
            }

            log.info("Processing lead {}/{}: {}", i + 1, total, record.getId());

            TransitionOutcome outcome;
            try {
                outcome = processor.process(record);
            } catch (RuntimeException e) {
                log.error("Unexpected error on lead {}: {}", record.getId(), e.getMessage(), e);
                outcome = onUnexpectedError(record.getId(), e, routeFailuresToErrorStage);
            }

            stats.record(outcome);
            logStatus(record.getId(), outcome);
        }

        logSummary(stats);
        return stats;
    }

    private TransitionOutcome onUnexpectedError(String recordId, RuntimeException error, boolean route) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (!route) {
            return TransitionOutcome.failed(recordId, null, message);
        }
        try {
            if (errorRouter.route(recordId, message)) {
                return TransitionOutcome.routedToError(recordId, message);
            }
        } catch (RuntimeException e) {
            log.error("Could not route lead {} to the error stage: {}", recordId, e.getMessage());
        }
        return TransitionOutcome.failed(recordId, null, message);
    }

    private void logStatus(String recordId, TransitionOutcome outcome) {
        if (outcome.isSuccess()) {
            log.info("Lead {} status: {}", recordId, outcome.statusLine());
        } else if (outcome.isFailure()) {
            log.error("Lead {} status: {}", recordId, outcome.statusLine());
        } else {
            log.warn("Lead {} status: {}", recordId, outcome.statusLine());
        }
    }

    private void logSummary(CampaignRunStats stats) {
        log.info("==================== SUMMARY ({}) ====================", stats.getRunName());
        log.info("Total leads processed: {}", stats.getAttempted());
        log.info("Successfully processed: {}", stats.getSucceeded());
        log.info("Failed to process: {}", stats.getFailed());
        log.info("Without eligible opportunities: {}", stats.getIneligible());
        if (stats.getPartial() > 0) {
            log.warn("Partially updated (need reconciliation): {}", stats.getPartial());
        }
        if (stats.getAttempted() > 0) {
            log.info("Success rate: {}%", String.format("%.1f", stats.successRate()));
        }
        log.info("Run {}: {}", stats.getRunName(), stats.summary());
    }
}
