package com.parkthrive.crmops.run;

import com.parkthrive.crmops.campaign.TransitionOutcome;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-run tallies. Ineligible records are attempted but count neither as succeeded nor failed.
 */
@Getter
public class CampaignRunStats {

    private final String runName;
    private int attempted;
    private int succeeded;
    private int failed;
    private int ineligible;
    private int partial;
    private final List<String> failedIds = new ArrayList<>();

    public CampaignRunStats(String runName) {
        this.runName = runName;
    }

    public void record(TransitionOutcome outcome) {
        attempted++;
        if (outcome.isSuccess()) {
            succeeded++;
        } else if (outcome.getKind() == TransitionOutcome.Kind.INELIGIBLE) {
            ineligible++;
        } else {
            failed++;
            failedIds.add(outcome.getRecordId());
            if (outcome.getKind() == TransitionOutcome.Kind.PARTIAL_FAILURE) {
                partial++;
            }
        }
    }

    public double successRate() {
        return attempted == 0 ? 0.0 : succeeded * 100.0 / attempted;
    }

    public String summary() {
        return String.format("attempted=%d, succeeded=%d, failed=%d", attempted, succeeded, failed);
    }

    @Override
    public String toString() {
        return runName + ": " + summary() + ", ineligible=" + ineligible;
    }
}
