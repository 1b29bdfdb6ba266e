package com.parkthrive.crmops.run;

import com.parkthrive.crmops.campaign.TransitionOutcome;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CampaignRunStatsTest {

    @Test
    void testRecord_TalliesByKind() {
        CampaignRunStats stats = new CampaignRunStats("round-1");

        stats.record(TransitionOutcome.succeeded("l1", "o1"));
        stats.record(TransitionOutcome.ineligible("l2", "No opportunities found"));
        stats.record(TransitionOutcome.failed("l3", "o3", "boom"));
        stats.record(TransitionOutcome.partialFailure("l4", "o4", "lead not updated"));
        stats.record(TransitionOutcome.routedToError("l5", "No template ID found"));

        assertThat(stats.getAttempted()).isEqualTo(5);
        assertThat(stats.getSucceeded()).isEqualTo(1);
        assertThat(stats.getIneligible()).isEqualTo(1);
        assertThat(stats.getFailed()).isEqualTo(3);
        assertThat(stats.getPartial()).isEqualTo(1);
        assertThat(stats.getFailedIds()).containsExactly("l3", "l4", "l5");
        assertThat(stats.summary()).isEqualTo("attempted=5, succeeded=1, failed=3");
        assertThat(stats.successRate()).isEqualTo(20.0);
    }

    @Test
    void testSuccessRate_ZeroWhenNothingAttempted() {
        assertThat(new CampaignRunStats("empty").successRate()).isZero();
    }
}
