package com.parkthrive.crmops.campaign;

import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.support.CampaignFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransitionTableTest {

    private StageCatalog stages;

    @BeforeEach
    void setUp() {
        stages = new StageCatalog(CampaignFixtures.campaignProperties());
    }

    @Test
    void testConstructor_RejectsSecondEntryForSameSource() {
        List<Transition> transitions = List.of(
                move(StageKey.ROUND_1, StageKey.ROUND_2),
                move(StageKey.ROUND_1, StageKey.ROUND_3));

        assertThatThrownBy(() -> new TransitionTable(stages, transitions))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("more than one transition");
    }

    @Test
    void testConstructor_RejectsSelfTransition() {
        assertThatThrownBy(() -> new TransitionTable(stages, List.of(move(StageKey.HOLD, StageKey.HOLD))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testFind_MatchesByStatusId() {
        TransitionTable table = new TransitionTable(stages, List.of(
                move(StageKey.ROUND_1, StageKey.ROUND_2),
                move(StageKey.ROUND_2, StageKey.ROUND_3)));

        assertThat(table.find(CampaignFixtures.opportunity("o1", CampaignFixtures.ROUND_2)))
                .map(Transition::getTo)
                .contains(StageKey.ROUND_3);
        assertThat(table.hasEntryFor(CampaignFixtures.opportunity("o2", CampaignFixtures.ROUND_3))).isFalse();
        assertThat(table.hasEntryFor(CampaignFixtures.opportunity("o3", "stat_other"))).isFalse();
    }

    @Test
    void testFind_FallsBackToLabelWithoutStatusId() {
        TransitionTable table = new TransitionTable(stages, List.of(move(StageKey.ROUND_1, StageKey.ROUND_2)));
        CrmRecord byLabel = CrmRecord.builder().id("o1").statusLabel("stage 1").build();

        assertThat(table.hasEntryFor(byLabel)).isTrue();
    }

    @Test
    void testReferencedStages_CollectsSourcesAndTargets() {
        TransitionTable table = new TransitionTable(stages, List.of(
                move(StageKey.ROUND_1, StageKey.ROUND_2),
                move(StageKey.ROUND_2, StageKey.ROUND_3)));

        assertThat(table.referencedStages())
                .containsExactlyInAnyOrder(StageKey.ROUND_1, StageKey.ROUND_2, StageKey.ROUND_3);
        assertThat(table.transitions()).hasSize(2);
    }

    private static Transition move(StageKey from, StageKey to) {
        return Transition.builder().from(from).to(to).build();
    }
}
