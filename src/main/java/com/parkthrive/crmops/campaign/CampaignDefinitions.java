package com.parkthrive.crmops.campaign;

import com.parkthrive.crmops.crm.CampaignField;
import com.parkthrive.crmops.crm.FieldRegistry;
import com.parkthrive.crmops.resolve.ResolvePolicy;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The mailer campaign workflows.
 */
@Component
public class CampaignDefinitions {

    public static final String ROUND_1 = "round-1";
    public static final String ROUNDS_2_3 = "round-2-3";
    public static final String HOLDS = "holds";

    private final StageCatalog stages;
    private final FieldRegistry fields;

    public CampaignDefinitions(StageCatalog stages, FieldRegistry fields) {
        this.stages = stages;
        this.fields = fields;
    }

    /**
     * First unpaid opportunity goes to round 1; its mailer dates restart at today.
     */
    public CampaignDefinition round1() {
        TransitionTable table = new TransitionTable(stages, List.of(
                Transition.builder()
                        .from(StageKey.UNPAID)
                        .to(StageKey.ROUND_1)
                        .templateId(stages.template(StageKey.ROUND_1).orElse(null))
                        .mailerDates(DateMutation.REPLACE)
                        .parentDateField(CampaignField.LAST_MAIL_DATE)
                        .build()));

        return CampaignDefinition.builder()
                .name(ROUND_1)
                .table(table)
                .selector(CandidateSelector.FIRST)
                .resolvePolicy(ResolvePolicy.referenceOnly())
                .build();
    }

    /**
     * Every opportunity in round 1 or 2 moves one round on; today is appended to its mailer dates.
     */
    public CampaignDefinition rounds2And3() {
        TransitionTable table = new TransitionTable(stages, List.of(
                Transition.builder()
                        .from(StageKey.ROUND_1)
                        .to(StageKey.ROUND_2)
                        .templateId(stages.template(StageKey.ROUND_2).orElse(null))
                        .mailerDates(DateMutation.APPEND)
                        .parentDateField(CampaignField.LAST_MAIL_DATE)
                        .build(),
                Transition.builder()
                        .from(StageKey.ROUND_2)
                        .to(StageKey.ROUND_3)
                        .templateId(stages.template(StageKey.ROUND_3).orElse(null))
                        .mailerDates(DateMutation.APPEND)
                        .parentDateField(CampaignField.LAST_MAIL_DATE)
                        .build()));

        return CampaignDefinition.builder()
                .name(ROUNDS_2_3)
                .table(table)
                .selector(CandidateSelector.ALL)
                .resolvePolicy(ResolvePolicy.builder().childDetail(table::hasEntryFor).build())
                .build();
    }

    /**
     * The held opportunity with the oldest citation is released to unpaid.
     */
    public CampaignDefinition holds() {
        TransitionTable table = new TransitionTable(stages, List.of(
                Transition.builder()
                        .from(StageKey.HOLD)
                        .to(StageKey.UNPAID)
                        .build()));

        return CampaignDefinition.builder()
                .name(HOLDS)
                .table(table)
                .selector(new OldestCandidateSelector(fields.id(CampaignField.CITATION_DATE)))
                .resolvePolicy(ResolvePolicy.builder()
                        .refreshParent(true)
                        .childDetail(table::hasEntryFor)
                        .build())
                .build();
    }

    public CampaignDefinition byName(String name) {
        switch (name) {
            case ROUND_1:
                return round1();
            case ROUNDS_2_3:
                return rounds2And3();
            case HOLDS:
                return holds();
            default:
                throw new IllegalArgumentException("Unknown campaign workflow: " + name);
        }
    }
}
