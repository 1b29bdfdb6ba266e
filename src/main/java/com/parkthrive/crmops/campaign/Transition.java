package com.parkthrive.crmops.campaign;

import com.parkthrive.crmops.crm.CampaignField;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One entry of a {@link TransitionTable}.
 */
@Value
@Builder
public class Transition {

    StageKey from;
    StageKey to;

    /** Letter template written to the child; null keeps the current one */
    String templateId;

    @Builder.Default
    DateMutation mailerDates = DateMutation.NONE;

    /** Child fields that must be set for the transition to be applied */
    @Singular
    List<CampaignField> requiredFields;

    /** Parent fields set to today's date once the child is written */
    @Singular
    List<CampaignField> parentDateFields;

    public boolean writesParent() {
        return !parentDateFields.isEmpty();
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
