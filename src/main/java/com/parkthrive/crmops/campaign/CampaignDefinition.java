package com.parkthrive.crmops.campaign;

import com.parkthrive.crmops.resolve.ResolvePolicy;
import lombok.Builder;
import lombok.Value;

/**
 * A campaign workflow as data: which moves exist, which children are picked and what is fetched.
 */
@Value
@Builder
public class CampaignDefinition {

    String name;
    TransitionTable table;

    @Builder.Default
    CandidateSelector selector = CandidateSelector.FIRST;

    @Builder.Default
    ResolvePolicy resolvePolicy = ResolvePolicy.referenceOnly();

    /** Move leads to the error stage when a transition cannot be applied */
    boolean routeErrorsToStage;
}
