package com.parkthrive.crmops.workflow;

import com.parkthrive.crmops.campaign.CampaignDefinitions;
import com.parkthrive.crmops.campaign.StageCatalog;
import com.parkthrive.crmops.campaign.StageKey;
import com.parkthrive.crmops.campaign.StageTransitionEngine;
import com.parkthrive.crmops.crm.CampaignField;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.paging.CursorPaginator;
import com.parkthrive.crmops.paging.QueryLoader;
import com.parkthrive.crmops.resolve.RecordResolver;
import com.parkthrive.crmops.run.RunOrchestrator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The stage-driven mailer workflows: round 1, rounds 2 and 3, hold release.
 */
@Configuration
public class StageCampaignConfig {

    private final CampaignDefinitions definitions;
    private final StageCatalog stages;
    private final QueryFiles queryFiles;
    private final QueryLoader queryLoader;
    private final CursorPaginator paginator;
    private final CrmClient client;
    private final RecordResolver resolver;
    private final StageTransitionEngine engine;
    private final RunOrchestrator orchestrator;

    public StageCampaignConfig(CampaignDefinitions definitions,
                               StageCatalog stages,
                               QueryFiles queryFiles,
                               QueryLoader queryLoader,
                               CursorPaginator paginator,
                               @Qualifier("primaryCrmClient") CrmClient client,
                               RecordResolver resolver,
                               StageTransitionEngine engine,
                               RunOrchestrator orchestrator) {
        this.definitions = definitions;
        this.stages = stages;
        this.queryFiles = queryFiles;
        this.queryLoader = queryLoader;
        this.paginator = paginator;
        this.client = client;
        this.resolver = resolver;
        this.engine = engine;
        this.orchestrator = orchestrator;
    }

    @Bean
    public StageCampaignWorkflow round1Workflow() {
        return base(CampaignDefinitions.ROUND_1)
                .requiredStage(StageKey.UNPAID)
                .requiredStage(StageKey.ROUND_1)
                .requiredTemplate(StageKey.ROUND_1)
                .field(CampaignField.MAILER_DATES)
                .field(CampaignField.TEMPLATE)
                .field(CampaignField.LAST_MAIL_DATE)
                .build();
    }

    @Bean
    public StageCampaignWorkflow rounds2And3Workflow() {
        return base(CampaignDefinitions.ROUNDS_2_3)
                .requiredStage(StageKey.ROUND_1)
                .requiredStage(StageKey.ROUND_2)
                .requiredStage(StageKey.ROUND_3)
                .requiredTemplate(StageKey.ROUND_2)
                .requiredTemplate(StageKey.ROUND_3)
                .field(CampaignField.MAILER_DATES)
                .field(CampaignField.TEMPLATE)
                .field(CampaignField.LAST_MAIL_DATE)
                .build();
    }

    @Bean
    public StageCampaignWorkflow holdsWorkflow() {
        return base(CampaignDefinitions.HOLDS)
                .requiredStage(StageKey.HOLD)
                .requiredStage(StageKey.UNPAID)
                .field(CampaignField.CITATION_DATE)
                .build();
    }

    private StageCampaignWorkflow.StageCampaignWorkflowBuilder base(String name) {
        return StageCampaignWorkflow.builder()
                .name(name)
                .definitions(definitions)
                .stages(stages)
                .queryFiles(queryFiles)
                .queryLoader(queryLoader)
                .paginator(paginator)
                .client(client)
                .resolver(resolver)
                .engine(engine)
                .orchestrator(orchestrator);
    }
}
