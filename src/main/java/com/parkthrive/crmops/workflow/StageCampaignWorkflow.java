package com.parkthrive.crmops.workflow;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.campaign.CampaignDefinition;
import com.parkthrive.crmops.campaign.CampaignDefinitions;
import com.parkthrive.crmops.campaign.StageCatalog;
import com.parkthrive.crmops.campaign.StageKey;
import com.parkthrive.crmops.campaign.StageTransitionEngine;
import com.parkthrive.crmops.crm.CampaignField;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.paging.CursorPaginator;
import com.parkthrive.crmops.paging.QueryLoader;
import com.parkthrive.crmops.resolve.RecordResolver;
import com.parkthrive.crmops.run.CampaignRunStats;
import com.parkthrive.crmops.run.RunOrchestrator;
import com.parkthrive.crmops.run.Workflow;
import lombok.Builder;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Search, then drive every lead found through one campaign definition.
 */
@Slf4j
public class StageCampaignWorkflow implements Workflow {

    static final List<String> DEFAULT_LEAD_FIELDS = List.of("id", "display_name", "opportunities");

    private final String name;
    private final List<StageKey> requiredStages;
    private final List<StageKey> requiredTemplates;
    private final List<CampaignField> fields;

    private final CampaignDefinitions definitions;
    private final StageCatalog stages;
    private final QueryFiles queryFiles;
    private final QueryLoader queryLoader;
    private final CursorPaginator paginator;
    private final CrmClient client;
    private final RecordResolver resolver;
    private final StageTransitionEngine engine;
    private final RunOrchestrator orchestrator;

    @Builder
    public StageCampaignWorkflow(String name,
                                 @Singular List<StageKey> requiredStages,
                                 @Singular List<StageKey> requiredTemplates,
                                 @Singular List<CampaignField> fields,
                                 CampaignDefinitions definitions,
                                 StageCatalog stages,
                                 QueryFiles queryFiles,
                                 QueryLoader queryLoader,
                                 CursorPaginator paginator,
                                 CrmClient client,
                                 RecordResolver resolver,
                                 StageTransitionEngine engine,
                                 RunOrchestrator orchestrator) {
        this.name = name;
        this.requiredStages = requiredStages;
        this.requiredTemplates = requiredTemplates;
        this.fields = fields;
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

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<CampaignField> fields() {
        return fields;
    }

    @Override
    public List<String> checkConfiguration() {
        List<String> problems = new ArrayList<>(queryFiles.check(name));
        problems.addAll(stages.missingStages(requiredStages));
        problems.addAll(stages.missingTemplates(requiredTemplates));
        return problems;
    }

    @Override
    public CampaignRunStats run() {
        CampaignDefinition definition = definitions.byName(name);
        ObjectNode query = queryLoader.withDefaultLeadFields(queryFiles.load(name), DEFAULT_LEAD_FIELDS);

        List<CrmRecord> leads = paginator.fetchAll(client::search, query);
        log.info("Fetched {} leads for {}", leads.size(), name);

        return orchestrator.run(name, leads,
                reference -> engine.advance(resolver.resolve(reference, definition.getResolvePolicy()), definition),
                definition.isRouteErrorsToStage());
    }
}
