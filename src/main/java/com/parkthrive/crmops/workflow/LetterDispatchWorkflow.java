package com.parkthrive.crmops.workflow;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.campaign.ErrorStageRouter;
import com.parkthrive.crmops.campaign.ReconciliationHook;
import com.parkthrive.crmops.campaign.StageCatalog;
import com.parkthrive.crmops.campaign.StageKey;
import com.parkthrive.crmops.campaign.TransitionOutcome;
import com.parkthrive.crmops.config.CampaignProperties;
import com.parkthrive.crmops.config.PostGridProperties;
import com.parkthrive.crmops.crm.CampaignField;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.crm.FieldRegistry;
import com.parkthrive.crmops.crm.WriteResult;
import com.parkthrive.crmops.mail.LetterClient;
import com.parkthrive.crmops.mail.LetterResult;
import com.parkthrive.crmops.paging.CursorPaginator;
import com.parkthrive.crmops.paging.QueryLoader;
import com.parkthrive.crmops.resolve.LetterData;
import com.parkthrive.crmops.resolve.LetterDataResolver;
import com.parkthrive.crmops.run.CampaignRunStats;
import com.parkthrive.crmops.run.RunOrchestrator;
import com.parkthrive.crmops.run.Workflow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Sends one printed letter per lead in a mailer round and stamps the send date on the lead.
 * Leads whose letter cannot be built or is refused by the vendor go to the error stage.
 */
@Slf4j
@Component
public class LetterDispatchWorkflow implements Workflow {

    public static final String NAME = "mailers";

    static final String NO_TEMPLATE = "No template ID found";
    static final String NO_RECIPIENT = "Missing required contact information";

    private final QueryFiles queryFiles;
    private final QueryLoader queryLoader;
    private final CursorPaginator paginator;
    private final CrmClient client;
    private final LetterDataResolver letterDataResolver;
    private final LetterClient letterClient;
    private final ErrorStageRouter errorRouter;
    private final ReconciliationHook reconciliationHook;
    private final FieldRegistry fields;
    private final StageCatalog stages;
    private final PostGridProperties postGridProperties;
    private final RunOrchestrator orchestrator;
    private final Clock clock;
    private final DateTimeFormatter dateFormat;

    public LetterDispatchWorkflow(QueryFiles queryFiles,
                                  QueryLoader queryLoader,
                                  CursorPaginator paginator,
                                  @Qualifier("primaryCrmClient") CrmClient client,
                                  LetterDataResolver letterDataResolver,
                                  LetterClient letterClient,
                                  ErrorStageRouter errorRouter,
                                  ReconciliationHook reconciliationHook,
                                  FieldRegistry fields,
                                  StageCatalog stages,
                                  PostGridProperties postGridProperties,
                                  CampaignProperties campaignProperties,
                                  RunOrchestrator orchestrator,
                                  Clock clock) {
        this.queryFiles = queryFiles;
        this.queryLoader = queryLoader;
        this.paginator = paginator;
        this.client = client;
        this.letterDataResolver = letterDataResolver;
        this.letterClient = letterClient;
        this.errorRouter = errorRouter;
        this.reconciliationHook = reconciliationHook;
        this.fields = fields;
        this.stages = stages;
        this.postGridProperties = postGridProperties;
        this.orchestrator = orchestrator;
        this.clock = clock;
        this.dateFormat = DateTimeFormatter.ofPattern(campaignProperties.getDateFormat());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<CampaignField> fields() {
        return List.of(CampaignField.CITATION_NUMBER, CampaignField.CITATION_DATE, CampaignField.CITATION_TIME,
                CampaignField.LOT_ADDRESS, CampaignField.CITATION_IMAGE_URL, CampaignField.FINE_AMOUNT,
                CampaignField.SERVICE_FEE, CampaignField.MAILER_DATES, CampaignField.TEMPLATE,
                CampaignField.POSTGRID_SEND_DATE);
    }

    @Override
    public List<String> checkConfiguration() {
        List<String> problems = new ArrayList<>(queryFiles.check(NAME));
        if (isBlank(postGridProperties.getApiKey())) {
            problems.add("crm.postgrid.api-key is not set");
        }
        if (isBlank(postGridProperties.getFromContactId())) {
            problems.add("crm.postgrid.from-contact-id is not set");
        }
        problems.addAll(stages.missingStages(
                List.of(StageKey.ROUND_1, StageKey.ROUND_2, StageKey.ROUND_3, StageKey.LEAD_ERROR)));
        return problems;
    }

    @Override
    public CampaignRunStats run() {
        ObjectNode query = queryLoader.withDefaultLeadFields(queryFiles.load(NAME), List.of("id", "display_name"));
        List<CrmRecord> leads = paginator.fetchAll(client::search, query);
        log.info("Fetched {} leads for letters", leads.size());

        return orchestrator.run(NAME, leads, this::dispatch, true);
    }

    TransitionOutcome dispatch(CrmRecord reference) {
        String leadId = reference.getId();
        LetterData letter = letterDataResolver.resolve(reference);

        if (!letter.hasTemplate()) {
            return toErrorStage(leadId, NO_TEMPLATE);
        }
        if (!letter.hasRecipient()) {
            return toErrorStage(leadId, NO_RECIPIENT);
        }

        LetterResult result = letterClient.send(letter);
        if (!result.isSuccess()) {
            log.error("Letter for lead {} rejected: {}", leadId, result.errorDisplay());
            return toErrorStage(leadId, result.errorDisplay());
        }
        log.info("Letter {} created for lead {}", result.getLetterId(), leadId);

        String today = LocalDate.now(clock).format(dateFormat);
        String sendDateKey = fields.writeKey(CampaignField.POSTGRID_SEND_DATE);
        WriteResult stamp = client.updateLead(leadId, Map.of(sendDateKey, today));
        if (!stamp.isOk()) {
            TransitionOutcome partial = TransitionOutcome.partialFailure(leadId, null,
                    "Letter " + result.getLetterId() + " sent but send date not written (HTTP " + stamp.getHttpStatus() + ")");
            reconciliationHook.onPartialFailure(partial, "lead " + sendDateKey + "=" + today);
            return partial;
        }
        return TransitionOutcome.succeeded(leadId, null);
    }

    private TransitionOutcome toErrorStage(String leadId, String message) {
        if (errorRouter.route(leadId, message)) {
            return TransitionOutcome.routedToError(leadId, message);
        }
        return TransitionOutcome.failed(leadId, null, message + " (error stage not updated)");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
