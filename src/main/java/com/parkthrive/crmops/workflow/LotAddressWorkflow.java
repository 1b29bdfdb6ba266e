package com.parkthrive.crmops.workflow;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.campaign.TransitionOutcome;
import com.parkthrive.crmops.crm.CampaignField;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.crm.FieldRegistry;
import com.parkthrive.crmops.crm.WriteResult;
import com.parkthrive.crmops.paging.CursorPaginator;
import com.parkthrive.crmops.paging.QueryLoader;
import com.parkthrive.crmops.resolve.CrossAccountLookup;
import com.parkthrive.crmops.resolve.RecordResolver;
import com.parkthrive.crmops.resolve.ResolvePolicy;
import com.parkthrive.crmops.resolve.ResolvedLead;
import com.parkthrive.crmops.run.CampaignRunStats;
import com.parkthrive.crmops.run.RunOrchestrator;
import com.parkthrive.crmops.run.Workflow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fills the lot address of opportunities that only carry a lot UID, using the address of the
 * matching lead in the secondary account.
 */
@Slf4j
@Component
public class LotAddressWorkflow implements Workflow {

    public static final String NAME = "missing-lot";

    private static final ResolvePolicy ALL_DETAILS = ResolvePolicy.builder()
            .childDetail(ResolvePolicy.allChildren())
            .build();

    private final QueryFiles queryFiles;
    private final QueryLoader queryLoader;
    private final CursorPaginator paginator;
    private final CrmClient client;
    private final RecordResolver resolver;
    private final CrossAccountLookup crossAccount;
    private final FieldRegistry fields;
    private final RunOrchestrator orchestrator;

    public LotAddressWorkflow(QueryFiles queryFiles,
                              QueryLoader queryLoader,
                              CursorPaginator paginator,
                              @Qualifier("primaryCrmClient") CrmClient client,
                              RecordResolver resolver,
                              CrossAccountLookup crossAccount,
                              FieldRegistry fields,
                              RunOrchestrator orchestrator) {
        this.queryFiles = queryFiles;
        this.queryLoader = queryLoader;
        this.paginator = paginator;
        this.client = client;
        this.resolver = resolver;
        this.crossAccount = crossAccount;
        this.fields = fields;
        this.orchestrator = orchestrator;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<CampaignField> fields() {
        return List.of(CampaignField.LOT_ADDRESS, CampaignField.LOT_UID, CampaignField.SECONDARY_LOT_UID);
    }

    @Override
    public List<String> checkConfiguration() {
        return queryFiles.check(NAME);
    }

    @Override
    public CampaignRunStats run() {
        ObjectNode query = queryLoader.withDefaultLeadFields(queryFiles.load(NAME),
                StageCampaignWorkflow.DEFAULT_LEAD_FIELDS);
        List<CrmRecord> leads = paginator.fetchAll(client::search, query);
        log.info("Processing {} leads with opportunities missing lot addresses", leads.size());

        return orchestrator.run(NAME, leads, this::fillLotAddresses, false);
    }

    /**
     * Succeeds when at least one opportunity was updated and none failed to update.
     */
    TransitionOutcome fillLotAddresses(CrmRecord reference) {
        ResolvedLead lead = resolver.resolve(reference, ALL_DETAILS);
        int updated = 0;

        for (CrmRecord opportunity : lead.getChildren()) {
            if (fields.read(opportunity, CampaignField.LOT_ADDRESS).filter(v -> !v.isBlank()).isPresent()) {
                continue;
            }
            Optional<String> lotUid = fields.read(opportunity, CampaignField.LOT_UID).filter(v -> !v.isBlank());
            if (lotUid.isEmpty()) {
                log.warn("Opportunity {} is missing both lot address and lot UID", opportunity.getId());
                continue;
            }

            Optional<String> address = crossAccount.findAddress(fields.id(CampaignField.SECONDARY_LOT_UID), lotUid.get());
            if (address.isEmpty()) {
                log.warn("No business address found for lot UID {}", lotUid.get());
                continue;
            }

            WriteResult write = client.updateOpportunity(opportunity.getId(),
                    Map.of(fields.writeKey(CampaignField.LOT_ADDRESS), address.get()));
            if (!write.isOk()) {
                return TransitionOutcome.failed(lead.getId(), opportunity.getId(),
                        "Failed to update opportunity (HTTP " + write.getHttpStatus() + ")");
            }
            log.info("Opportunity {} with lot UID {} now has lot address {}", opportunity.getId(), lotUid.get(), address.get());
            updated++;
        }

        if (updated == 0) {
            return TransitionOutcome.ineligible(lead.getId(), "No lot address to fill");
        }
        return TransitionOutcome.succeeded(lead.getId(), null);
    }
}
