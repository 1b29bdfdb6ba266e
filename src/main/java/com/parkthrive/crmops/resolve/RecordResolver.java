package com.parkthrive.crmops.resolve;

import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.crm.DetailResult;
import com.parkthrive.crmops.crm.SearchResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Expands a lead reference from a search page into the detail a transition needs.
 * Children keep their listed order.
 */
@Slf4j
public class RecordResolver {

    private final CrmClient client;

    public RecordResolver(CrmClient client) {
        this.client = client;
    }

    public ResolvedLead resolve(CrmRecord reference, ResolvePolicy policy) {
        CrmRecord lead = reference;

        if (policy.isRefreshParent()) {
            DetailResult detail = client.getLead(reference.getId());
            lead = detail.record()
                    .orElseThrow(() -> new ResolutionException("Failed to fetch lead data"));
        }

        List<CrmRecord> children = lead.getChildren();
        if (policy.isListChildren()) {
            SearchResult listed = client.listOpportunities(lead.getId());
            if (!listed.isOk()) {
                throw new ResolutionException("Failed to fetch opportunities data");
            }
            children = listed.getItems();
        }

        ResolvedLead.ResolvedLeadBuilder resolved = ResolvedLead.builder().lead(lead);
        int unresolved = 0;

        for (CrmRecord child : children) {
            if (!policy.getChildDetail().test(child)) {
                resolved.child(child);
                continue;
            }

            Optional<CrmRecord> detail = childDetail(child);
            if (detail.isPresent()) {
                resolved.child(detail.get());
            } else {
                unresolved++;
                log.warn("Opportunity {} of lead {} could not be fetched, skipping", child.getId(), lead.getId());
            }
        }

        return resolved.unresolvedChildren(unresolved).build();
    }

    /**
     * Full detail of one child; empty when the fetch fails or returns no status.
     */
    public Optional<CrmRecord> childDetail(CrmRecord child) {
        DetailResult detail = client.getOpportunity(child.getId());
        if (detail.isFound() && detail.getRecord().getStatusId() != null) {
            return Optional.of(detail.getRecord());
        }
        return Optional.empty();
    }
}
