package com.parkthrive.crmops.resolve;

import com.parkthrive.crmops.crm.CrmRecord;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A lead with its children, detailed as far as the {@link ResolvePolicy} asked.
 */
@Value
@Builder
public class ResolvedLead {

    CrmRecord lead;

    @Singular("child")
    List<CrmRecord> children;

    /** Children dropped because their detail could not be fetched */
    int unresolvedChildren;

    public String getId() {
        return lead.getId();
    }
}
