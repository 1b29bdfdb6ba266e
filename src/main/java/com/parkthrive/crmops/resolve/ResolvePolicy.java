package com.parkthrive.crmops.resolve;

import com.parkthrive.crmops.crm.CrmRecord;
import lombok.Builder;
import lombok.Value;

import java.util.function.Predicate;

/**
 * What the resolver fetches beyond the search result reference.
 */
@Value
@Builder
public class ResolvePolicy {

    /** Replace the reference with the full lead detail */
    @Builder.Default
    boolean refreshParent = false;

    /** Take children from the opportunity list endpoint instead of the lead's nested list */
    @Builder.Default
    boolean listChildren = false;

    /** Children whose detail is fetched; the others are kept as referenced */
    @Builder.Default
    Predicate<CrmRecord> childDetail = child -> false;

    public static ResolvePolicy referenceOnly() {
        return ResolvePolicy.builder().build();
    }

    public static Predicate<CrmRecord> allChildren() {
        return child -> true;
    }
}
