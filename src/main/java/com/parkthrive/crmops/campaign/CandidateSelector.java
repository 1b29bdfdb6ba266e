package com.parkthrive.crmops.campaign;

import com.parkthrive.crmops.crm.CrmRecord;

import java.util.List;

/**
 * Chooses which of a record's eligible children are transitioned.
 */
@FunctionalInterface
public interface CandidateSelector {

    CandidateSelector FIRST = eligible -> eligible.isEmpty() ? List.of() : List.of(eligible.get(0));

    CandidateSelector ALL = List::copyOf;

    List<CrmRecord> select(List<CrmRecord> eligible);
}
