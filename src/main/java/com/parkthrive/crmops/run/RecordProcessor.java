package com.parkthrive.crmops.run;

import com.parkthrive.crmops.campaign.TransitionOutcome;
import com.parkthrive.crmops.crm.CrmRecord;

/**
 * Handles one record of a run. Runtime exceptions are caught by the orchestrator.
 */
@FunctionalInterface
public interface RecordProcessor {

    TransitionOutcome process(CrmRecord record);
}
