package com.parkthrive.crmops.campaign;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Logs partial failures and keeps them for the end of run report.
 */
@Slf4j
@Component
public class LoggingReconciliationHook implements ReconciliationHook {

    private final List<String> pending = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void onPartialFailure(TransitionOutcome outcome, String pendingWrite) {
        String entry = String.format("lead=%s opportunity=%s pending=%s: %s",
                outcome.getRecordId(), outcome.getChildId(), pendingWrite, outcome.getMessage());
        pending.add(entry);
        log.warn("Needs reconciliation: {}", entry);
    }

    public List<String> getPending() {
        return List.copyOf(pending);
    }
}
