package com.parkthrive.crmops.campaign;

import com.parkthrive.crmops.config.CampaignProperties;
import com.parkthrive.crmops.crm.CampaignField;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.crm.FieldRegistry;
import com.parkthrive.crmops.crm.WriteResult;
import com.parkthrive.crmops.resolve.FieldValues;
import com.parkthrive.crmops.resolve.ResolvedLead;
import com.parkthrive.crmops.run.RunMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Applies a campaign's transition table to one resolved lead.
 * <p>
 * Each selected child is written first (new stage, mailer dates, template), then the parent
 * (date fields). Both writes are needed for success; a failed parent write after a successful
 * child write is reported as a partial failure and handed to the {@link ReconciliationHook}.
 * Children are processed in listed order and processing stops at the first child that does
 * not succeed. A lead left without a candidate because some children could not be fetched
 * fails rather than being ineligible.
 */
@Slf4j
public class StageTransitionEngine {

    static final String STATUS_ID = "status_id";

    private final CrmClient client;
    private final FieldRegistry fields;
    private final StageCatalog stages;
    private final ErrorStageRouter errorRouter;
    private final ReconciliationHook reconciliationHook;
    private final RunMetrics metrics;
    private final Clock clock;
    private final DateTimeFormatter dateFormat;

    public StageTransitionEngine(CrmClient client,
                                 FieldRegistry fields,
                                 StageCatalog stages,
                                 ErrorStageRouter errorRouter,
                                 ReconciliationHook reconciliationHook,
                                 RunMetrics metrics,
                                 CampaignProperties properties,
                                 Clock clock) {
        this.client = client;
        this.fields = fields;
        this.stages = stages;
        this.errorRouter = errorRouter;
        this.reconciliationHook = reconciliationHook;
        this.metrics = metrics;
        this.clock = clock;
        this.dateFormat = DateTimeFormatter.ofPattern(properties.getDateFormat());
    }

    public TransitionOutcome advance(ResolvedLead lead, CampaignDefinition definition) {
        String leadId = lead.getId();

        if (lead.getChildren().isEmpty()) {
            return record(lead.getUnresolvedChildren() > 0
                    ? unresolved(lead)
                    : TransitionOutcome.ineligible(leadId, "No opportunities found"));
        }

        TransitionTable table = definition.getTable();
        List<CrmRecord> eligible = lead.getChildren().stream()
                .filter(table::hasEntryFor)
                .collect(Collectors.toList());
        List<CrmRecord> selected = definition.getSelector().select(eligible);

        if (selected.isEmpty()) {
            return record(lead.getUnresolvedChildren() > 0
                    ? unresolved(lead)
                    : TransitionOutcome.ineligible(leadId, "No eligible opportunities for update"));
        }

        String today = LocalDate.now(clock).format(dateFormat);
        TransitionOutcome outcome = null;

        for (CrmRecord child : selected) {
            Transition transition = table.find(child)
                    .orElseThrow(() -> new IllegalStateException("Selected opportunity " + child.getId() + " has no transition"));
            try {
                outcome = apply(leadId, child, transition, today);
            } catch (MissingFieldException e) {
                outcome = escalate(leadId, child.getId(), e.getMessage(), definition);
            }
            if (!outcome.isSuccess()) {
                break;
            }
        }
        return record(outcome);
    }

    private TransitionOutcome apply(String leadId, CrmRecord child, Transition transition, String today) {
        requireFields(child, transition);

        Map<String, Object> childChanges = new LinkedHashMap<>();
        childChanges.put(STATUS_ID, stages.get(transition.getTo()).getId());

        if (transition.getMailerDates() == DateMutation.REPLACE) {
            childChanges.put(fields.writeKey(CampaignField.MAILER_DATES), today);
        } else if (transition.getMailerDates() == DateMutation.APPEND) {
            String existing = fields.read(child, CampaignField.MAILER_DATES).orElse(null);
            childChanges.put(fields.writeKey(CampaignField.MAILER_DATES), FieldValues.append(existing, today));
        }
        if (transition.getTemplateId() != null) {
            childChanges.put(fields.writeKey(CampaignField.TEMPLATE), transition.getTemplateId());
        }

        WriteResult childWrite = client.updateOpportunity(child.getId(), childChanges);
        if (!childWrite.isOk()) {
            return TransitionOutcome.failed(leadId, child.getId(),
                    "Failed to update opportunity (HTTP " + childWrite.getHttpStatus() + ")");
        }
        log.debug("Opportunity {} moved {}", child.getId(), transition);

        if (!transition.writesParent()) {
            return TransitionOutcome.succeeded(leadId, child.getId());
        }

        Map<String, Object> parentChanges = new LinkedHashMap<>();
        for (CampaignField field : transition.getParentDateFields()) {
            parentChanges.put(fields.writeKey(field), today);
        }

        WriteResult parentWrite = client.updateLead(leadId, parentChanges);
        if (!parentWrite.isOk()) {
            TransitionOutcome partial = TransitionOutcome.partialFailure(leadId, child.getId(),
                    "Failed to update lead (HTTP " + parentWrite.getHttpStatus() + ")");
            reconciliationHook.onPartialFailure(partial, "lead " + parentChanges.keySet() + " after " + transition);
            return partial;
        }
        return TransitionOutcome.succeeded(leadId, child.getId());
    }

    private static TransitionOutcome unresolved(ResolvedLead lead) {
        return TransitionOutcome.failed(lead.getId(), null,
                lead.getUnresolvedChildren() + " opportunities could not be fetched");
    }

    private void requireFields(CrmRecord child, Transition transition) {
        List<CampaignField> missing = new ArrayList<>();
        for (CampaignField field : transition.getRequiredFields()) {
            if (fields.read(child, field).filter(v -> !v.isBlank()).isEmpty()) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingFieldException(child.getId(), missing);
        }
    }

    private TransitionOutcome escalate(String leadId, String childId, String message, CampaignDefinition definition) {
        if (!definition.isRouteErrorsToStage()) {
            return TransitionOutcome.failed(leadId, childId, message);
        }
        if (errorRouter.route(leadId, message)) {
            return TransitionOutcome.routedToError(leadId, message);
        }
        return TransitionOutcome.failed(leadId, childId, message + " (error stage not updated)");
    }

    private TransitionOutcome record(TransitionOutcome outcome) {
        switch (outcome.getKind()) {
            case SUCCEEDED:
                metrics.getTransitionSucceeded().increment();
                break;
            case INELIGIBLE:
                metrics.getTransitionIneligible().increment();
                break;
            case PARTIAL_FAILURE:
                metrics.getTransitionPartial().increment();
                break;
            case ROUTED_TO_ERROR:
                metrics.getTransitionRoutedToError().increment();
                break;
            default:
                metrics.getTransitionFailed().increment();
                break;
        }
        return outcome;
    }
}
