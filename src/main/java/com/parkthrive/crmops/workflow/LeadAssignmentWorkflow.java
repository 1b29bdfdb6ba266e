package com.parkthrive.crmops.workflow;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.campaign.TransitionOutcome;
import com.parkthrive.crmops.config.AssignmentProperties;
import com.parkthrive.crmops.config.RetryProperties;
import com.parkthrive.crmops.crm.CampaignField;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.crm.FieldRegistry;
import com.parkthrive.crmops.crm.WriteResult;
import com.parkthrive.crmops.http.Sleeper;
import com.parkthrive.crmops.paging.CursorPaginator;
import com.parkthrive.crmops.paging.PagedResult;
import com.parkthrive.crmops.paging.QueryLoader;
import com.parkthrive.crmops.run.CampaignRunStats;
import com.parkthrive.crmops.run.Workflow;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Tops every sales rep up to the target number of owned leads from the unassigned reservoir.
 */
@Slf4j
@Component
public class LeadAssignmentWorkflow implements Workflow {

    public static final String NAME = "assign";

    private final AssignmentProperties properties;
    private final RetryProperties retryProperties;
    private final SalesRepsFileParser repsParser;
    private final QueryFiles queryFiles;
    private final QueryLoader queryLoader;
    private final CursorPaginator paginator;
    private final CrmClient client;
    private final FieldRegistry fields;
    private final Sleeper sleeper;

    public LeadAssignmentWorkflow(AssignmentProperties properties,
                                  RetryProperties retryProperties,
                                  SalesRepsFileParser repsParser,
                                  QueryFiles queryFiles,
                                  QueryLoader queryLoader,
                                  CursorPaginator paginator,
                                  @Qualifier("primaryCrmClient") CrmClient client,
                                  FieldRegistry fields,
                                  Sleeper sleeper) {
        this.properties = properties;
        this.retryProperties = retryProperties;
        this.repsParser = repsParser;
        this.queryFiles = queryFiles;
        this.queryLoader = queryLoader;
        this.paginator = paginator;
        this.client = client;
        this.fields = fields;
        this.sleeper = sleeper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<CampaignField> fields() {
        return List.of(CampaignField.SALES_OWNER);
    }

    @Override
    public List<String> checkConfiguration() {
        List<String> problems = new ArrayList<>();
        problems.addAll(queryFiles.check("crm.assignment.counting-query", properties.getCountingQuery()));
        problems.addAll(queryFiles.check("crm.assignment.reservoir-query", properties.getReservoirQuery()));
        problems.addAll(queryFiles.check("crm.assignment.sales-reps-file", properties.getSalesRepsFile()));
        if (properties.getTargetLeadsPerRep() <= 0) {
            problems.add("crm.assignment.target-leads-per-rep must be positive");
        }
        return problems;
    }

    @Override
    public CampaignRunStats run() {
        List<SalesRep> reps = repsParser.load(Path.of(properties.getSalesRepsFile()));
        ObjectNode countingQuery = queryLoader.load(Path.of(properties.getCountingQuery()));
        ObjectNode reservoirQuery = queryLoader.load(Path.of(properties.getReservoirQuery()));
        String ownerFieldId = fields.id(CampaignField.SALES_OWNER);

        CampaignRunStats stats = new CampaignRunStats(NAME);
        List<RepAssignment> summary = new ArrayList<>();

        for (int i = 0; i < reps.size(); i++) {
            if (i > 0) {
                sleeper.pause(retryProperties.repDelay());
            }
            summary.add(assign(reps.get(i), countingQuery, reservoirQuery, ownerFieldId, stats));
        }

        logSummary(summary);
        return stats;
    }

    RepAssignment assign(SalesRep rep, ObjectNode countingQuery, ObjectNode reservoirQuery, String ownerFieldId,
                         CampaignRunStats stats) {
        log.info("Processing {} ({})", rep.getName(), rep.getUserId());

        ObjectNode repQuery = queryLoader.withObjectIds(countingQuery, ownerFieldId, rep.getUserId());
        PagedResult owned = paginator.fetchPages(client::search, repQuery);
        if (!owned.isComplete()) {
            log.error("Could not count the leads of {}, skipping the rep", rep.getName());
            stats.record(TransitionOutcome.failed(rep.getUserId(), null, "Lead count incomplete"));
            return RepAssignment.skipped(rep.getName(), properties.getTargetLeadsPerRep());
        }
        int has = owned.size();
        int needs = Math.max(0, properties.getTargetLeadsPerRep() - has);
        log.info("{} has {} leads and needs {} more", rep.getName(), has, needs);

        if (needs == 0) {
            return new RepAssignment(rep.getName(), properties.getTargetLeadsPerRep(), has, 0, 0);
        }

        List<CrmRecord> reservoir = paginator.fetchAll(client::search, reservoirQuery, OptionalInt.of(needs));
        if (reservoir.size() < needs) {
            log.warn("Reservoir holds only {} leads, {} needs {}", reservoir.size(), rep.getName(), needs);
        }

        int assigned = 0;
        for (int i = 0; i < reservoir.size(); i++) {
            if (i > 0) {
                sleeper.pause(retryProperties.assignmentDelay());
            }
            String leadId = reservoir.get(i).getId();
            WriteResult write = client.updateLead(leadId, Map.of(fields.writeKey(CampaignField.SALES_OWNER), rep.getUserId()));
            if (write.isOk()) {
                assigned++;
                stats.record(TransitionOutcome.succeeded(leadId, null));
            } else {
                log.error("Failed to assign lead {} to {}: HTTP {}", leadId, rep.getName(), write.getHttpStatus());
                stats.record(TransitionOutcome.failed(leadId, null, "Failed to assign lead (HTTP " + write.getHttpStatus() + ")"));
            }
        }
        log.info("Assigned {} leads to {}", assigned, rep.getName());
        return new RepAssignment(rep.getName(), properties.getTargetLeadsPerRep(), has, needs, assigned);
    }

    private void logSummary(List<RepAssignment> summary) {
        log.info("==================== ASSIGNMENT SUMMARY ====================");
        log.info(String.format("%-25s %8s %8s %10s %8s", "Rep", "Has", "Needs", "Assigned", "Worked"));
        for (RepAssignment row : summary) {
            if (row.isSkipped()) {
                log.info(String.format("%-25s %s", row.getName(), "count failed, skipped"));
                continue;
            }
            log.info(String.format("%-25s %8d %8d %10d %7d%%",
                    row.getName(), row.getHas(), row.getNeeds(), row.getAssigned(), row.workedPercent()));
        }
    }

    @Value
    @AllArgsConstructor
    static class RepAssignment {
        String name;
        int target;
        int has;
        int needs;
        int assigned;
        boolean skipped;

        RepAssignment(String name, int target, int has, int needs, int assigned) {
            this(name, target, has, needs, assigned, false);
        }

        static RepAssignment skipped(String name, int target) {
            return new RepAssignment(name, target, 0, 0, 0, true);
        }

        /** Share of the target the rep worked through since the last top-up */
        long workedPercent() {
            return target == 0 ? 0 : Math.round(needs * 100.0 / target);
        }
    }
}
