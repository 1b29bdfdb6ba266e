package com.parkthrive.crmops.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.campaign.TransitionOutcome;
import com.parkthrive.crmops.config.AssignmentProperties;
import com.parkthrive.crmops.config.RetryProperties;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.crm.SearchResult;
import com.parkthrive.crmops.http.Sleeper;
import com.parkthrive.crmops.run.CampaignRunStats;
import com.parkthrive.crmops.run.Workflow;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Call volume, call time and won opportunities of every sales rep over the previous calendar month.
 */
@Slf4j
@Component
public class ActivityReportWorkflow implements Workflow {

    public static final String NAME = "activity-report";

    static final String CALL_COUNT = "calls.all.all.count";
    static final String CALL_DURATION = "calls.all.all.sum_duration";
    static final String WON_COUNT = "opportunities.won.all.count";

    private static final DateTimeFormatter RANGE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    private final AssignmentProperties assignmentProperties;
    private final RetryProperties retryProperties;
    private final SalesRepsFileParser repsParser;
    private final QueryFiles queryFiles;
    private final CrmClient client;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private final Clock clock;

    public ActivityReportWorkflow(AssignmentProperties assignmentProperties,
                                  RetryProperties retryProperties,
                                  SalesRepsFileParser repsParser,
                                  QueryFiles queryFiles,
                                  @Qualifier("primaryCrmClient") CrmClient client,
                                  ObjectMapper objectMapper,
                                  Sleeper sleeper,
                                  Clock clock) {
        this.assignmentProperties = assignmentProperties;
        this.retryProperties = retryProperties;
        this.repsParser = repsParser;
        this.queryFiles = queryFiles;
        this.client = client;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> checkConfiguration() {
        return queryFiles.check("crm.assignment.sales-reps-file", assignmentProperties.getSalesRepsFile());
    }

    @Override
    public CampaignRunStats run() {
        List<SalesRep> reps = repsParser.load(Path.of(assignmentProperties.getSalesRepsFile()));

        LocalDate end = LocalDate.now(clock).withDayOfMonth(1);
        LocalDate start = end.minusMonths(1);
        log.info("Analyzing activity from {} to {}", start, end.minusDays(1));

        CampaignRunStats stats = new CampaignRunStats(NAME);
        List<RepActivity> activity = new ArrayList<>();

        for (int i = 0; i < reps.size(); i++) {
            if (i > 0) {
                sleeper.pause(retryProperties.repDelay());
            }
            SalesRep rep = reps.get(i);
            log.info("Processing data for {}...", rep.getName());

            Optional<RepActivity> row = fetch(rep, start, end);
            if (row.isPresent()) {
                activity.add(row.get());
                stats.record(TransitionOutcome.succeeded(rep.getUserId(), null));
            } else {
                activity.add(new RepActivity(rep.getName(), 0, 0, 0));
                stats.record(TransitionOutcome.failed(rep.getUserId(), null, "Activity report failed"));
            }
        }

        logReport(activity);
        return stats;
    }

    Optional<RepActivity> fetch(SalesRep rep, LocalDate start, LocalDate end) {
        SearchResult report = client.activityReport(reportQuery(rep.getUserId(), start, end));
        if (!report.isOk()) {
            log.error("Activity report for {} failed: HTTP {}", rep.getName(), report.getHttpStatus());
            return Optional.empty();
        }

        JsonNode row = report.getItems().stream()
                .map(CrmRecord::getSource)
                .filter(source -> source != null && rep.getUserId().equals(source.path("user_id").asText()))
                .findFirst()
                .orElse(null);
        if (row == null) {
            return Optional.of(new RepActivity(rep.getName(), 0, 0, 0));
        }
        return Optional.of(new RepActivity(rep.getName(),
                row.path(CALL_COUNT).asLong(0),
                row.path(CALL_DURATION).asLong(0),
                row.path(WON_COUNT).asLong(0)));
    }

    ObjectNode reportQuery(String userId, LocalDate start, LocalDate end) {
        ObjectNode query = objectMapper.createObjectNode();
        query.putObject("datetime_range")
                .put("start", start.atStartOfDay().atOffset(ZoneOffset.UTC).format(RANGE_FORMAT))
                .put("end", end.atStartOfDay().atOffset(ZoneOffset.UTC).format(RANGE_FORMAT));
        query.putArray("users").add(userId);
        query.put("type", "comparison");
        query.putArray("metrics").add(CALL_COUNT).add(CALL_DURATION).add(WON_COUNT);
        return query;
    }

    private void logReport(List<RepActivity> activity) {
        log.info("==================== SALES REP PERFORMANCE ====================");
        log.info(String.format("%-25s %12s %16s %18s", "Name", "Total Calls", "Total Call Time", "Won Opportunities"));
        activity.stream()
                .sorted(Comparator.comparingLong(RepActivity::getCallSeconds).reversed())
                .forEach(row -> log.info(String.format("%-25s %12d %16s %18d",
                        row.getName(), row.getCalls(), formatDuration(row.getCallSeconds()), row.getWon())));
    }

    /** {@code Hh Mm Ss} */
    static String formatDuration(long seconds) {
        return String.format("%dh %dm %ds", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }

    @Value
    static class RepActivity {
        String name;
        long calls;
        long callSeconds;
        long won;
    }
}
