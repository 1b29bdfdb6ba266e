package com.parkthrive.crmops.run;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.campaign.CampaignDefinitions;
import com.parkthrive.crmops.campaign.ErrorStageRouter;
import com.parkthrive.crmops.campaign.ReconciliationHook;
import com.parkthrive.crmops.campaign.StageCatalog;
import com.parkthrive.crmops.campaign.StageTransitionEngine;
import com.parkthrive.crmops.campaign.TransitionOutcome;
import com.parkthrive.crmops.config.CampaignProperties;
import com.parkthrive.crmops.config.RetryProperties;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.crm.FieldRegistry;
import com.parkthrive.crmops.crm.SearchResult;
import com.parkthrive.crmops.crm.WriteResult;
import com.parkthrive.crmops.paging.CursorPaginator;
import com.parkthrive.crmops.resolve.RecordResolver;
import com.parkthrive.crmops.resolve.ResolvePolicy;
import com.parkthrive.crmops.support.CampaignFixtures;
import com.parkthrive.crmops.support.RecordingSleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static com.parkthrive.crmops.support.CampaignFixtures.lead;
import static com.parkthrive.crmops.support.CampaignFixtures.opportunity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunOrchestratorTest {

    @Mock
    private CrmClient client;

    @Mock
    private ErrorStageRouter errorRouter;

    @Mock
    private ReconciliationHook reconciliationHook;

    private RecordingSleeper sleeper;
    private RetryProperties retryProperties;
    private RunOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        retryProperties = new RetryProperties();
        orchestrator = new RunOrchestrator(errorRouter, retryProperties, sleeper);
    }

    @Test
    void testRun_RoundOneOverThreePages() {
        // Given: 250 leads over pages of 100/100/50, every 6th or so has an unpaid opportunity
        Deque<SearchResult> pages = new ArrayDeque<>();
        pages.add(page(0, 100, "c1"));
        pages.add(page(100, 100, "c2"));
        pages.add(page(200, 50, null));

        RunMetrics metrics = new RunMetrics(new SimpleMeterRegistry());
        CampaignProperties properties = CampaignFixtures.campaignProperties();
        FieldRegistry fields = new FieldRegistry(properties);
        StageCatalog stages = new StageCatalog(properties);
        CampaignDefinitions definitions = new CampaignDefinitions(stages, fields);
        StageTransitionEngine engine = new StageTransitionEngine(client, fields, stages, errorRouter,
                reconciliationHook, metrics, properties, Clock.systemUTC());
        RecordResolver resolver = new RecordResolver(client);
        CursorPaginator paginator = new CursorPaginator(retryProperties, sleeper, metrics);

        when(client.updateOpportunity(anyString(), anyMap())).thenReturn(WriteResult.ok(200, null));
        when(client.updateLead(anyString(), anyMap())).thenReturn(WriteResult.ok(200, null));

        // When
        List<CrmRecord> leads = paginator.fetchAll(query -> pages.poll(), new ObjectMapper().createObjectNode());
        CampaignRunStats stats = orchestrator.run(CampaignDefinitions.ROUND_1, leads,
                ref -> engine.advance(resolver.resolve(ref, ResolvePolicy.referenceOnly()), definitions.round1()),
                false);

        // Then
        assertEquals(250, stats.getAttempted());
        assertEquals(40, stats.getSucceeded());
        assertEquals(0, stats.getFailed());
        assertEquals(210, stats.getIneligible());
        verify(client, times(40)).updateOpportunity(anyString(), anyMap());
        verify(client, times(40)).updateLead(anyString(), anyMap());

        long recordPauses = sleeper.getWaits().stream().filter(d -> d.equals(retryProperties.recordDelay())).count();
        assertEquals(249, recordPauses);
    }

    @Test
    void testRun_ExceptionDoesNotStopRun() {
        List<CrmRecord> leads = List.of(lead("lead_1"), lead("lead_2"), lead("lead_3"));

        CampaignRunStats stats = orchestrator.run("test", leads, record -> {
            if (record.getId().equals("lead_2")) {
                throw new IllegalStateException("boom");
            }
            return TransitionOutcome.succeeded(record.getId(), null);
        }, false);

        assertEquals(3, stats.getAttempted());
        assertEquals(2, stats.getSucceeded());
        assertEquals(1, stats.getFailed());
        assertThat(stats.getFailedIds()).containsExactly("lead_2");
        verify(errorRouter, never()).route(anyString(), anyString());
    }

    @Test
    void testRun_ExceptionRoutedToErrorStage() {
        when(errorRouter.route("lead_1", "boom")).thenReturn(true);

        CampaignRunStats stats = orchestrator.run("test", List.of(lead("lead_1")), record -> {
            throw new IllegalStateException("boom");
        }, true);

        assertEquals(1, stats.getFailed());
        verify(errorRouter).route("lead_1", "boom");
    }

    @Test
    void testRun_RoutingFailureStillCountsRecord() {
        when(errorRouter.route(anyString(), anyString())).thenThrow(new IllegalStateException("down"));

        CampaignRunStats stats = orchestrator.run("test", List.of(lead("lead_1"), lead("lead_2")),
                record -> {
                    throw new IllegalStateException("boom");
                }, true);

        assertEquals(2, stats.getAttempted());
        assertEquals(2, stats.getFailed());
    }

    @Test
    void testRun_PausesOnlyBetweenRecords() {
        orchestrator.run("test", List.of(lead("lead_1"), lead("lead_2")),
                record -> TransitionOutcome.ineligible(record.getId(), "none"), false);

        assertThat(sleeper.getWaits()).containsExactly(Duration.ofMillis(1000));
    }

    @Test
    void testRun_EmptyInput() {
        CampaignRunStats stats = orchestrator.run("test", List.of(), record -> {
            throw new AssertionError("not called");
        }, false);

        assertEquals(0, stats.getAttempted());
        assertThat(sleeper.getWaits()).isEmpty();
    }

    private static SearchResult page(int start, int size, String cursor) {
        SearchResult.SearchResultBuilder builder = SearchResult.builder()
                .status(SearchResult.Status.OK)
                .httpStatus(200)
                .cursor(cursor);
        for (int i = start; i < start + size; i++) {
            String id = "lead_" + i;
            if (i % 6 == 0 && i < 240) {
                builder.item(lead(id, opportunity("opp_" + i, CampaignFixtures.UNPAID)));
            } else {
                builder.item(lead(id));
            }
        }
        return builder.build();
    }
}
