package com.parkthrive.crmops.campaign;

import com.parkthrive.crmops.config.CampaignProperties;
import com.parkthrive.crmops.crm.CampaignField;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.crm.FieldRegistry;
import com.parkthrive.crmops.crm.WriteResult;
import com.parkthrive.crmops.resolve.ResolvedLead;
import com.parkthrive.crmops.run.RunMetrics;
import com.parkthrive.crmops.support.CampaignFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.parkthrive.crmops.support.CampaignFixtures.opportunity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StageTransitionEngineTest {

    private static final String TODAY = "03/15/2024";

    @Mock
    private CrmClient client;

    @Mock
    private ErrorStageRouter errorRouter;

    @Mock
    private ReconciliationHook reconciliationHook;

    private StageCatalog stages;
    private CampaignDefinitions definitions;
    private RunMetrics metrics;
    private StageTransitionEngine engine;

    @BeforeEach
    void setUp() {
        CampaignProperties properties = CampaignFixtures.campaignProperties();
        FieldRegistry fields = new FieldRegistry(properties);
        stages = new StageCatalog(properties);
        definitions = new CampaignDefinitions(stages, fields);
        metrics = new RunMetrics(new SimpleMeterRegistry());
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC);
        engine = new StageTransitionEngine(client, fields, stages, errorRouter, reconciliationHook,
                metrics, properties, clock);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testAdvance_RoundOneMovesFirstUnpaidOpportunity() {
        // Given
        ResolvedLead lead = resolved("lead_1",
                opportunity("opp_1", CampaignFixtures.HOLD),
                opportunity("opp_2", CampaignFixtures.UNPAID),
                opportunity("opp_3", CampaignFixtures.UNPAID));
        when(client.updateOpportunity(eq("opp_2"), anyMap())).thenReturn(WriteResult.ok(200, null));
        when(client.updateLead(eq("lead_1"), anyMap())).thenReturn(WriteResult.ok(200, null));

        // When
        TransitionOutcome outcome = engine.advance(lead, definitions.round1());

        // Then
        assertEquals(TransitionOutcome.Kind.SUCCEEDED, outcome.getKind());
        assertEquals("opp_2", outcome.getChildId());

        ArgumentCaptor<Map<String, Object>> childChanges = ArgumentCaptor.forClass(Map.class);
        verify(client).updateOpportunity(eq("opp_2"), childChanges.capture());
        assertThat(childChanges.getValue()).containsExactly(
                Map.entry("status_id", CampaignFixtures.ROUND_1),
                Map.entry("custom." + CampaignFixtures.MAILER_DATES, TODAY),
                Map.entry("custom." + CampaignFixtures.TEMPLATE, "template_r1"));

        ArgumentCaptor<Map<String, Object>> parentChanges = ArgumentCaptor.forClass(Map.class);
        verify(client).updateLead(eq("lead_1"), parentChanges.capture());
        assertThat(parentChanges.getValue()).containsExactly(
                Map.entry("custom." + CampaignFixtures.LAST_MAIL_DATE, TODAY));

        verify(client, never()).updateOpportunity(eq("opp_3"), anyMap());
        assertEquals(1.0, metrics.getTransitionSucceeded().count());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testAdvance_RoundsTwoAndThreeAppendMailerDates() {
        CrmRecord round1 = CrmRecord.builder().id("opp_1").statusId(CampaignFixtures.ROUND_1)
                .customField(CampaignFixtures.MAILER_DATES, "02/01/2024").build();
        CrmRecord round2 = CrmRecord.builder().id("opp_2").statusId(CampaignFixtures.ROUND_2)
                .customField(CampaignFixtures.MAILER_DATES, "01/01/2024,02/01/2024").build();
        when(client.updateOpportunity(anyString(), anyMap())).thenReturn(WriteResult.ok(200, null));
        when(client.updateLead(eq("lead_1"), anyMap())).thenReturn(WriteResult.ok(200, null));

        TransitionOutcome outcome = engine.advance(resolved("lead_1", round1, round2), definitions.rounds2And3());

        assertEquals(TransitionOutcome.Kind.SUCCEEDED, outcome.getKind());

        ArgumentCaptor<Map<String, Object>> first = ArgumentCaptor.forClass(Map.class);
        verify(client).updateOpportunity(eq("opp_1"), first.capture());
        assertThat(first.getValue())
                .containsEntry("status_id", CampaignFixtures.ROUND_2)
                .containsEntry("custom." + CampaignFixtures.MAILER_DATES, "02/01/2024," + TODAY)
                .containsEntry("custom." + CampaignFixtures.TEMPLATE, "template_r2");

        ArgumentCaptor<Map<String, Object>> second = ArgumentCaptor.forClass(Map.class);
        verify(client).updateOpportunity(eq("opp_2"), second.capture());
        assertThat(second.getValue())
                .containsEntry("status_id", CampaignFixtures.ROUND_3)
                .containsEntry("custom." + CampaignFixtures.MAILER_DATES, "01/01/2024,02/01/2024," + TODAY);

        verify(client, times(2)).updateLead(eq("lead_1"), anyMap());
    }

    @Test
    void testAdvance_StopsAtFirstChildThatFails() {
        when(client.updateOpportunity(eq("opp_1"), anyMap())).thenReturn(WriteResult.failed(500, "boom"));

        TransitionOutcome outcome = engine.advance(resolved("lead_1",
                opportunity("opp_1", CampaignFixtures.ROUND_1),
                opportunity("opp_2", CampaignFixtures.ROUND_2)), definitions.rounds2And3());

        assertEquals(TransitionOutcome.Kind.FAILED, outcome.getKind());
        assertEquals("opp_1", outcome.getChildId());
        assertThat(outcome.getMessage()).contains("HTTP 500");
        verify(client, never()).updateOpportunity(eq("opp_2"), anyMap());
        verify(client, never()).updateLead(anyString(), anyMap());
    }

    @Test
    void testAdvance_ParentWriteFailureIsPartial() {
        // Given
        when(client.updateOpportunity(eq("opp_1"), anyMap())).thenReturn(WriteResult.ok(200, null));
        when(client.updateLead(eq("lead_1"), anyMap())).thenReturn(WriteResult.failed(503, "unavailable"));

        // When
        TransitionOutcome outcome = engine.advance(resolved("lead_1",
                opportunity("opp_1", CampaignFixtures.UNPAID)), definitions.round1());

        // Then
        assertEquals(TransitionOutcome.Kind.PARTIAL_FAILURE, outcome.getKind());
        assertThat(outcome.isChildOk()).isTrue();
        assertThat(outcome.isParentOk()).isFalse();
        assertThat(outcome.isFailure()).isTrue();
        verify(reconciliationHook).onPartialFailure(eq(outcome), startsWith("lead [custom." + CampaignFixtures.LAST_MAIL_DATE + "]"));
        assertEquals(1.0, metrics.getTransitionPartial().count());
    }

    @Test
    void testAdvance_NoChildrenIsIneligible() {
        TransitionOutcome outcome = engine.advance(resolved("lead_1"), definitions.round1());

        assertEquals(TransitionOutcome.Kind.INELIGIBLE, outcome.getKind());
        assertEquals("No opportunities found", outcome.getMessage());
        assertThat(outcome.isFailure()).isFalse();
        verifyNoInteractions(client);
    }

    @Test
    void testAdvance_UnfetchedOnlyCandidateIsFailure() {
        // Given: the only Stage 1 opportunity could not be fetched
        ResolvedLead lead = ResolvedLead.builder()
                .lead(CrmRecord.builder().id("lead_1").build())
                .unresolvedChildren(1)
                .build();

        // When
        TransitionOutcome outcome = engine.advance(lead, definitions.rounds2And3());

        // Then
        assertEquals(TransitionOutcome.Kind.FAILED, outcome.getKind());
        assertEquals("1 opportunities could not be fetched", outcome.getMessage());
        assertEquals(1.0, metrics.getTransitionFailed().count());
        verifyNoInteractions(client);
    }

    @Test
    void testAdvance_UnfetchedChildrenWithNoOtherCandidateIsFailure() {
        ResolvedLead lead = ResolvedLead.builder()
                .lead(CrmRecord.builder().id("lead_1").build())
                .child(opportunity("opp_1", CampaignFixtures.UNPAID))
                .unresolvedChildren(2)
                .build();

        TransitionOutcome outcome = engine.advance(lead, definitions.rounds2And3());

        assertEquals(TransitionOutcome.Kind.FAILED, outcome.getKind());
        assertEquals("2 opportunities could not be fetched", outcome.getMessage());
        assertThat(outcome.isFailure()).isTrue();
    }

    @Test
    void testAdvance_NoMatchingStageIsIneligible() {
        TransitionOutcome outcome = engine.advance(resolved("lead_1",
                opportunity("opp_1", CampaignFixtures.ROUND_3),
                opportunity("opp_2", "stat_unknown")), definitions.round1());

        assertEquals(TransitionOutcome.Kind.INELIGIBLE, outcome.getKind());
        assertEquals("No eligible opportunities for update", outcome.getMessage());
        verifyNoInteractions(client);
        assertEquals(1.0, metrics.getTransitionIneligible().count());
    }

    @Test
    void testAdvance_HoldsReleaseOldestCitation() {
        CrmRecord newer = CrmRecord.builder().id("opp_1").statusId(CampaignFixtures.HOLD)
                .customField(CampaignFixtures.CITATION_DATE, "2024-02-10").build();
        CrmRecord older = CrmRecord.builder().id("opp_2").statusId(CampaignFixtures.HOLD)
                .customField(CampaignFixtures.CITATION_DATE, "1/5/2024").build();
        when(client.updateOpportunity(eq("opp_2"), anyMap())).thenReturn(WriteResult.ok(200, null));

        TransitionOutcome outcome = engine.advance(resolved("lead_1", newer, older), definitions.holds());

        assertEquals(TransitionOutcome.Kind.SUCCEEDED, outcome.getKind());
        assertEquals("opp_2", outcome.getChildId());
        verify(client).updateOpportunity("opp_2", Map.of("status_id", CampaignFixtures.UNPAID));
        verify(client, never()).updateLead(anyString(), anyMap());
    }

    @Test
    void testAdvance_MissingFieldRoutedToErrorStage() {
        when(errorRouter.route("lead_1", "Missing required field(s): citation date")).thenReturn(true);

        TransitionOutcome outcome = engine.advance(resolved("lead_1",
                opportunity("opp_1", CampaignFixtures.HOLD)), requiringCitationDate(true));

        assertEquals(TransitionOutcome.Kind.ROUTED_TO_ERROR, outcome.getKind());
        verify(client, never()).updateOpportunity(anyString(), anyMap());
        assertEquals(1.0, metrics.getTransitionRoutedToError().count());
    }

    @Test
    void testAdvance_MissingFieldRoutingFailedIsFailure() {
        when(errorRouter.route(eq("lead_1"), anyString())).thenReturn(false);

        TransitionOutcome outcome = engine.advance(resolved("lead_1",
                opportunity("opp_1", CampaignFixtures.HOLD)), requiringCitationDate(true));

        assertEquals(TransitionOutcome.Kind.FAILED, outcome.getKind());
        assertThat(outcome.getMessage()).endsWith("(error stage not updated)");
    }

    @Test
    void testAdvance_MissingFieldWithoutRoutingIsFailure() {
        TransitionOutcome outcome = engine.advance(resolved("lead_1",
                opportunity("opp_1", CampaignFixtures.HOLD)), requiringCitationDate(false));

        assertEquals(TransitionOutcome.Kind.FAILED, outcome.getKind());
        assertEquals("Missing required field(s): citation date", outcome.getMessage());
        verifyNoInteractions(errorRouter);
    }

    private CampaignDefinition requiringCitationDate(boolean route) {
        TransitionTable table = new TransitionTable(stages, List.of(Transition.builder()
                .from(StageKey.HOLD)
                .to(StageKey.UNPAID)
                .requiredField(CampaignField.CITATION_DATE)
                .build()));
        return CampaignDefinition.builder()
                .name("test")
                .table(table)
                .routeErrorsToStage(route)
                .build();
    }

    private static ResolvedLead resolved(String id, CrmRecord... children) {
        return ResolvedLead.builder()
                .lead(CrmRecord.builder().id(id).build())
                .children(List.of(children))
                .build();
    }
}
