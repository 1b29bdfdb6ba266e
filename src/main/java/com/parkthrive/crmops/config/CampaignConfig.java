package com.parkthrive.crmops.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parkthrive.crmops.campaign.ErrorStageRouter;
import com.parkthrive.crmops.campaign.ReconciliationHook;
import com.parkthrive.crmops.campaign.StageCatalog;
import com.parkthrive.crmops.campaign.StageTransitionEngine;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.FieldRegistry;
import com.parkthrive.crmops.http.Sleeper;
import com.parkthrive.crmops.resolve.CrossAccountLookup;
import com.parkthrive.crmops.resolve.LetterDataResolver;
import com.parkthrive.crmops.resolve.MailingAddressParser;
import com.parkthrive.crmops.resolve.RecordResolver;
import com.parkthrive.crmops.run.RunMetrics;
import com.parkthrive.crmops.run.RunOrchestrator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the resolver, engine and orchestrator to the primary CRM account.
 */
@Configuration
public class CampaignConfig {

    @Bean
    public RecordResolver recordResolver(@Qualifier("primaryCrmClient") CrmClient client) {
        return new RecordResolver(client);
    }

    @Bean
    public CrossAccountLookup crossAccountLookup(@Qualifier("secondaryCrmClient") CrmClient client,
                                                 ObjectMapper objectMapper) {
        return new CrossAccountLookup(client, objectMapper);
    }

    @Bean
    public MailingAddressParser mailingAddressParser(PostGridProperties postGridProperties) {
        return new MailingAddressParser(postGridProperties.getDefaultCountryCode());
    }

    @Bean
    public LetterDataResolver letterDataResolver(RecordResolver resolver, FieldRegistry fields, StageCatalog stages,
                                                 MailingAddressParser addressParser) {
        return new LetterDataResolver(resolver, fields, stages, addressParser);
    }

    @Bean
    public ErrorStageRouter errorStageRouter(@Qualifier("primaryCrmClient") CrmClient client, StageCatalog stages,
                                             CampaignProperties properties, Clock clock) {
        return new ErrorStageRouter(client, stages, properties, clock);
    }

    @Bean
    public StageTransitionEngine stageTransitionEngine(@Qualifier("primaryCrmClient") CrmClient client,
                                                       FieldRegistry fields,
                                                       StageCatalog stages,
                                                       ErrorStageRouter errorRouter,
                                                       ReconciliationHook reconciliationHook,
                                                       RunMetrics metrics,
                                                       CampaignProperties properties,
                                                       Clock clock) {
        return new StageTransitionEngine(client, fields, stages, errorRouter, reconciliationHook, metrics,
                properties, clock);
    }

    @Bean
    public RunOrchestrator runOrchestrator(ErrorStageRouter errorRouter, RetryProperties retryProperties, Sleeper sleeper) {
        return new RunOrchestrator(errorRouter, retryProperties, sleeper);
    }
}
