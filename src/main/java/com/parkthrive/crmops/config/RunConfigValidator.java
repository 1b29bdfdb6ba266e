package com.parkthrive.crmops.config;

import com.parkthrive.crmops.crm.CampaignField;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.FieldRegistry;
import com.parkthrive.crmops.run.Workflow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks everything a workflow needs before the first record is read.
 */
@Slf4j
@Component
public class RunConfigValidator {

    private final CrmApiProperties apiProperties;
    private final CampaignProperties campaignProperties;
    private final FieldRegistry fieldRegistry;
    private final CrmClient primaryClient;
    private final CrmClient secondaryClient;

    public RunConfigValidator(CrmApiProperties apiProperties,
                              CampaignProperties campaignProperties,
                              FieldRegistry fieldRegistry,
                              @Qualifier("primaryCrmClient") CrmClient primaryClient,
                              @Qualifier("secondaryCrmClient") CrmClient secondaryClient) {
        this.apiProperties = apiProperties;
        this.campaignProperties = campaignProperties;
        this.fieldRegistry = fieldRegistry;
        this.primaryClient = primaryClient;
        this.secondaryClient = secondaryClient;
    }

    /**
     * Returns list of problems. Empty list means the workflow may start.
     */
    public List<String> validate(Workflow workflow) {
        List<String> errors = new ArrayList<>();

        if (isBlank(apiProperties.getPrimaryApiKey())) {
            errors.add("crm.api.primary-api-key is not set");
        }
        if (isBlank(apiProperties.getBaseUrl())) {
            errors.add("crm.api.base-url is not set");
        }

        boolean needsSecondary = workflow.fields().stream().anyMatch(CampaignField::isSecondaryAccount);
        if (needsSecondary && isBlank(apiProperties.getSecondaryApiKey())) {
            errors.add("crm.api.secondary-api-key is not set");
        }

        errors.addAll(fieldRegistry.missing(workflow.fields()));
        errors.addAll(workflow.checkConfiguration());

        if (errors.isEmpty() && campaignProperties.isValidateFields() && !workflow.fields().isEmpty()) {
            errors.addAll(fieldRegistry.validateAgainstSchema(workflow.fields(), primaryClient,
                    needsSecondary ? secondaryClient : null));
        }

        return errors;
    }

    /**
     * @throws FatalConfigException when {@link #validate} reports any problem
     */
    public void requireValid(Workflow workflow) {
        List<String> errors = validate(workflow);
        if (!errors.isEmpty()) {
            errors.forEach(e -> log.error("Configuration error ({}): {}", workflow.name(), e));
            throw new FatalConfigException(workflow.name(), errors);
        }
        log.info("Configuration of workflow '{}' is valid", workflow.name());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
