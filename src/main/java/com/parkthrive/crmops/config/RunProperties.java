package com.parkthrive.crmops.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "crm.run")
public class RunProperties {

    /**
     * Workflow to run when none is given as the first program argument
     * Example: round-1, round-2-3, holds, mailers, missing-lot, assign, find-owner, activity-report
     */
    private String workflow;
}
