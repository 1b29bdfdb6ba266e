package com.parkthrive.crmops.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "crm.assignment")
public class AssignmentProperties {

    /**
     * Leads every rep should hold after assignment
     */
    private int targetLeadsPerRep = 400;

    /**
     * File listing reps as "Name", "user_id" pairs
     */
    private String salesRepsFile = "./sales_reps.txt";

    /**
     * Query counting the leads a rep currently owns (rep id injected per rep)
     */
    private String countingQuery = "./queries/la_mpo.json";

    /**
     * Query listing unassigned leads
     */
    private String reservoirQuery = "./queries/mpo_reservoir.json";
}
