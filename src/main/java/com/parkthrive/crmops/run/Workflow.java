package com.parkthrive.crmops.run;

import com.parkthrive.crmops.crm.CampaignField;

import java.util.List;

/**
 * A job selectable by name from the command line.
 */
public interface Workflow {

    String name();

    /**
     * Configuration problems that prevent the workflow from starting. Empty means ready.
     */
    List<String> checkConfiguration();

    /**
     * Custom fields the workflow reads or writes; their ids are checked before the run.
     */
    default List<CampaignField> fields() {
        return List.of();
    }

    CampaignRunStats run();
}
