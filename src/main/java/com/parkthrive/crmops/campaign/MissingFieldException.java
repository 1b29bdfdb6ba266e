package com.parkthrive.crmops.campaign;

import com.parkthrive.crmops.crm.CampaignField;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A record lacks a value the transition requires.
 */
@Getter
public class MissingFieldException extends RuntimeException {

    private final String recordId;
    private final List<CampaignField> fields;

    public MissingFieldException(String recordId, List<CampaignField> fields) {
        super("Missing required field(s): " + fields.stream()
                .map(f -> f.name().toLowerCase().replace('_', ' '))
                .collect(Collectors.joining(", ")));
        this.recordId = recordId;
        this.fields = List.copyOf(fields);
    }
}
