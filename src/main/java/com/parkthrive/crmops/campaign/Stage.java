package com.parkthrive.crmops.campaign;

import com.parkthrive.crmops.crm.CrmRecord;
import lombok.Value;

/**
 * A configured status of the campaign. Records are matched by status id when both sides
 * carry one, otherwise by label ignoring case.
 */
@Value
public class Stage {

    StageKey key;
    String id;
    String label;

    public boolean matches(CrmRecord record) {
        if (id != null && record.getStatusId() != null) {
            return id.equals(record.getStatusId());
        }
        return label != null && label.equalsIgnoreCase(record.getStatusLabel());
    }

    @Override
    public String toString() {
        return label != null ? label : key.name();
    }
}
