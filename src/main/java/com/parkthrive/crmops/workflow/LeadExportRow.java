package com.parkthrive.crmops.workflow;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LeadExportRow {

    String id;

    @Builder.Default String address = "";
    @Builder.Default String city = "";
    @Builder.Default String state = "";
    @Builder.Default String zipcode = "";

    String[] toArray() {
        return new String[]{id, address, city, state, zipcode};
    }
}
