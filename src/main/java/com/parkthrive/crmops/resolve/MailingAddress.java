package com.parkthrive.crmops.resolve;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MailingAddress {

    @Builder.Default
    String addressLine1 = "";

    @Builder.Default
    String addressLine2 = "";

    @Builder.Default
    String city = "";

    @Builder.Default
    String state = "";

    @Builder.Default
    String postalCode = "";

    String countryCode;

    public boolean isEmpty() {
        return addressLine1.isEmpty();
    }
}
