package com.parkthrive.crmops.crm;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of a lead's {@code addresses} list.
 */
@Value
@Builder
public class CrmAddress {

    String label;
    String address1;
    String address2;
    String city;
    String state;
    String zipcode;
    String country;

    public boolean isBusiness() {
        return "business".equalsIgnoreCase(label);
    }

    /**
     * {@code address_1 address_2 city, state, zip}, skipping blank parts.
     * City, state and zip are only included when the city is present.
     */
    public String toSingleLine() {
        List<String> parts = new ArrayList<>();
        if (hasText(address1)) parts.add(address1);
        if (hasText(address2)) parts.add(address2);

        if (hasText(city)) {
            List<String> cityStateZip = new ArrayList<>();
            cityStateZip.add(city);
            if (hasText(state)) cityStateZip.add(state);
            if (hasText(zipcode)) cityStateZip.add(zipcode);
            parts.add(String.join(", ", cityStateZip));
        }
        return String.join(" ", parts);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
