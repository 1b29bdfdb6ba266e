package com.parkthrive.crmops.resolve;

/**
 * Parses the free text mailing address kept on leads: {@code street, city, STATE ZIP}.
 * Two components are read as street and city; one as the street only.
 */
public class MailingAddressParser {

    private final String defaultCountryCode;

    public MailingAddressParser(String defaultCountryCode) {
        this.defaultCountryCode = defaultCountryCode;
    }

    public MailingAddress parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return MailingAddress.builder().build();
        }

        String[] parts = raw.split(",");
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
        }

        MailingAddress.MailingAddressBuilder address = MailingAddress.builder()
                .countryCode(defaultCountryCode);

        if (parts.length >= 3) {
            String[] stateZip = parts[2].split(" ", 2);
            return address
                    .addressLine1(parts[0])
                    .city(parts[1])
                    .state(stateZip[0])
                    .postalCode(stateZip.length > 1 ? stateZip[1].trim() : "")
                    .build();
        }
        if (parts.length == 2) {
            return address.addressLine1(parts[0]).city(parts[1]).build();
        }
        return address.addressLine1(raw).build();
    }
}
