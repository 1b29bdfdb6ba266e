package com.parkthrive.crmops.resolve;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything a collection letter needs for one lead. Unknown values are empty strings.
 */
@Value
@Builder
public class LetterData {

    String leadId;

    @Builder.Default String firstName = "";
    @Builder.Default String lastName = "";
    MailingAddress address;

    @Builder.Default String plateNumber = "";
    @Builder.Default String plateLocation = "";
    @Builder.Default String make = "";
    @Builder.Default String model = "";
    @Builder.Default String lastMailDate = "";

    @Builder.Default String value = "";
    @Builder.Default String citationNumber = "";
    @Builder.Default String citationDate = "";
    @Builder.Default String citationTime = "";
    @Builder.Default String lotLocation = "";
    @Builder.Default String citationImageUrl = "";
    @Builder.Default String fineAmount = "";
    @Builder.Default String serviceFee = "";
    @Builder.Default String firstMailer = "";
    @Builder.Default String secondMailer = "";
    @Builder.Default String template = "";

    public boolean hasTemplate() {
        return !template.isEmpty();
    }

    public boolean hasRecipient() {
        return !firstName.isEmpty() && !lastName.isEmpty() && address != null && !address.isEmpty();
    }

    /**
     * Template merge variables, keyed by the names used in the letter templates.
     */
    public Map<String, String> mergeVariables() {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("citation number", citationNumber);
        vars.put("last mail date", lastMailDate);
        vars.put("value", value);
        vars.put("plate number", plateNumber);
        vars.put("plate location", plateLocation);
        vars.put("make", make);
        vars.put("model", model);
        vars.put("citation date", citationDate);
        vars.put("citation time", citationTime);
        vars.put("lot location", lotLocation);
        vars.put("first mailer", firstMailer);
        vars.put("second mailer", secondMailer);
        vars.put("fine amount", fineAmount);
        vars.put("service fee", serviceFee);
        vars.put("citation image url", citationImageUrl);
        return vars;
    }
}
