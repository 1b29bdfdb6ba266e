package com.parkthrive.crmops.mail;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LetterResult {

    boolean success;
    String letterId;
    int statusCode;
    String error;

    public static LetterResult sent(int statusCode, String letterId) {
        return new LetterResult(true, letterId, statusCode, null);
    }

    public static LetterResult rejected(int statusCode, String error) {
        return new LetterResult(false, null, statusCode, error);
    }

    /** Transport failure before any status was received */
    public static LetterResult unreachable(String error) {
        return new LetterResult(false, null, 0, error);
    }

    /**
     * {@code Error <status> - <message>}, the text recorded on the lead when sending fails.
     */
    public String errorDisplay() {
        String status = statusCode > 0 ? String.valueOf(statusCode) : "Unknown";
        return "Error " + status + " - " + (error != null ? error : "Unknown error");
    }
}
