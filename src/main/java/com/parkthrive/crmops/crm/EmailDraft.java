package com.parkthrive.crmops.crm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Body of {@code POST /activity/email/}. Status {@code outbox} sends immediately.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EmailDraft {

    @JsonProperty("lead_id")
    String leadId;

    @JsonProperty("contact_id")
    String contactId;

    @JsonProperty("email_account_id")
    String emailAccountId;

    @Builder.Default
    String direction = "outbound";

    @Builder.Default
    String status = "outbox";

    String subject;

    @JsonProperty("created_by_name")
    String createdByName;

    String sender;

    @Singular("to")
    List<String> to;

    @JsonProperty("body_text")
    String bodyText;

    @Singular
    List<Attachment> attachments;

    @Value
    @Builder
    public static class Attachment {
        String url;
        String filename;

        @JsonProperty("content_type")
        String contentType;

        long size;
    }
}
