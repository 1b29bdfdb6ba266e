package com.parkthrive.crmops.campaign;

import com.parkthrive.crmops.config.CampaignProperties;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.WriteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Moves a lead to the terminal error stage and records why in a note on the lead.
 */
@Slf4j
public class ErrorStageRouter {

    private final CrmClient client;
    private final StageCatalog stages;
    private final CampaignProperties properties;
    private final Clock clock;

    public ErrorStageRouter(CrmClient client, StageCatalog stages, CampaignProperties properties, Clock clock) {
        this.client = client;
        this.stages = stages;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return true when both the status change and the note were written
     */
    public boolean route(String leadId, String message) {
        String errorStageId = stages.get(StageKey.LEAD_ERROR).getId();
        WriteResult status = client.updateLead(leadId, Map.of("status_id", errorStageId));
        if (!status.isOk()) {
            log.error("Could not move lead {} to the error stage: HTTP {}", leadId, status.getHttpStatus());
        }

        WriteResult note = client.createNote(leadId, noteHtml(message));
        if (!note.isOk()) {
            log.error("Could not add error note to lead {}: HTTP {}", leadId, note.getHttpStatus());
        }

        return status.isOk() && note.isOk();
    }

    String noteHtml(String message) {
        String today = LocalDate.now(clock).format(DateTimeFormatter.ofPattern(properties.getDateFormat()));
        return "<body><p><strong>" + HtmlUtils.htmlEscape(properties.getErrorNoteTitle())
                + " (" + today + "):</strong> " + HtmlUtils.htmlEscape(message) + "</p></body>";
    }
}
