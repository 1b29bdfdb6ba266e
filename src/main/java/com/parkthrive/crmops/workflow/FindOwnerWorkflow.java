package com.parkthrive.crmops.workflow;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.campaign.TransitionOutcome;
import com.parkthrive.crmops.config.FindOwnerProperties;
import com.parkthrive.crmops.crm.CrmAddress;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.crm.EmailDraft;
import com.parkthrive.crmops.crm.FileUploader;
import com.parkthrive.crmops.crm.SearchResult;
import com.parkthrive.crmops.crm.UploadTarget;
import com.parkthrive.crmops.crm.WriteResult;
import com.parkthrive.crmops.notification.NotificationService;
import com.parkthrive.crmops.paging.CursorPaginator;
import com.parkthrive.crmops.paging.PagedResult;
import com.parkthrive.crmops.paging.QueryLoader;
import com.parkthrive.crmops.run.CampaignRunStats;
import com.parkthrive.crmops.run.Workflow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Watches the find-owner queue. Below target the team is told how many leads are missing;
 * at target the leads are exported to CSV and emailed to the find-owner vendor.
 */
@Slf4j
@Component
public class FindOwnerWorkflow implements Workflow {

    public static final String NAME = "find-owner";

    static final String CSV_CONTENT_TYPE = "text/csv";
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("MM_dd_yyyy");
    private static final DateTimeFormatter SUBJECT_DATE = DateTimeFormatter.ofPattern("MM/dd/yy");

    private final FindOwnerProperties properties;
    private final QueryFiles queryFiles;
    private final QueryLoader queryLoader;
    private final CursorPaginator paginator;
    private final CrmClient client;
    private final LeadExportWriter exportWriter;
    private final FileUploader fileUploader;
    private final NotificationService notificationService;
    private final Clock clock;

    public FindOwnerWorkflow(FindOwnerProperties properties,
                             QueryFiles queryFiles,
                             QueryLoader queryLoader,
                             CursorPaginator paginator,
                             @Qualifier("primaryCrmClient") CrmClient client,
                             LeadExportWriter exportWriter,
                             FileUploader fileUploader,
                             NotificationService notificationService,
                             Clock clock) {
        this.properties = properties;
        this.queryFiles = queryFiles;
        this.queryLoader = queryLoader;
        this.paginator = paginator;
        this.client = client;
        this.exportWriter = exportWriter;
        this.fileUploader = fileUploader;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> checkConfiguration() {
        List<String> problems = new ArrayList<>(queryFiles.check("crm.find-owner.query", properties.getQuery()));
        if (properties.getTargetLeads() <= 0) {
            problems.add("crm.find-owner.target-leads must be positive");
        }
        if (isBlank(properties.getRecipientLeadId())) {
            problems.add("crm.find-owner.recipient-lead-id is not set");
        }
        if (isBlank(properties.getRecipientContactId())) {
            problems.add("crm.find-owner.recipient-contact-id is not set");
        }
        if (isBlank(properties.getSenderEmail())) {
            problems.add("crm.find-owner.sender-email is not set");
        }
        return problems;
    }

    @Override
    public CampaignRunStats run() {
        int target = properties.getTargetLeads();
        ObjectNode query = queryLoader.load(Path.of(properties.getQuery()));

        log.info("Counting leads in the find-owner queue...");
        PagedResult queue = paginator.fetchPages(client::search, query, OptionalInt.of(target));
        List<CrmRecord> leads = queue.getItems();
        log.info("Found {} leads in the find-owner queue", leads.size());

        CampaignRunStats stats = new CampaignRunStats(NAME);
        if (!queue.isComplete()) {
            log.error("Find-owner queue could not be counted; nothing sent");
            stats.record(TransitionOutcome.failed(NAME, null, "Find-owner queue count incomplete"));
            return stats;
        }
        if (leads.size() < target) {
            int needed = target - leads.size();
            notificationService.sendTeamMessage(String.format(
                    "We currently have %d leads in the Find Owner queue. We need %d more to reach our goal of %d before sending them over.",
                    leads.size(), needed, target), true);
            return stats;
        }

        notificationService.sendTeamMessage(
                "We've reached our goal in the Find Owner queue and have sent all leads over.", true);

        List<LeadExportRow> rows = exportRows(leads, stats);
        Path file = Path.of(properties.getExportDirectory()).resolve(fileName());
        try {
            exportWriter.write(file, rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + file, e);
        }

        if (handOff(file)) {
            log.info("Find-owner hand-off of {} leads completed", rows.size());
        } else {
            log.error("Find-owner hand-off failed. Send {} to the vendor manually", file.toAbsolutePath());
        }
        return stats;
    }

    List<LeadExportRow> exportRows(List<CrmRecord> leads, CampaignRunStats stats) {
        List<LeadExportRow> rows = new ArrayList<>();
        for (CrmRecord reference : leads) {
            Optional<CrmRecord> lead = client.getLead(reference.getId()).record();
            if (lead.isEmpty()) {
                log.warn("Could not fetch lead {}, left out of the export", reference.getId());
                stats.record(TransitionOutcome.failed(reference.getId(), null, "Failed to fetch lead data"));
                continue;
            }
            rows.add(toRow(lead.get()));
            stats.record(TransitionOutcome.succeeded(reference.getId(), null));
        }
        return rows;
    }

    static LeadExportRow toRow(CrmRecord lead) {
        LeadExportRow.LeadExportRowBuilder row = LeadExportRow.builder().id(lead.getId());
        if (!lead.getAddresses().isEmpty()) {
            CrmAddress address = lead.getAddresses().get(0);
            row.address(nullToEmpty(address.getAddress1()))
                    .city(nullToEmpty(address.getCity()))
                    .state(nullToEmpty(address.getState()))
                    .zipcode(nullToEmpty(address.getZipcode()));
        }
        return row.build();
    }

    String fileName() {
        return "find_owner_leads_" + LocalDate.now(clock).format(FILE_DATE) + ".csv";
    }

    private boolean handOff(Path file) {
        String filename = file.getFileName().toString();

        Optional<UploadTarget> upload = client.requestUpload(filename, CSV_CONTENT_TYPE);
        if (upload.isEmpty()) {
            log.error("Failed to get an upload URL for {}", filename);
            return false;
        }
        if (!fileUploader.upload(upload.get(), file, MediaType.parseMediaType(CSV_CONTENT_TYPE))) {
            return false;
        }

        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read size of " + file, e);
        }

        EmailDraft draft = EmailDraft.builder()
                .leadId(properties.getRecipientLeadId())
                .contactId(properties.getRecipientContactId())
                .emailAccountId(senderEmailAccountId().orElse(null))
                .subject(LocalDate.now(clock).format(SUBJECT_DATE) + " Find Owners")
                .createdByName(properties.getSenderName())
                .sender(sender())
                .to(recipientEmail())
                .bodyText(body())
                .attachment(EmailDraft.Attachment.builder()
                        .url(upload.get().getDownloadUrl())
                        .filename(filename)
                        .contentType(CSV_CONTENT_TYPE)
                        .size(size)
                        .build())
                .build();

        WriteResult sent = client.sendEmail(draft);
        if (!sent.isOk()) {
            log.error("Failed to send find-owner email: HTTP {}", sent.getHttpStatus());
            return false;
        }
        log.info("Email sent with id {}", sent.createdId().orElse("?"));
        return true;
    }

    String recipientEmail() {
        Optional<String> email = client.getContact(properties.getRecipientContactId()).record()
                .flatMap(contact -> contact.getEmails().stream().filter(e -> !e.isBlank()).findFirst());
        if (email.isPresent()) {
            return email.get();
        }
        log.warn("Using fallback email for recipient: {}", properties.getFallbackRecipientEmail());
        return properties.getFallbackRecipientEmail();
    }

    Optional<String> senderEmailAccountId() {
        SearchResult accounts = client.listEmailAccounts();
        Optional<String> id = accounts.getItems().stream()
                .filter(account -> account.getSource() != null
                        && properties.getSenderEmail().equalsIgnoreCase(account.getSource().path("email").asText()))
                .map(CrmRecord::getId)
                .findFirst();
        if (id.isEmpty()) {
            log.warn("No email account found for {}; the email may not be sent", properties.getSenderEmail());
        }
        return id;
    }

    private String sender() {
        if (isBlank(properties.getSenderName())) {
            return properties.getSenderEmail();
        }
        return "\"" + properties.getSenderName() + "\" <" + properties.getSenderEmail() + ">";
    }

    private String body() {
        String greeting = isBlank(properties.getRecipientGreetingName()) ? "there" : properties.getRecipientGreetingName();
        return "Hi " + greeting + ",\n\n"
                + "We have another list of Find Owners for you to process. Please see the attached file "
                + "and let us know when you are ready for our review and payment.\n\n"
                + "Best,\n" + properties.getSignature();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
