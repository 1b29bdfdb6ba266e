package com.parkthrive.crmops.resolve;

import com.parkthrive.crmops.campaign.StageCatalog;
import com.parkthrive.crmops.campaign.StageKey;
import com.parkthrive.crmops.crm.CampaignField;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.crm.FieldRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Builds {@link LetterData} from a lead, its first contact and its first opportunity in a
 * mailer round. Mailer dates depend on the round: round 2 letters cite the first mailer,
 * round 3 letters the first and second.
 */
@Slf4j
public class LetterDataResolver {

    static final String MAILING_ADDRESS = "Current Mailing Address";
    static final String LAST_MAIL_DATE = "Last Mail Date";
    static final String MAKE = "Make";
    static final String MODEL = "Model";

    private static final List<StageKey> MAILER_ROUNDS = List.of(StageKey.ROUND_1, StageKey.ROUND_2, StageKey.ROUND_3);

    private final RecordResolver resolver;
    private final FieldRegistry fields;
    private final StageCatalog stages;
    private final MailingAddressParser addressParser;

    public LetterDataResolver(RecordResolver resolver, FieldRegistry fields, StageCatalog stages,
                              MailingAddressParser addressParser) {
        this.resolver = resolver;
        this.fields = fields;
        this.stages = stages;
        this.addressParser = addressParser;
    }

    public LetterData resolve(CrmRecord reference) {
        ResolvedLead resolved = resolver.resolve(reference, ResolvePolicy.builder()
                .refreshParent(true)
                .listChildren(true)
                .build());
        CrmRecord lead = resolved.getLead();

        LetterData.LetterDataBuilder letter = LetterData.builder().leadId(lead.getId());

        if (!lead.getContacts().isEmpty()) {
            String[] name = splitFirst(lead.getContacts().get(0).getDisplayName());
            letter.firstName(name[0]).lastName(name[1]);
        }

        String[] plate = splitFirst(lead.getName());
        letter.plateNumber(plate[0]).plateLocation(plate[1]);

        letter.address(addressParser.parse(lead.named(MAILING_ADDRESS).orElse("")));
        letter.lastMailDate(FieldValues.isoToUsDate(lead.named(LAST_MAIL_DATE).orElse("")));
        letter.make(lead.named(MAKE).orElse(""));
        letter.model(lead.named(MODEL).orElse(""));

        firstMailerOpportunity(resolved).ifPresent(listed -> {
            CrmRecord detail = resolver.childDetail(listed).orElse(listed);
            applyOpportunity(letter, listed, detail);
        });
        return letter.build();
    }

    private void applyOpportunity(LetterData.LetterDataBuilder letter, CrmRecord listed, CrmRecord opp) {
        letter.value(FieldValues.formatMoney(Optional.ofNullable(listed.getValueFormatted()).orElse("")));
        letter.citationNumber(read(opp, CampaignField.CITATION_NUMBER));
        letter.citationDate(FieldValues.isoToUsDate(read(opp, CampaignField.CITATION_DATE)));
        letter.citationTime(read(opp, CampaignField.CITATION_TIME));
        letter.lotLocation(read(opp, CampaignField.LOT_ADDRESS));
        letter.citationImageUrl(read(opp, CampaignField.CITATION_IMAGE_URL));
        letter.fineAmount(FieldValues.formatMoney(read(opp, CampaignField.FINE_AMOUNT)));
        letter.serviceFee(FieldValues.formatMoney(read(opp, CampaignField.SERVICE_FEE)));
        letter.template(read(opp, CampaignField.TEMPLATE));

        String mailerDates = read(opp, CampaignField.MAILER_DATES);
        Optional<StageKey> round = stages.stageOf(listed);
        if (round.isPresent() && round.get() == StageKey.ROUND_2) {
            letter.firstMailer(FieldValues.isoToUsDate(FieldValues.component(mailerDates, 0)));
        } else if (round.isPresent() && round.get() == StageKey.ROUND_3) {
            letter.firstMailer(FieldValues.isoToUsDate(FieldValues.component(mailerDates, 0)));
            letter.secondMailer(FieldValues.isoToUsDate(FieldValues.component(mailerDates, 1)));
        }
    }

    private Optional<CrmRecord> firstMailerOpportunity(ResolvedLead resolved) {
        return resolved.getChildren().stream().filter(this::inMailerRound).findFirst();
    }

    private boolean inMailerRound(CrmRecord record) {
        return stages.stageOf(record).filter(MAILER_ROUNDS::contains).isPresent();
    }

    private String read(CrmRecord record, CampaignField field) {
        return fields.read(record, field).orElse("");
    }

    private static String[] splitFirst(String value) {
        if (value == null || value.isEmpty()) {
            return new String[]{"", ""};
        }
        String[] parts = value.split(" ", 2);
        return new String[]{parts[0], parts.length > 1 ? parts[1] : ""};
    }
}
