package com.parkthrive.crmops.campaign;

import com.parkthrive.crmops.crm.CrmRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * Picks the child with the earliest date in a custom field. Dates are tried in the order
 * {@code M/d/yyyy}, {@code yyyy-M-d}, {@code M-d-yyyy}, {@code d/M/yyyy}; children whose
 * date matches none of them are not candidates. On equal dates the first listed child wins.
 */
@Slf4j
public class OldestCandidateSelector implements CandidateSelector {

    static final List<DateTimeFormatter> FORMATS = List.of(
            strict("M/d/uuuu"),
            strict("uuuu-M-d"),
            strict("M-d-uuuu"),
            strict("d/M/uuuu"));

    private final String dateFieldId;

    public OldestCandidateSelector(String dateFieldId) {
        this.dateFieldId = dateFieldId;
    }

    @Override
    public List<CrmRecord> select(List<CrmRecord> eligible) {
        CrmRecord oldest = null;
        LocalDate oldestDate = null;

        for (CrmRecord candidate : eligible) {
            Optional<LocalDate> date = candidate.custom(dateFieldId).flatMap(OldestCandidateSelector::parse);
            if (date.isEmpty()) {
                log.debug("Opportunity {} has no parseable date in {}, excluded", candidate.getId(), dateFieldId);
                continue;
            }
            if (oldestDate == null || date.get().isBefore(oldestDate)) {
                oldest = candidate;
                oldestDate = date.get();
            }
        }
        return oldest == null ? List.of() : List.of(oldest);
    }

    public static Optional<LocalDate> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (DateTimeFormatter format : FORMATS) {
            Optional<LocalDate> date = tryParse(trimmed, format);
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> tryParse(String value, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(value, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
