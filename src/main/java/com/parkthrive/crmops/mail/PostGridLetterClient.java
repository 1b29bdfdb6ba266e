package com.parkthrive.crmops.mail;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parkthrive.crmops.config.PostGridProperties;
import com.parkthrive.crmops.resolve.LetterData;
import com.parkthrive.crmops.resolve.MailingAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * PostGrid print-mail letters: form encoded {@code POST /letters} with the recipient in
 * {@code to[...]} fields and template values in {@code mergeVariables[...]} fields.
 */
@Slf4j
public class PostGridLetterClient implements LetterClient {

    private static final DateTimeFormatter DESCRIPTION_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    private final RestClient restClient;
    private final PostGridProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PostGridLetterClient(RestClient restClient, PostGridProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.restClient = restClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public LetterResult send(LetterData letter) {
        MultiValueMap<String, String> form = toForm(letter);

        try {
            return restClient.post()
                    .uri("/letters")
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .exchange((req, resp) -> {
                        int status = resp.getStatusCode().value();
                        String body = StreamUtils.copyToString(resp.getBody(), StandardCharsets.UTF_8);
                        if (status >= 400) {
                            return LetterResult.rejected(status, errorMessage(body, status));
                        }
                        return LetterResult.sent(status, letterId(body));
                    });
        } catch (Exception e) {
            log.error("Error sending letter for lead {}: {}", letter.getLeadId(), e.getMessage());
            return LetterResult.unreachable(e.getMessage());
        }
    }

    MultiValueMap<String, String> toForm(LetterData letter) {
        MailingAddress address = letter.getAddress() != null ? letter.getAddress() : MailingAddress.builder().build();
        String country = address.getCountryCode() != null ? address.getCountryCode() : properties.getDefaultCountryCode();

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("to[firstName]", letter.getFirstName());
        form.add("to[lastName]", letter.getLastName());
        form.add("to[addressLine1]", address.getAddressLine1());
        form.add("to[addressLine2]", address.getAddressLine2());
        form.add("to[city]", address.getCity());
        form.add("to[provinceOrState]", address.getState());
        form.add("to[postalOrZip]", address.getPostalCode());
        form.add("to[countryCode]", country);

        form.add("from", properties.getFromContactId());
        form.add("template", letter.getTemplate());
        form.add("size", properties.getSize());
        form.add("addressPlacement", properties.getAddressPlacement());
        form.add("doubleSided", String.valueOf(properties.isDoubleSided()));
        form.add("color", String.valueOf(properties.isColor()));
        form.add("mailingClass", properties.getMailingClass());
        form.add("description", "Invoice " + letter.getCitationNumber()
                + " (" + LocalDate.now(clock).format(DESCRIPTION_DATE) + ")");

        letter.mergeVariables().forEach((name, value) -> form.add("mergeVariables[" + name + "]", value));
        return form;
    }

    private String letterId(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node.hasNonNull("id") ? node.get("id").asText() : null;
        } catch (Exception e) {
            return body.trim();
        }
    }

    private String errorMessage(String body, int status) {
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.hasNonNull("message")) {
                return error.get("message").asText();
            }
            if (error.hasNonNull("type")) {
                return error.get("type").asText();
            }
            return "Unknown error";
        } catch (Exception e) {
            return body != null && !body.isBlank() ? truncate(body, 100) : "HTTP " + status;
        }
    }

    private static String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
}
