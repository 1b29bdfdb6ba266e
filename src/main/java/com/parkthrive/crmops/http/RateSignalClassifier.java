package com.parkthrive.crmops.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parkthrive.crmops.config.RetryProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Turns a raw response into a {@link RateSignal}.
 * <p>
 * The wait of a 429 is resolved from, in order: the {@code retry-after} header (seconds),
 * the {@code reset} key of the structured {@code ratelimit} header
 * ({@code limit=100, remaining=0, reset=4;w=60}), a {@code rate_reset} number in the body,
 * and finally the configured default. Zero, negative or unparseable values fall through
 * to the next source.
 */
@Slf4j
public class RateSignalClassifier {

    static final String RETRY_AFTER = "retry-after";
    static final String RATE_LIMIT = "ratelimit";
    static final String BODY_RESET = "rate_reset";

    private final RetryProperties retryProperties;
    private final ObjectMapper objectMapper;

    public RateSignalClassifier(RetryProperties retryProperties, ObjectMapper objectMapper) {
        this.retryProperties = retryProperties;
        this.objectMapper = objectMapper;
    }

    public RateSignal classify(RawResponse response) {
        int status = response.status();
        if (status == 429) {
            return RateSignal.rateLimited(resolveWaitHint(response));
        }
        if (response.is2xx()) {
            return RateSignal.ok(status);
        }
        return RateSignal.permanentError(status);
    }

    public Duration resolveWaitHint(RawResponse response) {
        return fromRetryAfter(response)
                .or(() -> fromRateLimitHeader(response))
                .or(() -> fromBody(response))
                .orElse(retryProperties.defaultRateLimitWait());
    }

    private Optional<Duration> fromRetryAfter(RawResponse response) {
        return seconds(response.headers().getFirst(RETRY_AFTER));
    }

    private Optional<Duration> fromRateLimitHeader(RawResponse response) {
        String header = response.headers().getFirst(RATE_LIMIT);
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }

        for (String segment : header.split(",")) {
            for (String pair : segment.split(";")) {
                int eq = pair.indexOf('=');
                if (eq < 0) {
                    continue;
                }
                String key = pair.substring(0, eq).trim();
                if ("reset".equalsIgnoreCase(key)) {
                    return seconds(pair.substring(eq + 1));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Duration> fromBody(RawResponse response) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(body).path(BODY_RESET);
            return node.isNumber() ? positive(node.asDouble()) : seconds(node.asText(null));
        } catch (Exception e) {
            log.debug("Rate limit body is not JSON: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<Duration> seconds(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return positive(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Duration> positive(double seconds) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds <= 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(Math.round(seconds * 1000)));
    }
}
