package com.parkthrive.crmops.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parkthrive.crmops.config.RetryProperties;
import com.parkthrive.crmops.run.RunMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Executes one request to completion.
 * <p>
 * 429 responses are retried after the resolved wait plus the configured buffer, and
 * connection errors after the network retry interval; neither has a retry ceiling.
 * Every other status is final and returned as an {@link ApiResponse}, never thrown.
 */
@Slf4j
public class RateAwareRequestExecutor {

    private final String name;
    private final ApiTransport transport;
    private final RateSignalClassifier classifier;
    private final RetryProperties retryProperties;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper;
    private final RunMetrics metrics;

    public RateAwareRequestExecutor(String name,
                                    ApiTransport transport,
                                    RateSignalClassifier classifier,
                                    RetryProperties retryProperties,
                                    Sleeper sleeper,
                                    ObjectMapper objectMapper,
                                    RunMetrics metrics) {
        this.name = name;
        this.transport = transport;
        this.classifier = classifier;
        this.retryProperties = retryProperties;
        this.sleeper = sleeper;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    public ApiResponse execute(ApiRequest request) {
        int attempt = 0;

        while (true) {
            attempt++;
            RawResponse raw;
            Timer.Sample sample = Timer.start(metrics.getRegistry());
            try {
                raw = transport.exchange(request);
                sample.stop(metrics.getHttpRequestTimer());
            } catch (TransientTransportException e) {
                sample.stop(metrics.getHttpRequestTimer());
                metrics.getHttpNetworkRetry().increment();
                Duration wait = retryProperties.networkRetryInterval();
                log.warn("[{}] Network error on {} (attempt {}): {}. Retrying in {} ms",
                        name, request.describe(), attempt, e.getMessage(), wait.toMillis());
                sleeper.pause(wait);
                continue;
            }

            RateSignal signal = classifier.classify(raw);

            if (signal.getOutcome() == RateSignal.Outcome.RATE_LIMITED) {
                metrics.getHttpRateLimited().increment();
                Duration wait = signal.getWaitHint().plus(retryProperties.rateLimitBuffer());
                log.warn("[{}] Rate limited on {} (attempt {}). Retrying in {} ms",
                        name, request.describe(), attempt, wait.toMillis());
                sleeper.pause(wait);
                continue;
            }

            metrics.recordHttpResult(raw.status());

            if (signal.getOutcome() == RateSignal.Outcome.PERMANENT_ERROR) {
                log.error("[{}] {} failed with HTTP {}: {}",
                        name, request.describe(), raw.status(), truncate(raw.body(), 500));
                return ApiResponse.failure(raw.status(), raw.body());
            }

            return decode(request, raw);
        }
    }

    private ApiResponse decode(ApiRequest request, RawResponse raw) {
        String body = raw.body();
        if (body == null || body.isBlank()) {
            return ApiResponse.success(raw.status(), null);
        }

        try {
            JsonNode node = objectMapper.readTree(body);
            return ApiResponse.success(raw.status(), node);
        } catch (JsonProcessingException e) {
            metrics.getHttpMalformed().increment();
            if (request.getIdempotency() == ApiRequest.Idempotency.WRITE) {
                log.warn("[{}] {} succeeded but the response body could not be decoded",
                        name, request.describe());
                return ApiResponse.success(raw.status(), null);
            }
            log.error("[{}] Error decoding response of {}: {}", name, request.describe(), e.getOriginalMessage());
            return ApiResponse.malformed(raw.status());
        }
    }

    private static String truncate(String value, int max) {
        if (value == null) return "";
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}
