package com.parkthrive.crmops.run;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Central counters for the API engine and campaign runs.
 *
 * Naming convention:
 *   crm.{area}.{metric_type}
 *
 * Tags:
 *   stage   = http_request | pagination | transition
 *   result  = success | error_4xx | error_5xx | rate_limited | network | malformed | ...
 */
@Slf4j
@Getter
@Component
public class RunMetrics {

    private final MeterRegistry registry;

    // ==================== HTTP ====================
    private final Timer httpRequestTimer;
    private final Counter httpSuccess;
    private final Counter httpError4xx;
    private final Counter httpError5xx;
    private final Counter httpRateLimited;
    private final Counter httpNetworkRetry;
    private final Counter httpMalformed;

    // ==================== Pagination ====================
    private final Counter pagesFetched;
    private final Counter itemsFetched;

    // ==================== Transitions ====================
    private final Counter transitionSucceeded;
    private final Counter transitionIneligible;
    private final Counter transitionFailed;
    private final Counter transitionPartial;
    private final Counter transitionRoutedToError;

    public RunMetrics(MeterRegistry registry) {
        this.registry = registry;

        // ==================== HTTP ====================

        this.httpRequestTimer = Timer.builder("crm.http.request.duration")
                .description("Duration of a single CRM API exchange")
                .tag("stage", "http_request")
                .register(registry);

        this.httpSuccess = httpCounter("success", "Successful HTTP requests");
        this.httpError4xx = httpCounter("error_4xx", "HTTP 4xx client errors (429 excluded)");
        this.httpError5xx = httpCounter("error_5xx", "HTTP 5xx server errors");
        this.httpRateLimited = httpCounter("rate_limited", "Requests answered with 429 and retried");
        this.httpNetworkRetry = httpCounter("network", "Connection errors and timeouts retried");
        this.httpMalformed = httpCounter("malformed", "2xx responses whose body could not be decoded");

        // ==================== Pagination ====================

        this.pagesFetched = Counter.builder("crm.pagination.pages")
                .description("Search pages fetched")
                .tag("stage", "pagination")
                .register(registry);

        this.itemsFetched = Counter.builder("crm.pagination.items")
                .description("Items accumulated across all pages")
                .tag("stage", "pagination")
                .register(registry);

        // ==================== Transitions ====================

        this.transitionSucceeded = transitionCounter("success");
        this.transitionIneligible = transitionCounter("ineligible");
        this.transitionFailed = transitionCounter("failed");
        this.transitionPartial = transitionCounter("partial_failure");
        this.transitionRoutedToError = transitionCounter("routed_to_error");

        log.info("CRM run metrics registered (http + pagination + transitions)");
    }

    private Counter httpCounter(String result, String description) {
        return Counter.builder("crm.http.request.total")
                .description(description)
                .tag("stage", "http_request")
                .tag("result", result)
                .register(registry);
    }

    private Counter transitionCounter(String result) {
        return Counter.builder("crm.transition.total")
                .description("Stage transitions by outcome")
                .tag("stage", "transition")
                .tag("result", result)
                .register(registry);
    }

    // ==================== Convenience Methods ====================

    /**
     * Record HTTP result based on status code
     */
    public void recordHttpResult(int statusCode) {
        if (statusCode >= 200 && statusCode < 400) {
            httpSuccess.increment();
        } else if (statusCode >= 400 && statusCode < 500) {
            httpError4xx.increment();
        } else if (statusCode >= 500) {
            httpError5xx.increment();
        }
    }

    public void recordPage(int items) {
        pagesFetched.increment();
        itemsFetched.increment(items);
    }
}
