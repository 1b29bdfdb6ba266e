package com.parkthrive.crmops.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "crm.retry")
public class RetryProperties {

    /**
     * Wait applied to a 429 when no header or body hint can be resolved
     * Default: 5000 (5 seconds)
     */
    private long defaultRateLimitWaitMs = 5000;

    /**
     * Added to every rate-limit wait so the retry lands past the window boundary
     * Default: 500
     */
    private long rateLimitBufferMs = 500;

    /**
     * Interval between retries after a connection error or timeout
     * Default: 5000 (5 seconds)
     */
    private long networkRetryIntervalMs = 5000;

    /**
     * Pause between consecutive search pages
     */
    private long pageDelayMs = 500;

    /**
     * Pause between consecutive records in a run
     */
    private long recordDelayMs = 1000;

    /**
     * Pause between lead assignment writes
     */
    private long assignmentDelayMs = 200;

    /**
     * Pause between sales reps in assignment and reporting jobs
     */
    private long repDelayMs = 1000;

    public Duration defaultRateLimitWait() {
        return Duration.ofMillis(defaultRateLimitWaitMs);
    }

    public Duration rateLimitBuffer() {
        return Duration.ofMillis(rateLimitBufferMs);
    }

    public Duration networkRetryInterval() {
        return Duration.ofMillis(networkRetryIntervalMs);
    }

    public Duration pageDelay() {
        return Duration.ofMillis(pageDelayMs);
    }

    public Duration recordDelay() {
        return Duration.ofMillis(recordDelayMs);
    }

    public Duration assignmentDelay() {
        return Duration.ofMillis(assignmentDelayMs);
    }

    public Duration repDelay() {
        return Duration.ofMillis(repDelayMs);
    }
}
