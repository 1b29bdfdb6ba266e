package com.parkthrive.crmops.http;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * How the executor should react to one exchange. Network failures never get this far; they
 * surface as {@link TransientTransportException}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RateSignal {

    Outcome outcome;
    Duration waitHint;
    int statusCode;

    public enum Outcome {
        OK,
        RATE_LIMITED,
        PERMANENT_ERROR
    }

    public static RateSignal ok(int statusCode) {
        return new RateSignal(Outcome.OK, Duration.ZERO, statusCode);
    }

    public static RateSignal rateLimited(Duration waitHint) {
        Duration wait = waitHint == null || waitHint.isNegative() ? Duration.ZERO : waitHint;
        return new RateSignal(Outcome.RATE_LIMITED, wait, 429);
    }

    public static RateSignal permanentError(int statusCode) {
        return new RateSignal(Outcome.PERMANENT_ERROR, Duration.ZERO, statusCode);
    }
}
