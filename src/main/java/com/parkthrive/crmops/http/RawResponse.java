package com.parkthrive.crmops.http;

import org.springframework.http.HttpHeaders;

/**
 * Status, headers and undecoded body of a completed exchange.
 */
public record RawResponse(int status, HttpHeaders headers, String body) {

    public RawResponse {
        headers = headers == null ? new HttpHeaders() : headers;
    }

    public static RawResponse of(int status, String body) {
        return new RawResponse(status, new HttpHeaders(), body);
    }

    public boolean is2xx() {
        return status >= 200 && status < 300;
    }
}
