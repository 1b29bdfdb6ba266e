package com.parkthrive.crmops.http;

/**
 * Performs a single exchange with no retry or interpretation of the status code.
 */
public interface ApiTransport {

    /**
     * @throws TransientTransportException when no response was obtained (connection error, timeout)
     */
    RawResponse exchange(ApiRequest request) throws TransientTransportException;
}
