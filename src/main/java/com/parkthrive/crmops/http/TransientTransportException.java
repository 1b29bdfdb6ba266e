package com.parkthrive.crmops.http;

public class TransientTransportException extends Exception {

    public TransientTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
