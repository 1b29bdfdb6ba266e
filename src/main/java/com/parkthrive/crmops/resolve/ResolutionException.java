package com.parkthrive.crmops.resolve;

/**
 * A record could not be assembled because a required read failed.
 */
public class ResolutionException extends RuntimeException {

    public ResolutionException(String message) {
        super(message);
    }
}
