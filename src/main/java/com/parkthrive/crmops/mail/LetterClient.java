package com.parkthrive.crmops.mail;

import com.parkthrive.crmops.resolve.LetterData;

/**
 * Creates a printed letter at the mailing vendor.
 */
public interface LetterClient {

    LetterResult send(LetterData letter);
}
