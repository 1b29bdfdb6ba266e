package com.parkthrive.crmops.campaign;

/**
 * How a transition changes the child's mailer date list.
 */
public enum DateMutation {
    /** Leave the list untouched */
    NONE,
    /** The list becomes today's date only */
    REPLACE,
    /** Today's date is appended; existing dates are kept */
    APPEND
}
