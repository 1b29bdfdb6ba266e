package com.parkthrive.crmops.campaign;

/**
 * Configured stages, in campaign order. {@link #LEAD_ERROR} is the terminal
 * stage a lead is moved to when its processing cannot complete.
 */
public enum StageKey {
    HOLD,
    UNPAID,
    ROUND_1,
    ROUND_2,
    ROUND_3,
    LEAD_ERROR
}
