package org.mendoza.consultation.session;

public enum FinalizeReason {
    LAST_PARTICIPANT_LEFT,
    FORCE_END,
    WATCHDOG
}
