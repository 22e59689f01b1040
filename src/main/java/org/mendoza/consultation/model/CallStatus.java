package org.mendoza.consultation.model;

/**
 * Lifecycle states of a video consultation, stored lowercase in {@code video_calls.status}.
 */
public enum CallStatus {
    SCHEDULED("scheduled"),
    ONGOING("ongoing"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String dbValue;

    CallStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public static CallStatus fromDb(String value) {
        for (CallStatus status : values()) {
            if (status.dbValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown call status: " + value);
    }
}
