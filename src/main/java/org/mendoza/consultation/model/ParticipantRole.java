package org.mendoza.consultation.model;

public enum ParticipantRole {
    DOCTOR("doctor"),
    PATIENT("patient"),
    OBSERVER("observer");

    private final String dbValue;

    ParticipantRole(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    /**
     * Lenient lookup used for provider payloads: anything unrecognised is an observer.
     */
    public static ParticipantRole fromDb(String value) {
        if (value != null) {
            for (ParticipantRole role : values()) {
                if (role.dbValue.equalsIgnoreCase(value)) {
                    return role;
                }
            }
        }
        return OBSERVER;
    }
}
