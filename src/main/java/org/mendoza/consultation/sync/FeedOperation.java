package org.mendoza.consultation.sync;

public enum FeedOperation {
    INSERT,
    UPDATE,
    DELETE;

    /**
     * Accepts trigger {@code TG_OP} values in any case.
     */
    public static FeedOperation parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Missing change-feed operation");
        }
        return valueOf(value.trim().toUpperCase());
    }
}
