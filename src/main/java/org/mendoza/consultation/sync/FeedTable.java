package org.mendoza.consultation.sync;

/**
 * Tables whose row changes are published on the change-feed channel.
 */
public enum FeedTable {
    VIDEO_CALLS("video_calls"),
    VIDEO_CALL_PARTICIPANTS("video_call_participants"),
    APPOINTMENTS("appointments");

    private final String tableName;

    FeedTable(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }

    public static FeedTable fromTableName(String value) {
        for (FeedTable table : values()) {
            if (table.tableName.equalsIgnoreCase(value)) {
                return table;
            }
        }
        return null;
    }
}
