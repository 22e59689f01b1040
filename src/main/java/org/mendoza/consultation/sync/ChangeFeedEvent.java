package org.mendoza.consultation.sync;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * One row-level change: {@code {"table": ..., "operation": ..., "row": {...}}}.
 * For deletes {@code row} is the old row.
 *
 * <p>Call and span ids are numeric. Appointment ids belong to the booking schema and arrive as
 * UUID text.
 */
public final class ChangeFeedEvent {
    public final FeedTable table;
    public final FeedOperation operation;
    public final JsonObject row;

    public ChangeFeedEvent(FeedTable table, FeedOperation operation, JsonObject row) {
        this.table = table;
        this.operation = operation;
        this.row = row != null ? row : new JsonObject();
    }

    /**
     * @return the event, or null for tables nobody here consumes
     * @throws IllegalArgumentException for payloads that are not change-feed JSON, or whose id
     *                                  fields have the wrong type for their table
     */
    public static ChangeFeedEvent parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("Empty change-feed payload");
        }
        JsonObject json;
        try {
            json = new JsonObject(payload);
        } catch (DecodeException e) {
            throw new IllegalArgumentException("Malformed change-feed payload: " + payload, e);
        }
        try {
            FeedTable table = FeedTable.fromTableName(json.getString("table"));
            if (table == null) {
                return null;
            }
            ChangeFeedEvent event = new ChangeFeedEvent(table,
                FeedOperation.parse(json.getString("operation")), json.getJsonObject("row"));
            event.validate();
            return event;
        } catch (ClassCastException e) {
            throw new IllegalArgumentException("Change-feed field has the wrong type: " + payload, e);
        }
    }

    private void validate() {
        switch (table) {
            case VIDEO_CALLS:
                numericId("id");
                break;
            case VIDEO_CALL_PARTICIPANTS:
                numericId("id");
                numericId("video_call_id");
                break;
            case APPOINTMENTS:
                textId("id");
                break;
            default:
                break;
        }
        Object status = row.getValue("status");
        if (status != null && !(status instanceof String)) {
            throw new IllegalArgumentException(table.tableName() + ".status is not text: " + status);
        }
    }

    private Long numericId(String field) {
        Object value = row.getValue(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).longValue();
        }
        throw new IllegalArgumentException(table.tableName() + "." + field + " is not an integer: " + value);
    }

    private String textId(String field) {
        Object value = row.getValue(field);
        if (value == null) {
            return null;
        }
        if (value instanceof String || value instanceof Integer || value instanceof Long) {
            String text = value.toString();
            return text.isBlank() ? null : text;
        }
        throw new IllegalArgumentException(table.tableName() + "." + field + " is not an id: " + value);
    }

    /**
     * The video call the change belongs to, or null for appointment rows and rows without one.
     */
    public Long callId() {
        switch (table) {
            case VIDEO_CALLS:
                return numericId("id");
            case VIDEO_CALL_PARTICIPANTS:
                return numericId("video_call_id");
            default:
                return null;
        }
    }

    /**
     * The appointment id of an {@code appointments} row, as text.
     */
    public String appointmentId() {
        return table == FeedTable.APPOINTMENTS ? textId("id") : null;
    }

    /**
     * Events with the same key describe the same thing, so only the latest of a burst matters.
     * Participant changes are keyed by call: the handler re-reads every span of that call anyway.
     */
    public String coalescingKey() {
        if (table == FeedTable.VIDEO_CALL_PARTICIPANTS) {
            return table.tableName() + ":" + callId();
        }
        if (table == FeedTable.APPOINTMENTS) {
            return table.tableName() + ":" + appointmentId();
        }
        return table.tableName() + ":" + numericId("id");
    }

    @Override
    public String toString() {
        return "ChangeFeedEvent{table=" + table.tableName() + ", operation=" + operation + ", row=" + row.encode() + "}";
    }
}
