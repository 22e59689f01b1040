package org.mendoza.consultation.notify;

import io.vertx.core.json.JsonObject;

/**
 * Domain event for the notification component: a call started or ended.
 * {@code durationMinutes} is only present on {@code ended} events of calls that actually ran.
 */
public final class CallLifecycleEvent {
    public final Long sessionId;
    public final String appointmentId;
    public final LifecycleEventType type;
    public final Integer durationMinutes;

    public CallLifecycleEvent(Long sessionId, String appointmentId, LifecycleEventType type, Integer durationMinutes) {
        this.sessionId = sessionId;
        this.appointmentId = appointmentId;
        this.type = type;
        this.durationMinutes = durationMinutes;
    }

    public static CallLifecycleEvent started(Long sessionId, String appointmentId) {
        return new CallLifecycleEvent(sessionId, appointmentId, LifecycleEventType.STARTED, null);
    }

    public static CallLifecycleEvent ended(Long sessionId, String appointmentId, Integer durationMinutes) {
        return new CallLifecycleEvent(sessionId, appointmentId, LifecycleEventType.ENDED, durationMinutes);
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("sessionId", sessionId)
            .put("appointmentId", appointmentId)
            .put("event", type.wireName());
        if (durationMinutes != null) {
            json.put("durationMinutes", durationMinutes);
        }
        return json;
    }

    @Override
    public String toString() {
        return "CallLifecycleEvent" + toJson().encode();
    }
}
