package org.mendoza.consultation;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.mendoza.consultation.model.CallSession;
import org.mendoza.consultation.model.CallStatus;
import org.mendoza.consultation.model.ParticipantRecord;
import org.mendoza.consultation.session.SessionSnapshot;

import java.time.Instant;
import java.util.Map;

/**
 * JSON rendering for the management endpoints. Timestamps are ISO-8601 strings, absent values are null.
 */
final class SessionJson {

    private SessionJson() {
    }

    static JsonObject session(CallSession session) {
        return new JsonObject()
            .put("id", session.id)
            .put("appointmentId", session.appointmentId)
            .put("doctorId", session.doctorId)
            .put("patientId", session.patientId)
            .put("status", session.status.dbValue())
            .put("meetingRef", session.meetingRef)
            .put("callLink", session.callLink)
            .put("startedAt", iso(session.startedAt))
            .put("endedAt", iso(session.endedAt))
            .put("durationMinutes", session.durationMinutes)
            .put("isRecording", session.isRecording)
            .put("recordingRequested", session.recordingRequested)
            .put("needsReconciliation", session.needsReconciliation)
            .put("createdAt", iso(session.createdAt));
    }

    static JsonObject summary(SessionSnapshot snapshot) {
        return session(snapshot.session).put("activeParticipants", snapshot.activeParticipants);
    }

    static JsonObject detail(SessionSnapshot snapshot) {
        JsonArray participants = new JsonArray();
        for (ParticipantRecord span : snapshot.spans) {
            participants.add(new JsonObject()
                .put("userId", span.userId)
                .put("role", span.role.dbValue())
                .put("joinedAt", iso(span.joinedAt))
                .put("leftAt", iso(span.leftAt)));
        }
        return summary(snapshot).put("participants", participants);
    }

    static JsonObject stats(Map<CallStatus, Long> counts) {
        JsonObject json = new JsonObject();
        long total = 0;
        for (CallStatus status : CallStatus.values()) {
            long count = counts.getOrDefault(status, 0L);
            json.put(status.dbValue(), count);
            total += count;
        }
        return json.put("total", total);
    }

    private static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
