package org.mendoza.consultation.model;

import java.time.Instant;

public class CallSession {
    public Long id;
    public String appointmentId;     // appointments.id, a UUID
    public String doctorId;
    public String patientId;
    public CallStatus status;
    public String meetingRef;     // room id issued by the video provider
    public String callLink;
    public Instant startedAt;
    public Instant endedAt;
    public Integer durationMinutes;
    public boolean isRecording;
    public boolean recordingRequested;
    public boolean needsReconciliation;
    public Instant createdAt;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public CallSession copy() {
        CallSession copy = new CallSession();
        copy.id = id;
        copy.appointmentId = appointmentId;
        copy.doctorId = doctorId;
        copy.patientId = patientId;
        copy.status = status;
        copy.meetingRef = meetingRef;
        copy.callLink = callLink;
        copy.startedAt = startedAt;
        copy.endedAt = endedAt;
        copy.durationMinutes = durationMinutes;
        copy.isRecording = isRecording;
        copy.recordingRequested = recordingRequested;
        copy.needsReconciliation = needsReconciliation;
        copy.createdAt = createdAt;
        return copy;
    }

    @Override
    public String toString() {
        return "CallSession{id=" + id + ", appointmentId=" + appointmentId + ", status=" + status +
               ", meetingRef=" + meetingRef + ", startedAt=" + startedAt + ", endedAt=" + endedAt +
               ", durationMinutes=" + durationMinutes + ", isRecording=" + isRecording + "}";
    }
}
