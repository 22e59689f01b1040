package org.mendoza.consultation.provider;

import org.mendoza.consultation.model.ParticipantRole;

import java.time.Instant;

/**
 * A normalized provider notification scoped to one meeting.
 * {@code userId} and {@code role} are null for recording events.
 */
public final class ProviderEvent {
    public final ProviderEventType type;
    public final String meetingRef;
    public final String userId;
    public final ParticipantRole role;
    public final Instant timestamp;

    public ProviderEvent(ProviderEventType type, String meetingRef, String userId, ParticipantRole role, Instant timestamp) {
        this.type = type;
        this.meetingRef = meetingRef;
        this.userId = userId;
        this.role = role;
        this.timestamp = timestamp;
    }

    public static ProviderEvent joined(String meetingRef, String userId, ParticipantRole role, Instant at) {
        return new ProviderEvent(ProviderEventType.JOINED, meetingRef, userId, role, at);
    }

    public static ProviderEvent left(String meetingRef, String userId, Instant at) {
        return new ProviderEvent(ProviderEventType.LEFT, meetingRef, userId, null, at);
    }

    public static ProviderEvent recordingStarted(String meetingRef, Instant at) {
        return new ProviderEvent(ProviderEventType.RECORDING_STARTED, meetingRef, null, null, at);
    }

    public static ProviderEvent recordingStopped(String meetingRef, Instant at) {
        return new ProviderEvent(ProviderEventType.RECORDING_STOPPED, meetingRef, null, null, at);
    }

    @Override
    public String toString() {
        return "ProviderEvent{type=" + type + ", meetingRef=" + meetingRef + ", userId=" + userId +
               ", role=" + role + ", timestamp=" + timestamp + "}";
    }
}
