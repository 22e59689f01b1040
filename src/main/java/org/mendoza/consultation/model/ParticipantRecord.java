package org.mendoza.consultation.model;

import java.time.Instant;

/**
 * One presence span of one user within one call. A rejoin opens a new span.
 */
public class ParticipantRecord {
    public Long id;
    public Long callId;
    public String userId;
    public ParticipantRole role;
    public Instant joinedAt;
    public Instant leftAt;

    public boolean isOpen() {
        return leftAt == null;
    }

    public ParticipantRecord copy() {
        ParticipantRecord copy = new ParticipantRecord();
        copy.id = id;
        copy.callId = callId;
        copy.userId = userId;
        copy.role = role;
        copy.joinedAt = joinedAt;
        copy.leftAt = leftAt;
        return copy;
    }

    @Override
    public String toString() {
        return "ParticipantRecord{callId=" + callId + ", userId=" + userId + ", role=" + role +
               ", joinedAt=" + joinedAt + ", leftAt=" + leftAt + "}";
    }
}
