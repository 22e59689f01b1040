package org.mendoza.consultation.session;

import java.time.Instant;

/**
 * A session completed in memory whose terminal write has not reached the store yet.
 * The ended notification is held back until it does.
 */
class PendingFinalization {
    final Long sessionId;
    final Instant endedAt;
    final Integer durationMinutes;
    final FinalizeReason reason;
    int attempts;

    PendingFinalization(Long sessionId, Instant endedAt, Integer durationMinutes, FinalizeReason reason, int attempts) {
        this.sessionId = sessionId;
        this.endedAt = endedAt;
        this.durationMinutes = durationMinutes;
        this.reason = reason;
        this.attempts = attempts;
    }

    @Override
    public String toString() {
        return "PendingFinalization{sessionId=" + sessionId + ", endedAt=" + endedAt + ", reason=" + reason +
               ", attempts=" + attempts + "}";
    }
}
