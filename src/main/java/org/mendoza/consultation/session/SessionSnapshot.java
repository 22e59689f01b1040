package org.mendoza.consultation.session;

import org.mendoza.consultation.model.CallSession;
import org.mendoza.consultation.model.ParticipantRecord;

import java.util.List;

/**
 * Read-side view of one session: the stored row, its open span count and, for detail views, every span.
 */
public class SessionSnapshot {
    public final CallSession session;
    public final int activeParticipants;
    public final List<ParticipantRecord> spans;

    public SessionSnapshot(CallSession session, int activeParticipants, List<ParticipantRecord> spans) {
        this.session = session;
        this.activeParticipants = activeParticipants;
        this.spans = spans;
    }
}
