package org.mendoza.consultation.store;

import io.smallrye.mutiny.Uni;
import org.mendoza.consultation.model.Appointment;
import org.mendoza.consultation.model.CallSession;
import org.mendoza.consultation.model.CallStatus;
import org.mendoza.consultation.model.ParticipantRecord;
import org.mendoza.consultation.model.ParticipantRole;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Durable source of truth for call sessions and participant spans.
 * All operations are lazy: nothing touches the backend until the returned {@link Uni} is subscribed,
 * and re-subscribing repeats the operation.
 * Lookups emit {@code null} when the row does not exist.
 */
public interface CallStore {

    /**
     * Create tables and indexes if they are missing. Safe to call repeatedly.
     */
    Uni<Void> initialize();

    /**
     * Insert a new {@code scheduled} session and return it with its generated id.
     * Fails with {@link DuplicateSessionException} when the appointment already has an active session.
     */
    Uni<CallSession> insertSession(CallSession session);

    Uni<CallSession> findById(Long id);

    Uni<CallSession> findByMeetingRef(String meetingRef);

    /**
     * The {@code scheduled} or {@code ongoing} session of an appointment, if any.
     */
    Uni<CallSession> findActiveByAppointment(String appointmentId);

    Uni<List<CallSession>> findByStatus(CallStatus status);

    Uni<List<CallSession>> findRecent(int limit);

    Uni<List<CallSession>> findNeedingReconciliation();

    Uni<Map<CallStatus, Long>> countByStatus();

    /**
     * {@code scheduled -> ongoing}; keeps an existing {@code started_at}.
     * Emits false when the stored status was not {@code scheduled}.
     */
    Uni<Boolean> markOngoing(Long id, Instant startedAt);

    /**
     * Compare-and-set {@code ongoing -> completed}. Also clears the recording and reconciliation flags.
     * Emits true only for the single writer that observed {@code ongoing}.
     */
    Uni<Boolean> completeIfOngoing(Long id, Instant endedAt, Integer durationMinutes);

    /**
     * Compare-and-set {@code scheduled -> cancelled}.
     */
    Uni<Boolean> cancelIfScheduled(Long id, Instant endedAt);

    /**
     * Fill {@code ended_at} / {@code duration_minutes} on a terminal row written by someone else.
     */
    Uni<Boolean> fillEndedFields(Long id, Instant endedAt, Integer durationMinutes);

    /**
     * Set the recording flag; only applies while the session is {@code ongoing}.
     */
    Uni<Boolean> updateRecording(Long id, boolean recording);

    Uni<Void> setNeedsReconciliation(Long id, boolean needsReconciliation);

    Uni<ParticipantRecord> openSpan(Long callId, String userId, ParticipantRole role, Instant joinedAt);

    /**
     * Close every open span of one user. {@code left_at} never precedes {@code joined_at}.
     */
    Uni<Integer> closeOpenSpans(Long callId, String userId, Instant leftAt);

    /**
     * Close the most recent open span of one user; emits false when none was open.
     */
    Uni<Boolean> closeLatestOpenSpan(Long callId, String userId, Instant leftAt);

    Uni<Integer> closeAllOpenSpans(Long callId, Instant leftAt);

    Uni<Integer> countOpenSpans(Long callId);

    Uni<Map<Long, Integer>> countOpenSpans(List<Long> callIds);

    Uni<List<ParticipantRecord>> findSpans(Long callId);

    Uni<Appointment> findAppointment(String appointmentId);
}
