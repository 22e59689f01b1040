package org.mendoza.consultation.store;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.pgclient.PgPool;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.RowSet;
import io.vertx.mutiny.sqlclient.Tuple;
import io.vertx.pgclient.PgException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.mendoza.consultation.model.Appointment;
import org.mendoza.consultation.model.CallSession;
import org.mendoza.consultation.model.CallStatus;
import org.mendoza.consultation.model.ParticipantRecord;
import org.mendoza.consultation.model.ParticipantRole;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link CallStore} over the reactive PostgreSQL client.
 */
@ApplicationScoped
public class PgCallStore implements CallStore {

    private static final Logger LOG = Logger.getLogger(PgCallStore.class);

    private static final String UNIQUE_VIOLATION = "23505";

    private static final String SESSION_COLUMNS = """
        id, appointment_id, doctor_id, patient_id, status, meeting_ref, call_link,
        started_at, ended_at, duration_minutes, is_recording, recording_requested,
        needs_reconciliation, created_at
        """;

    private static final String SPAN_COLUMNS = "id, video_call_id, user_id, role, joined_at, left_at";

    private final PgPool client;
    private final boolean createSchema;
    private final Uni<Void> initialization;

    @Inject
    public PgCallStore(PgPool client,
                       @ConfigProperty(name = "consultation.store.create-schema", defaultValue = "true") boolean createSchema) {
        this.client = client;
        this.createSchema = createSchema;
        this.initialization = Uni.createFrom().deferred(this::createSchemaIfEnabled)
            .memoize().indefinitely();
    }

    @Override
    public Uni<Void> initialize() {
        return initialization;
    }

    private Uni<Void> createSchemaIfEnabled() {
        if (!createSchema) {
            LOG.info("Schema creation disabled, assuming video_calls tables exist");
            return Uni.createFrom().voidItem();
        }

        String sql = """
            CREATE TABLE IF NOT EXISTS video_calls (
                id BIGSERIAL PRIMARY KEY,
                appointment_id TEXT NOT NULL,
                doctor_id TEXT,
                patient_id TEXT,
                status TEXT NOT NULL DEFAULT 'scheduled'
                    CHECK (status IN ('scheduled', 'ongoing', 'completed', 'cancelled')),
                meeting_ref TEXT NOT NULL UNIQUE,
                call_link TEXT,
                started_at TIMESTAMPTZ,
                ended_at TIMESTAMPTZ,
                duration_minutes INTEGER,
                is_recording BOOLEAN NOT NULL DEFAULT FALSE,
                recording_requested BOOLEAN NOT NULL DEFAULT FALSE,
                needs_reconciliation BOOLEAN NOT NULL DEFAULT FALSE,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                CHECK (ended_at IS NULL OR status IN ('completed', 'cancelled')),
                CHECK (duration_minutes IS NULL OR ended_at IS NOT NULL)
            );

            -- at most one live call per appointment
            CREATE UNIQUE INDEX IF NOT EXISTS video_calls_active_appointment_idx
                ON video_calls (appointment_id)
                WHERE status IN ('scheduled', 'ongoing');

            CREATE TABLE IF NOT EXISTS video_call_participants (
                id BIGSERIAL PRIMARY KEY,
                video_call_id BIGINT NOT NULL REFERENCES video_calls (id) ON DELETE CASCADE,
                user_id TEXT NOT NULL,
                role TEXT NOT NULL,
                joined_at TIMESTAMPTZ NOT NULL,
                left_at TIMESTAMPTZ,
                CHECK (left_at IS NULL OR left_at >= joined_at)
            );

            CREATE INDEX IF NOT EXISTS video_call_participants_open_idx
                ON video_call_participants (video_call_id, user_id)
                WHERE left_at IS NULL;
            """;

        return client.query(sql).execute()
            .onItem().invoke(rows -> LOG.info("video_calls schema verified/created"))
            .onFailure().invoke(failure ->
                LOG.error("Failed to create video_calls schema: " + failure.getMessage(), failure))
            .replaceWithVoid();
    }

    @Override
    public Uni<CallSession> insertSession(CallSession session) {
        String sql = """
            INSERT INTO video_calls (appointment_id, doctor_id, patient_id, status, meeting_ref,
                                     call_link, recording_requested, created_at)
            VALUES ($1, $2, $3, 'scheduled', $4, $5, $6, $7)
            RETURNING
            """ + SESSION_COLUMNS;

        Tuple params = Tuple.tuple()
            .addValue(session.appointmentId)
            .addValue(session.doctorId)
            .addValue(session.patientId)
            .addValue(session.meetingRef)
            .addValue(session.callLink)
            .addValue(session.recordingRequested)
            .addValue(timestamp(session.createdAt));

        return client.preparedQuery(sql).execute(params)
            .onItem().transform(rows -> toSession(rows.iterator().next()))
            .onFailure(this::isUniqueViolation)
            .transform(failure -> new DuplicateSessionException(session.appointmentId, failure));
    }

    private boolean isUniqueViolation(Throwable failure) {
        return failure instanceof PgException
            && UNIQUE_VIOLATION.equals(((PgException) failure).getSqlState());
    }

    @Override
    public Uni<CallSession> findById(Long id) {
        return selectOne("SELECT " + SESSION_COLUMNS + " FROM video_calls WHERE id = $1", Tuple.of(id));
    }

    @Override
    public Uni<CallSession> findByMeetingRef(String meetingRef) {
        return selectOne("SELECT " + SESSION_COLUMNS + " FROM video_calls WHERE meeting_ref = $1",
            Tuple.of(meetingRef));
    }

    @Override
    public Uni<CallSession> findActiveByAppointment(String appointmentId) {
        String sql = "SELECT " + SESSION_COLUMNS + """
             FROM video_calls
            WHERE appointment_id = $1 AND status IN ('scheduled', 'ongoing')
            ORDER BY created_at DESC
            LIMIT 1
            """;
        return selectOne(sql, Tuple.of(appointmentId));
    }

    @Override
    public Uni<List<CallSession>> findByStatus(CallStatus status) {
        return selectMany("SELECT " + SESSION_COLUMNS + " FROM video_calls WHERE status = $1",
            Tuple.of(status.dbValue()));
    }

    @Override
    public Uni<List<CallSession>> findRecent(int limit) {
        return selectMany("SELECT " + SESSION_COLUMNS + " FROM video_calls ORDER BY created_at DESC, id DESC LIMIT $1",
            Tuple.of(limit));
    }

    @Override
    public Uni<List<CallSession>> findNeedingReconciliation() {
        return selectMany("SELECT " + SESSION_COLUMNS + " FROM video_calls WHERE needs_reconciliation",
            Tuple.tuple());
    }

    @Override
    public Uni<Map<CallStatus, Long>> countByStatus() {
        return client.query("SELECT status, COUNT(*) AS total FROM video_calls GROUP BY status").execute()
            .onItem().transform(rows -> {
                Map<CallStatus, Long> counts = new EnumMap<>(CallStatus.class);
                for (CallStatus status : CallStatus.values()) {
                    counts.put(status, 0L);
                }
                for (Row row : rows) {
                    counts.put(CallStatus.fromDb(row.getString("status")), row.getLong("total"));
                }
                return counts;
            });
    }

    @Override
    public Uni<Boolean> markOngoing(Long id, Instant startedAt) {
        String sql = """
            UPDATE video_calls
               SET status = 'ongoing', started_at = COALESCE(started_at, $2)
             WHERE id = $1 AND status = 'scheduled'
            """;
        return update(sql, Tuple.of(id, timestamp(startedAt)));
    }

    @Override
    public Uni<Boolean> completeIfOngoing(Long id, Instant endedAt, Integer durationMinutes) {
        String sql = """
            UPDATE video_calls
               SET status = 'completed', ended_at = $2, duration_minutes = $3,
                   is_recording = FALSE, needs_reconciliation = FALSE
             WHERE id = $1 AND status = 'ongoing'
            """;
        return update(sql, Tuple.of(id, timestamp(endedAt), durationMinutes));
    }

    @Override
    public Uni<Boolean> cancelIfScheduled(Long id, Instant endedAt) {
        String sql = """
            UPDATE video_calls
               SET status = 'cancelled', ended_at = $2, is_recording = FALSE
             WHERE id = $1 AND status = 'scheduled'
            """;
        return update(sql, Tuple.of(id, timestamp(endedAt)));
    }

    @Override
    public Uni<Boolean> fillEndedFields(Long id, Instant endedAt, Integer durationMinutes) {
        String sql = """
            UPDATE video_calls
               SET ended_at = COALESCE(ended_at, $2),
                   duration_minutes = COALESCE(duration_minutes, $3),
                   is_recording = FALSE
             WHERE id = $1 AND status IN ('completed', 'cancelled')
               AND (ended_at IS NULL OR (duration_minutes IS NULL AND $3::INTEGER IS NOT NULL) OR is_recording)
            """;
        return update(sql, Tuple.of(id, timestamp(endedAt), durationMinutes));
    }

    @Override
    public Uni<Boolean> updateRecording(Long id, boolean recording) {
        return update("UPDATE video_calls SET is_recording = $2 WHERE id = $1 AND status = 'ongoing'",
            Tuple.of(id, recording));
    }

    @Override
    public Uni<Void> setNeedsReconciliation(Long id, boolean needsReconciliation) {
        return update("UPDATE video_calls SET needs_reconciliation = $2 WHERE id = $1",
            Tuple.of(id, needsReconciliation))
            .replaceWithVoid();
    }

    @Override
    public Uni<ParticipantRecord> openSpan(Long callId, String userId, ParticipantRole role, Instant joinedAt) {
        String sql = """
            INSERT INTO video_call_participants (video_call_id, user_id, role, joined_at)
            VALUES ($1, $2, $3, $4)
            RETURNING
            """ + SPAN_COLUMNS;
        return client.preparedQuery(sql).execute(Tuple.of(callId, userId, role.dbValue(), timestamp(joinedAt)))
            .onItem().transform(rows -> toSpan(rows.iterator().next()));
    }

    @Override
    public Uni<Integer> closeOpenSpans(Long callId, String userId, Instant leftAt) {
        String sql = """
            UPDATE video_call_participants
               SET left_at = GREATEST(joined_at, $3)
             WHERE video_call_id = $1 AND user_id = $2 AND left_at IS NULL
            """;
        return client.preparedQuery(sql).execute(Tuple.of(callId, userId, timestamp(leftAt)))
            .onItem().transform(RowSet::rowCount);
    }

    @Override
    public Uni<Boolean> closeLatestOpenSpan(Long callId, String userId, Instant leftAt) {
        String sql = """
            UPDATE video_call_participants
               SET left_at = GREATEST(joined_at, $3)
             WHERE id = (SELECT id FROM video_call_participants
                          WHERE video_call_id = $1 AND user_id = $2 AND left_at IS NULL
                          ORDER BY joined_at DESC, id DESC
                          LIMIT 1)
            """;
        return update(sql, Tuple.of(callId, userId, timestamp(leftAt)));
    }

    @Override
    public Uni<Integer> closeAllOpenSpans(Long callId, Instant leftAt) {
        String sql = """
            UPDATE video_call_participants
               SET left_at = GREATEST(joined_at, $2)
             WHERE video_call_id = $1 AND left_at IS NULL
            """;
        return client.preparedQuery(sql).execute(Tuple.of(callId, timestamp(leftAt)))
            .onItem().transform(RowSet::rowCount);
    }

    @Override
    public Uni<Integer> countOpenSpans(Long callId) {
        String sql = "SELECT COUNT(*) AS active FROM video_call_participants WHERE video_call_id = $1 AND left_at IS NULL";
        return client.preparedQuery(sql).execute(Tuple.of(callId))
            .onItem().transform(rows -> rows.iterator().next().getLong("active").intValue());
    }

    @Override
    public Uni<Map<Long, Integer>> countOpenSpans(List<Long> callIds) {
        if (callIds.isEmpty()) {
            return Uni.createFrom().item(Map.of());
        }
        String sql = """
            SELECT video_call_id, COUNT(*) AS active
              FROM video_call_participants
             WHERE left_at IS NULL AND video_call_id = ANY($1)
             GROUP BY video_call_id
            """;
        return client.preparedQuery(sql).execute(Tuple.of(callIds.toArray(new Long[0])))
            .onItem().transform(rows -> {
                Map<Long, Integer> counts = new HashMap<>();
                callIds.forEach(id -> counts.put(id, 0));
                for (Row row : rows) {
                    counts.put(row.getLong("video_call_id"), row.getLong("active").intValue());
                }
                return counts;
            });
    }

    @Override
    public Uni<List<ParticipantRecord>> findSpans(Long callId) {
        String sql = "SELECT " + SPAN_COLUMNS + " FROM video_call_participants WHERE video_call_id = $1 ORDER BY joined_at, id";
        return client.preparedQuery(sql).execute(Tuple.of(callId))
            .onItem().transform(rows -> {
                List<ParticipantRecord> spans = new ArrayList<>();
                for (Row row : rows) {
                    spans.add(toSpan(row));
                }
                return spans;
            });
    }

    @Override
    public Uni<Appointment> findAppointment(String appointmentId) {
        return client.preparedQuery("SELECT id::text AS id, status FROM appointments WHERE id::text = $1")
            .execute(Tuple.of(appointmentId))
            .onItem().transform(rows -> {
                for (Row row : rows) {
                    return new Appointment(row.getString("id"), row.getString("status"));
                }
                return null;
            });
    }

    private Uni<CallSession> selectOne(String sql, Tuple params) {
        return client.preparedQuery(sql).execute(params)
            .onItem().transform(rows -> {
                for (Row row : rows) {
                    return toSession(row);
                }
                return null;
            });
    }

    private Uni<List<CallSession>> selectMany(String sql, Tuple params) {
        return client.preparedQuery(sql).execute(params)
            .onItem().transform(rows -> {
                List<CallSession> sessions = new ArrayList<>();
                for (Row row : rows) {
                    sessions.add(toSession(row));
                }
                return sessions;
            });
    }

    private Uni<Boolean> update(String sql, Tuple params) {
        return client.preparedQuery(sql).execute(params)
            .onItem().transform(rows -> rows.rowCount() > 0);
    }

    private CallSession toSession(Row row) {
        CallSession session = new CallSession();
        session.id = row.getLong("id");
        session.appointmentId = row.getString("appointment_id");
        session.doctorId = row.getString("doctor_id");
        session.patientId = row.getString("patient_id");
        session.status = CallStatus.fromDb(row.getString("status"));
        session.meetingRef = row.getString("meeting_ref");
        session.callLink = row.getString("call_link");
        session.startedAt = instant(row, "started_at");
        session.endedAt = instant(row, "ended_at");
        session.durationMinutes = row.getInteger("duration_minutes");
        session.isRecording = Boolean.TRUE.equals(row.getBoolean("is_recording"));
        session.recordingRequested = Boolean.TRUE.equals(row.getBoolean("recording_requested"));
        session.needsReconciliation = Boolean.TRUE.equals(row.getBoolean("needs_reconciliation"));
        session.createdAt = instant(row, "created_at");
        return session;
    }

    private ParticipantRecord toSpan(Row row) {
        ParticipantRecord span = new ParticipantRecord();
        span.id = row.getLong("id");
        span.callId = row.getLong("video_call_id");
        span.userId = row.getString("user_id");
        span.role = ParticipantRole.fromDb(row.getString("role"));
        span.joinedAt = instant(row, "joined_at");
        span.leftAt = instant(row, "left_at");
        return span;
    }

    private static Instant instant(Row row, String column) {
        OffsetDateTime value = row.getOffsetDateTime(column);
        return value != null ? value.toInstant() : null;
    }

    private static OffsetDateTime timestamp(Instant instant) {
        return instant != null ? OffsetDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }
}
