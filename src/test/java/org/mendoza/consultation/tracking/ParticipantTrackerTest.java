package org.mendoza.consultation.tracking;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mendoza.consultation.model.ParticipantRecord;
import org.mendoza.consultation.model.ParticipantRole;
import org.mendoza.consultation.support.InMemoryCallStore;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mendoza.consultation.support.ConsultationFixture.await;

class ParticipantTrackerTest {

    private static final Long CALL = 7L;
    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private InMemoryCallStore store;
    private ParticipantTracker tracker;

    @BeforeEach
    void setUp() {
        store = new InMemoryCallStore();
        tracker = new ParticipantTracker(store);
    }

    @Test
    @DisplayName("Joins of different users are counted separately")
    void testJoinCountsUsers() {
        await(tracker.addJoin(CALL, "doctor", ParticipantRole.DOCTOR, T0));
        await(tracker.addJoin(CALL, "patient", ParticipantRole.PATIENT, T0.plusSeconds(5)));

        assertEquals(2, await(tracker.activeCount(CALL)));
    }

    @Test
    @DisplayName("Duplicate join closes the previous span before opening a new one")
    void testDuplicateJoinClosesOpenSpan() {
        await(tracker.addJoin(CALL, "patient", ParticipantRole.PATIENT, T0));
        await(tracker.addJoin(CALL, "patient", ParticipantRole.PATIENT, T0.plusSeconds(30)));

        List<ParticipantRecord> spans = await(tracker.spans(CALL));
        assertEquals(2, spans.size());
        assertEquals(T0.plusSeconds(30), spans.get(0).leftAt);
        assertNull(spans.get(1).leftAt);
        assertEquals(1, await(tracker.activeCount(CALL)));
    }

    @Test
    @DisplayName("Leave closes the latest open span")
    void testLeaveClosesSpan() {
        await(tracker.addJoin(CALL, "doctor", ParticipantRole.DOCTOR, T0));

        assertTrue(await(tracker.addLeave(CALL, "doctor", T0.plusSeconds(60))));

        ParticipantRecord span = await(tracker.spans(CALL)).get(0);
        assertEquals(T0.plusSeconds(60), span.leftAt);
        assertEquals(0, await(tracker.activeCount(CALL)));
    }

    @Test
    @DisplayName("Leave without an open span is a no-op")
    void testLeaveWithoutJoin() {
        assertFalse(await(tracker.addLeave(CALL, "ghost", T0)));

        await(tracker.addJoin(CALL, "doctor", ParticipantRole.DOCTOR, T0));
        await(tracker.addLeave(CALL, "doctor", T0.plusSeconds(10)));
        assertFalse(await(tracker.addLeave(CALL, "doctor", T0.plusSeconds(20))));

        assertEquals(0, await(tracker.activeCount(CALL)));
        assertEquals(T0.plusSeconds(10), await(tracker.spans(CALL)).get(0).leftAt);
    }

    @Test
    @DisplayName("A leave stamped before the join never produces leftAt < joinedAt")
    void testLeaveBeforeJoinIsClamped() {
        await(tracker.addJoin(CALL, "patient", ParticipantRole.PATIENT, T0.plusSeconds(10)));
        await(tracker.addLeave(CALL, "patient", T0));

        ParticipantRecord span = await(tracker.spans(CALL)).get(0);
        assertFalse(span.leftAt.isBefore(span.joinedAt));
    }

    @Test
    @DisplayName("Rejoin after a leave creates a distinct span")
    void testRejoinCreatesNewSpan() {
        await(tracker.addJoin(CALL, "patient", ParticipantRole.PATIENT, T0));
        await(tracker.addLeave(CALL, "patient", T0.plusSeconds(5)));
        await(tracker.addJoin(CALL, "patient", ParticipantRole.PATIENT, T0.plusSeconds(8)));

        List<ParticipantRecord> spans = await(tracker.spans(CALL));
        assertEquals(2, spans.size());
        assertNotEquals(spans.get(0).id, spans.get(1).id);
        assertEquals(T0.plusSeconds(5), spans.get(0).leftAt);
        assertTrue(spans.get(1).isOpen());
    }

    @Test
    @DisplayName("Active count never goes negative and matches open spans for random event sequences")
    void testRandomSequencesKeepCountConsistent() {
        Random random = new Random(20260302L);
        String[] users = {"doctor", "patient", "nurse"};

        for (int round = 0; round < 20; round++) {
            Long callId = 100L + round;
            Instant at = T0;
            for (int step = 0; step < 40; step++) {
                String user = users[random.nextInt(users.length)];
                at = at.plusSeconds(random.nextInt(30));
                if (random.nextBoolean()) {
                    await(tracker.addJoin(callId, user, ParticipantRole.OBSERVER, at));
                } else {
                    await(tracker.addLeave(callId, user, at));
                }

                int count = await(tracker.activeCount(callId));
                long open = await(tracker.spans(callId)).stream().filter(ParticipantRecord::isOpen).count();
                assertTrue(count >= 0);
                assertTrue(count <= users.length, "at most one open span per user");
                assertEquals(open, count);
            }
        }
    }

    @Test
    @DisplayName("Close all ends every open span at the given time")
    void testCloseAll() {
        await(tracker.addJoin(CALL, "doctor", ParticipantRole.DOCTOR, T0));
        await(tracker.addJoin(CALL, "patient", ParticipantRole.PATIENT, T0));

        assertEquals(2, await(tracker.closeAll(CALL, T0.plusSeconds(90))));
        assertEquals(0, await(tracker.activeCount(CALL)));
        await(tracker.spans(CALL)).forEach(span -> assertEquals(T0.plusSeconds(90), span.leftAt));
    }

    @Test
    @DisplayName("Last activity is the latest join or leave")
    void testLastActivity() {
        assertNull(await(tracker.lastActivity(CALL)));

        await(tracker.addJoin(CALL, "doctor", ParticipantRole.DOCTOR, T0));
        await(tracker.addLeave(CALL, "doctor", T0.plusSeconds(300)));
        await(tracker.addJoin(CALL, "patient", ParticipantRole.PATIENT, T0.plusSeconds(100)));

        assertEquals(T0.plusSeconds(300), await(tracker.lastActivity(CALL)));
    }

    @Test
    @DisplayName("Active counts are reported per call, including empty calls")
    void testActiveCounts() {
        await(tracker.addJoin(1L, "doctor", ParticipantRole.DOCTOR, T0));
        await(tracker.addJoin(1L, "patient", ParticipantRole.PATIENT, T0));
        await(tracker.addJoin(2L, "doctor", ParticipantRole.DOCTOR, T0));

        Map<Long, Integer> counts = await(tracker.activeCounts(List.of(1L, 2L, 3L)));
        assertEquals(2, counts.get(1L));
        assertEquals(1, counts.get(2L));
        assertEquals(0, counts.get(3L));
    }
}
