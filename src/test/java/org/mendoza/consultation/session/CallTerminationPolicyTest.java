package org.mendoza.consultation.session;

import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mendoza.consultation.model.CallSession;
import org.mendoza.consultation.model.CallStatus;
import org.mendoza.consultation.model.ParticipantRole;
import org.mendoza.consultation.support.InMemoryCallStore;
import org.mendoza.consultation.tracking.ParticipantTracker;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mendoza.consultation.support.ConsultationFixture.await;
import static org.mendoza.consultation.support.ConsultationFixture.waitUntil;

class CallTerminationPolicyTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private Vertx vertx;
    private InMemoryCallStore store;
    private ParticipantTracker tracker;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        store = new InMemoryCallStore();
        tracker = new ParticipantTracker(store);
    }

    @AfterEach
    void tearDown() {
        vertx.closeAndAwait();
    }

    private CallTerminationPolicy policy(Duration grace) {
        return new CallTerminationPolicy(tracker, vertx, grace, Duration.ofHours(1));
    }

    private CallSession session(Long id, CallStatus status) {
        CallSession session = new CallSession();
        session.id = id;
        session.appointmentId = "appointment-" + id;
        session.status = status;
        session.startedAt = T0;
        return session;
    }

    @Test
    @DisplayName("Terminates only an ongoing call with no open spans")
    void testShouldTerminate() {
        CallTerminationPolicy policy = policy(Duration.ZERO);

        assertTrue(await(policy.shouldTerminate(session(1L, CallStatus.ONGOING))));
        assertFalse(await(policy.shouldTerminate(session(1L, CallStatus.SCHEDULED))));
        assertFalse(await(policy.shouldTerminate(session(1L, CallStatus.COMPLETED))));

        await(tracker.addJoin(1L, "doctor", ParticipantRole.DOCTOR, T0));
        assertFalse(await(policy.shouldTerminate(session(1L, CallStatus.ONGOING))));
    }

    @Test
    @DisplayName("Duration is rounded to whole minutes")
    void testDurationRounding() {
        assertEquals(1, CallTerminationPolicy.durationMinutes(T0, T0.plusSeconds(89)));
        assertEquals(2, CallTerminationPolicy.durationMinutes(T0, T0.plusSeconds(90)));
        assertEquals(0, CallTerminationPolicy.durationMinutes(T0, T0.plusSeconds(29)));
        assertEquals(45, CallTerminationPolicy.durationMinutes(T0, T0.plus(Duration.ofMinutes(45))));
        assertEquals(0, CallTerminationPolicy.durationMinutes(T0, T0.minusSeconds(120)));
        assertNull(CallTerminationPolicy.durationMinutes(null, T0));
        assertNull(CallTerminationPolicy.durationMinutes(T0, null));
    }

    @Test
    @DisplayName("Zero grace period arms no timer")
    void testZeroGraceDoesNotSchedule() {
        CallTerminationPolicy policy = policy(Duration.ZERO);

        assertFalse(policy.scheduleTermination(1L, () -> fail("must not fire")));
        assertFalse(policy.hasPending(1L));
    }

    @Test
    @DisplayName("Grace timer fires once after the grace period")
    void testGraceTimerFires() {
        CallTerminationPolicy policy = policy(Duration.ofMillis(50));
        AtomicInteger fired = new AtomicInteger();

        assertTrue(policy.scheduleTermination(1L, fired::incrementAndGet));
        assertTrue(policy.hasPending(1L));

        waitUntil(() -> fired.get() == 1);
        assertFalse(policy.hasPending(1L));
    }

    @Test
    @DisplayName("Cancelled grace timer never fires")
    void testCancelPending() throws InterruptedException {
        CallTerminationPolicy policy = policy(Duration.ofMillis(100));
        AtomicInteger fired = new AtomicInteger();

        policy.scheduleTermination(1L, fired::incrementAndGet);
        assertTrue(policy.cancelPending(1L));
        assertFalse(policy.cancelPending(1L));

        Thread.sleep(250);
        assertEquals(0, fired.get());
    }

    @Test
    @DisplayName("Rescheduling replaces the previous timer")
    void testRescheduleReplacesTimer() throws InterruptedException {
        CallTerminationPolicy policy = policy(Duration.ofMillis(50));
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();

        policy.scheduleTermination(1L, first::incrementAndGet);
        policy.scheduleTermination(1L, second::incrementAndGet);

        waitUntil(() -> second.get() == 1);
        Thread.sleep(100);
        assertEquals(0, first.get());
    }

    @Test
    @DisplayName("Abandoned only after the ceiling has passed with nobody present")
    void testIsAbandoned() {
        CallTerminationPolicy policy = new CallTerminationPolicy(tracker, vertx, Duration.ZERO, Duration.ofMinutes(60));
        CallSession session = session(3L, CallStatus.ONGOING);

        await(tracker.addJoin(3L, "doctor", ParticipantRole.DOCTOR, T0));
        assertFalse(await(policy.isAbandoned(session, T0.plus(Duration.ofHours(5)))), "someone is still present");

        await(tracker.addLeave(3L, "doctor", T0.plus(Duration.ofMinutes(10))));
        assertFalse(await(policy.isAbandoned(session, T0.plus(Duration.ofMinutes(69)))));
        assertTrue(await(policy.isAbandoned(session, T0.plus(Duration.ofMinutes(70)))));

        session.status = CallStatus.COMPLETED;
        assertFalse(await(policy.isAbandoned(session, T0.plus(Duration.ofHours(5)))));
    }

    @Test
    @DisplayName("A call that never had participants is measured from its start")
    void testAbandonedWithoutSpans() {
        CallTerminationPolicy policy = new CallTerminationPolicy(tracker, vertx, Duration.ZERO, Duration.ofMinutes(30));
        CallSession session = session(4L, CallStatus.ONGOING);

        assertFalse(await(policy.isAbandoned(session, T0.plus(Duration.ofMinutes(29)))));
        assertTrue(await(policy.isAbandoned(session, T0.plus(Duration.ofMinutes(30)))));
    }
}
