package org.mendoza.consultation.support;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import org.mendoza.consultation.model.CallSession;
import org.mendoza.consultation.model.ParticipantRole;
import org.mendoza.consultation.notify.LifecycleNotifier;
import org.mendoza.consultation.provider.ProviderEvent;
import org.mendoza.consultation.session.CallTerminationPolicy;
import org.mendoza.consultation.session.RecordingController;
import org.mendoza.consultation.session.VideoCallSessionManager;
import org.mendoza.consultation.session.WriteRetryPolicy;
import org.mendoza.consultation.tracking.ParticipantTracker;

import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Wires the session components by hand against the in-memory doubles.
 */
public class ConsultationFixture implements AutoCloseable {

    public static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");
    private static final Duration AWAIT = Duration.ofSeconds(5);

    public final Vertx vertx;
    public final InMemoryCallStore store;
    public final FakeVideoProvider provider;
    public final RecordingNotifier notifier;
    public final MutableClock clock;
    public final ParticipantTracker tracker;
    public final CallTerminationPolicy policy;
    public final WriteRetryPolicy retryPolicy;
    public final RecordingController recording;
    public final VideoCallSessionManager manager;

    private final boolean ownsVertx;

    public ConsultationFixture(Duration gracePeriod) {
        this(Vertx.vertx(), true, new InMemoryCallStore(), gracePeriod, Duration.ofHours(1));
    }

    public ConsultationFixture(Duration gracePeriod, Duration abandonedCeiling) {
        this(Vertx.vertx(), true, new InMemoryCallStore(), gracePeriod, abandonedCeiling);
    }

    private ConsultationFixture(Vertx vertx, boolean ownsVertx, InMemoryCallStore store,
                                Duration gracePeriod, Duration abandonedCeiling) {
        this.vertx = vertx;
        this.ownsVertx = ownsVertx;
        this.store = store;
        this.provider = new FakeVideoProvider();
        this.notifier = new RecordingNotifier();
        this.clock = new MutableClock(T0);
        this.tracker = new ParticipantTracker(store);
        this.policy = new CallTerminationPolicy(tracker, vertx, gracePeriod, abandonedCeiling);
        this.retryPolicy = new WriteRetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5));
        this.recording = new RecordingController(store, provider, retryPolicy);
        this.manager = newManager(store, notifier);
    }

    /**
     * A second, independent manager instance over the same store, as in a two-node deployment.
     */
    public ConsultationFixture secondInstance() {
        return new ConsultationFixture(vertx, false, store, policy.getGracePeriod(), policy.getAbandonedCeiling());
    }

    private VideoCallSessionManager newManager(InMemoryCallStore store, LifecycleNotifier notifier) {
        return new VideoCallSessionManager(store, tracker, policy, recording, provider, notifier, clock,
            retryPolicy, "https://clinic.test/video-call/");
    }

    /**
     * Appointment ids are UUIDs; tests number them.
     */
    public static String appointment(long n) {
        return String.format("00000000-0000-4000-8000-%012d", n);
    }

    public CallSession schedule(long n) {
        return await(manager.createSession(appointment(n), "doctor-" + n, "patient-" + n, false));
    }

    public boolean join(CallSession session, String userId, ParticipantRole role) {
        return await(manager.handleProviderEvent(ProviderEvent.joined(session.meetingRef, userId, role, clock.instant())));
    }

    public boolean leave(CallSession session, String userId) {
        return await(manager.handleProviderEvent(ProviderEvent.left(session.meetingRef, userId, clock.instant())));
    }

    public CallSession stored(CallSession session) {
        return store.row(session.id).copy();
    }

    public static <T> T await(Uni<T> uni) {
        return uni.await().atMost(AWAIT);
    }

    /**
     * Poll until the condition holds; timers fire on the event loop, so some outcomes arrive later.
     */
    public static void waitUntil(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + AWAIT.toMillis();
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not met within " + AWAIT);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting", e);
            }
        }
    }

    @Override
    public void close() {
        if (ownsVertx) {
            vertx.closeAndAwait();
        }
    }
}
