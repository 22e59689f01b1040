package org.mendoza.consultation.session;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.mendoza.consultation.model.CallSession;
import org.mendoza.consultation.model.CallStatus;
import org.mendoza.consultation.tracking.ParticipantTracker;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides when an ongoing call is over and owns the grace timers that delay that decision.
 */
@ApplicationScoped
public class CallTerminationPolicy {

    private static final Logger LOG = Logger.getLogger(CallTerminationPolicy.class);

    private final ParticipantTracker tracker;
    private final Vertx vertx;
    private final Duration gracePeriod;
    private final Duration abandonedCeiling;

    private final ConcurrentHashMap<Long, PendingTermination> pendingTerminations = new ConcurrentHashMap<>();

    @Inject
    public CallTerminationPolicy(ParticipantTracker tracker,
                                 Vertx vertx,
                                 @ConfigProperty(name = "consultation.termination.grace-period", defaultValue = "PT10S") Duration gracePeriod,
                                 @ConfigProperty(name = "consultation.termination.abandoned-ceiling", defaultValue = "PT1H") Duration abandonedCeiling) {
        this.tracker = tracker;
        this.vertx = vertx;
        this.gracePeriod = gracePeriod;
        this.abandonedCeiling = abandonedCeiling;
    }

    /**
     * True iff the session is ongoing and no stored span is open.
     */
    public Uni<Boolean> shouldTerminate(CallSession session) {
        if (session.status != CallStatus.ONGOING) {
            return Uni.createFrom().item(false);
        }
        return tracker.activeCount(session.id)
            .onItem().transform(count -> {
                LOG.debugf("Call %d has %d active participant(s)", session.id, count);
                return count == 0;
            });
    }

    /**
     * Arm the grace timer for a session, replacing any timer already armed for it.
     * Returns false without arming anything when the grace period is zero; the caller terminates at once.
     */
    public boolean scheduleTermination(Long sessionId, Runnable onExpiry) {
        if (gracePeriod.isZero() || gracePeriod.isNegative()) {
            return false;
        }
        PendingTermination pending = new PendingTermination();
        PendingTermination previous = pendingTerminations.put(sessionId, pending);
        if (previous != null) {
            vertx.cancelTimer(previous.timerId);
        }
        pending.timerId = vertx.setTimer(gracePeriod.toMillis(), timerId -> {
            // only the timer that is still registered may fire
            if (pendingTerminations.remove(sessionId, pending)) {
                LOG.debugf("Grace period elapsed for call %d", sessionId);
                onExpiry.run();
            }
        });
        LOG.debugf("Termination of call %d scheduled in %s", sessionId, gracePeriod);
        return true;
    }

    /**
     * Abort a pending termination. Emits true when a timer was actually cancelled.
     */
    public boolean cancelPending(Long sessionId) {
        PendingTermination pending = pendingTerminations.remove(sessionId);
        if (pending == null) {
            return false;
        }
        vertx.cancelTimer(pending.timerId);
        LOG.infof("Pending termination of call %d cancelled", sessionId);
        return true;
    }

    public boolean hasPending(Long sessionId) {
        return pendingTerminations.containsKey(sessionId);
    }

    public Duration getGracePeriod() {
        return gracePeriod;
    }

    public Duration getAbandonedCeiling() {
        return abandonedCeiling;
    }

    /**
     * Whole minutes between start and end, rounded half up. Null when either end is missing.
     */
    public static Integer durationMinutes(Instant startedAt, Instant endedAt) {
        if (startedAt == null || endedAt == null) {
            return null;
        }
        long millis = Math.max(0, Duration.between(startedAt, endedAt).toMillis());
        return (int) Math.round(millis / 60000.0);
    }

    /**
     * An ongoing call with nobody in it and no participant activity for longer than the ceiling.
     */
    public Uni<Boolean> isAbandoned(CallSession session, Instant now) {
        if (session.status != CallStatus.ONGOING) {
            return Uni.createFrom().item(false);
        }
        return tracker.activeCount(session.id)
            .chain(count -> {
                if (count > 0) {
                    return Uni.createFrom().item(false);
                }
                return tracker.lastActivity(session.id)
                    .onItem().transform(lastActivity -> {
                        Instant reference = lastActivity != null ? lastActivity
                            : session.startedAt != null ? session.startedAt : session.createdAt;
                        return reference == null || !reference.plus(abandonedCeiling).isAfter(now);
                    });
            });
    }

    private static class PendingTermination {
        volatile long timerId;
    }
}
