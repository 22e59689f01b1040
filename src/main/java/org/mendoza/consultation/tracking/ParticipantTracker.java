package org.mendoza.consultation.tracking;

import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.mendoza.consultation.model.ParticipantRecord;
import org.mendoza.consultation.model.ParticipantRole;
import org.mendoza.consultation.store.CallStore;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only log of presence spans per call.
 *
 * Counts are always read back from the store: several clients report joins and leaves
 * for the same call, so nothing held in this JVM is authoritative.
 */
@ApplicationScoped
public class ParticipantTracker {

    private static final Logger LOG = Logger.getLogger(ParticipantTracker.class);

    private final CallStore store;

    @Inject
    public ParticipantTracker(CallStore store) {
        this.store = store;
    }

    /**
     * Open a new span. Any span the user still has open in this call is closed at {@code at} first,
     * which absorbs duplicate joins and missed leaves.
     */
    public Uni<ParticipantRecord> addJoin(Long callId, String userId, ParticipantRole role, Instant at) {
        return store.closeOpenSpans(callId, userId, at)
            .onItem().invoke(closed -> {
                if (closed > 0) {
                    LOG.debugf("Closed %d stale span(s) of %s in call %d before rejoin", closed, userId, callId);
                }
            })
            .chain(closed -> store.openSpan(callId, userId, role, at))
            .onItem().invoke(span -> LOG.debugf("Span opened: %s", span));
    }

    /**
     * Close the latest open span of the user. Emits false when nothing was open.
     */
    public Uni<Boolean> addLeave(Long callId, String userId, Instant at) {
        return store.closeLatestOpenSpan(callId, userId, at)
            .onItem().invoke(closed -> {
                if (!closed) {
                    LOG.debugf("Ignoring leave of %s in call %d: no open span", userId, callId);
                }
            });
    }

    public Uni<Integer> activeCount(Long callId) {
        return store.countOpenSpans(callId);
    }

    public Uni<Map<Long, Integer>> activeCounts(List<Long> callIds) {
        return store.countOpenSpans(callIds);
    }

    public Uni<Integer> closeAll(Long callId, Instant at) {
        return store.closeAllOpenSpans(callId, at);
    }

    public Uni<List<ParticipantRecord>> spans(Long callId) {
        return store.findSpans(callId);
    }

    /**
     * Latest join or leave recorded for the call, or null when it has no spans.
     */
    public Uni<Instant> lastActivity(Long callId) {
        return store.findSpans(callId)
            .onItem().transform(spans -> {
                Instant latest = null;
                for (ParticipantRecord span : spans) {
                    latest = later(latest, span.joinedAt);
                    latest = later(latest, span.leftAt);
                }
                return latest;
            });
    }

    private static Instant later(Instant current, Instant candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null || candidate.isAfter(current) ? candidate : current;
    }
}
