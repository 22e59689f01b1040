package org.mendoza.consultation.sync;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.mendoza.consultation.session.VideoCallSessionManager;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Feeds store-side changes into the session manager.
 *
 * <p>Bursts on the same row are coalesced within the debounce window and only the latest
 * change is forwarded. Every (re)connect triggers a full reconciliation, because notifications sent
 * while the LISTEN connection was down are lost.
 */
@ApplicationScoped
public class RealtimeSyncBridge implements ChangeFeedListener {

    private static final Logger LOG = Logger.getLogger(RealtimeSyncBridge.class);

    private final ChangeFeed changeFeed;
    private final VideoCallSessionManager sessionManager;
    private final Vertx vertx;
    private final boolean enabled;
    private final Duration debounce;

    // coalescing key -> change waiting for its debounce timer
    private final ConcurrentHashMap<String, PendingDispatch> pendingDispatches = new ConcurrentHashMap<>();

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong dispatched = new AtomicLong();
    private final AtomicLong coalesced = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong connects = new AtomicLong();
    private final AtomicLong disconnects = new AtomicLong();
    private final AtomicLong reconciliations = new AtomicLong();

    @Inject
    public RealtimeSyncBridge(ChangeFeed changeFeed,
                              VideoCallSessionManager sessionManager,
                              Vertx vertx,
                              @ConfigProperty(name = "consultation.sync.enabled", defaultValue = "true") boolean enabled,
                              @ConfigProperty(name = "consultation.sync.debounce", defaultValue = "PT0.25S") Duration debounce) {
        this.changeFeed = changeFeed;
        this.sessionManager = sessionManager;
        this.vertx = vertx;
        this.enabled = enabled;
        this.debounce = debounce;
    }

    void onStart(@Observes StartupEvent ev) {
        if (!enabled) {
            LOG.info("Change-feed sync disabled");
            return;
        }
        start().subscribe().with(
            v -> LOG.info("✅ Change-feed sync started"),
            failure -> LOG.error("❌ Failed to start change-feed sync: " + failure.getMessage(), failure)
        );
    }

    void onShutdown(@Observes ShutdownEvent ev) {
        stop();
    }

    public Uni<Void> start() {
        return changeFeed.start(this);
    }

    public void stop() {
        changeFeed.stop();
        dropPendingDispatches();
    }

    @Override
    public void onConnected() {
        long count = connects.incrementAndGet();
        // buffered changes predate the gap; the full pass supersedes them
        dropPendingDispatches();
        LOG.infof("Change-feed connected (#%d), reconciling all calls", count);
        sessionManager.reconcileAll().subscribe().with(
            reconciled -> reconciliations.incrementAndGet(),
            failure -> {
                failures.incrementAndGet();
                LOG.error("❌ Reconciliation after connect failed: " + failure.getMessage(), failure);
            }
        );
    }

    @Override
    public void onDisconnected() {
        disconnects.incrementAndGet();
        LOG.warn("Change-feed disconnected, a full reconciliation will run on reconnect");
    }

    @Override
    public void onPayload(String payload) {
        received.incrementAndGet();
        ChangeFeedEvent event;
        try {
            event = ChangeFeedEvent.parse(payload);
        } catch (IllegalArgumentException e) {
            malformed.incrementAndGet();
            LOG.warnf("Dropping change-feed payload: %s", e.getMessage());
            return;
        }
        if (event == null) {
            LOG.debugf("Change on unwatched table: %s", payload);
            return;
        }
        submit(event);
    }

    private void submit(ChangeFeedEvent event) {
        if (debounce.isZero() || debounce.isNegative()) {
            dispatch(event);
            return;
        }
        pendingDispatches.compute(event.coalescingKey(), (key, existing) -> {
            if (existing != null) {
                existing.latest = event;
                coalesced.incrementAndGet();
                return existing;
            }
            PendingDispatch pending = new PendingDispatch(event);
            pending.timerId = vertx.setTimer(debounce.toMillis(), timerId -> flush(key, pending));
            return pending;
        });
    }

    private void flush(String key, PendingDispatch pending) {
        if (pendingDispatches.remove(key, pending)) {
            dispatch(pending.latest);
        }
    }

    private void dispatch(ChangeFeedEvent event) {
        sessionManager.handleChangeFeedEvent(event).subscribe().with(
            v -> {
                dispatched.incrementAndGet();
                LOG.debugf("Applied %s", event);
            },
            failure -> {
                failures.incrementAndGet();
                LOG.errorf(failure, "Failed to apply %s", event);
            }
        );
    }

    private void dropPendingDispatches() {
        pendingDispatches.forEach((key, pending) -> {
            if (pendingDispatches.remove(key, pending)) {
                vertx.cancelTimer(pending.timerId);
            }
        });
    }

    public boolean isConnected() {
        return changeFeed.isConnected();
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("enabled", enabled);
        stats.put("connected", changeFeed.isConnected());
        stats.put("received", received.get());
        stats.put("dispatched", dispatched.get());
        stats.put("coalesced", coalesced.get());
        stats.put("malformed", malformed.get());
        stats.put("failures", failures.get());
        stats.put("connects", connects.get());
        stats.put("disconnects", disconnects.get());
        stats.put("reconciliations", reconciliations.get());
        stats.put("pending", pendingDispatches.size());
        return stats;
    }

    private static class PendingDispatch {
        volatile ChangeFeedEvent latest;
        volatile long timerId;

        PendingDispatch(ChangeFeedEvent latest) {
            this.latest = latest;
        }
    }
}
