package org.mendoza.consultation.session;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.mendoza.consultation.model.CallSession;
import org.mendoza.consultation.model.CallStatus;
import org.mendoza.consultation.model.ParticipantRole;
import org.mendoza.consultation.notify.CallLifecycleEvent;
import org.mendoza.consultation.notify.LifecycleNotifier;
import org.mendoza.consultation.provider.ProviderEvent;
import org.mendoza.consultation.provider.ProviderEventType;
import org.mendoza.consultation.provider.VideoProvider;
import org.mendoza.consultation.store.CallStore;
import org.mendoza.consultation.store.DuplicateSessionException;
import org.mendoza.consultation.sync.ChangeFeedEvent;
import org.mendoza.consultation.tracking.ParticipantTracker;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the call lifecycle: {@code scheduled -> ongoing -> completed}, or {@code scheduled -> cancelled}.
 *
 * <p>Input arrives from the video provider and from the store's change-feed, in no particular
 * order relative to each other. Everything touching one session runs through {@link SessionEventQueue},
 * so handlers for the same session never interleave; different sessions proceed in parallel.
 *
 * <p>The store stays the source of truth. Status transitions are compare-and-set writes, and a
 * lost race is resolved by re-reading the row and adopting it.
 */
@ApplicationScoped
public class VideoCallSessionManager {

    private static final Logger LOG = Logger.getLogger(VideoCallSessionManager.class);

    private final CallStore store;
    private final ParticipantTracker tracker;
    private final CallTerminationPolicy terminationPolicy;
    private final RecordingController recordingController;
    private final VideoProvider provider;
    private final LifecycleNotifier notifier;
    private final Clock clock;
    private final WriteRetryPolicy retryPolicy;
    private final String joinBaseUrl;

    private final SessionEventQueue eventQueue = new SessionEventQueue();

    // Sessions this instance has seen, keyed both ways
    private final ConcurrentHashMap<Long, CallSession> sessionsById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> sessionIdsByMeetingRef = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<Long, PendingFinalization> pendingFinalizations = new ConcurrentHashMap<>();

    // Join/leave writes the store kept rejecting, replayed in order before any newer one
    private final ConcurrentHashMap<Long, ConcurrentLinkedQueue<ProviderEvent>> deferredSpanEvents = new ConcurrentHashMap<>();

    @Inject
    public VideoCallSessionManager(CallStore store,
                                   ParticipantTracker tracker,
                                   CallTerminationPolicy terminationPolicy,
                                   RecordingController recordingController,
                                   VideoProvider provider,
                                   LifecycleNotifier notifier,
                                   Clock clock,
                                   WriteRetryPolicy retryPolicy,
                                   @ConfigProperty(name = "consultation.provider.join-base-url", defaultValue = "http://localhost:5173/video-call/") String joinBaseUrl) {
        this.store = store;
        this.tracker = tracker;
        this.terminationPolicy = terminationPolicy;
        this.recordingController = recordingController;
        this.provider = provider;
        this.notifier = notifier;
        this.clock = clock;
        this.retryPolicy = retryPolicy;
        this.joinBaseUrl = joinBaseUrl;
    }

    void onStart(@Observes StartupEvent ev) {
        LOG.info("🚀 Loading live video calls...");
        store.initialize()
            .chain(this::loadLiveSessions)
            .subscribe().with(
                count -> LOG.infof("✅ Session manager ready, %d live call(s) cached", count),
                failure -> LOG.error("❌ Failed to load live calls: " + failure.getMessage(), failure)
            );
    }

    Uni<Integer> loadLiveSessions() {
        return Uni.combine().all().unis(
                store.findByStatus(CallStatus.SCHEDULED),
                store.findByStatus(CallStatus.ONGOING)
            ).asTuple()
            .onItem().transform(tuple -> {
                tuple.getItem1().forEach(this::cacheIfAbsent);
                tuple.getItem2().forEach(this::cacheIfAbsent);
                return tuple.getItem1().size() + tuple.getItem2().size();
            });
    }

    // ---------------------------------------------------------------- creation

    /**
     * Return the appointment's live session, creating a provider meeting and a {@code scheduled} row
     * when it has none. Fails with a provider configuration error when credentials are missing.
     */
    public Uni<CallSession> createSession(String appointmentId, String doctorId, String patientId, boolean enableRecording) {
        if (appointmentId == null) {
            return Uni.createFrom().failure(new IllegalArgumentException("appointmentId is required"));
        }
        return ensureAppointmentBookable(appointmentId)
            .chain(() -> store.findActiveByAppointment(appointmentId))
            .chain(existing -> {
                if (existing != null) {
                    LOG.infof("Reusing call %d for appointment %s", existing.id, appointmentId);
                    return Uni.createFrom().item(cacheIfAbsent(existing));
                }
                return provider.createMeeting()
                    .chain(meetingRef -> insertSession(appointmentId, doctorId, patientId, enableRecording, meetingRef));
            })
            .onItem().transform(CallSession::copy);
    }

    private Uni<Void> ensureAppointmentBookable(String appointmentId) {
        return store.findAppointment(appointmentId)
            .onFailure().recoverWithItem(failure -> {
                LOG.warnf("Could not read appointment %s, skipping status check: %s", appointmentId, failure.getMessage());
                return null;
            })
            .onItem().transform(appointment -> {
                if (appointment != null && appointment.isCancelled()) {
                    throw new IllegalArgumentException("Appointment " + appointmentId + " is cancelled");
                }
                return null;
            })
            .replaceWithVoid();
    }

    private Uni<CallSession> insertSession(String appointmentId, String doctorId, String patientId,
                                           boolean enableRecording, String meetingRef) {
        CallSession session = new CallSession();
        session.appointmentId = appointmentId;
        session.doctorId = doctorId;
        session.patientId = patientId;
        session.status = CallStatus.SCHEDULED;
        session.meetingRef = meetingRef;
        session.callLink = joinBaseUrl + meetingRef;
        session.recordingRequested = enableRecording;
        session.createdAt = now();

        return store.insertSession(session)
            .onItem().transform(inserted -> {
                LOG.infof("📅 Call %d scheduled for appointment %s (room %s)", inserted.id, appointmentId, meetingRef);
                return cacheIfAbsent(inserted);
            })
            .onFailure(DuplicateSessionException.class).recoverWithUni(duplicate -> {
                LOG.infof("Appointment %s got a call concurrently, releasing room %s", appointmentId, meetingRef);
                return endMeetingQuietly(meetingRef)
                    .chain(() -> store.findActiveByAppointment(appointmentId))
                    .onItem().ifNull().failWith(() -> duplicate)
                    .onItem().transform(this::cacheIfAbsent);
            });
    }

    // ---------------------------------------------------------------- provider events

    /**
     * Apply one provider event. Emits false when the event was discarded: unknown meetingRef,
     * or a session that already ended.
     */
    public Uni<Boolean> handleProviderEvent(ProviderEvent event) {
        return resolveByMeetingRef(event.meetingRef)
            .chain(session -> {
                if (session == null) {
                    LOG.warnf("Discarding %s: no video call for meetingRef %s", event.type, event.meetingRef);
                    return Uni.createFrom().item(false);
                }
                return eventQueue.submit(session.id, () -> applyProviderEvent(session.id, event));
            });
    }

    private Uni<Boolean> applyProviderEvent(Long sessionId, ProviderEvent event) {
        return current(sessionId).chain(session -> {
            if (session == null || session.isTerminal()) {
                LOG.debugf("Ignoring %s for ended call %d", event.type, sessionId);
                return Uni.createFrom().item(false);
            }
            switch (event.type) {
                case JOINED:
                    return onJoined(session, event).replaceWith(true);
                case LEFT:
                    return onLeft(session, event).replaceWith(true);
                case RECORDING_STARTED:
                    return recordingController.confirm(session, true).replaceWith(true);
                case RECORDING_STOPPED:
                    return recordingController.confirm(session, false).replaceWith(true);
                default:
                    throw new IllegalStateException("Unhandled provider event " + event.type);
            }
        });
    }

    private Uni<Void> onJoined(CallSession session, ProviderEvent event) {
        terminationPolicy.cancelPending(session.id);
        return recordSpan(session, event).replaceWithVoid();
    }

    private Uni<Void> markOngoing(CallSession session, Instant at) {
        return store.markOngoing(session.id, at)
            .chain(updated -> {
                if (!updated) {
                    return refresh(session);
                }
                session.status = CallStatus.ONGOING;
                if (session.startedAt == null) {
                    session.startedAt = at;
                }
                LOG.infof("▶️ Call %d ongoing (appointment %s)", session.id, session.appointmentId);
                notifier.publish(CallLifecycleEvent.started(session.id, session.appointmentId));
                if (!session.recordingRequested) {
                    return Uni.createFrom().voidItem();
                }
                return recordingController.start(session)
                    .onFailure().recoverWithItem(failure -> {
                        LOG.errorf(failure, "Failed to start requested recording of call %d", session.id);
                        return false;
                    })
                    .replaceWithVoid();
            });
    }

    private Uni<Void> onLeft(CallSession session, ProviderEvent event) {
        return recordSpan(session, event)
            .chain(recorded -> recorded ? evaluateTermination(session) : Uni.createFrom().voidItem())
            .onFailure().recoverWithUni(failure -> {
                LOG.errorf(failure, "Termination check for call %d failed, leaving it to reconciliation", session.id);
                return flagForReconciliation(session);
            });
    }

    /**
     * Write one join or leave with retries. When the store keeps failing the event is kept and
     * replayed later, ahead of any newer event for the session. Emits true when it was written now.
     */
    private Uni<Boolean> recordSpan(CallSession session, ProviderEvent event) {
        return replayDeferredSpans(session).chain(drained -> {
            if (!drained) {
                deferSpanEvent(session.id, event);
                return Uni.createFrom().item(false);
            }
            return retryPolicy.retry(() -> writeSpan(session, event), event.type + " of " + event.userId + " in call " + session.id)
                .replaceWith(true)
                .onFailure().recoverWithUni(failure -> {
                    LOG.errorf(failure, "❌ Could not record %s of %s in call %d, deferring it",
                        event.type, event.userId, session.id);
                    deferSpanEvent(session.id, event);
                    return flagForReconciliation(session).replaceWith(false);
                });
        });
    }

    /**
     * One attempt at a join or leave. The first join of a scheduled call also moves it to ongoing;
     * repeating the attempt after a partial failure does not repeat the transition.
     */
    private Uni<Void> writeSpan(CallSession session, ProviderEvent event) {
        Instant at = eventTime(event);
        if (event.type != ProviderEventType.JOINED) {
            return tracker.addLeave(session.id, event.userId, at).replaceWithVoid();
        }
        Uni<Void> transition = session.status == CallStatus.SCHEDULED
            ? markOngoing(session, at)
            : Uni.createFrom().voidItem();
        return transition.chain(() -> {
            if (session.isTerminal()) {
                LOG.debugf("Call %d ended while handling join of %s", session.id, event.userId);
                return Uni.createFrom().voidItem();
            }
            ParticipantRole role = event.role != null ? event.role : ParticipantRole.OBSERVER;
            return tracker.addJoin(session.id, event.userId, role, at).replaceWithVoid();
        });
    }

    private void deferSpanEvent(Long sessionId, ProviderEvent event) {
        deferredSpanEvents.computeIfAbsent(sessionId, id -> new ConcurrentLinkedQueue<>()).add(event);
    }

    /**
     * Write deferred joins and leaves in arrival order, one attempt each. Emits true once none are
     * left. Must run inside the session's queue slot.
     */
    private Uni<Boolean> replayDeferredSpans(CallSession session) {
        ConcurrentLinkedQueue<ProviderEvent> deferred = deferredSpanEvents.get(session.id);
        if (deferred == null) {
            return Uni.createFrom().item(true);
        }
        ProviderEvent next = deferred.peek();
        if (next == null) {
            deferredSpanEvents.remove(session.id, deferred);
            return flagForReconciliation(session, false).replaceWith(true);
        }
        return writeSpan(session, next)
            .onItem().invoke(() -> {
                deferred.poll();
                LOG.infof("Deferred %s of %s in call %d recorded", next.type, next.userId, session.id);
            })
            .chain(() -> replayDeferredSpans(session))
            .onFailure().recoverWithItem(failure -> {
                LOG.warnf("Deferred span writes of call %d still failing: %s", session.id, failure.getMessage());
                return false;
            });
    }

    private void dropDeferredSpans(Long sessionId) {
        ConcurrentLinkedQueue<ProviderEvent> dropped = deferredSpanEvents.remove(sessionId);
        if (dropped != null && !dropped.isEmpty()) {
            // the end of the call closes every span anyway
            LOG.infof("Dropping %d deferred join/leave event(s) of ended call %d", dropped.size(), sessionId);
        }
    }

    private Uni<Void> flagForReconciliation(CallSession session) {
        return flagForReconciliation(session, true);
    }

    private Uni<Void> flagForReconciliation(CallSession session, boolean flag) {
        if (session.needsReconciliation == flag) {
            return Uni.createFrom().voidItem();
        }
        session.needsReconciliation = flag;
        return store.setNeedsReconciliation(session.id, flag)
            .onFailure().recoverWithUni(failure -> {
                LOG.warnf("Could not set reconciliation flag of call %d: %s", session.id, failure.getMessage());
                return Uni.createFrom().voidItem();
            });
    }

    /**
     * Ask the policy whether the call is over; if so arm the grace timer, or finalize at once when
     * there is no grace period. Must run inside the session's queue slot.
     */
    private Uni<Void> evaluateTermination(CallSession session) {
        return terminationPolicy.shouldTerminate(session)
            .chain(terminate -> {
                if (!terminate) {
                    return Uni.createFrom().voidItem();
                }
                if (terminationPolicy.hasPending(session.id)) {
                    return Uni.createFrom().voidItem();
                }
                Long sessionId = session.id;
                if (terminationPolicy.scheduleTermination(sessionId, () -> onGracePeriodElapsed(sessionId))) {
                    LOG.infof("⏳ Call %d is empty, ending in %s unless someone rejoins",
                        sessionId, terminationPolicy.getGracePeriod());
                    return Uni.createFrom().voidItem();
                }
                return finalizeLocked(session, FinalizeReason.LAST_PARTICIPANT_LEFT).replaceWithVoid();
            });
    }

    private void onGracePeriodElapsed(Long sessionId) {
        eventQueue.submit(sessionId, () -> current(sessionId).chain(session -> {
                if (session == null || session.status != CallStatus.ONGOING) {
                    return Uni.createFrom().item(false);
                }
                // re-check: a join may have been recorded by another instance meanwhile
                return terminationPolicy.shouldTerminate(session)
                    .chain(terminate -> terminate
                        ? finalizeLocked(session, FinalizeReason.LAST_PARTICIPANT_LEFT)
                        : Uni.createFrom().item(false));
            }))
            .subscribe().with(
                finalized -> LOG.debugf("Grace check for call %d done, finalized=%s", sessionId, finalized),
                failure -> LOG.errorf(failure, "Grace check for call %d failed", sessionId)
            );
    }

    // ---------------------------------------------------------------- finalize

    /**
     * Complete an ongoing session. Emits true only for the caller whose terminal write won.
     */
    public Uni<Boolean> finalizeSession(Long sessionId, FinalizeReason reason) {
        return eventQueue.submit(sessionId, () -> current(sessionId).chain(session -> {
            if (session == null) {
                return Uni.createFrom().failure(new SessionNotFoundException(sessionId));
            }
            return finalizeLocked(session, reason);
        }));
    }

    private Uni<Boolean> finalizeLocked(CallSession session, FinalizeReason reason) {
        if (session.status != CallStatus.ONGOING) {
            LOG.debugf("Finalize of call %d skipped, status is %s", session.id, session.status);
            return Uni.createFrom().item(false);
        }
        terminationPolicy.cancelPending(session.id);
        Instant endedAt = now();
        Integer duration = CallTerminationPolicy.durationMinutes(session.startedAt, endedAt);

        AtomicBoolean attemptFailed = new AtomicBoolean();

        return retryPolicy.retry(() -> store.completeIfOngoing(session.id, endedAt, duration),
                "Terminal write of call " + session.id, attemptFailed)
            .onItemOrFailure().transformToUni((won, failure) -> {
                if (failure != null) {
                    return finalizeLocally(session, reason, endedAt, duration, failure);
                }
                if (won) {
                    return completeFinalization(session, reason, endedAt, duration, true).replaceWith(true);
                }
                return store.findById(session.id).chain(stored -> {
                    if (attemptFailed.get() && stored != null && stored.status == CallStatus.COMPLETED
                        && endedAt.equals(stored.endedAt)) {
                        // an earlier attempt committed but its response was lost
                        return completeFinalization(session, reason, endedAt, duration, true).replaceWith(true);
                    }
                    LOG.infof("Call %d was already ended elsewhere", session.id);
                    if (stored == null) {
                        evict(session.id);
                        return Uni.createFrom().item(false);
                    }
                    return applyStoredState(session, stored).replaceWith(false);
                });
            });
    }

    /**
     * The store rejected every attempt. Complete in memory, flag the row, run the side effects and
     * keep the ended notification until the write goes through.
     */
    private Uni<Boolean> finalizeLocally(CallSession session, FinalizeReason reason, Instant endedAt,
                                         Integer duration, Throwable failure) {
        LOG.errorf(failure, "❌ Could not persist completion of call %d after %d attempt(s), completing locally",
            session.id, retryPolicy.getMaxAttempts());
        session.needsReconciliation = true;
        pendingFinalizations.put(session.id,
            new PendingFinalization(session.id, endedAt, duration, reason, retryPolicy.getMaxAttempts()));

        return store.setNeedsReconciliation(session.id, true)
            .onFailure().recoverWithUni(flagFailure -> {
                LOG.warnf("Could not flag call %d for reconciliation: %s", session.id, flagFailure.getMessage());
                return Uni.createFrom().voidItem();
            })
            .chain(() -> completeFinalization(session, reason, endedAt, duration, false))
            .replaceWith(true);
    }

    private Uni<Void> completeFinalization(CallSession session, FinalizeReason reason, Instant endedAt,
                                           Integer duration, boolean notifyNow) {
        boolean wasRecording = session.isRecording;
        session.status = CallStatus.COMPLETED;
        session.endedAt = endedAt;
        session.durationMinutes = duration;
        session.isRecording = false;
        dropDeferredSpans(session.id);
        LOG.infof("🏁 Call %d completed (%s), duration %s min", session.id, reason, duration);

        return tracker.closeAll(session.id, endedAt)
            .onFailure().recoverWithItem(failure -> {
                LOG.errorf(failure, "Failed to close open spans of call %d", session.id);
                return 0;
            })
            .chain(() -> recordingController.forceStop(session, wasRecording))
            .chain(() -> endMeetingQuietly(session.meetingRef))
            .onItem().invoke(() -> {
                if (notifyNow) {
                    notifier.publish(CallLifecycleEvent.ended(session.id, session.appointmentId, duration));
                }
            });
    }

    private Uni<Void> endMeetingQuietly(String meetingRef) {
        return provider.endMeeting(meetingRef)
            .onFailure().recoverWithUni(failure -> {
                LOG.warnf("Could not deactivate room %s: %s", meetingRef, failure.getMessage());
                return Uni.createFrom().voidItem();
            });
    }

    // ---------------------------------------------------------------- management commands

    /**
     * Staff-initiated end. An ongoing call is finalized through the guarded path, a scheduled one is
     * cancelled, an ended one is left alone.
     */
    public Uni<Boolean> forceEnd(Long sessionId) {
        return eventQueue.submit(sessionId, () -> current(sessionId).chain(session -> {
            if (session == null) {
                return Uni.createFrom().failure(new SessionNotFoundException(sessionId));
            }
            LOG.infof("Force end requested for call %d (%s)", sessionId, session.status);
            if (session.status == CallStatus.SCHEDULED) {
                return cancelLocked(session).chain(cancelled -> {
                    // the row may have gone ongoing under us
                    if (!cancelled && session.status == CallStatus.ONGOING) {
                        return finalizeLocked(session, FinalizeReason.FORCE_END);
                    }
                    return Uni.createFrom().item(cancelled);
                });
            }
            return finalizeLocked(session, FinalizeReason.FORCE_END);
        }));
    }

    private Uni<Boolean> cancelLocked(CallSession session) {
        Instant endedAt = now();
        return store.cancelIfScheduled(session.id, endedAt)
            .chain(cancelled -> {
                if (!cancelled) {
                    return refresh(session).replaceWith(false);
                }
                terminationPolicy.cancelPending(session.id);
                dropDeferredSpans(session.id);
                session.status = CallStatus.CANCELLED;
                session.endedAt = endedAt;
                session.isRecording = false;
                LOG.infof("🚫 Call %d cancelled (appointment %s)", session.id, session.appointmentId);
                notifier.publish(CallLifecycleEvent.ended(session.id, session.appointmentId, null));
                return endMeetingQuietly(session.meetingRef).replaceWith(true);
            });
    }

    /**
     * Emits true when recording was switched on by this request.
     */
    public Uni<Boolean> startRecording(Long sessionId) {
        return eventQueue.submit(sessionId, () -> current(sessionId).chain(session -> {
            if (session == null) {
                return Uni.createFrom().failure(new SessionNotFoundException(sessionId));
            }
            return recordingController.start(session);
        }));
    }

    public Uni<Boolean> stopRecording(Long sessionId) {
        return eventQueue.submit(sessionId, () -> current(sessionId).chain(session -> {
            if (session == null) {
                return Uni.createFrom().failure(new SessionNotFoundException(sessionId));
            }
            return recordingController.stop(session);
        }));
    }

    // ---------------------------------------------------------------- change-feed

    /**
     * Reconcile one store-side change. Every branch re-reads the store, so redelivery is harmless.
     */
    public Uni<Void> handleChangeFeedEvent(ChangeFeedEvent event) {
        switch (event.table) {
            case VIDEO_CALLS:
                return onCallRowChanged(event);
            case VIDEO_CALL_PARTICIPANTS:
                return onParticipantRowChanged(event);
            case APPOINTMENTS:
                return onAppointmentRowChanged(event);
            default:
                return Uni.createFrom().voidItem();
        }
    }

    private Uni<Void> onCallRowChanged(ChangeFeedEvent event) {
        Long sessionId = event.callId();
        if (sessionId == null) {
            LOG.debugf("video_calls change without id: %s", event);
            return Uni.createFrom().voidItem();
        }
        return reconcileSession(sessionId);
    }

    private Uni<Void> onParticipantRowChanged(ChangeFeedEvent event) {
        Long sessionId = event.callId();
        if (sessionId == null) {
            return Uni.createFrom().voidItem();
        }
        return eventQueue.submit(sessionId, () -> current(sessionId).chain(session -> {
            if (session == null || session.status != CallStatus.ONGOING) {
                return Uni.createFrom().voidItem();
            }
            return tracker.activeCount(sessionId).chain(count -> {
                if (count > 0) {
                    terminationPolicy.cancelPending(sessionId);
                    return Uni.createFrom().voidItem();
                }
                return evaluateTermination(session);
            });
        }));
    }

    private Uni<Void> onAppointmentRowChanged(ChangeFeedEvent event) {
        String appointmentId = event.appointmentId();
        if (appointmentId == null || !"cancelled".equalsIgnoreCase(event.row.getString("status"))) {
            return Uni.createFrom().voidItem();
        }
        return store.findActiveByAppointment(appointmentId)
            .chain(active -> {
                if (active == null) {
                    return Uni.createFrom().voidItem();
                }
                return eventQueue.submit(active.id, () -> current(active.id).chain(session -> {
                    if (session == null) {
                        return Uni.createFrom().voidItem();
                    }
                    if (session.status == CallStatus.SCHEDULED) {
                        LOG.infof("Appointment %s cancelled, cancelling call %d", appointmentId, session.id);
                        return cancelLocked(session).replaceWithVoid();
                    }
                    if (session.status == CallStatus.ONGOING) {
                        LOG.infof("Appointment %s cancelled while call %d is ongoing, leaving it running",
                            appointmentId, session.id);
                    }
                    return Uni.createFrom().voidItem();
                }));
            });
    }

    /**
     * Bring one session in line with its stored row and re-derive termination.
     */
    public Uni<Void> reconcileSession(Long sessionId) {
        return eventQueue.submit(sessionId, () -> reconcileLocked(sessionId));
    }

    private Uni<Void> reconcileLocked(Long sessionId) {
        PendingFinalization pending = pendingFinalizations.get(sessionId);
        if (pending != null) {
            return retryFinalizationLocked(pending).replaceWithVoid();
        }
        return store.findById(sessionId).chain(stored -> {
            if (stored == null) {
                evict(sessionId);
                return Uni.createFrom().voidItem();
            }
            CallSession cached = sessionsById.get(sessionId);
            Uni<Void> applied = cached == null
                ? Uni.createFrom().voidItem()
                : applyStoredState(cached, stored);
            CallSession session = cached != null ? cached : cacheIfAbsent(stored);

            return applied.chain(() -> {
                if (!session.isTerminal() && deferredSpanEvents.containsKey(sessionId)) {
                    return replayDeferredSpans(session).chain(drained -> drained && session.status == CallStatus.ONGOING
                        ? evaluateTermination(session)
                        : Uni.createFrom().voidItem());
                }
                if (session.status == CallStatus.ONGOING) {
                    return evaluateTermination(session)
                        .chain(() -> session.status == CallStatus.ONGOING
                            ? flagForReconciliation(session, false)
                            : Uni.createFrom().voidItem());
                }
                if (session.isTerminal() && stored.needsReconciliation) {
                    return store.setNeedsReconciliation(sessionId, false);
                }
                return Uni.createFrom().voidItem();
            });
        });
    }

    /**
     * Full pass after a change-feed (re)connect: every live, flagged, cached or pending session is
     * re-read and re-derived. Emits the number of sessions visited.
     */
    public Uni<Integer> reconcileAll() {
        return Uni.combine().all().unis(
                store.findByStatus(CallStatus.SCHEDULED),
                store.findByStatus(CallStatus.ONGOING),
                store.findNeedingReconciliation()
            ).asTuple()
            .chain(tuple -> {
                Set<Long> ids = new LinkedHashSet<>(sessionsById.keySet());
                ids.addAll(pendingFinalizations.keySet());
                ids.addAll(deferredSpanEvents.keySet());
                tuple.getItem1().forEach(session -> ids.add(session.id));
                tuple.getItem2().forEach(session -> ids.add(session.id));
                tuple.getItem3().forEach(session -> ids.add(session.id));

                return Multi.createFrom().iterable(ids)
                    .onItem().transformToUniAndConcatenate(id -> reconcileSession(id)
                        .onFailure().recoverWithUni(failure -> {
                            LOG.errorf(failure, "Reconciliation of call %d failed", id);
                            return Uni.createFrom().voidItem();
                        })
                        .replaceWith(id))
                    .collect().asList()
                    .onItem().transform(List::size);
            })
            .onItem().invoke(count -> LOG.infof("🔄 Reconciled %d call(s)", count));
    }

    /**
     * Copy the stored row over the cached one. A live session that the store shows as ended was
     * ended out of band and gets the end-of-call cleanup here.
     */
    private Uni<Void> applyStoredState(CallSession cached, CallSession stored) {
        if (pendingFinalizations.containsKey(cached.id)) {
            // our own terminal write is still outstanding; do not revert to the stored row
            return Uni.createFrom().voidItem();
        }
        boolean wasLive = !cached.isTerminal();
        boolean wasRecording = cached.isRecording || stored.isRecording;
        CallStatus previousStatus = cached.status;

        cached.status = stored.status;
        cached.startedAt = stored.startedAt;
        cached.endedAt = stored.endedAt;
        cached.durationMinutes = stored.durationMinutes;
        cached.isRecording = stored.isRecording;
        cached.recordingRequested = stored.recordingRequested;
        cached.needsReconciliation = stored.needsReconciliation;
        cached.callLink = stored.callLink;

        if (wasLive && stored.isTerminal()) {
            return onEndedElsewhere(cached, wasRecording);
        }
        if (previousStatus != stored.status) {
            LOG.infof("Call %d moved %s -> %s in the store", cached.id, previousStatus, stored.status);
        }
        return Uni.createFrom().voidItem();
    }

    /**
     * Cleanup for a call that some other writer ended. Missing end fields are filled in; whoever fills
     * them owns the ended notification, so managers that ended the call themselves do not notify twice.
     */
    private Uni<Void> onEndedElsewhere(CallSession session, boolean wasRecording) {
        terminationPolicy.cancelPending(session.id);
        dropDeferredSpans(session.id);
        Instant endedAt = session.endedAt != null ? session.endedAt : now();
        Integer duration = session.durationMinutes;
        if (duration == null && session.status == CallStatus.COMPLETED) {
            duration = CallTerminationPolicy.durationMinutes(session.startedAt, endedAt);
        }
        Integer finalDuration = duration;

        return store.fillEndedFields(session.id, endedAt, finalDuration)
            .chain(filled -> {
                session.endedAt = endedAt;
                session.durationMinutes = finalDuration;
                session.isRecording = false;
                Uni<Void> cleanup = tracker.closeAll(session.id, endedAt).replaceWithVoid();
                if (wasRecording) {
                    cleanup = cleanup.chain(() -> recordingController.forceStop(session, true));
                }
                return cleanup.onItem().invoke(() -> {
                    if (filled) {
                        LOG.infof("Call %d ended out of band (%s)", session.id, session.status);
                        notifier.publish(CallLifecycleEvent.ended(session.id, session.appointmentId, finalDuration));
                    } else {
                        LOG.debugf("Call %d ended by another session manager", session.id);
                    }
                });
            });
    }

    // ---------------------------------------------------------------- scheduled jobs

    @Scheduled(every = "${consultation.watchdog.interval:60s}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void runWatchdog() {
        watchdog().subscribe().with(
            count -> {
                if (count > 0) {
                    LOG.infof("Watchdog ended %d abandoned call(s)", count);
                }
            },
            failure -> LOG.error("Watchdog pass failed: " + failure.getMessage(), failure)
        );
    }

    /**
     * Finalize ongoing calls that have been empty longer than the abandoned ceiling, and drop
     * ended sessions from the cache. Emits how many calls were ended.
     */
    public Uni<Integer> watchdog() {
        evictEnded();
        Instant now = now();
        return store.findByStatus(CallStatus.ONGOING)
            .chain(ongoing -> Multi.createFrom().iterable(ongoing)
                .onItem().transformToUniAndConcatenate(stored -> eventQueue.submit(stored.id,
                    () -> current(stored.id).chain(session -> {
                        if (session == null || session.status != CallStatus.ONGOING) {
                            return Uni.createFrom().item(false);
                        }
                        return terminationPolicy.isAbandoned(session, now).chain(abandoned -> {
                            if (!abandoned) {
                                return Uni.createFrom().item(false);
                            }
                            LOG.warnf("Call %d has been empty past %s, ending it",
                                session.id, terminationPolicy.getAbandonedCeiling());
                            return finalizeLocked(session, FinalizeReason.WATCHDOG);
                        });
                    })))
                .collect().asList())
            .onItem().transform(results -> (int) results.stream().filter(Boolean::booleanValue).count());
    }

    @Scheduled(every = "${consultation.reconciliation.interval:30s}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void retryPendingFinalizations() {
        if (pendingFinalizations.isEmpty() && deferredSpanEvents.isEmpty()) {
            return;
        }
        retryPending().subscribe().with(
            count -> LOG.debugf("%d pending write(s) settled", count),
            failure -> LOG.error("Pending completion retry failed: " + failure.getMessage(), failure)
        );
    }

    /**
     * Retry the terminal writes of locally completed sessions and the joins and leaves the store
     * rejected. Emits how many sessions were settled.
     */
    public Uni<Integer> retryPending() {
        List<Long> ids = new ArrayList<>(pendingFinalizations.keySet());
        for (Long id : deferredSpanEvents.keySet()) {
            if (!ids.contains(id)) {
                ids.add(id);
            }
        }
        return Multi.createFrom().iterable(ids)
            .onItem().transformToUniAndConcatenate(id -> eventQueue.submit(id, () -> {
                PendingFinalization pending = pendingFinalizations.get(id);
                if (pending != null) {
                    return retryFinalizationLocked(pending);
                }
                return replayDeferredLocked(id);
            }))
            .collect().asList()
            .onItem().transform(results -> (int) results.stream().filter(Boolean::booleanValue).count());
    }

    private Uni<Boolean> replayDeferredLocked(Long sessionId) {
        if (!deferredSpanEvents.containsKey(sessionId)) {
            return Uni.createFrom().item(false);
        }
        return current(sessionId).chain(session -> {
            if (session == null || session.isTerminal()) {
                dropDeferredSpans(sessionId);
                return Uni.createFrom().item(false);
            }
            return replayDeferredSpans(session).chain(drained -> {
                if (!drained) {
                    return Uni.createFrom().item(false);
                }
                Uni<Void> termination = session.status == CallStatus.ONGOING
                    ? evaluateTermination(session)
                    : Uni.createFrom().voidItem();
                return termination.replaceWith(true);
            });
        });
    }

    private Uni<Boolean> retryFinalizationLocked(PendingFinalization pending) {
        Long sessionId = pending.sessionId;
        return store.completeIfOngoing(sessionId, pending.endedAt, pending.durationMinutes)
            .chain(won -> {
                if (won) {
                    pendingFinalizations.remove(sessionId);
                    CallSession session = sessionsById.get(sessionId);
                    if (session != null) {
                        session.needsReconciliation = false;
                    }
                    LOG.infof("Completion of call %d persisted after %d attempt(s)", sessionId, pending.attempts + 1);
                    return tracker.closeAll(sessionId, pending.endedAt)
                        .onItem().invoke(() -> publishDeferredEnd(pending))
                        .replaceWith(true);
                }
                return settleAgainstStore(pending);
            })
            .onFailure().recoverWithItem(failure -> {
                pending.attempts++;
                LOG.warnf("Completion of call %d still failing (%d attempts): %s",
                    sessionId, pending.attempts, failure.getMessage());
                return false;
            });
    }

    private Uni<Boolean> settleAgainstStore(PendingFinalization pending) {
        Long sessionId = pending.sessionId;
        return store.findById(sessionId).chain(stored -> {
            pendingFinalizations.remove(sessionId);
            if (stored == null) {
                evict(sessionId);
                return Uni.createFrom().item(true);
            }
            CallSession cached = sessionsById.get(sessionId);
            if (stored.status == CallStatus.COMPLETED && pending.endedAt.equals(stored.endedAt)) {
                publishDeferredEnd(pending);
                return clearFlag(stored).replaceWith(true);
            }
            if (cached == null) {
                return clearFlag(stored).replaceWith(true);
            }
            LOG.infof("Call %d was settled by another writer while its completion was pending", sessionId);
            // cached is already terminal locally; mark it live so the ended-elsewhere path runs once
            cached.status = CallStatus.ONGOING;
            return applyStoredState(cached, stored).chain(() -> clearFlag(stored)).replaceWith(true);
        });
    }

    private Uni<Void> clearFlag(CallSession stored) {
        if (!stored.needsReconciliation || !stored.isTerminal()) {
            return Uni.createFrom().voidItem();
        }
        return store.setNeedsReconciliation(stored.id, false);
    }

    private void publishDeferredEnd(PendingFinalization pending) {
        CallSession session = sessionsById.get(pending.sessionId);
        String appointmentId = session != null ? session.appointmentId : null;
        notifier.publish(CallLifecycleEvent.ended(pending.sessionId, appointmentId, pending.durationMinutes));
    }

    // ---------------------------------------------------------------- read side

    public Uni<SessionSnapshot> snapshot(Long sessionId) {
        return store.findById(sessionId)
            .onItem().ifNull().failWith(() -> new SessionNotFoundException(sessionId))
            .chain(session -> Uni.combine().all().unis(tracker.activeCount(sessionId), tracker.spans(sessionId))
                .asTuple()
                .onItem().transform(tuple -> new SessionSnapshot(session, tuple.getItem1(), tuple.getItem2())));
    }

    public Uni<List<SessionSnapshot>> listRecent(int limit) {
        return store.findRecent(limit)
            .chain(sessions -> {
                List<Long> ids = new ArrayList<>();
                sessions.forEach(session -> ids.add(session.id));
                return tracker.activeCounts(ids)
                    .onItem().transform(counts -> {
                        List<SessionSnapshot> snapshots = new ArrayList<>();
                        for (CallSession session : sessions) {
                            snapshots.add(new SessionSnapshot(session, counts.getOrDefault(session.id, 0), List.of()));
                        }
                        return snapshots;
                    });
            });
    }

    public Uni<Map<CallStatus, Long>> countByStatus() {
        return store.countByStatus();
    }

    /**
     * In-memory view for diagnostics.
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("cachedSessions", sessionsById.size());
        stats.put("liveSessions", sessionsById.values().stream().filter(session -> !session.isTerminal()).count());
        stats.put("pendingFinalizations", pendingFinalizations.size());
        stats.put("deferredSpanSessions", deferredSpanEvents.size());
        stats.put("busySessions", eventQueue.activeSessions());
        return stats;
    }

    /**
     * Copy of the cached session, or null when this instance does not hold it.
     */
    public CallSession cached(Long sessionId) {
        CallSession session = sessionsById.get(sessionId);
        return session != null ? session.copy() : null;
    }

    public boolean isPendingFinalization(Long sessionId) {
        return pendingFinalizations.containsKey(sessionId);
    }

    public int deferredSpanEvents(Long sessionId) {
        ConcurrentLinkedQueue<ProviderEvent> deferred = deferredSpanEvents.get(sessionId);
        return deferred != null ? deferred.size() : 0;
    }

    // ---------------------------------------------------------------- cache

    private Uni<CallSession> resolveByMeetingRef(String meetingRef) {
        if (meetingRef == null) {
            return Uni.createFrom().nullItem();
        }
        Long sessionId = sessionIdsByMeetingRef.get(meetingRef);
        if (sessionId != null) {
            CallSession cached = sessionsById.get(sessionId);
            if (cached != null) {
                return Uni.createFrom().item(cached);
            }
        }
        return store.findByMeetingRef(meetingRef)
            .onItem().ifNotNull().transform(this::cacheIfAbsent);
    }

    private Uni<CallSession> current(Long sessionId) {
        CallSession cached = sessionsById.get(sessionId);
        if (cached != null) {
            return Uni.createFrom().item(cached);
        }
        return store.findById(sessionId)
            .onItem().ifNotNull().transform(this::cacheIfAbsent);
    }

    private Uni<Void> refresh(CallSession session) {
        return store.findById(session.id).chain(stored -> {
            if (stored == null) {
                evict(session.id);
                session.status = CallStatus.CANCELLED;
                return Uni.createFrom().voidItem();
            }
            return applyStoredState(session, stored);
        });
    }

    private CallSession cacheIfAbsent(CallSession session) {
        CallSession existing = sessionsById.putIfAbsent(session.id, session);
        if (session.meetingRef != null) {
            sessionIdsByMeetingRef.putIfAbsent(session.meetingRef, session.id);
        }
        return existing != null ? existing : session;
    }

    private void evict(Long sessionId) {
        terminationPolicy.cancelPending(sessionId);
        deferredSpanEvents.remove(sessionId);
        CallSession removed = sessionsById.remove(sessionId);
        if (removed != null && removed.meetingRef != null) {
            sessionIdsByMeetingRef.remove(removed.meetingRef, sessionId);
        }
        LOG.debugf("Evicted call %d from cache", sessionId);
    }

    private void evictEnded() {
        List<Long> ended = new ArrayList<>();
        sessionsById.forEach((id, session) -> {
            if (session.isTerminal() && !pendingFinalizations.containsKey(id)) {
                ended.add(id);
            }
        });
        ended.forEach(this::evict);
    }

    private Instant eventTime(ProviderEvent event) {
        return event.timestamp != null ? event.timestamp.truncatedTo(ChronoUnit.MILLIS) : now();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
