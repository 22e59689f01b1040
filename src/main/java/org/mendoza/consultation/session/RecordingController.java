package org.mendoza.consultation.session;

import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.mendoza.consultation.model.CallSession;
import org.mendoza.consultation.model.CallStatus;
import org.mendoza.consultation.provider.VideoProvider;
import org.mendoza.consultation.store.CallStore;

/**
 * Idempotent recording toggle. The flag on the session and in the store only moves after the
 * provider acknowledged the change. Callers hold the session's event slot, so the session
 * instance passed in is updated in place.
 */
@ApplicationScoped
public class RecordingController {

    private static final Logger LOG = Logger.getLogger(RecordingController.class);

    private final CallStore store;
    private final VideoProvider provider;
    private final WriteRetryPolicy retryPolicy;

    @Inject
    public RecordingController(CallStore store, VideoProvider provider, WriteRetryPolicy retryPolicy) {
        this.store = store;
        this.provider = provider;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Emits true when recording was started by this call.
     */
    public Uni<Boolean> start(CallSession session) {
        if (session.status != CallStatus.ONGOING) {
            LOG.debugf("Not starting recording of call %d: status is %s", session.id, session.status);
            return Uni.createFrom().item(false);
        }
        if (session.isRecording) {
            return Uni.createFrom().item(false);
        }
        return provider.startRecording(session.meetingRef)
            .chain(() -> persist(session, true));
    }

    /**
     * Emits true when recording was stopped by this call; a session that is not recording is left alone.
     */
    public Uni<Boolean> stop(CallSession session) {
        if (!session.isRecording) {
            return Uni.createFrom().item(false);
        }
        return provider.stopRecording(session.meetingRef)
            .chain(() -> persist(session, false));
    }

    /**
     * Apply a recording state the provider reported on its own.
     */
    public Uni<Boolean> confirm(CallSession session, boolean recording) {
        if (session.isRecording == recording) {
            return Uni.createFrom().item(false);
        }
        if (recording && session.status != CallStatus.ONGOING) {
            LOG.debugf("Ignoring recording-started for call %d in status %s", session.id, session.status);
            return Uni.createFrom().item(false);
        }
        return persist(session, recording);
    }

    /**
     * Stop recording whatever the flag says. Used when a call ends; the store row is
     * cleared by the terminal write itself, so only the provider is contacted here.
     */
    public Uni<Void> forceStop(CallSession session, boolean wasRecording) {
        return provider.stopRecording(session.meetingRef)
            .onItem().invoke(() -> {
                if (wasRecording) {
                    LOG.infof("Recording of call %d stopped", session.id);
                }
            })
            .onFailure().recoverWithUni(failure -> {
                if (wasRecording) {
                    LOG.errorf(failure, "Failed to stop recording of ended call %d", session.id);
                } else {
                    LOG.debugf("Stop-recording for call %d rejected by provider: %s", session.id, failure.getMessage());
                }
                return Uni.createFrom().voidItem();
            })
            .onItem().invoke(() -> session.isRecording = false);
    }

    private Uni<Boolean> persist(CallSession session, boolean recording) {
        return retryPolicy.retry(() -> store.updateRecording(session.id, recording), "Recording flag of call " + session.id)
            .onFailure().recoverWithUni(failure -> {
                // the provider already switched; ending the call stops recording whatever the row says
                LOG.errorf(failure, "❌ Could not store recording=%s for call %d, flagging it for reconciliation",
                    recording, session.id);
                session.needsReconciliation = true;
                return store.setNeedsReconciliation(session.id, true)
                    .onFailure().recoverWithUni(flagFailure -> {
                        LOG.warnf("Could not flag call %d for reconciliation: %s", session.id, flagFailure.getMessage());
                        return Uni.createFrom().voidItem();
                    })
                    .replaceWith(false);
            })
            .onItem().transform(updated -> {
                // provider already switched; keep memory in line even if the row moved on
                session.isRecording = recording && session.status == CallStatus.ONGOING;
                if (updated) {
                    LOG.infof("Call %d recording=%s", session.id, recording);
                }
                return true;
            });
    }
}
