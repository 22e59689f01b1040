package org.mendoza.consultation.provider;

import io.smallrye.mutiny.Uni;

/**
 * Outbound calls to the conferencing provider. Each {@link Uni} completes only after the provider
 * acknowledged the request.
 */
public interface VideoProvider {

    /**
     * Create a room and emit its id, which becomes the session's meetingRef.
     */
    Uni<String> createMeeting();

    Uni<Void> startRecording(String meetingRef);

    Uni<Void> stopRecording(String meetingRef);

    /**
     * Deactivate the room so nobody can rejoin it.
     */
    Uni<Void> endMeeting(String meetingRef);
}
