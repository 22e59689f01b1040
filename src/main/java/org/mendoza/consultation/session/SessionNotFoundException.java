package org.mendoza.consultation.session;

public class SessionNotFoundException extends RuntimeException {

    private final Long sessionId;

    public SessionNotFoundException(Long sessionId) {
        super("Video call " + sessionId + " not found");
        this.sessionId = sessionId;
    }

    public Long getSessionId() {
        return sessionId;
    }
}
