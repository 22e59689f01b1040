package org.mendoza.consultation.store;

/**
 * The appointment already owns a {@code scheduled} or {@code ongoing} session.
 */
public class DuplicateSessionException extends RuntimeException {

    private final String appointmentId;

    public DuplicateSessionException(String appointmentId, Throwable cause) {
        super("Appointment " + appointmentId + " already has an active video call", cause);
        this.appointmentId = appointmentId;
    }

    public String getAppointmentId() {
        return appointmentId;
    }
}
