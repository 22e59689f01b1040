package org.mendoza.consultation.model;

/**
 * Read-only view of the owning appointment; only the status matters here.
 */
public class Appointment {
    public String id;
    public String status;

    public Appointment() {
    }

    public Appointment(String id, String status) {
        this.id = id;
        this.status = status;
    }

    public boolean isCancelled() {
        return "cancelled".equalsIgnoreCase(status);
    }

    @Override
    public String toString() {
        return "Appointment{id=" + id + ", status=" + status + "}";
    }
}
