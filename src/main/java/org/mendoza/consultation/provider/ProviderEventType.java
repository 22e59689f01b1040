package org.mendoza.consultation.provider;

public enum ProviderEventType {
    JOINED("participant-joined"),
    LEFT("participant-left"),
    RECORDING_STARTED("recording-started"),
    RECORDING_STOPPED("recording-stopped");

    private final String webhookType;

    ProviderEventType(String webhookType) {
        this.webhookType = webhookType;
    }

    public String webhookType() {
        return webhookType;
    }

    public boolean isParticipantEvent() {
        return this == JOINED || this == LEFT;
    }

    /**
     * Null for webhook types this service does not consume.
     */
    public static ProviderEventType fromWebhookType(String value) {
        for (ProviderEventType type : values()) {
            if (type.webhookType.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
