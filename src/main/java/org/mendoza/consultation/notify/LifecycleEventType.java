package org.mendoza.consultation.notify;

public enum LifecycleEventType {
    STARTED("started"),
    ENDED("ended");

    private final String wireName;

    LifecycleEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
