package org.mendoza.consultation.sync;

public interface ChangeFeedListener {

    /**
     * Called on the first connect and on every reconnect; notifications may have been missed before it.
     */
    void onConnected();

    void onDisconnected();

    void onPayload(String payload);
}
