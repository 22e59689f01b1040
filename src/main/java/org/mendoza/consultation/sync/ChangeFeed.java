package org.mendoza.consultation.sync;

import io.smallrye.mutiny.Uni;

/**
 * Long-lived subscription to store-side row changes. Delivery is at-least-once with possible gaps
 * across disconnects.
 */
public interface ChangeFeed {

    Uni<Void> start(ChangeFeedListener listener);

    void stop();

    boolean isConnected();
}
