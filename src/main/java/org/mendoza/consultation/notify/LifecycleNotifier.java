package org.mendoza.consultation.notify;

/**
 * Hand-off point to whatever tells participants about call starts and ends.
 */
public interface LifecycleNotifier {

    void publish(CallLifecycleEvent event);
}
