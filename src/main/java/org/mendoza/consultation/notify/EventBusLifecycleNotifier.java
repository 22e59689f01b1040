package org.mendoza.consultation.notify;

import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Publishes lifecycle events as JSON on the Vert.x event bus.
 */
@ApplicationScoped
public class EventBusLifecycleNotifier implements LifecycleNotifier {

    public static final String ADDRESS = "consultation.lifecycle";

    private static final Logger LOG = Logger.getLogger(EventBusLifecycleNotifier.class);

    private final EventBus eventBus;

    @Inject
    public EventBusLifecycleNotifier(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void publish(CallLifecycleEvent event) {
        LOG.infof("📣 %s", event);
        eventBus.publish(ADDRESS, event.toJson());
    }
}
