package org.mendoza.consultation.support;

import io.quarkus.test.Mock;
import jakarta.enterprise.context.ApplicationScoped;
import org.mendoza.consultation.notify.CallLifecycleEvent;
import org.mendoza.consultation.notify.LifecycleEventType;
import org.mendoza.consultation.notify.LifecycleNotifier;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Mock
@ApplicationScoped
public class RecordingNotifier implements LifecycleNotifier {

    private final List<CallLifecycleEvent> events = new ArrayList<>();

    @Override
    public synchronized void publish(CallLifecycleEvent event) {
        events.add(event);
    }

    public synchronized List<CallLifecycleEvent> eventsFor(Long sessionId) {
        return events.stream()
            .filter(event -> event.sessionId.equals(sessionId))
            .collect(Collectors.toList());
    }

    public synchronized long count(Long sessionId, LifecycleEventType type) {
        return events.stream()
            .filter(event -> event.sessionId.equals(sessionId) && event.type == type)
            .count();
    }

    public synchronized List<CallLifecycleEvent> all() {
        return new ArrayList<>(events);
    }
}
