package org.mendoza.consultation.session;

import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff for store writes issued while handling call events.
 * Each retry re-subscribes the write, so the supplied operation must be safe to repeat.
 */
@ApplicationScoped
public class WriteRetryPolicy {

    private static final Logger LOG = Logger.getLogger(WriteRetryPolicy.class);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    @Inject
    public WriteRetryPolicy(@ConfigProperty(name = "consultation.finalize.max-attempts", defaultValue = "3") int maxAttempts,
                            @ConfigProperty(name = "consultation.finalize.initial-backoff", defaultValue = "PT0.2S") Duration initialBackoff,
                            @ConfigProperty(name = "consultation.finalize.max-backoff", defaultValue = "PT2S") Duration maxBackoff) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    public <T> Uni<T> retry(Supplier<Uni<T>> write, String description) {
        return retry(write, description, new AtomicBoolean());
    }

    /**
     * @param attemptFailed set as soon as one attempt fails, even if a later one succeeds
     */
    public <T> Uni<T> retry(Supplier<Uni<T>> write, String description, AtomicBoolean attemptFailed) {
        Uni<T> attempt = Uni.createFrom().deferred(write::get)
            .onFailure().invoke(failure -> {
                attemptFailed.set(true);
                LOG.warnf("%s failed: %s", description, failure.getMessage());
            });
        if (maxAttempts <= 1) {
            return attempt;
        }
        return attempt.onFailure().retry().withBackOff(initialBackoff, maxBackoff).atMost(maxAttempts - 1);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
