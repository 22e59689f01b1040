package org.mendoza.consultation.session;

import io.smallrye.mutiny.Uni;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs submitted work one at a time per session, in submission order. Different sessions never wait
 * on each other.
 */
public class SessionEventQueue {

    private final ConcurrentHashMap<Long, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public <T> Uni<T> submit(Long sessionId, Supplier<Uni<T>> work) {
        return Uni.createFrom().deferred(() -> {
            CompletableFuture<Void> done = new CompletableFuture<>();
            CompletableFuture<Void> previous = swapTail(sessionId, done);
            return Uni.createFrom().completionStage(previous)
                .chain(ignored -> Uni.createFrom().deferred(work::get))
                .onTermination().invoke(() -> {
                    done.complete(null);
                    tails.remove(sessionId, done);
                });
        });
    }

    private CompletableFuture<Void> swapTail(Long sessionId, CompletableFuture<Void> next) {
        while (true) {
            CompletableFuture<Void> previous = tails.get(sessionId);
            if (previous == null) {
                if (tails.putIfAbsent(sessionId, next) == null) {
                    return CompletableFuture.completedFuture(null);
                }
            } else if (tails.replace(sessionId, previous, next)) {
                return previous;
            }
        }
    }

    public int activeSessions() {
        return tails.size();
    }
}
