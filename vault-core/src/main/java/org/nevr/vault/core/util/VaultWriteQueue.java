package org.nevr.vault.core.util;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Single-writer queue keyed by vault file path. Work submitted for the same path runs one at
 * a time in submission order; different paths do not wait on each other.
 * Waiting does not block a thread.
 */
@Slf4j
public class VaultWriteQueue {

    private final Map<Path, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public <T> Mono<T> submit(Path vaultPath, Supplier<Mono<T>> work) {
        Path key = vaultPath.toAbsolutePath().normalize();
        return Mono.defer(() -> {
            CompletableFuture<Void> turn = new CompletableFuture<>();
            CompletableFuture<Void> previous = tails.put(key, turn);

            Mono<Void> waitForTurn = previous == null
                    ? Mono.empty()
                    : Mono.fromFuture(previous, true)
                            .doOnSubscribe(s -> log.debug("Waiting for pending write on {}", key));

            return waitForTurn
                    .then(Mono.defer(work))
                    .doFinally(signal -> release(key, previous, turn));
        });
    }

    /**
     * Hand the turn on. A caller cancelled while still waiting releases only once its
     * predecessor finished, so the order is kept.
     */
    private void release(Path key, CompletableFuture<Void> previous, CompletableFuture<Void> turn) {
        if (previous == null || previous.isDone()) {
            complete(key, turn);
        } else {
            previous.whenComplete((ignored, error) -> complete(key, turn));
        }
    }

    private void complete(Path key, CompletableFuture<Void> turn) {
        tails.remove(key, turn);
        turn.complete(null);
    }

    int pendingPaths() {
        return tails.size();
    }
}
