package org.nevr.vault.core.util;

import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class VaultWriteQueueTest {

    private final VaultWriteQueue queue = new VaultWriteQueue();

    @Test
    void testSubmit_SamePathRunsInSubmissionOrder() {
        // Given
        Path vault = Path.of("build", "a.vault");
        Sinks.One<String> gate = Sinks.one();
        List<String> events = new CopyOnWriteArrayList<>();

        Mono<String> first = queue.submit(vault, () -> {
            events.add("first-start");
            return gate.asMono().doOnNext(v -> events.add("first-end"));
        });
        Mono<String> second = queue.submit(vault, () -> {
            events.add("second-start");
            return Mono.just("second");
        });

        // When
        first.subscribe();
        StepVerifier.create(second)
                .then(() -> {
                    assertEquals(List.of("first-start"), events, "second must wait for first");
                    gate.tryEmitValue("first");
                })
                .expectNext("second")
                .verifyComplete();

        // Then
        assertEquals(List.of("first-start", "first-end", "second-start"), events);
        assertEquals(0, queue.pendingPaths());
    }

    @Test
    void testSubmit_DifferentPathsDoNotWait() {
        // Given
        Sinks.One<String> never = Sinks.one();
        queue.submit(Path.of("a.vault"), never::asMono).subscribe();

        // When / Then
        StepVerifier.create(queue.submit(Path.of("b.vault"), () -> Mono.just("b")))
                .expectNext("b")
                .verifyComplete();
    }

    @Test
    void testSubmit_NormalizesPathKeys() {
        // Given
        Sinks.One<String> gate = Sinks.one();
        AtomicInteger started = new AtomicInteger();
        queue.submit(Path.of("dir", "x.vault"), gate::asMono).subscribe();

        // When
        Mono<Integer> second = queue.submit(Path.of("dir", ".", "other", "..", "x.vault"),
                () -> Mono.fromCallable(started::incrementAndGet));

        // Then
        StepVerifier.create(second)
                .then(() -> assertEquals(0, started.get()))
                .then(() -> gate.tryEmitValue("done"))
                .expectNext(1)
                .verifyComplete();
    }

    @Test
    void testSubmit_FailureStillReleasesTurn() {
        Path vault = Path.of("failing.vault");

        StepVerifier.create(queue.submit(vault, () -> Mono.error(new IllegalStateException("boom"))))
                .expectError(IllegalStateException.class)
                .verify();

        StepVerifier.create(queue.submit(vault, () -> Mono.just("next")))
                .expectNext("next")
                .verifyComplete();
    }

    @Test
    void testSubmit_CancelledWaiterKeepsOrder() {
        // Given
        Path vault = Path.of("cancel.vault");
        Sinks.One<String> gate = Sinks.one();
        List<String> events = new CopyOnWriteArrayList<>();

        queue.submit(vault, () -> gate.asMono().doOnNext(v -> events.add("first"))).subscribe();
        Disposable cancelled = queue.submit(vault, () -> {
            events.add("cancelled-ran");
            return Mono.just("x");
        }).subscribe();
        Mono<String> third = queue.submit(vault, () -> {
            events.add("third");
            return Mono.just("third");
        });

        // When
        cancelled.dispose();

        // Then
        StepVerifier.create(third)
                .then(() -> assertTrue(events.isEmpty(), "third must not overtake the running write"))
                .then(() -> gate.tryEmitValue("go"))
                .expectNext("third")
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        assertEquals(List.of("first", "third"), events);
    }
}
