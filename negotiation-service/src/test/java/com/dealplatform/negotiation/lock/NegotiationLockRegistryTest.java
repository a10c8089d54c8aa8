package com.dealplatform.negotiation.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class NegotiationLockRegistryTest {

    private final NegotiationLockRegistry registry = new NegotiationLockRegistry();
    private final List<String> events = new CopyOnWriteArrayList<>();

    private Mono<String> step(String name, Duration hold) {
        return Mono.fromRunnable(() -> events.add(name + "-start"))
            .then(Mono.delay(hold))
            .doOnNext(tick -> events.add(name + "-end"))
            .thenReturn(name);
    }

    @Test
    @DisplayName("operations on the same negotiation run one after the other, in arrival order")
    void serialisesSameKey() {
        Flux<String> both = Flux.merge(
            registry.withLock("neg-1", () -> step("a", Duration.ofMillis(100))),
            registry.withLock("neg-1", () -> step("b", Duration.ofMillis(1))),
            registry.withLock("neg-1", () -> step("c", Duration.ofMillis(1))));

        StepVerifier.create(both.collectList())
            .assertNext(done -> assertEquals(List.of("a", "b", "c"), done))
            .verifyComplete();

        assertEquals(List.of("a-start", "a-end", "b-start", "b-end", "c-start", "c-end"), events);
    }

    @Test
    @DisplayName("different negotiations do not wait for each other")
    void independentKeys() {
        Flux<String> both = Flux.merge(
            registry.withLock("neg-1", () -> step("a", Duration.ofMillis(200))),
            registry.withLock("neg-2", () -> step("b", Duration.ofMillis(1))));

        StepVerifier.create(both.collectList())
            .assertNext(done -> assertEquals(List.of("b", "a"), done))
            .verifyComplete();

        assertTrue(events.indexOf("b-end") < events.indexOf("a-end"));
    }

    @Test
    @DisplayName("a failing holder still releases the lock")
    void releasesOnError() {
        Mono<String> failing = registry.<String>withLock("neg-1", () ->
                Mono.delay(Duration.ofMillis(50)).then(Mono.error(new IllegalStateException("boom"))))
            .onErrorReturn("failed");
        Mono<String> next = registry.withLock("neg-1", () -> Mono.just("ok"));

        StepVerifier.create(Flux.merge(failing, next).collectList())
            .assertNext(done -> assertEquals(List.of("failed", "ok"), done))
            .verifyComplete();
    }

    @Test
    @DisplayName("a cancelled holder releases the lock")
    void releasesOnCancel() {
        Disposable holder = registry.withLock("neg-1", Mono::never).subscribe();
        Mono<String> next = registry.withLock("neg-1", () -> Mono.just("ok"));

        StepVerifier.create(next)
            .then(holder::dispose)
            .expectNext("ok")
            .expectComplete()
            .verify(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("keys are forgotten once their last holder is done")
    void forgetsIdleKeys() {
        assertEquals("x", registry.withLock("neg-1", () -> Mono.just("x")).block());
        assertEquals("y", registry.withLock("neg-2", () -> Mono.just("y")).block());
        assertEquals(0, registry.activeKeys());
    }
}
