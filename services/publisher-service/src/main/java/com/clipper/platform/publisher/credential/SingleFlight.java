package com.clipper.platform.publisher.credential;

import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Runs at most one unit of work per key at a time. Callers arriving while work for their key is in
 * flight share its result instead of starting their own.
 */
public class SingleFlight<K, V> {

    private final ConcurrentMap<K, Mono<V>> inFlight = new ConcurrentHashMap<>();

    public Mono<V> run(K key, Supplier<Mono<V>> work) {
        // the key is released before the result reaches callers, so a caller that needs fresher
        // work than the shared result can start its own run right away
        return Mono.defer(() -> inFlight.computeIfAbsent(key, k -> work.get()
                .doOnTerminate(() -> inFlight.remove(k))
                .doOnCancel(() -> inFlight.remove(k))
                .cache()));
    }
}
