package com.providergateway.adapter;

import com.providergateway.error.AdapterException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns an absolute deadline into a bound on a reactive call. Expiry cancels the
 * upstream, which is what releases processes and connections.
 */
public final class Deadlines {

    private Deadlines() {
    }

    public static <T> Mono<T> bound(Mono<T> call, Instant deadline, String what) {
        return Mono.defer(() -> {
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                return Mono.error(AdapterException.timeout(what + ": deadline already passed"));
            }
            return call.timeout(remaining, Mono.error(() ->
                    AdapterException.timeout(what + " exceeded " + remaining.toMillis() + " ms")));
        });
    }

    public static <T> Flux<T> bound(Flux<T> stream, Instant deadline, String what) {
        return Flux.defer(() -> {
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                return Flux.error(AdapterException.timeout(what + ": deadline already passed"));
            }
            AtomicBoolean expired = new AtomicBoolean();
            return stream
                    .takeUntilOther(Mono.delay(remaining).doOnNext(tick -> expired.set(true)))
                    .concatWith(Mono.defer(() -> expired.get()
                            ? Mono.error(AdapterException.timeout(what + " exceeded " + remaining.toMillis() + " ms"))
                            : Mono.empty()));
        });
    }
}
