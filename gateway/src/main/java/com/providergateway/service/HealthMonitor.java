package com.providergateway.service;

import com.providergateway.adapter.ProviderAdapter;
import com.providergateway.config.GatewayProperties;
import com.providergateway.error.ErrorKind;
import com.providergateway.error.GatewayException;
import com.providergateway.error.Sanitizer;
import com.providergateway.model.HealthProbeResult;
import com.providergateway.model.HealthState;
import com.providergateway.model.HealthStatus;
import com.providergateway.model.ProbeTrigger;
import com.providergateway.model.Provider;
import com.providergateway.model.TestResult;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Per-provider health view fed by scheduled probes, manual tests and inline
 * signals from production traffic. Each provider has its own lock and at most
 * one probe in flight; providers never wait on each other.
 */
@Slf4j
@Service
public class HealthMonitor {

    private static final Duration PROBE_SLACK = Duration.ofSeconds(1);

    private final ProviderRegistry registry;
    private final HealthStatusStore statusStore;
    private final GatewayProperties.HealthSettings settings;
    private final MeterRegistry meterRegistry;
    private final GatewayEventLogger events;
    private final Clock clock;

    private final Map<String, ProviderHealth> entries = new ConcurrentHashMap<>();
    private final AtomicLong totalProbes = new AtomicLong();
    private final AtomicLong successfulProbes = new AtomicLong();
    private final AtomicLong failedProbes = new AtomicLong();
    private final AtomicLong skippedProbes = new AtomicLong();
    private volatile Instant lastCycleAt;
    private volatile long lastCycleMillis;

    @Autowired
    public HealthMonitor(ProviderRegistry registry, HealthStatusStore statusStore, GatewayProperties properties,
                         MeterRegistry meterRegistry, GatewayEventLogger events) {
        this(registry, statusStore, properties.getHealth(), meterRegistry, events, Clock.systemUTC());
    }

    HealthMonitor(ProviderRegistry registry, HealthStatusStore statusStore, GatewayProperties.HealthSettings settings,
                  MeterRegistry meterRegistry, GatewayEventLogger events, Clock clock) {
        this.registry = registry;
        this.statusStore = statusStore;
        this.settings = settings;
        this.meterRegistry = meterRegistry;
        this.events = events;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${gateway.health.interval-millis:30000}",
            initialDelayString = "${gateway.health.initial-delay-millis:5000}")
    public void scheduledTick() {
        if (!settings.isEnabled()) {
            return;
        }
        Duration budget = Duration.ofSeconds(settings.getProbeTimeoutSeconds()).plus(PROBE_SLACK.multipliedBy(2));
        runScheduledProbes().block(budget);
    }

    /**
     * One probe cycle over every enabled provider, concurrently.
     */
    public Mono<Void> runScheduledProbes() {
        return Mono.defer(() -> {
            long started = System.nanoTime();
            List<Provider> providers = registry.getProviders();
            Set<String> known = providers.stream().map(Provider::getId).collect(Collectors.toSet());
            entries.keySet().removeIf(id -> !known.contains(id));

            return Flux.fromIterable(providers)
                    .filter(Provider::isEnabled)
                    .flatMap(provider -> startOrJoin(provider, ProbeTrigger.SCHEDULED))
                    .then()
                    .doFinally(signal -> {
                        lastCycleAt = clock.instant();
                        lastCycleMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();
                        log.debug("Health cycle over {} provider(s) took {} ms", providers.size(), lastCycleMillis);
                    });
        });
    }

    /**
     * Probes one provider. A manual test joins a probe already in flight; a
     * scheduled one is skipped and completes empty.
     */
    public Mono<TestResult> probe(String idOrSlug, ProbeTrigger trigger) {
        return Mono.defer(() -> registry.getProvider(idOrSlug)
                .map(provider -> startOrJoin(provider, trigger))
                .orElseGet(() -> Mono.error(new GatewayException(ErrorKind.NOT_FOUND, "Unknown provider " + idOrSlug,
                        "Provider not found: " + idOrSlug, null, null, null))));
    }

    private Mono<TestResult> startOrJoin(Provider provider, ProbeTrigger trigger) {
        ProviderHealth entry = entry(provider.getId());
        while (true) {
            Mono<TestResult> running = entry.inFlight.get();
            if (running != null) {
                if (trigger == ProbeTrigger.SCHEDULED) {
                    skippedProbes.incrementAndGet();
                    log.debug("Skipping scheduled probe of {}: previous probe still running", provider.getSlug());
                    return Mono.empty();
                }
                return running;
            }
            Sinks.One<TestResult> sink = Sinks.one();
            Mono<TestResult> shared = sink.asMono();
            if (entry.inFlight.compareAndSet(null, shared)) {
                execute(provider, trigger)
                        .doFinally(signal -> entry.inFlight.compareAndSet(shared, null))
                        .subscribe(sink::tryEmitValue, sink::tryEmitError);
                return shared;
            }
        }
    }

    private Mono<TestResult> execute(Provider provider, ProbeTrigger trigger) {
        Duration timeout = Duration.ofSeconds(settings.getProbeTimeoutSeconds());
        Instant deadline = clock.instant().plus(timeout);
        ProviderAdapter adapter = registry.getAdapter(provider.getId()).orElse(null);
        if (adapter == null) {
            return Mono.error(new GatewayException(ErrorKind.NOT_FOUND, "Provider " + provider.getSlug() + " was removed"));
        }
        return adapter.healthCheck(deadline)
                .timeout(timeout.plus(PROBE_SLACK), Mono.fromSupplier(() -> HealthProbeResult.failure(ErrorKind.TIMEOUT,
                        "Probe did not finish within " + timeout.toMillis() + " ms", null, timeout.toMillis())))
                .onErrorResume(error -> Mono.just(HealthProbeResult.failure(ErrorKind.UPSTREAM_ERROR,
                        Sanitizer.snapshot(String.valueOf(error.getMessage())), null, 0)))
                .map(result -> {
                    TestResult testResult = TestResult.from(provider.getId(), trigger, result, clock.instant());
                    recordProbe(provider, testResult);
                    return testResult;
                });
    }

    private void recordProbe(Provider provider, TestResult result) {
        totalProbes.incrementAndGet();
        (result.isSuccess() ? successfulProbes : failedProbes).incrementAndGet();
        meterRegistry.counter("gateway.health.probes",
                "provider", provider.getSlug(),
                "trigger", result.getTrigger().wireName(),
                "result", result.isSuccess() ? "success" : "failure").increment();

        ProviderHealth entry = entry(provider.getId());
        entry.lock.lock();
        try {
            entry.history.addFirst(result);
            while (entry.history.size() > settings.getHistorySize()) {
                entry.history.removeLast();
            }
        } finally {
            entry.lock.unlock();
        }
        log.atDebug()
                .addKeyValue("probe", true)
                .addKeyValue("providerId", provider.getId())
                .addKeyValue("trigger", result.getTrigger().wireName())
                .addKeyValue("latencyMs", result.getLatencyMs())
                .log("Probe of {} {}", provider.getSlug(), result.isSuccess() ? "succeeded" : "failed");

        apply(provider.getId(), result.isSuccess() ? null : result.getErrorKind(),
                result.isSuccess() ? null : result.getErrorMessage());
    }

    /**
     * Inline signal from production traffic. {@code failureKind == null} is a
     * success; kinds that say nothing about the provider are ignored.
     */
    public void recordOutcome(String providerId, ErrorKind failureKind, String detail) {
        if (failureKind != null && !failureKind.countsAgainstProvider()) {
            return;
        }
        apply(providerId, failureKind, detail);
    }

    private void apply(String providerId, ErrorKind failureKind, String detail) {
        ProviderHealth entry = entry(providerId);
        HealthStatus before;
        HealthStatus after;
        entry.lock.lock();
        try {
            before = entry.status;
            Instant now = clock.instant();
            if (failureKind == null) {
                after = HealthStateMachine.onSuccess(before, now);
            } else {
                String error = failureKind.getCode() + (detail != null ? ": " + Sanitizer.snapshot(detail) : "");
                after = HealthStateMachine.onFailure(before, error, now, settings.getUnhealthyThreshold());
            }
            entry.status = after;
        } finally {
            entry.lock.unlock();
        }
        if (before.getState() != after.getState()) {
            onTransition(providerId, before, after);
        }
    }

    private void onTransition(String providerId, HealthStatus before, HealthStatus after) {
        meterRegistry.counter("gateway.health.transitions",
                "provider", providerId,
                "from", before.getState().wireName(),
                "to", after.getState().wireName()).increment();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("from", before.getState().wireName());
        fields.put("to", after.getState().wireName());
        fields.put("consecutiveFailures", after.getConsecutiveFailures());
        fields.put("lastError", after.getLastError());
        if (after.getState() == HealthState.UNHEALTHY) {
            events.warn("health_transition", providerId, null, fields);
        } else {
            events.info("health_transition", providerId, null, fields);
        }
        if (settings.isPersist()) {
            statusStore.save(providerId, after)
                    .subscribe(null, error -> log.warn("Could not persist health of {}: {}", providerId, error.getMessage()));
        }
    }

    public boolean isRoutable(String providerId) {
        return getStatus(providerId).isRoutable();
    }

    public HealthStatus getStatus(String providerId) {
        ProviderHealth entry = entries.get(providerId);
        if (entry == null) {
            return HealthStatus.INITIAL;
        }
        entry.lock.lock();
        try {
            return entry.status;
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Most recent first.
     */
    public List<TestResult> getHistory(String providerId) {
        ProviderHealth entry = entries.get(providerId);
        if (entry == null) {
            return List.of();
        }
        entry.lock.lock();
        try {
            return new ArrayList<>(entry.history);
        } finally {
            entry.lock.unlock();
        }
    }

    public Statistics getStatistics() {
        Map<HealthState, Integer> byState = new EnumMap<>(HealthState.class);
        for (Provider provider : registry.getProviders()) {
            byState.merge(getStatus(provider.getId()).getState(), 1, Integer::sum);
        }
        return Statistics.builder()
                .totalProbes(totalProbes.get())
                .successfulProbes(successfulProbes.get())
                .failedProbes(failedProbes.get())
                .skippedProbes(skippedProbes.get())
                .lastCycleAt(lastCycleAt)
                .lastCycleMillis(lastCycleMillis)
                .providersByState(byState)
                .build();
    }

    private ProviderHealth entry(String providerId) {
        return entries.computeIfAbsent(providerId, id -> new ProviderHealth());
    }

    @Value
    @Builder
    public static class Statistics {
        long totalProbes;
        long successfulProbes;
        long failedProbes;
        long skippedProbes;
        Instant lastCycleAt;
        long lastCycleMillis;
        Map<HealthState, Integer> providersByState;
    }

    private static final class ProviderHealth {
        private final ReentrantLock lock = new ReentrantLock();
        private final Deque<TestResult> history = new ArrayDeque<>();
        private final AtomicReference<Mono<TestResult>> inFlight = new AtomicReference<>();
        private HealthStatus status = HealthStatus.INITIAL;
    }
}
