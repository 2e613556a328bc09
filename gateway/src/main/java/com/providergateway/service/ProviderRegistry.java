package com.providergateway.service;

import com.providergateway.adapter.AdapterFactory;
import com.providergateway.adapter.ProviderAdapter;
import com.providergateway.error.ErrorKind;
import com.providergateway.error.GatewayException;
import com.providergateway.model.ModelMapping;
import com.providergateway.model.Provider;
import com.providergateway.model.ProviderDefinition;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In-memory source of truth for dispatch. Readers see an immutable snapshot
 * swapped atomically; writers are serialized by one lock. A removed provider is
 * disabled at once and dropped when its last in-flight request finishes. An
 * adapter replaced by an update is closed after the last lease granted on it.
 */
@Slf4j
@Service
public class ProviderRegistry {

    private final AdapterFactory adapterFactory;
    private final ProviderConfigValidator validator;
    private final ProviderStore store;
    private final Clock clock;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);
    private final Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final Set<String> pendingRemoval = ConcurrentHashMap.newKeySet();
    private final Map<ProviderAdapter, AtomicInteger> adapterLeases = new ConcurrentHashMap<>();
    private final Set<ProviderAdapter> retiring = ConcurrentHashMap.newKeySet();
    private Instant lastStamp = Instant.EPOCH;

    @Autowired
    public ProviderRegistry(AdapterFactory adapterFactory, ProviderConfigValidator validator, ProviderStore store) {
        this(adapterFactory, validator, store, Clock.systemUTC());
    }

    ProviderRegistry(AdapterFactory adapterFactory, ProviderConfigValidator validator,
                     ProviderStore store, Clock clock) {
        this.adapterFactory = adapterFactory;
        this.validator = validator;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Loads the store. Invalid definitions are logged and skipped so one bad entry
     * does not keep the gateway down.
     */
    @PostConstruct
    public void loadSeeds() {
        int loaded = 0;
        for (ProviderDefinition definition : store.loadAll()) {
            try {
                install(definition, false);
                loaded++;
            } catch (GatewayException e) {
                log.atError()
                        .addKeyValue("source", "gateway-core")
                        .addKeyValue("event", "provider_rejected")
                        .addKeyValue("slug", definition.getSlug())
                        .log("Skipping provider definition: {}", e.getMessage());
            }
        }
        log.info("Provider registry loaded {} provider(s)", loaded);
    }

    @PreDestroy
    public void shutdown() {
        snapshot.get().entries.values().forEach(entry -> entry.adapter.close());
    }

    public Provider register(ProviderDefinition definition) {
        return install(definition, true);
    }

    private Provider install(ProviderDefinition definition, boolean persist) {
        Provider validated = validator.validate(definition);
        writeLock.lock();
        try {
            Snapshot current = snapshot.get();
            if (current.entries.containsKey(validated.getId())) {
                throw conflict("Provider id '" + validated.getId() + "' already exists");
            }
            if (current.slugToId.containsKey(validated.getSlug())) {
                throw conflict("Provider slug '" + validated.getSlug() + "' already exists");
            }
            Instant now = stamp();
            Provider provider = validated.toBuilder()
                    .createdAt(now)
                    .updatedAt(now)
                    .enabledAt(validated.isEnabled() ? now : null)
                    .build();
            ProviderAdapter adapter = adapterFactory.create(provider);
            definition.setId(provider.getId());
            if (persist) {
                store.save(definition);
            }
            publish(current.with(new Entry(provider, adapter, definition)));
            log.atInfo()
                    .addKeyValue("source", "gateway-core")
                    .addKeyValue("event", "provider_registered")
                    .addKeyValue("providerId", provider.getId())
                    .addKeyValue("type", provider.getType().getWireName())
                    .log("Registered provider {}", provider.getSlug());
            return provider;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Replaces configuration and mappings. The adapter type is fixed at creation.
     */
    public Provider update(String idOrSlug, ProviderDefinition definition) {
        writeLock.lock();
        try {
            Snapshot current = snapshot.get();
            Entry existing = current.find(idOrSlug).orElseThrow(() -> providerNotFound(idOrSlug));
            if (pendingRemoval.contains(existing.provider.getId())) {
                throw conflict("Provider " + existing.provider.getSlug() + " is being removed");
            }
            definition.setId(existing.provider.getId());
            Provider validated = validator.validate(definition);
            if (validated.getType() != existing.provider.getType()) {
                throw new GatewayException(ErrorKind.CONFIGURATION_INVALID,
                        "Provider " + existing.provider.getSlug() + " is " + existing.provider.getType()
                                + " and cannot change type to " + validated.getType(),
                        "Changing the adapter type of an existing provider is not allowed", existing.provider.getId(), null, null);
            }
            String otherId = current.slugToId.get(validated.getSlug());
            if (otherId != null && !otherId.equals(existing.provider.getId())) {
                throw conflict("Provider slug '" + validated.getSlug() + "' already exists");
            }
            Instant now = stamp();
            Provider provider = validated.toBuilder()
                    .createdAt(existing.provider.getCreatedAt())
                    .updatedAt(now)
                    .enabledAt(enabledAt(existing.provider, validated.isEnabled(), now))
                    .build();
            ProviderAdapter adapter = adapterFactory.create(provider);
            store.save(definition);
            publish(current.without(existing.provider.getId()).with(new Entry(provider, adapter, definition)));
            retire(existing.adapter);
            log.info("Updated provider {}", provider.getSlug());
            return provider;
        } finally {
            writeLock.unlock();
        }
    }

    public Provider setEnabled(String idOrSlug, boolean enabled) {
        writeLock.lock();
        try {
            Snapshot current = snapshot.get();
            Entry existing = current.find(idOrSlug).orElseThrow(() -> providerNotFound(idOrSlug));
            if (existing.provider.isEnabled() == enabled) {
                return existing.provider;
            }
            if (enabled && pendingRemoval.contains(existing.provider.getId())) {
                throw conflict("Provider " + existing.provider.getSlug() + " is being removed");
            }
            Instant now = stamp();
            Provider provider = existing.provider.toBuilder()
                    .enabled(enabled)
                    .updatedAt(now)
                    .enabledAt(enabledAt(existing.provider, enabled, now))
                    .build();
            existing.definition.setEnabled(enabled);
            store.save(existing.definition);
            publish(current.with(new Entry(provider, existing.adapter, existing.definition)));
            log.atInfo()
                    .addKeyValue("source", "gateway-core")
                    .addKeyValue("event", enabled ? "provider_enabled" : "provider_disabled")
                    .addKeyValue("providerId", provider.getId())
                    .log("Provider {} {}", provider.getSlug(), enabled ? "enabled" : "disabled");
            return provider;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Disables the provider and removes it once no request holds a lease on it.
     *
     * @return true when the provider was removed immediately
     */
    public boolean remove(String idOrSlug) {
        String id;
        writeLock.lock();
        try {
            Entry existing = snapshot.get().find(idOrSlug).orElseThrow(() -> providerNotFound(idOrSlug));
            id = existing.provider.getId();
            pendingRemoval.add(id);
            if (existing.provider.isEnabled()) {
                Provider disabled = existing.provider.toBuilder().enabled(false).updatedAt(stamp()).build();
                publish(snapshot.get().with(new Entry(disabled, existing.adapter, existing.definition)));
            }
        } finally {
            writeLock.unlock();
        }
        boolean removed = finishRemovalIfIdle(id);
        if (!removed) {
            log.info("Provider {} disabled; removal waits for {} in-flight request(s)", idOrSlug, leaseCount(id));
        }
        return removed;
    }

    private boolean finishRemovalIfIdle(String id) {
        writeLock.lock();
        try {
            if (!pendingRemoval.contains(id) || leaseCount(id) > 0) {
                return false;
            }
            Snapshot current = snapshot.get();
            Entry entry = current.entries.get(id);
            if (entry != null) {
                publish(current.without(id));
            }
            // Only after the entry is gone: an acquire that misses the pending mark must miss the entry too.
            pendingRemoval.remove(id);
            inFlight.remove(id);
            if (entry == null) {
                return true;
            }
            store.delete(id);
            retire(entry.adapter);
            log.atInfo()
                    .addKeyValue("source", "gateway-core")
                    .addKeyValue("event", "provider_removed")
                    .addKeyValue("providerId", id)
                    .log("Removed provider {}", entry.provider.getSlug());
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Marks one in-flight request against the provider and pins the adapter it
     * runs on. Fails once removal has started. Must be released exactly once.
     */
    public Lease acquire(String providerId) {
        AtomicInteger counter = inFlight.computeIfAbsent(providerId, id -> new AtomicInteger());
        counter.incrementAndGet();
        while (true) {
            Entry entry = snapshot.get().entries.get(providerId);
            if (entry == null || pendingRemoval.contains(providerId)) {
                releaseProvider(providerId, counter);
                throw providerNotFound(providerId);
            }
            AtomicInteger adapterCounter = adapterLeases.computeIfAbsent(entry.adapter, adapter -> new AtomicInteger());
            adapterCounter.incrementAndGet();
            Entry current = snapshot.get().entries.get(providerId);
            if (current != null && current.adapter == entry.adapter) {
                return new Lease(providerId, entry.adapter, counter, adapterCounter);
            }
            // Replaced by an update between the two reads; retry on the new adapter.
            releaseAdapter(entry.adapter, adapterCounter);
            if (adapterCounter.get() == 0) {
                adapterLeases.remove(entry.adapter, adapterCounter);
            }
        }
    }

    int leaseCount(String providerId) {
        AtomicInteger counter = inFlight.get(providerId);
        return counter == null ? 0 : counter.get();
    }

    /**
     * Closes the adapter now if nothing holds a lease on it, otherwise when the
     * last lease is released.
     */
    private void retire(ProviderAdapter adapter) {
        retiring.add(adapter);
        AtomicInteger counter = adapterLeases.get(adapter);
        if ((counter == null || counter.get() == 0) && retiring.remove(adapter)) {
            closeAdapter(adapter);
        }
    }

    private void releaseAdapter(ProviderAdapter adapter, AtomicInteger counter) {
        if (counter.decrementAndGet() == 0 && retiring.remove(adapter)) {
            closeAdapter(adapter);
        }
    }

    private void releaseProvider(String providerId, AtomicInteger counter) {
        if (counter.decrementAndGet() <= 0 && pendingRemoval.contains(providerId)) {
            finishRemovalIfIdle(providerId);
        }
    }

    private void closeAdapter(ProviderAdapter adapter) {
        adapterLeases.remove(adapter);
        adapter.close();
    }

    /**
     * Enabled, dispatch-eligible providers mapping the external model id.
     */
    public List<Candidate> findCandidates(String externalModelId) {
        Snapshot current = snapshot.get();
        List<String> ids = current.modelIndex.getOrDefault(externalModelId, List.of());
        List<Candidate> candidates = new ArrayList<>(ids.size());
        for (String id : ids) {
            Entry entry = current.entries.get(id);
            entry.provider.findMapping(externalModelId)
                    .ifPresent(mapping -> candidates.add(new Candidate(entry.provider, mapping)));
        }
        return candidates;
    }

    /**
     * One entry per external model id; when several providers map it, the most
     * recently enabled one is listed.
     */
    public List<Candidate> listRoutableModels() {
        Snapshot current = snapshot.get();
        List<Candidate> models = new ArrayList<>();
        current.modelIndex.forEach((externalId, ids) -> ids.stream()
                .map(current.entries::get)
                .max(Comparator.comparing(entry -> entry.provider.getEnabledAt(), Comparator.nullsFirst(Comparator.naturalOrder())))
                .flatMap(entry -> entry.provider.findMapping(externalId).map(mapping -> new Candidate(entry.provider, mapping)))
                .ifPresent(models::add));
        models.sort(Comparator.comparing(candidate -> candidate.mapping().getExternalId()));
        return models;
    }

    public Optional<Provider> getProvider(String idOrSlug) {
        return snapshot.get().find(idOrSlug).map(entry -> entry.provider);
    }

    public Optional<ProviderAdapter> getAdapter(String providerId) {
        return Optional.ofNullable(snapshot.get().entries.get(providerId)).map(entry -> entry.adapter);
    }

    public List<Provider> getProviders() {
        return snapshot.get().entries.values().stream()
                .map(entry -> entry.provider)
                .sorted(Comparator.comparing(Provider::getSlug))
                .collect(Collectors.toList());
    }

    public boolean isPendingRemoval(String providerId) {
        return pendingRemoval.contains(providerId);
    }

    private void publish(Snapshot next) {
        snapshot.set(next);
        next.modelIndex.forEach((externalId, ids) -> {
            if (ids.size() > 1) {
                log.atWarn()
                        .addKeyValue("source", "gateway-core")
                        .addKeyValue("event", "configuration_conflict")
                        .addKeyValue("model", externalId)
                        .addKeyValue("providerIds", ids)
                        .log("Model {} is mapped by {} enabled providers", externalId, ids.size());
            }
        });
    }

    private Instant stamp() {
        Instant now = clock.instant();
        if (!now.isAfter(lastStamp)) {
            now = lastStamp.plusNanos(1);
        }
        lastStamp = now;
        return now;
    }

    private static Instant enabledAt(Provider existing, boolean enabled, Instant now) {
        if (!enabled) {
            return existing.getEnabledAt();
        }
        return existing.isEnabled() ? existing.getEnabledAt() : now;
    }

    private static GatewayException providerNotFound(String idOrSlug) {
        return new GatewayException(ErrorKind.NOT_FOUND, "Unknown provider " + idOrSlug,
                "Provider not found: " + idOrSlug, null, null, null);
    }

    private static GatewayException conflict(String message) {
        return new GatewayException(ErrorKind.CONFIGURATION_INVALID, message, message, null, null, null);
    }

    public record Candidate(Provider provider, ModelMapping mapping) {
    }

    /**
     * In-flight marker handed out by {@link #acquire}. Release is idempotent.
     */
    public final class Lease implements AutoCloseable {

        private final String providerId;
        private final ProviderAdapter adapter;
        private final AtomicInteger providerCounter;
        private final AtomicInteger adapterCounter;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(String providerId, ProviderAdapter adapter,
                      AtomicInteger providerCounter, AtomicInteger adapterCounter) {
            this.providerId = providerId;
            this.adapter = adapter;
            this.providerCounter = providerCounter;
            this.adapterCounter = adapterCounter;
        }

        public String getProviderId() {
            return providerId;
        }

        /**
         * The adapter this lease keeps open, even if an update has since replaced it.
         */
        public ProviderAdapter getAdapter() {
            return adapter;
        }

        public void release() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            releaseAdapter(adapter, adapterCounter);
            releaseProvider(providerId, providerCounter);
        }

        @Override
        public void close() {
            release();
        }
    }

    private static final class Entry {
        private final Provider provider;
        private final ProviderAdapter adapter;
        private final ProviderDefinition definition;

        private Entry(Provider provider, ProviderAdapter adapter, ProviderDefinition definition) {
            this.provider = provider;
            this.adapter = adapter;
            this.definition = definition;
        }
    }

    private static final class Snapshot {

        static final Snapshot EMPTY = new Snapshot(Map.of());

        private final Map<String, Entry> entries;
        private final Map<String, String> slugToId;
        private final Map<String, List<String>> modelIndex;

        private Snapshot(Map<String, Entry> entries) {
            this.entries = Collections.unmodifiableMap(entries);
            Map<String, String> slugs = new LinkedHashMap<>();
            Map<String, List<String>> models = new LinkedHashMap<>();
            for (Entry entry : entries.values()) {
                slugs.put(entry.provider.getSlug(), entry.provider.getId());
                if (!entry.provider.isDispatchEligible()) {
                    continue;
                }
                for (ModelMapping mapping : entry.provider.getModels()) {
                    models.computeIfAbsent(mapping.getExternalId(), key -> new ArrayList<>()).add(entry.provider.getId());
                }
            }
            models.replaceAll((key, ids) -> List.copyOf(ids));
            this.slugToId = Collections.unmodifiableMap(slugs);
            this.modelIndex = Collections.unmodifiableMap(models);
        }

        Snapshot with(Entry entry) {
            Map<String, Entry> next = new LinkedHashMap<>(entries);
            next.put(entry.provider.getId(), entry);
            return new Snapshot(next);
        }

        Snapshot without(String providerId) {
            Map<String, Entry> next = new LinkedHashMap<>(entries);
            next.remove(providerId);
            return new Snapshot(next);
        }

        Optional<Entry> find(String idOrSlug) {
            Entry entry = entries.get(idOrSlug);
            if (entry == null) {
                String id = slugToId.get(idOrSlug);
                entry = id != null ? entries.get(id) : null;
            }
            return Optional.ofNullable(entry);
        }
    }
}
